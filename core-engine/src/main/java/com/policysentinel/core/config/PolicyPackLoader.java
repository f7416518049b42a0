package com.policysentinel.core.config;

import com.policysentinel.core.model.DocumentNode;
import com.policysentinel.core.model.Evidence;
import com.policysentinel.core.model.Issue;
import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.Matrix;
import com.policysentinel.core.model.PolicyPack;
import com.policysentinel.core.model.RuleId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Loads the policy pack referenced by one registry policy entry.
 *
 * <h3>Rules</h3>
 * <ul>
 * <li>{@code DMX.REG.011} the resolved file must exist</li>
 * <li>{@code DMX.PACK.001} the document must parse and have a mapping root</li>
 * <li>{@code DMX.PACK.002} {@code downmix_policy_pack} with {@code policy_id},
 * {@code pack_version} and a {@code matrices} mapping must be present</li>
 * <li>{@code DMX.PACK.003} {@code pack_version} must be a semantic version</li>
 * <li>{@code DMX.REG.013} the pack's {@code policy_id} must equal the
 * registry key</li>
 * </ul>
 *
 * <p>
 * Failures are scoped to the one policy: they are returned as issues and
 * never abort the run.
 * </p>
 *
 * @since 1.0.0
 */
public final class PolicyPackLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyPackLoader.class);

    static final String ROOT_KEY = "downmix_policy_pack";
    static final String POLICY_ID_KEY = "policy_id";
    static final String PACK_VERSION_KEY = "pack_version";
    static final String MATRICES_KEY = "matrices";
    static final String SUPPORTS_SOURCE_KEY = "supports_source_layouts";
    static final String SUPPORTS_TARGET_KEY = "supports_target_layouts";

    private static final Pattern SEMVER = Pattern.compile(
            "^(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)(?:-[0-9A-Za-z.-]+)?(?:\\+[0-9A-Za-z.-]+)?$");

    private PolicyPackLoader() {
        // utility class
    }

    /**
     * Report a declared {@code file} that cannot be turned into a path on
     * this platform, for example one containing a NUL character.
     *
     * @param policyKey    registry key that declared the file; must not be {@code null}
     * @param declaredFile the raw {@code file} value
     * @param reason       why the path was rejected
     * @return a failed load carrying one {@code DMX.REG.011} issue
     */
    public static PackLoadResult unresolvable(String policyKey, String declaredFile, String reason) {
        Objects.requireNonNull(policyKey, "policyKey must not be null");
        LOG.debug("Policy pack path for {} is not valid: {}", policyKey, reason);
        Issue issue = Issue.error(IssueId.POLICY_FILE_MISSING, RuleId.REG_011)
                .message("Policy pack file is not a valid path (" + reason + "): " + declaredFile)
                .evidence(Evidence.builder()
                        .filePath(declaredFile)
                        .policyId(policyKey)
                        .location("policies." + policyKey + ".file")
                        .build())
                .build();
        return new PackLoadResult(policyKey, null, null, List.of(issue));
    }

    /**
     * Load a policy pack.
     *
     * @param policyKey registry key that referenced the pack; must not be {@code null}
     * @param file      resolved pack path; must not be {@code null}
     * @return the load outcome
     */
    public static PackLoadResult load(String policyKey, Path file) {
        Objects.requireNonNull(policyKey, "policyKey must not be null");
        Objects.requireNonNull(file, "file must not be null");

        List<Issue> issues = new ArrayList<>();
        Evidence evidence = Evidence.builder()
                .filePath(file.toString())
                .policyId(policyKey)
                .build();

        if (!Files.isRegularFile(file)) {
            LOG.debug("Policy pack for {} not found: {}", policyKey, file);
            issues.add(Issue.error(IssueId.POLICY_FILE_MISSING, RuleId.REG_011)
                    .message("Policy pack file not found: " + file)
                    .evidence(evidence.toBuilder().location("policies." + policyKey + ".file").build())
                    .build());
            return new PackLoadResult(policyKey, file, null, issues);
        }

        Object document;
        try {
            document = DocumentReader.read(file);
        } catch (DocumentParseException e) {
            issues.add(Issue.error(IssueId.POLICY_PARSE_ERROR, RuleId.PACK_001)
                    .message(e.getMessage())
                    .evidence(evidence)
                    .build());
            return new PackLoadResult(policyKey, file, null, issues);
        }

        if (!(document instanceof Map<?, ?> root)) {
            issues.add(Issue.error(IssueId.POLICY_PARSE_ERROR, RuleId.PACK_001)
                    .message("Policy pack root must be a mapping: " + file)
                    .evidence(evidence)
                    .build());
            return new PackLoadResult(policyKey, file, null, issues);
        }

        if (!(root.get(ROOT_KEY) instanceof Map<?, ?> rawSection)) {
            issues.add(missingField(evidence, ROOT_KEY));
            return new PackLoadResult(policyKey, file, null, issues);
        }
        Map<String, Object> section = DocumentNode.copyOf(rawSection);

        String declaredPolicyId = null;
        if (section.get(POLICY_ID_KEY) instanceof String s) {
            declaredPolicyId = s;
            if (!policyKey.equals(s)) {
                issues.add(Issue.error(IssueId.DOWNMIX_POLICY_ID_MISMATCH, RuleId.REG_013)
                        .message("Policy pack policy_id " + s + " does not match registry key " + policyKey)
                        .evidence(evidence.toBuilder().location(ROOT_KEY + "." + POLICY_ID_KEY).build())
                        .build());
            }
        } else {
            issues.add(missingField(evidence, ROOT_KEY + "." + POLICY_ID_KEY));
        }

        String packVersion = null;
        Object rawVersion = section.get(PACK_VERSION_KEY);
        if (rawVersion == null) {
            issues.add(missingField(evidence, ROOT_KEY + "." + PACK_VERSION_KEY));
        } else if (rawVersion instanceof String v && SEMVER.matcher(v).matches()) {
            packVersion = v;
        } else {
            issues.add(Issue.error(IssueId.POLICY_SCHEMA_INVALID, RuleId.PACK_003)
                    .message("pack_version must be a semantic version string, got: " + rawVersion)
                    .evidence(evidence.toBuilder().location(ROOT_KEY + "." + PACK_VERSION_KEY).build())
                    .build());
        }

        if (!(section.get(MATRICES_KEY) instanceof Map<?, ?> rawMatrices)) {
            issues.add(missingField(evidence, ROOT_KEY + "." + MATRICES_KEY));
            return new PackLoadResult(policyKey, file, null, issues);
        }

        Map<String, Matrix> matrices = new LinkedHashMap<>();
        DocumentNode.copyOf(rawMatrices).forEach((id, raw) -> matrices.put(id, new Matrix(id, raw)));

        PolicyPack pack = new PolicyPack(file, declaredPolicyId, packVersion, matrices,
                section.get(SUPPORTS_SOURCE_KEY), section.get(SUPPORTS_TARGET_KEY));
        LOG.debug("Loaded policy pack {} ({} matrices) from {}", policyKey, matrices.size(), file);
        return new PackLoadResult(policyKey, file, pack, issues);
    }

    private static Issue missingField(Evidence evidence, String field) {
        return Issue.error(IssueId.POLICY_SCHEMA_INVALID, RuleId.PACK_002)
                .message("Policy pack missing required field: " + field)
                .evidence(evidence.toBuilder().location(field).build())
                .build();
    }
}
