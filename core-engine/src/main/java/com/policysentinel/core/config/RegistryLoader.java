package com.policysentinel.core.config;

import com.policysentinel.core.model.DocumentNode;
import com.policysentinel.core.model.Evidence;
import com.policysentinel.core.model.Issue;
import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.Registry;
import com.policysentinel.core.model.RuleId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses the root downmix registry document.
 *
 * <p>
 * The registry must parse ({@code DMX.REG.001}) and its {@code downmix}
 * section must hold {@code _meta}, {@code policies} (mapping),
 * {@code default_policy_by_source_layout} (mapping) and {@code conversions}
 * (list) ({@code DMX.REG.002}). Either failure is fatal for the registry:
 * the result carries exactly one issue and no {@link Registry}.
 * </p>
 *
 * <p>
 * The path is made absolute before anything else, so that pack files are
 * resolved against the registry's own directory and never against the
 * process working directory.
 * </p>
 *
 * @since 1.0.0
 */
public final class RegistryLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RegistryLoader.class);

    static final String ROOT_KEY = "downmix";
    static final String META_KEY = "_meta";
    static final String POLICIES_KEY = "policies";
    static final String DEFAULTS_KEY = "default_policy_by_source_layout";
    static final String CONVERSIONS_KEY = "conversions";
    static final String COMPOSITION_PATHS_KEY = "composition_paths";

    private RegistryLoader() {
        // utility class
    }

    /**
     * Load a registry document.
     *
     * @param registryFile path to the registry; must not be {@code null}
     * @return the loaded registry, or the fatal issue
     */
    public static RegistryLoadResult load(Path registryFile) {
        Objects.requireNonNull(registryFile, "Registry file path must not be null");
        Path file = registryFile.toAbsolutePath().normalize();
        Evidence evidence = Evidence.builder().filePath(file.toString()).build();

        if (!Files.isRegularFile(file)) {
            LOG.debug("Registry file does not exist: {}", file);
            return RegistryLoadResult.failed(Issue.error(IssueId.POLICY_PARSE_ERROR, RuleId.REG_001)
                    .message("Registry file not found or not readable: " + file)
                    .evidence(evidence)
                    .build());
        }

        Object document;
        try {
            document = DocumentReader.read(file);
        } catch (DocumentParseException e) {
            LOG.debug("Registry parse failed: {}", e.getMessage());
            return RegistryLoadResult.failed(Issue.error(IssueId.POLICY_PARSE_ERROR, RuleId.REG_001)
                    .message(e.getMessage())
                    .evidence(evidence)
                    .build());
        }

        if (!(document instanceof Map<?, ?> root)) {
            return RegistryLoadResult.failed(Issue.error(IssueId.POLICY_PARSE_ERROR, RuleId.REG_001)
                    .message("Registry root must be a mapping: " + file)
                    .evidence(evidence)
                    .build());
        }

        if (!(root.get(ROOT_KEY) instanceof Map<?, ?> rawSection)) {
            return RegistryLoadResult.failed(schemaInvalid(evidence, List.of(ROOT_KEY)));
        }
        Map<String, Object> section = DocumentNode.copyOf(rawSection);

        List<String> missing = new ArrayList<>();
        if (!(section.get(META_KEY) instanceof Map)) {
            missing.add(META_KEY);
        }
        if (!(section.get(POLICIES_KEY) instanceof Map)) {
            missing.add(POLICIES_KEY);
        }
        if (!(section.get(DEFAULTS_KEY) instanceof Map)) {
            missing.add(DEFAULTS_KEY);
        }
        if (!(section.get(CONVERSIONS_KEY) instanceof List)) {
            missing.add(CONVERSIONS_KEY);
        }
        if (!missing.isEmpty()) {
            return RegistryLoadResult.failed(schemaInvalid(evidence, missing));
        }

        List<Object> conversions = new ArrayList<>((List<?>) section.get(CONVERSIONS_KEY));
        Registry registry = new Registry(
                file,
                DocumentNode.copyOf((Map<?, ?>) section.get(META_KEY)),
                DocumentNode.copyOf((Map<?, ?>) section.get(POLICIES_KEY)),
                DocumentNode.copyOf((Map<?, ?>) section.get(DEFAULTS_KEY)),
                conversions,
                section.get(COMPOSITION_PATHS_KEY));

        LOG.info("Loaded registry {} (version {}) with {} polic(ies) and {} conversion(s)",
                file, registry.getMeta().getOrDefault("registry_version", "unset"),
                registry.getPolicies().size(), registry.getConversions().size());
        return RegistryLoadResult.loaded(registry);
    }

    private static Issue schemaInvalid(Evidence evidence, List<String> missing) {
        String prefix = missing.size() == 1 && ROOT_KEY.equals(missing.get(0)) ? "" : ROOT_KEY + ".";
        StringBuilder fields = new StringBuilder();
        for (String name : missing) {
            if (fields.length() > 0) {
                fields.append(", ");
            }
            fields.append(prefix).append(name);
        }
        return Issue.error(IssueId.POLICY_SCHEMA_INVALID, RuleId.REG_002)
                .message("Registry missing or malformed required section(s): " + fields)
                .evidence(evidence.toBuilder().location(ROOT_KEY).build())
                .build();
    }
}
