package com.policysentinel.core.validation;

import com.policysentinel.core.catalog.Catalog;
import com.policysentinel.core.model.Conversion;
import com.policysentinel.core.model.Evidence;
import com.policysentinel.core.model.Issue;
import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.Matrix;
import com.policysentinel.core.model.PolicyEntry;
import com.policysentinel.core.model.PolicyPack;
import com.policysentinel.core.model.Registry;
import com.policysentinel.core.model.RuleId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cross-checks every ID the registry mentions against the catalog and
 * against the registry's own policies and packs.
 *
 * <ul>
 * <li>{@code DMX.REG.014} supported layout lists</li>
 * <li>{@code DMX.REG.020} default policy per source layout</li>
 * <li>{@code DMX.REG.030..033} conversions: layouts, policy, matrix, matrix
 * layouts</li>
 * </ul>
 *
 * <p>
 * Each conversion is checked field by field, so an unknown layout does not
 * hide a missing policy or matrix on the same entry.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReferenceValidator implements ValidationStage {

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceValidator.class);

    @Override
    public List<ValidationTask> plan(ValidationContext context) {
        List<ValidationTask> tasks = new ArrayList<>();
        tasks.add(issues -> context.getRegistry().getPolicies().values()
                .forEach(entry -> checkSupportedLayouts(context, entry, issues)));
        tasks.add(issues -> checkDefaults(context, issues));
        for (Conversion conversion : context.getRegistry().getConversions()) {
            tasks.add(issues -> checkConversion(context, conversion, issues));
        }
        return tasks;
    }

    @Override
    public String getName() {
        return "reference";
    }

    // ---------------------------------------------------------------
    // DMX.REG.014
    // ---------------------------------------------------------------

    private void checkSupportedLayouts(ValidationContext context, PolicyEntry entry, IssueCollector issues) {
        Optional<PolicyPack> pack = context.pack(entry.getPolicyKey());
        checkLayoutList(context, entry, PolicyEntry.FIELD_SUPPORTS_SOURCE,
                pack.flatMap(PolicyPack::getSupportsSourceLayouts), issues);
        checkLayoutList(context, entry, PolicyEntry.FIELD_SUPPORTS_TARGET,
                pack.flatMap(PolicyPack::getSupportsTargetLayouts), issues);
    }

    private void checkLayoutList(ValidationContext context, PolicyEntry entry, String field,
            Optional<Object> fromPack, IssueCollector issues) {
        Evidence.Builder evidence;
        Object declared;
        if (entry.hasField(field)) {
            declared = entry.getFields().get(field);
            evidence = context.registryEvidence().location(entry.getLocation() + "." + field);
        } else if (fromPack.isPresent()) {
            declared = fromPack.get();
            evidence = Evidence.builder()
                    .filePath(context.pack(entry.getPolicyKey()).orElseThrow().getFile().toString())
                    .location("downmix_policy_pack." + field);
        } else {
            return;
        }
        evidence.policyId(entry.getPolicyKey());

        if (!(declared instanceof List<?> layouts)) {
            issues.add(Issue.error(IssueId.POLICY_SCHEMA_INVALID, RuleId.REG_014)
                    .message(field + " must be a list of layout IDs for " + entry.getPolicyKey())
                    .evidence(evidence.build())
                    .build());
            return;
        }
        Catalog catalog = context.getCatalog();
        for (Object layout : layouts) {
            String layoutId = String.valueOf(layout);
            if (!(layout instanceof String) || !catalog.isKnownLayout(layoutId)) {
                issues.add(Issue.error(IssueId.DOWNMIX_LAYOUT_UNKNOWN, RuleId.REG_014)
                        .message("Unknown layout in " + field + " of " + entry.getPolicyKey() + ": " + layoutId)
                        .evidence(evidence.build().toBuilder().layoutId(layoutId).build())
                        .build());
            }
        }
    }

    // ---------------------------------------------------------------
    // DMX.REG.020
    // ---------------------------------------------------------------

    private void checkDefaults(ValidationContext context, IssueCollector issues) {
        Registry registry = context.getRegistry();
        for (Map.Entry<String, Object> entry : registry.getDefaultPolicyBySourceLayout().entrySet()) {
            String layoutId = entry.getKey();
            String location = "default_policy_by_source_layout." + layoutId;
            if (!context.getCatalog().isKnownLayout(layoutId)) {
                issues.add(Issue.error(IssueId.DOWNMIX_LAYOUT_UNKNOWN, RuleId.REG_020)
                        .message("Unknown layout in default_policy_by_source_layout: " + layoutId)
                        .evidence(context.registryEvidence().location(location).layoutId(layoutId).build())
                        .build());
            }
            Object policy = entry.getValue();
            if (!(policy instanceof String policyKey) || !registry.hasPolicy(policyKey)) {
                // Unknown policy references reuse the mismatch code.
                issues.add(Issue.error(IssueId.DOWNMIX_POLICY_ID_MISMATCH, RuleId.REG_020)
                        .message("Default policy for " + layoutId + " is not a declared policy: " + policy)
                        .evidence(context.registryEvidence()
                                .location(location)
                                .layoutId(layoutId)
                                .policyId(String.valueOf(policy))
                                .build())
                        .build());
            }
        }
    }

    // ---------------------------------------------------------------
    // DMX.REG.030 - DMX.REG.033
    // ---------------------------------------------------------------

    private void checkConversion(ValidationContext context, Conversion conversion, IssueCollector issues) {
        String location = conversion.getLocation();
        if (!conversion.isMapping()) {
            issues.add(Issue.error(IssueId.POLICY_SCHEMA_INVALID, RuleId.REG_030)
                    .message("Conversion entry must be a mapping: " + location)
                    .evidence(context.registryEvidence().location(location).build())
                    .build());
            return;
        }

        boolean sourceKnown = checkConversionLayout(context, conversion, Conversion.FIELD_SOURCE_LAYOUT,
                conversion.getSourceLayoutId(), issues);
        boolean targetKnown = checkConversionLayout(context, conversion, Conversion.FIELD_TARGET_LAYOUT,
                conversion.getTargetLayoutId(), issues);

        String policyKey = resolveConversionPolicy(context, conversion, issues);

        Optional<String> matrixId = conversion.getMatrixId();
        if (matrixId.isEmpty()) {
            issues.add(Issue.error(IssueId.DOWNMIX_MATRIX_ID_MISSING, RuleId.REG_032)
                    .message("Conversion missing matrix_id: " + location)
                    .evidence(context.registryEvidence()
                            .location(location + "." + Conversion.FIELD_MATRIX)
                            .policyId(policyKey)
                            .build())
                    .build());
            return;
        }
        if (policyKey == null) {
            return;
        }
        Optional<PolicyPack> pack = context.pack(policyKey);
        if (pack.isEmpty()) {
            LOG.trace("Skipping matrix checks for {}: pack for {} not loaded", location, policyKey);
            return;
        }

        Optional<Matrix> matrix = pack.get().getMatrix(matrixId.get());
        if (matrix.isEmpty()) {
            issues.add(Issue.error(IssueId.DOWNMIX_MATRIX_ID_MISSING, RuleId.REG_032)
                    .message("Policy " + policyKey + " does not declare matrix " + matrixId.get())
                    .evidence(context.registryEvidence()
                            .location(location + "." + Conversion.FIELD_MATRIX)
                            .policyId(policyKey)
                            .matrixId(matrixId.get())
                            .build())
                    .build());
            return;
        }

        if (sourceKnown) {
            compareLayouts(context, conversion, Conversion.FIELD_SOURCE_LAYOUT, conversion.getSourceLayoutId().get(),
                    matrix.get().getSourceLayoutId(), policyKey, matrix.get(), issues);
        }
        if (targetKnown) {
            compareLayouts(context, conversion, Conversion.FIELD_TARGET_LAYOUT, conversion.getTargetLayoutId().get(),
                    matrix.get().getTargetLayoutId(), policyKey, matrix.get(), issues);
        }
    }

    private boolean checkConversionLayout(ValidationContext context, Conversion conversion, String field,
            Optional<String> layoutId, IssueCollector issues) {
        String location = conversion.getLocation() + "." + field;
        if (layoutId.isEmpty()) {
            issues.add(Issue.error(IssueId.POLICY_SCHEMA_INVALID, RuleId.REG_030)
                    .message("Conversion missing string field " + field + ": " + conversion.getLocation())
                    .evidence(context.registryEvidence().location(location).build())
                    .build());
            return false;
        }
        if (!context.getCatalog().isKnownLayout(layoutId.get())) {
            issues.add(Issue.error(IssueId.DOWNMIX_LAYOUT_UNKNOWN, RuleId.REG_030)
                    .message("Unknown layout in " + location + ": " + layoutId.get())
                    .evidence(context.registryEvidence().location(location).layoutId(layoutId.get()).build())
                    .build());
            return false;
        }
        return true;
    }

    /**
     * @return the registry policy key the conversion resolves to, or {@code null}
     *         if it cannot be resolved (already reported)
     */
    private String resolveConversionPolicy(ValidationContext context, Conversion conversion,
            IssueCollector issues) {
        Registry registry = context.getRegistry();
        String location = conversion.getLocation() + "." + Conversion.FIELD_POLICY;
        String policyKey;
        if (conversion.hasField(Conversion.FIELD_POLICY)) {
            Optional<String> explicit = conversion.getPolicyId();
            if (explicit.isEmpty()) {
                issues.add(policyMismatch(context, location, null,
                        "Conversion policy_id must be a string: " + conversion.getLocation()));
                return null;
            }
            policyKey = explicit.get();
        } else {
            Optional<String> fallback = conversion.getSourceLayoutId().flatMap(registry::defaultPolicyFor);
            if (fallback.isEmpty()) {
                issues.add(policyMismatch(context, location, null,
                        "Conversion has no policy_id and no default policy for its source layout: "
                                + conversion.getLocation()));
                return null;
            }
            policyKey = fallback.get();
        }
        if (!registry.hasPolicy(policyKey)) {
            issues.add(policyMismatch(context, location, policyKey,
                    "Conversion references unknown policy: " + policyKey));
            return null;
        }
        return policyKey;
    }

    private Issue policyMismatch(ValidationContext context, String location, String policyKey, String message) {
        return Issue.error(IssueId.DOWNMIX_POLICY_ID_MISMATCH, RuleId.REG_031)
                .message(message)
                .evidence(context.registryEvidence().location(location).policyId(policyKey).build())
                .build();
    }

    private void compareLayouts(ValidationContext context, Conversion conversion, String field, String declared,
            Optional<String> actual, String policyKey, Matrix matrix, IssueCollector issues) {
        if (actual.isEmpty() || actual.get().equals(declared)) {
            return;
        }
        issues.add(Issue.error(IssueId.DOWNMIX_LAYOUT_SPEAKER_MISMATCH, RuleId.REG_033)
                .message("Conversion " + field + " " + declared + " does not match matrix "
                        + matrix.getMatrixId() + " (" + actual.get() + ")")
                .evidence(context.registryEvidence()
                        .location(conversion.getLocation() + "." + field)
                        .policyId(policyKey)
                        .matrixId(matrix.getMatrixId())
                        .layoutId(declared)
                        .build())
                .build());
    }
}
