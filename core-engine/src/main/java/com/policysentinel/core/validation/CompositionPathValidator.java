package com.policysentinel.core.validation;

import com.policysentinel.core.model.CompositionPath;
import com.policysentinel.core.model.CompositionStep;
import com.policysentinel.core.model.Issue;
import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.Matrix;
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
 * Verifies declared multi-step fold-down chains.
 *
 * <ul>
 * <li>{@code DMX.REG.041} path and step shape</li>
 * <li>{@code DMX.REG.042} declared path layouts must be known</li>
 * <li>{@code DMX.REG.044} explicit policy context must exist</li>
 * <li>{@code DMX.REG.040} every step's matrix must resolve</li>
 * <li>{@code DMX.REG.043} {@code steps[i].target == steps[i + 1].source}, the
 * first source and last target equal the path's declared layouts, and a
 * step's own declared layouts equal its matrix's</li>
 * </ul>
 *
 * <h3>Policy context</h3>
 * <p>
 * A step resolves its matrix in the step's {@code policy_id}, else the path's
 * {@code policy_id}, else the default policy of the path's source layout.
 * When that pack does not declare the matrix, the remaining loaded packs are
 * searched in policy-ID order.
 * </p>
 *
 * <p>
 * Edges touching an unresolved step are not checked, so a missing matrix is
 * reported once and its neighbours are not blamed for it.
 * </p>
 *
 * @since 1.0.0
 */
public final class CompositionPathValidator implements ValidationStage {

    private static final Logger LOG = LoggerFactory.getLogger(CompositionPathValidator.class);

    @Override
    public List<ValidationTask> plan(ValidationContext context) {
        Registry registry = context.getRegistry();
        if (!registry.hasCompositionPaths()) {
            return List.of();
        }
        if (!(registry.getCompositionPathsRaw().orElse(null) instanceof List)) {
            return List.of(issues -> issues.add(Issue.error(IssueId.POLICY_SCHEMA_INVALID, RuleId.REG_041)
                    .message("composition_paths must be a list")
                    .evidence(context.registryEvidence().location("composition_paths").build())
                    .build()));
        }
        List<ValidationTask> tasks = new ArrayList<>();
        for (CompositionPath path : registry.getCompositionPaths()) {
            tasks.add(issues -> validatePath(context, path, issues));
        }
        return tasks;
    }

    @Override
    public String getName() {
        return "composition";
    }

    void validatePath(ValidationContext context, CompositionPath path, IssueCollector issues) {
        String location = path.getLocation();
        if (!path.isMapping()) {
            issues.add(schemaInvalid(context, location, "Composition path must be a mapping: " + location));
            return;
        }

        Optional<String> declaredSource = checkDeclaredLayout(context, path, CompositionPath.FIELD_SOURCE_LAYOUT,
                path.getSourceLayoutId(), issues);
        Optional<String> declaredTarget = checkDeclaredLayout(context, path, CompositionPath.FIELD_TARGET_LAYOUT,
                path.getTargetLayoutId(), issues);

        boolean pathPolicyValid = checkPolicyReference(context, path.getLocation(), path.hasField(CompositionPath.FIELD_POLICY),
                path.getPolicyId(), issues);

        if (!path.hasStepList() || path.getSteps().isEmpty()) {
            issues.add(schemaInvalid(context, location + "." + CompositionPath.FIELD_STEPS,
                    "Composition path missing or empty steps list: " + location));
            return;
        }

        String pathContext = pathPolicyValid && path.getPolicyId().isPresent()
                ? path.getPolicyId().get()
                : path.getSourceLayoutId().flatMap(context.getRegistry()::defaultPolicyFor).orElse(null);

        List<CompositionStep> steps = path.getSteps();
        List<Matrix> resolved = new ArrayList<>(steps.size());
        for (CompositionStep step : steps) {
            resolved.add(resolveStep(context, step, pathContext, issues));
        }

        for (int i = 0; i + 1 < steps.size(); i++) {
            Matrix current = resolved.get(i);
            Matrix next = resolved.get(i + 1);
            if (current == null || next == null) {
                continue;
            }
            Optional<String> joinFrom = current.getTargetLayoutId();
            Optional<String> joinTo = next.getSourceLayoutId();
            if (joinFrom.isPresent() && joinTo.isPresent() && !joinFrom.get().equals(joinTo.get())) {
                issues.add(Issue.error(IssueId.DOWNMIX_LAYOUT_SPEAKER_MISMATCH, RuleId.REG_043)
                        .message("Composition chain broken between steps " + i + " and " + (i + 1) + ": "
                                + current.getMatrixId() + " ends at " + joinFrom.get() + " but "
                                + next.getMatrixId() + " starts at " + joinTo.get())
                        .evidence(context.registryEvidence()
                                .location(location + ".steps[" + i + "]->steps[" + (i + 1) + "]")
                                .matrixId(next.getMatrixId())
                                .layoutId(joinFrom.get())
                                .build())
                        .build());
            }
        }

        Matrix first = resolved.get(0);
        if (first != null && declaredSource.isPresent()) {
            checkEndpoint(context, location + ".steps[0]", "starts", first, first.getSourceLayoutId(),
                    declaredSource.get(), issues);
        }
        Matrix last = resolved.get(resolved.size() - 1);
        if (last != null && declaredTarget.isPresent()) {
            checkEndpoint(context, location + ".steps[" + (resolved.size() - 1) + "]", "ends", last,
                    last.getTargetLayoutId(), declaredTarget.get(), issues);
        }
    }

    private Matrix resolveStep(ValidationContext context, CompositionStep step, String pathContext,
            IssueCollector issues) {
        String location = step.getLocation();
        if (!step.isMapping()) {
            issues.add(schemaInvalid(context, location, "Composition step must be a mapping: " + location));
            return null;
        }
        Optional<String> matrixId = step.getMatrixId();
        if (matrixId.isEmpty()) {
            issues.add(schemaInvalid(context, location + "." + CompositionStep.FIELD_MATRIX,
                    "Composition step missing matrix_id: " + location));
            return null;
        }
        if (!checkPolicyReference(context, location, step.hasField(CompositionStep.FIELD_POLICY),
                step.getPolicyId(), issues)) {
            return null;
        }

        String policyKey = step.getPolicyId().orElse(pathContext);
        Optional<Matrix> matrix = context.matrix(policyKey, matrixId.get());
        if (matrix.isEmpty()) {
            matrix = searchOtherPacks(context, policyKey, matrixId.get());
        }
        if (matrix.isEmpty()) {
            if (context.isPackUnavailable(policyKey)) {
                LOG.trace("Skipping {}: pack for {} not loaded", location, policyKey);
                return null;
            }
            issues.add(Issue.error(IssueId.DOWNMIX_MATRIX_ID_MISSING, RuleId.REG_040)
                    .message("Composition step matrix not found: " + matrixId.get()
                            + (policyKey != null ? " (policy context " + policyKey + ")" : ""))
                    .evidence(context.registryEvidence()
                            .location(location + "." + CompositionStep.FIELD_MATRIX)
                            .policyId(policyKey)
                            .matrixId(matrixId.get())
                            .build())
                    .build());
            return null;
        }

        checkStepLayout(context, step, CompositionStep.FIELD_SOURCE_LAYOUT, step.getSourceLayoutId(),
                matrix.get().getSourceLayoutId(), matrix.get(), issues);
        checkStepLayout(context, step, CompositionStep.FIELD_TARGET_LAYOUT, step.getTargetLayoutId(),
                matrix.get().getTargetLayoutId(), matrix.get(), issues);
        return matrix.get();
    }

    private Optional<Matrix> searchOtherPacks(ValidationContext context, String skipPolicy, String matrixId) {
        for (Map.Entry<String, PolicyPack> entry : context.getPacks().entrySet()) {
            if (entry.getKey().equals(skipPolicy)) {
                continue;
            }
            Optional<Matrix> found = entry.getValue().getMatrix(matrixId);
            if (found.isPresent()) {
                LOG.trace("Resolved {} through fallback policy {}", matrixId, entry.getKey());
                return found;
            }
        }
        return Optional.empty();
    }

    private Optional<String> checkDeclaredLayout(ValidationContext context, CompositionPath path, String field,
            Optional<String> layoutId, IssueCollector issues) {
        String location = path.getLocation() + "." + field;
        if (layoutId.isEmpty()) {
            issues.add(schemaInvalid(context, location,
                    "Composition path missing string field " + field + ": " + path.getLocation()));
            return Optional.empty();
        }
        if (!context.getCatalog().isKnownLayout(layoutId.get())) {
            issues.add(Issue.error(IssueId.DOWNMIX_LAYOUT_UNKNOWN, RuleId.REG_042)
                    .message("Unknown layout in " + location + ": " + layoutId.get())
                    .evidence(context.registryEvidence().location(location).layoutId(layoutId.get()).build())
                    .build());
            return Optional.empty();
        }
        return layoutId;
    }

    /**
     * @return {@code false} if a {@code policy_id} is declared but is not a
     *         registry policy (already reported)
     */
    private boolean checkPolicyReference(ValidationContext context, String ownerLocation, boolean declared,
            Optional<String> policyId, IssueCollector issues) {
        if (!declared) {
            return true;
        }
        if (policyId.isPresent() && context.getRegistry().hasPolicy(policyId.get())) {
            return true;
        }
        String shown = policyId.orElse(null);
        issues.add(Issue.error(IssueId.DOWNMIX_POLICY_ID_MISMATCH, RuleId.REG_044)
                .message("Composition policy context is not a declared policy: " + shown)
                .evidence(context.registryEvidence()
                        .location(ownerLocation + "." + CompositionPath.FIELD_POLICY)
                        .policyId(shown)
                        .build())
                .build());
        return false;
    }

    private void checkStepLayout(ValidationContext context, CompositionStep step, String field,
            Optional<String> declared, Optional<String> actual, Matrix matrix, IssueCollector issues) {
        if (declared.isEmpty() || actual.isEmpty() || declared.get().equals(actual.get())) {
            return;
        }
        issues.add(Issue.error(IssueId.DOWNMIX_LAYOUT_SPEAKER_MISMATCH, RuleId.REG_043)
                .message("Step " + field + " " + declared.get() + " does not match matrix "
                        + matrix.getMatrixId() + " (" + actual.get() + ")")
                .evidence(context.registryEvidence()
                        .location(step.getLocation() + "." + field)
                        .matrixId(matrix.getMatrixId())
                        .layoutId(declared.get())
                        .build())
                .build());
    }

    private void checkEndpoint(ValidationContext context, String location, String verb, Matrix matrix,
            Optional<String> actual, String declared, IssueCollector issues) {
        if (actual.isEmpty() || actual.get().equals(declared)) {
            return;
        }
        issues.add(Issue.error(IssueId.DOWNMIX_LAYOUT_SPEAKER_MISMATCH, RuleId.REG_043)
                .message("Composition path " + verb + " at " + actual.get() + " via " + matrix.getMatrixId()
                        + " but declares " + declared)
                .evidence(context.registryEvidence()
                        .location(location)
                        .matrixId(matrix.getMatrixId())
                        .layoutId(declared)
                        .build())
                .build());
    }

    private static Issue schemaInvalid(ValidationContext context, String location, String message) {
        return Issue.error(IssueId.POLICY_SCHEMA_INVALID, RuleId.REG_041)
                .message(message)
                .evidence(context.registryEvidence().location(location).build())
                .build();
    }
}
