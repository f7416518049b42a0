package com.policysentinel.core.validation;

import com.policysentinel.core.catalog.Catalog;
import com.policysentinel.core.catalog.Layout;
import com.policysentinel.core.model.DocumentNode;
import com.policysentinel.core.model.Evidence;
import com.policysentinel.core.model.Issue;
import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.Matrix;
import com.policysentinel.core.model.PolicyPack;
import com.policysentinel.core.model.RuleId;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Per-matrix checks on every loaded pack.
 *
 * <ul>
 * <li>{@code DMX.PACK.010} source and target layouts must be known</li>
 * <li>{@code DMX.PACK.011} {@code coefficients} must map target speaker to a
 * mapping of source speaker to gain</li>
 * <li>{@code DMX.PACK.012} every speaker key must be known</li>
 * <li>{@code DMX.PACK.013} the target keys must equal the target layout's
 * channel set exactly</li>
 * <li>{@code DMX.PACK.014} every source key must belong to the source layout</li>
 * <li>{@code DMX.COEFF.*} via {@link CoefficientSanityChecker}</li>
 * </ul>
 *
 * <p>
 * An unknown speaker is reported once under {@code DMX.PACK.012} and is not
 * blamed again as a layout mismatch. A pack file referenced by several
 * policies is checked once.
 * </p>
 *
 * @since 1.0.0
 */
public final class MatrixValidator implements ValidationStage {

    private final CoefficientSanityChecker coefficients;

    public MatrixValidator(CoefficientSanityChecker coefficients) {
        this.coefficients = Objects.requireNonNull(coefficients, "coefficients must not be null");
    }

    @Override
    public List<ValidationTask> plan(ValidationContext context) {
        List<ValidationTask> tasks = new ArrayList<>();
        Set<Path> seen = new HashSet<>();
        for (PolicyPack pack : context.getPacks().values()) {
            if (!seen.add(pack.getFile())) {
                continue;
            }
            for (Matrix matrix : pack.getMatrices().values()) {
                tasks.add(issues -> validateMatrix(context.getCatalog(), pack, matrix, issues));
            }
        }
        return tasks;
    }

    @Override
    public String getName() {
        return "matrix";
    }

    /**
     * Validate one matrix.
     *
     * @param catalog reference catalog
     * @param pack    pack declaring the matrix
     * @param matrix  the matrix
     * @param issues  sink for findings
     */
    void validateMatrix(Catalog catalog, PolicyPack pack, Matrix matrix, IssueCollector issues) {
        Evidence base = Evidence.builder()
                .filePath(pack.getFile().toString())
                .matrixId(matrix.getMatrixId())
                .location(matrix.getLocation())
                .build();

        if (!matrix.isMapping()) {
            issues.add(Issue.error(IssueId.POLICY_SCHEMA_INVALID, RuleId.PACK_011)
                    .message("Matrix must be a mapping: " + matrix.getMatrixId())
                    .evidence(base)
                    .build());
            return;
        }

        Optional<Layout> source = layout(catalog, matrix, Matrix.FIELD_SOURCE_LAYOUT,
                matrix.getSourceLayoutId(), base, issues);
        Optional<Layout> target = layout(catalog, matrix, Matrix.FIELD_TARGET_LAYOUT,
                matrix.getTargetLayoutId(), base, issues);

        Optional<Object> rawCoefficients = matrix.getCoefficients();
        if (rawCoefficients.isEmpty() || !(rawCoefficients.get() instanceof Map<?, ?> rows)) {
            issues.add(Issue.error(IssueId.POLICY_SCHEMA_INVALID, RuleId.PACK_011)
                    .message("Matrix " + matrix.getMatrixId() + " coefficients must be a mapping")
                    .evidence(locate(base, Matrix.FIELD_COEFFICIENTS))
                    .build());
            return;
        }

        Set<String> targetKeys = new HashSet<>();
        for (Map.Entry<String, Object> row : DocumentNode.copyOf(rows).entrySet()) {
            String targetSpeaker = row.getKey();
            targetKeys.add(targetSpeaker);
            Evidence rowEvidence = base.toBuilder()
                    .location(base.getLocation() + "." + Matrix.FIELD_COEFFICIENTS + "." + targetSpeaker)
                    .targetSpeaker(targetSpeaker)
                    .build();

            if (!catalog.isKnownSpeaker(targetSpeaker)) {
                issues.add(Issue.error(IssueId.DOWNMIX_SPEAKER_UNKNOWN, RuleId.PACK_012)
                        .message("Unknown target speaker in " + matrix.getMatrixId() + ": " + targetSpeaker)
                        .evidence(rowEvidence)
                        .build());
            } else if (target.isPresent() && !target.get().hasChannel(targetSpeaker)) {
                issues.add(Issue.error(IssueId.DOWNMIX_LAYOUT_SPEAKER_MISMATCH, RuleId.PACK_013)
                        .message("Target speaker " + targetSpeaker + " is not a channel of "
                                + target.get().getId())
                        .evidence(rowEvidence.toBuilder().layoutId(target.get().getId().value()).build())
                        .build());
            }

            if (!(row.getValue() instanceof Map<?, ?> sources)) {
                issues.add(Issue.error(IssueId.POLICY_SCHEMA_INVALID, RuleId.PACK_011)
                        .message("Coefficients for " + targetSpeaker + " in " + matrix.getMatrixId()
                                + " must be a mapping")
                        .evidence(rowEvidence)
                        .build());
                continue;
            }

            double sumAbs = 0.0;
            for (Map.Entry<String, Object> cell : DocumentNode.copyOf(sources).entrySet()) {
                String sourceSpeaker = cell.getKey();
                Evidence cellEvidence = rowEvidence.toBuilder()
                        .location(rowEvidence.getLocation() + "." + sourceSpeaker)
                        .sourceSpeaker(sourceSpeaker)
                        .build();

                if (!catalog.isKnownSpeaker(sourceSpeaker)) {
                    issues.add(Issue.error(IssueId.DOWNMIX_SPEAKER_UNKNOWN, RuleId.PACK_012)
                            .message("Unknown source speaker in " + matrix.getMatrixId() + ": " + sourceSpeaker)
                            .evidence(cellEvidence)
                            .build());
                } else if (source.isPresent() && !source.get().hasChannel(sourceSpeaker)) {
                    issues.add(Issue.error(IssueId.DOWNMIX_LAYOUT_SPEAKER_MISMATCH, RuleId.PACK_014)
                            .message("Source speaker " + sourceSpeaker + " is not a channel of "
                                    + source.get().getId())
                            .evidence(cellEvidence.toBuilder().layoutId(source.get().getId().value()).build())
                            .build());
                }

                OptionalDouble magnitude = coefficients.checkCoefficient(cell.getValue(), cellEvidence, issues);
                if (magnitude.isPresent()) {
                    sumAbs += magnitude.getAsDouble();
                }
            }
            coefficients.checkChannelSum(sumAbs, rowEvidence, issues);
        }

        if (target.isPresent()) {
            for (String channel : target.get().channelSet()) {
                if (!targetKeys.contains(channel)) {
                    issues.add(Issue.error(IssueId.DOWNMIX_LAYOUT_SPEAKER_MISMATCH, RuleId.PACK_013)
                            .message("Matrix " + matrix.getMatrixId() + " has no coefficients for target channel "
                                    + channel + " of " + target.get().getId())
                            .evidence(base.toBuilder()
                                    .location(base.getLocation() + "." + Matrix.FIELD_COEFFICIENTS)
                                    .targetSpeaker(channel)
                                    .layoutId(target.get().getId().value())
                                    .build())
                            .build());
                }
            }
        }
    }

    private Optional<Layout> layout(Catalog catalog, Matrix matrix, String field, Optional<String> layoutId,
            Evidence base, IssueCollector issues) {
        Optional<Layout> layout = layoutId.flatMap(catalog::layout);
        if (layout.isEmpty()) {
            String shown = layoutId.orElse(String.valueOf(matrix.getFields().get(field)));
            issues.add(Issue.error(IssueId.DOWNMIX_LAYOUT_UNKNOWN, RuleId.PACK_010)
                    .message("Matrix " + matrix.getMatrixId() + " " + field + " is not a known layout: " + shown)
                    .evidence(locate(base, field).toBuilder().layoutId(shown).build())
                    .build());
        }
        return layout;
    }

    private static Evidence locate(Evidence base, String field) {
        return base.toBuilder().location(base.getLocation() + "." + field).build();
    }
}
