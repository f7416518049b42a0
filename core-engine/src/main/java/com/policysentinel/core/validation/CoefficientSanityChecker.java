package com.policysentinel.core.validation;

import com.policysentinel.core.config.ValidationOptions;
import com.policysentinel.core.model.Evidence;
import com.policysentinel.core.model.Issue;
import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.RuleId;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Numeric rules for downmix coefficients.
 *
 * <ul>
 * <li>{@code DMX.COEFF.001} value must be a finite number (error)</li>
 * <li>{@code DMX.COEFF.002} {@code |value| > hard limit} (error)</li>
 * <li>{@code DMX.COEFF.003} {@code soft limit < |value| <= hard limit} (warning)</li>
 * <li>{@code DMX.COEFF.004} per target channel, {@code sum |value|} above the
 * warning limit warns and above the error limit errors; an error replaces the
 * warning for that channel</li>
 * </ul>
 *
 * <p>
 * The per-coefficient and per-channel rules are independent: one channel can
 * raise both.
 * </p>
 *
 * @since 1.0.0
 */
public final class CoefficientSanityChecker {

    private final ValidationOptions options;

    public CoefficientSanityChecker(ValidationOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Check one coefficient.
     *
     * @param value    raw parsed value
     * @param evidence matrix / speaker context of the coefficient
     * @param issues   sink for findings
     * @return the magnitude when the value is a finite number, to be added to
     *         the channel sum; empty otherwise
     */
    public OptionalDouble checkCoefficient(Object value, Evidence evidence, IssueCollector issues) {
        if (!(value instanceof Number number)) {
            issues.add(Issue.error(IssueId.DOWNMIX_COEFFICIENT_INVALID, RuleId.COEFF_001)
                    .message("Coefficient is not numeric: " + value)
                    .evidence(evidence)
                    .build());
            return OptionalDouble.empty();
        }
        double v = number.doubleValue();
        if (!Double.isFinite(v)) {
            issues.add(Issue.error(IssueId.DOWNMIX_COEFFICIENT_INVALID, RuleId.COEFF_001)
                    .message("Coefficient is not finite: " + v)
                    .evidence(evidence.toBuilder().value(v).build())
                    .build());
            return OptionalDouble.empty();
        }

        double magnitude = Math.abs(v);
        if (magnitude > options.getHardLimit()) {
            issues.add(Issue.error(IssueId.DOWNMIX_COEFFICIENT_INVALID, RuleId.COEFF_002)
                    .message(String.format("Coefficient |%s| exceeds hard limit %s", v, options.getHardLimit()))
                    .evidence(evidence.toBuilder().value(v).build())
                    .build());
        } else if (magnitude > options.getSoftLimit()) {
            issues.add(Issue.warn(IssueId.DOWNMIX_COEFFICIENT_HIGH, RuleId.COEFF_003)
                    .message(String.format("Coefficient |%s| exceeds soft limit %s", v, options.getSoftLimit()))
                    .evidence(evidence.toBuilder().value(v).build())
                    .build());
        }
        return OptionalDouble.of(magnitude);
    }

    /**
     * Check the summed magnitude of one target channel.
     *
     * @param sumAbs   sum of {@code |coefficient|} over the channel's finite sources
     * @param evidence matrix / target speaker context
     * @param issues   sink for findings
     */
    public void checkChannelSum(double sumAbs, Evidence evidence, IssueCollector issues) {
        if (sumAbs > options.getSumErrorLimit()) {
            issues.add(Issue.error(IssueId.DOWNMIX_COEFFICIENT_INVALID, RuleId.COEFF_004)
                    .message(String.format("Unexpected level: sum_abs %s exceeds %s on %s",
                            sumAbs, options.getSumErrorLimit(), evidence.getTargetSpeaker()))
                    .evidence(evidence.toBuilder().value(sumAbs).build())
                    .build());
        } else if (sumAbs > options.getSumWarnLimit()) {
            issues.add(Issue.warn(IssueId.DOWNMIX_COEFFICIENT_HIGH, RuleId.COEFF_004)
                    .message(String.format("Unexpected level: sum_abs %s exceeds %s on %s",
                            sumAbs, options.getSumWarnLimit(), evidence.getTargetSpeaker()))
                    .evidence(evidence.toBuilder().value(sumAbs).build())
                    .build());
        }
    }
}
