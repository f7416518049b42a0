package com.policysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;
import java.util.Objects;

/**
 * A single validation finding.
 *
 * <p>
 * Issues are value objects: they are created once by a validator, never
 * mutated, and compared by value. {@link #ORDER} is the total order used for
 * every report: rule code, then file path, matrix, target speaker and source
 * speaker, then the remaining evidence and issue fields.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code issueId}, {@code severity}, {@code ruleId}
 * and {@code evidence} are required.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "issue_id", "severity", "rule_id", "message", "evidence" })
public final class Issue {

    /** Deterministic report order. */
    public static final Comparator<Issue> ORDER = Comparator
            .comparing((Issue i) -> i.ruleId.code())
            .thenComparing(Issue::getEvidence, Evidence.ORDER)
            .thenComparing(i -> i.issueId.code())
            .thenComparing(Issue::getSeverity)
            .thenComparing(Issue::getMessage, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final IssueId issueId;
    private final Severity severity;
    private final RuleId ruleId;
    private final String message;
    private final Evidence evidence;

    private Issue(Builder builder) {
        this.issueId = Objects.requireNonNull(builder.issueId, "issueId must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.ruleId = Objects.requireNonNull(builder.ruleId, "ruleId must not be null");
        this.evidence = Objects.requireNonNull(builder.evidence, "evidence must not be null");
        this.message = builder.message;
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for an {@link Severity#ERROR} issue.
     *
     * @return builder with severity preset
     */
    public static Builder error(IssueId issueId, RuleId ruleId) {
        return new Builder().issueId(issueId).ruleId(ruleId).severity(Severity.ERROR);
    }

    /**
     * Shorthand for a {@link Severity#WARN} issue.
     *
     * @return builder with severity preset
     */
    public static Builder warn(IssueId issueId, RuleId ruleId) {
        return new Builder().issueId(issueId).ruleId(ruleId).severity(Severity.WARN);
    }

    /**
     * Fluent builder for {@link Issue} instances.
     */
    public static class Builder {
        private IssueId issueId;
        private Severity severity;
        private RuleId ruleId;
        private String message;
        private Evidence evidence;

        public Builder issueId(IssueId issueId) {
            this.issueId = issueId;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder ruleId(RuleId ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder evidence(Evidence evidence) {
            this.evidence = evidence;
            return this;
        }

        /**
         * Build the issue.
         *
         * @return a new {@link Issue}
         * @throws NullPointerException if a required field is missing
         */
        public Issue build() {
            return new Issue(this);
        }
    }

    @JsonProperty("issue_id")
    public IssueId getIssueId() {
        return issueId;
    }

    @JsonProperty("severity")
    public Severity getSeverity() {
        return severity;
    }

    @JsonProperty("rule_id")
    public RuleId getRuleId() {
        return ruleId;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @JsonProperty("evidence")
    public Evidence getEvidence() {
        return evidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Issue issue))
            return false;
        return issueId == issue.issueId
                && severity == issue.severity
                && ruleId == issue.ruleId
                && Objects.equals(message, issue.message)
                && evidence.equals(issue.evidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(issueId, severity, ruleId, message, evidence);
    }

    @Override
    public String toString() {
        return "Issue{" +
                "issueId=" + issueId +
                ", severity=" + severity +
                ", ruleId=" + ruleId +
                ", message='" + message + '\'' +
                ", evidence=" + evidence +
                '}';
    }
}
