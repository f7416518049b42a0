package com.policysentinel.core.validation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.policysentinel.core.model.Issue;
import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.Severity;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Final, ordered result of a validation run.
 *
 * <p>
 * A report with zero {@code error} issues is passing: the registry is safe to
 * hand to a renderer. Any error blocks.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({ "issue_counts", "issues" })
public final class ValidationReport {

    private final List<Issue> issues;
    private final Map<Severity, Long> counts;

    /**
     * @param issues issues already in report order
     */
    public ValidationReport(List<Issue> issues) {
        this.issues = List.copyOf(Objects.requireNonNull(issues, "issues must not be null"));
        Map<Severity, Long> tally = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            tally.put(severity, 0L);
        }
        this.issues.forEach(i -> tally.merge(i.getSeverity(), 1L, Long::sum));
        this.counts = tally;
    }

    @JsonProperty("issues")
    public List<Issue> getIssues() {
        return issues;
    }

    /**
     * @return counts keyed by severity code, {@code error} first
     */
    @JsonProperty("issue_counts")
    public Map<String, Long> getIssueCounts() {
        Map<String, Long> byCode = new LinkedHashMap<>();
        byCode.put(Severity.ERROR.code(), count(Severity.ERROR));
        byCode.put(Severity.WARN.code(), count(Severity.WARN));
        return byCode;
    }

    public long count(Severity severity) {
        return counts.getOrDefault(severity, 0L);
    }

    /**
     * @return number of issues with the given ID and severity
     */
    public long count(IssueId issueId, Severity severity) {
        return issues.stream()
                .filter(i -> i.getIssueId() == issueId && i.getSeverity() == severity)
                .count();
    }

    @JsonIgnore
    public long getErrorCount() {
        return count(Severity.ERROR);
    }

    @JsonIgnore
    public long getWarnCount() {
        return count(Severity.WARN);
    }

    /**
     * @return the highest severity present, or empty for a clean report
     */
    @JsonIgnore
    public Optional<Severity> getMaxSeverity() {
        return issues.stream().map(Issue::getSeverity).reduce(Severity::max);
    }

    /**
     * @return {@code true} if the report holds no errors
     */
    @JsonIgnore
    public boolean isPassing() {
        return getErrorCount() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ValidationReport that))
            return false;
        return issues.equals(that.issues);
    }

    @Override
    public int hashCode() {
        return issues.hashCode();
    }

    @Override
    public String toString() {
        return "ValidationReport{errors=" + getErrorCount() + ", warnings=" + getWarnCount()
                + ", issues=" + issues.size() + '}';
    }
}
