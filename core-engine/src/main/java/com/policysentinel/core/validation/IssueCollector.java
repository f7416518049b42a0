package com.policysentinel.core.validation;

import com.policysentinel.core.model.Issue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Accumulates issues from every validator.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * {@link #add(Issue)} may be called concurrently from worker threads.
 * Arrival order is irrelevant: {@link #ordered()} sorts by
 * {@link Issue#ORDER} and drops exact duplicates, which arise when two
 * policies reference the same pack file.
 * </p>
 *
 * @since 1.0.0
 */
public final class IssueCollector {

    private static final Logger LOG = LoggerFactory.getLogger(IssueCollector.class);

    private final ConcurrentLinkedQueue<Issue> issues = new ConcurrentLinkedQueue<>();

    /**
     * @param issue finding to record; must not be {@code null}
     */
    public void add(Issue issue) {
        Objects.requireNonNull(issue, "issue must not be null");
        LOG.debug("[{}] {} {}: {}", issue.getRuleId(), issue.getSeverity(), issue.getIssueId(), issue.getMessage());
        issues.add(issue);
    }

    public void addAll(Collection<Issue> batch) {
        Objects.requireNonNull(batch, "batch must not be null");
        batch.forEach(this::add);
    }

    /**
     * @return number of issues recorded so far, duplicates included
     */
    public int size() {
        return issues.size();
    }

    /**
     * @return distinct issues in deterministic report order
     */
    public List<Issue> ordered() {
        List<Issue> snapshot = new ArrayList<>(issues);
        return snapshot.stream()
                .sorted(Issue.ORDER)
                .distinct()
                .toList();
    }

    /**
     * @return report over the distinct, ordered issues
     */
    public ValidationReport toReport() {
        return new ValidationReport(ordered());
    }
}
