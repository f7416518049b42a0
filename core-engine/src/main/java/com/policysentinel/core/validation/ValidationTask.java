package com.policysentinel.core.validation;

/**
 * One independent unit of validation work.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ValidationTask {

    /**
     * @param issues sink for every finding; safe for concurrent use
     */
    void run(IssueCollector issues);
}
