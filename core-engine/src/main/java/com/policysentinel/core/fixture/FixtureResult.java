package com.policysentinel.core.fixture;

import com.policysentinel.core.validation.ValidationReport;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of running one fixture: the report and every expectation it
 * failed. An empty failure list means the fixture passed.
 *
 * @since 1.0.0
 */
public final class FixtureResult {

    private final PolicyFixture fixture;
    private final ValidationReport report;
    private final List<String> failures;

    FixtureResult(PolicyFixture fixture, ValidationReport report, List<String> failures) {
        this.fixture = Objects.requireNonNull(fixture, "fixture must not be null");
        this.report = Objects.requireNonNull(report, "report must not be null");
        this.failures = List.copyOf(failures);
    }

    public PolicyFixture getFixture() {
        return fixture;
    }

    public ValidationReport getReport() {
        return report;
    }

    public List<String> getFailures() {
        return failures;
    }

    public boolean isPassed() {
        return failures.isEmpty();
    }

    @Override
    public String toString() {
        return "FixtureResult{" + fixture.getFixtureId() + (isPassed() ? ", passed" : ", failures=" + failures) + '}';
    }
}
