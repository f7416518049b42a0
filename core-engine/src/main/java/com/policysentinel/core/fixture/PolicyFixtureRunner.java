package com.policysentinel.core.fixture;

import com.policysentinel.core.model.Severity;
import com.policysentinel.core.validation.PolicyValidationEngine;
import com.policysentinel.core.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs {@code policy_validation} fixtures against a
 * {@link PolicyValidationEngine}: validate the fixture's registry, then
 * compare the aggregate counts and every {@code must_include} expectation.
 *
 * @since 1.0.0
 */
public final class PolicyFixtureRunner {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyFixtureRunner.class);

    private final PolicyValidationEngine engine;

    public PolicyFixtureRunner(PolicyValidationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * Load and run a fixture file.
     *
     * @throws IllegalArgumentException if the fixture is malformed
     */
    public FixtureResult run(Path fixtureFile) {
        return run(PolicyFixtureLoader.load(fixtureFile));
    }

    public FixtureResult run(PolicyFixture fixture) {
        Objects.requireNonNull(fixture, "fixture must not be null");
        ValidationReport report = engine.validate(fixture.getRegistryFile());
        List<String> failures = new ArrayList<>();

        checkCount(fixture.getExpectedErrors(), report.count(Severity.ERROR), "error", failures);
        checkCount(fixture.getExpectedWarns(), report.count(Severity.WARN), "warn", failures);
        for (PolicyFixture.ExpectedIssue expected : fixture.getMustInclude()) {
            long actual = report.count(expected.getIssueId(), expected.getSeverity());
            if (actual < expected.getCountMin()) {
                failures.add("must_include " + expected.getIssueId().code() + " (" + expected.getSeverity()
                        + "): expected at least " + expected.getCountMin() + ", got " + actual);
            }
        }

        FixtureResult result = new FixtureResult(fixture, report, failures);
        if (result.isPassed()) {
            LOG.info("Fixture {} passed ({})", fixture.getFixtureId(), fixture.getFixtureFile());
        } else {
            LOG.warn("Fixture {} failed with {} mismatch(es) ({})", fixture.getFixtureId(), failures.size(),
                    fixture.getFixtureFile());
        }
        return result;
    }

    private static void checkCount(Optional<Long> expected, long actual, String severity, List<String> failures) {
        if (expected.isPresent() && expected.get() != actual) {
            failures.add("issue_counts." + severity + ": expected " + expected.get() + ", got " + actual);
        }
    }
}
