package com.policysentinel.core.fixture;

import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.Severity;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed {@code policy_validation} fixture: the registry to validate and
 * the expected outcome.
 *
 * <p>
 * Instances are created by {@link PolicyFixtureLoader}; the registry path is
 * already resolved against the fixture's directory.
 * </p>
 *
 * @since 1.0.0
 */
public final class PolicyFixture {

    private final String fixtureId;
    private final Path fixtureFile;
    private final Path registryFile;
    private final Long expectedErrors;
    private final Long expectedWarns;
    private final List<ExpectedIssue> mustInclude;

    PolicyFixture(String fixtureId, Path fixtureFile, Path registryFile, Long expectedErrors, Long expectedWarns,
            List<ExpectedIssue> mustInclude) {
        this.fixtureId = Objects.requireNonNull(fixtureId, "fixtureId must not be null");
        this.fixtureFile = Objects.requireNonNull(fixtureFile, "fixtureFile must not be null");
        this.registryFile = Objects.requireNonNull(registryFile, "registryFile must not be null");
        this.expectedErrors = expectedErrors;
        this.expectedWarns = expectedWarns;
        this.mustInclude = List.copyOf(mustInclude);
    }

    public String getFixtureId() {
        return fixtureId;
    }

    public Path getFixtureFile() {
        return fixtureFile;
    }

    public Path getRegistryFile() {
        return registryFile;
    }

    /**
     * @return expected error count, empty if the fixture does not pin it
     */
    public Optional<Long> getExpectedErrors() {
        return Optional.ofNullable(expectedErrors);
    }

    public Optional<Long> getExpectedWarns() {
        return Optional.ofNullable(expectedWarns);
    }

    public List<ExpectedIssue> getMustInclude() {
        return mustInclude;
    }

    @Override
    public String toString() {
        return "PolicyFixture{" + fixtureId + ", registry=" + registryFile + '}';
    }

    /**
     * One {@code expected.must_include} entry: at least {@code countMin}
     * issues with this ID and severity.
     */
    public static final class ExpectedIssue {
        private final IssueId issueId;
        private final Severity severity;
        private final long countMin;

        public ExpectedIssue(IssueId issueId, Severity severity, long countMin) {
            this.issueId = Objects.requireNonNull(issueId, "issueId must not be null");
            this.severity = Objects.requireNonNull(severity, "severity must not be null");
            if (countMin < 1) {
                throw new IllegalArgumentException("countMin must be >= 1, got: " + countMin);
            }
            this.countMin = countMin;
        }

        public IssueId getIssueId() {
            return issueId;
        }

        public Severity getSeverity() {
            return severity;
        }

        public long getCountMin() {
            return countMin;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof ExpectedIssue that))
                return false;
            return countMin == that.countMin && issueId == that.issueId && severity == that.severity;
        }

        @Override
        public int hashCode() {
            return Objects.hash(issueId, severity, countMin);
        }

        @Override
        public String toString() {
            return issueId.code() + "/" + severity + ">=" + countMin;
        }
    }
}
