package com.policysentinel.core.fixture;

import com.policysentinel.core.TestResources;
import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PolicyFixtureLoader}.
 */
class PolicyFixtureLoaderTest {

    @Test
    @DisplayName("Should load a fixture and resolve its registry relative to the fixture")
    void shouldLoadFixture() {
        PolicyFixture fixture = PolicyFixtureLoader.load(TestResources.path("fixtures/missing-pack.yaml"));

        assertThat(fixture.getFixtureId()).isEqualTo("FIXTURE.POLICY.MISSING_PACK");
        assertThat(fixture.getRegistryFile())
                .isEqualTo(TestResources.path("registries/missing-pack/registry.yaml"));
        assertThat(fixture.getExpectedErrors()).contains(1L);
        assertThat(fixture.getExpectedWarns()).contains(0L);
        assertThat(fixture.getMustInclude()).containsExactly(
                new PolicyFixture.ExpectedIssue(IssueId.POLICY_FILE_MISSING, Severity.ERROR, 1));
    }

    @Test
    @DisplayName("Should default count_min to one and leave absent counts unchecked")
    void shouldApplyDefaults() {
        PolicyFixture fixture = PolicyFixtureLoader.load(TestResources.path("fixtures/wrong-expectations.yaml"));

        assertThat(fixture.getExpectedWarns()).isEmpty();
        assertThat(fixture.getMustInclude()).singleElement()
                .satisfies(expected -> assertThat(expected.getCountMin()).isEqualTo(1));
    }

    @Test
    @DisplayName("Should report every problem of a malformed fixture at once")
    void shouldRejectMalformedFixture() {
        assertThatThrownBy(() -> PolicyFixtureLoader.load(TestResources.path("fixtures/malformed.yaml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Fixture validation failed")
                .hasMessageContaining("fixture_type")
                .hasMessageContaining("inputs.registry_file")
                .hasMessageContaining("ISSUE.VALIDATION.NOT_A_REAL_ISSUE")
                .hasMessageContaining("fatal");
    }

    @Test
    @DisplayName("Should reject a fixture that does not parse")
    void shouldRejectUnparseableFixture(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.yaml");
        Files.writeString(file, "fixture_id: [unclosed\n");

        assertThatThrownBy(() -> PolicyFixtureLoader.load(file))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject a non-positive count_min")
    void shouldRejectZeroCountMin(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("zero.yaml");
        Files.writeString(file, "fixture_id: FIXTURE.ZERO\n"
                + "fixture_type: policy_validation\n"
                + "inputs:\n"
                + "  registry_file: registry.yaml\n"
                + "expected:\n"
                + "  must_include:\n"
                + "    - issue_id: ISSUE.VALIDATION.POLICY_FILE_MISSING\n"
                + "      severity: error\n"
                + "      count_min: 0\n");

        assertThatThrownBy(() -> PolicyFixtureLoader.load(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("count_min");
    }
}
