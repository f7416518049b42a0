package com.policysentinel.core.validation;

import com.policysentinel.core.TestResources;
import com.policysentinel.core.config.ValidationOptions;
import com.policysentinel.core.model.Issue;
import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.RuleId;
import com.policysentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PolicyValidationEngine}.
 *
 * <p>
 * Each scenario lives under {@code src/test/resources/registries}.
 * </p>
 */
class PolicyValidationEngineTest {

    private PolicyValidationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PolicyValidationEngine(TestResources.catalog());
    }

    @Test
    @DisplayName("Should pass a clean registry")
    void shouldPassCleanRegistry() {
        ValidationRun run = engine.run(TestResources.path("registries/clean/registry.yaml"));

        assertThat(run.getReport().getIssues()).isEmpty();
        assertThat(run.getReport().isPassing()).isTrue();
        assertThat(run.getReport().getMaxSeverity()).isEmpty();
        assertThat(run.getRegistry()).isPresent();
        assertThat(run.getPacks()).containsOnlyKeys("POLICY.DOWNMIX.STANDARD_FOLDOWN_V0");
    }

    @Test
    @DisplayName("Should report a missing pack once and skip its dependent checks")
    void shouldReportMissingPackOnce() {
        ValidationReport report = engine.validate(TestResources.path("registries/missing-pack/registry.yaml"));

        assertThat(report.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getIssueId()).isEqualTo(IssueId.POLICY_FILE_MISSING);
            assertThat(issue.getRuleId()).isEqualTo(RuleId.REG_011);
            assertThat(issue.getEvidence().getFilePath()).endsWith("absent.yaml");
        });
        assertThat(report.getIssueCounts()).containsEntry("error", 1L).containsEntry("warn", 0L);
    }

    @Test
    @DisplayName("Should report a pack whose policy ID differs from its registry key")
    void shouldReportPolicyIdMismatch() {
        ValidationReport report = engine.validate(TestResources.path("registries/id-mismatch/registry.yaml"));

        assertThat(report.getIssues()).extracting(Issue::getIssueId)
                .containsExactly(IssueId.DOWNMIX_POLICY_ID_MISMATCH);
    }

    @Test
    @DisplayName("Should report an unknown conversion layout once per field")
    void shouldReportUnknownLayout() {
        ValidationReport report = engine.validate(TestResources.path("registries/unknown-layout/registry.yaml"));

        assertThat(report.getErrorCount()).isEqualTo(3);
        assertThat(report.getIssues()).filteredOn(i -> "conversions[0].source_layout_id"
                        .equals(i.getEvidence().getLocation()))
                .singleElement()
                .satisfies(issue -> assertThat(issue.getIssueId()).isEqualTo(IssueId.DOWNMIX_LAYOUT_UNKNOWN));
        assertThat(report.count(IssueId.DOWNMIX_MATRIX_ID_MISSING, Severity.ERROR)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stop at a registry parse error")
    void shouldStopAtParseError() {
        ValidationRun run = engine.run(TestResources.path("registries/parse-error/registry.yaml"));

        assertThat(run.getReport().getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getIssueId()).isEqualTo(IssueId.POLICY_PARSE_ERROR);
            assertThat(issue.getRuleId()).isEqualTo(RuleId.REG_001);
        });
        assertThat(run.getRegistry()).isEmpty();
        assertThat(run.getPacks()).isEmpty();
    }

    @Test
    @DisplayName("Should report a pack file that is not a valid path and keep validating")
    void shouldReportInvalidPackPath(@TempDir Path dir) throws IOException {
        Path standard = TestResources.path("registries/clean/packs/standard.yaml");
        Path registry = dir.resolve("registry.yaml");
        Files.writeString(registry, "downmix:\n"
                + "  _meta:\n"
                + "    registry_version: \"1.0.0\"\n"
                + "  policies:\n"
                + "    POLICY.DOWNMIX.STANDARD_FOLDOWN_V0:\n"
                + "      file: \"" + standard.toAbsolutePath() + "\"\n"
                + "    POLICY.DOWNMIX.BROKEN_V0:\n"
                + "      file: \"packs/a\\0b.yaml\"\n"
                + "  default_policy_by_source_layout:\n"
                + "    LAYOUT.5_1: POLICY.DOWNMIX.STANDARD_FOLDOWN_V0\n"
                + "  conversions:\n"
                + "    - source_layout_id: LAYOUT.5_1\n"
                + "      target_layout_id: LAYOUT.2_0\n"
                + "      matrix_id: DMX.STD.5_1_TO_2_0\n");

        ValidationRun run = engine.run(registry);

        assertThat(run.getReport().getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getIssueId()).isEqualTo(IssueId.POLICY_FILE_MISSING);
            assertThat(issue.getRuleId()).isEqualTo(RuleId.REG_011);
            assertThat(issue.getEvidence().getFilePath()).isEqualTo("packs/a\0b.yaml");
            assertThat(issue.getEvidence().getLocation()).isEqualTo("policies.POLICY.DOWNMIX.BROKEN_V0.file");
        });
        assertThat(run.getPacks()).containsOnlyKeys("POLICY.DOWNMIX.STANDARD_FOLDOWN_V0");
    }

    @Test
    @DisplayName("Should pass a registry with valid composition paths")
    void shouldPassComposition() {
        ValidationReport report = engine.validate(TestResources.path("registries/composition/registry.yaml"));

        assertThat(report.getIssues()).isEmpty();
    }

    @Test
    @DisplayName("Should report exactly the broken link of a composition chain")
    void shouldReportBrokenChain() {
        ValidationReport report = engine.validate(
                TestResources.path("registries/composition/registry-broken-chain.yaml"));

        assertThat(report.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getRuleId()).isEqualTo(RuleId.REG_043);
            assertThat(issue.getEvidence().getLocation()).isEqualTo("composition_paths[0].steps[1]->steps[2]");
            assertThat(issue.getEvidence().getMatrixId()).isEqualTo("DMX.CHAIN.7_1_TO_2_0");
        });
    }

    @Test
    @DisplayName("Should report every independent problem in a messy registry")
    void shouldReportMessyRegistry() {
        ValidationReport report = engine.validate(TestResources.path("registries/messy/registry.yaml"));

        assertThat(report.getErrorCount()).isEqualTo(14);
        assertThat(report.getWarnCount()).isEqualTo(1);
        assertThat(report.getMaxSeverity()).contains(Severity.ERROR);
        assertThat(report.isPassing()).isFalse();
        assertThat(report.getIssues()).extracting(Issue::getRuleId).contains(
                RuleId.REG_010, RuleId.REG_011, RuleId.REG_020, RuleId.REG_030, RuleId.REG_031, RuleId.REG_032,
                RuleId.PACK_012, RuleId.PACK_013,
                RuleId.COEFF_001, RuleId.COEFF_002, RuleId.COEFF_003, RuleId.COEFF_004);
        assertThat(report.getIssues()).extracting(Issue::getRuleId)
                .doesNotContain(RuleId.REG_040, RuleId.REG_043);
        assertThat(report.count(IssueId.DOWNMIX_COEFFICIENT_HIGH, Severity.WARN)).isEqualTo(1);
        assertThat(report.getIssues()).isSortedAccordingTo(Issue.ORDER);
    }

    @Test
    @DisplayName("Should produce identical reports sequentially and in parallel")
    void shouldBeDeterministic() {
        PolicyValidationEngine parallel = new PolicyValidationEngine(TestResources.catalog(),
                ValidationOptions.builder().parallelism(4).build());

        ValidationReport first = engine.validate(TestResources.path("registries/messy/registry.yaml"));
        ValidationReport second = engine.validate(TestResources.path("registries/messy/registry.yaml"));
        ValidationReport concurrent = parallel.validate(TestResources.path("registries/messy/registry.yaml"));

        assertThat(second).isEqualTo(first);
        assertThat(concurrent).isEqualTo(first);
        assertThat(concurrent.getIssues()).containsExactlyElementsOf(first.getIssues());
    }
}
