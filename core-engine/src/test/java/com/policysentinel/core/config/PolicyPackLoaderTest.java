package com.policysentinel.core.config;

import com.policysentinel.core.TestResources;
import com.policysentinel.core.model.Issue;
import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.PolicyPack;
import com.policysentinel.core.model.RuleId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PolicyPackLoader}.
 */
class PolicyPackLoaderTest {

    private static final String STANDARD = "POLICY.DOWNMIX.STANDARD_FOLDOWN_V0";

    @Test
    @DisplayName("Should load a well-formed pack without issues")
    void shouldLoadPack() {
        Path file = TestResources.path("registries/clean/packs/standard.yaml");

        PackLoadResult result = PolicyPackLoader.load(STANDARD, file);

        assertThat(result.getIssues()).isEmpty();
        PolicyPack pack = result.getPack().orElseThrow();
        assertThat(pack.getPolicyId()).isEqualTo(STANDARD);
        assertThat(pack.getPackVersion()).isEqualTo("1.0.0");
        assertThat(pack.getMatrices()).containsOnlyKeys("DMX.STD.5_1_TO_2_0");
        assertThat(pack.supportedSourceLayouts()).containsExactly("LAYOUT.5_1");
        assertThat(pack.supportedTargetLayouts()).containsExactly("LAYOUT.2_0");
    }

    @Test
    @DisplayName("Should yield equal packs when the same file is loaded twice")
    void shouldBeIdempotent() {
        Path file = TestResources.path("registries/clean/packs/standard.yaml");

        PolicyPack first = PolicyPackLoader.load(STANDARD, file).getPack().orElseThrow();
        PolicyPack second = PolicyPackLoader.load(STANDARD, file).getPack().orElseThrow();

        assertThat(second).isEqualTo(first);
        assertThat(second.hashCode()).isEqualTo(first.hashCode());
    }

    @Test
    @DisplayName("Should report a missing file with its path")
    void shouldReportMissingFile(@TempDir Path dir) {
        Path file = dir.resolve("absent.yaml");

        PackLoadResult result = PolicyPackLoader.load(STANDARD, file);

        assertThat(result.getPack()).isEmpty();
        assertThat(result.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getIssueId()).isEqualTo(IssueId.POLICY_FILE_MISSING);
            assertThat(issue.getRuleId()).isEqualTo(RuleId.REG_011);
            assertThat(issue.getEvidence().getFilePath()).isEqualTo(file.toString());
        });
    }

    @Test
    @DisplayName("Should keep the pack but report a policy_id mismatch")
    void shouldReportPolicyIdMismatch() {
        Path file = TestResources.path("registries/clean/packs/standard.yaml");

        PackLoadResult result = PolicyPackLoader.load("POLICY.DOWNMIX.OTHER_V0", file);

        assertThat(result.getPack()).isPresent();
        assertThat(result.getIssues()).extracting(Issue::getIssueId)
                .containsExactly(IssueId.DOWNMIX_POLICY_ID_MISMATCH);
    }

    @Test
    @DisplayName("Should report each missing required field")
    void shouldReportMissingFields(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("pack.yaml"),
                "downmix_policy_pack:\n  policy_id: " + STANDARD + "\n");

        PackLoadResult result = PolicyPackLoader.load(STANDARD, file);

        assertThat(result.getPack()).isEmpty();
        assertThat(result.getIssues()).extracting(Issue::getRuleId)
                .containsExactly(RuleId.PACK_002, RuleId.PACK_002);
        assertThat(result.getIssues()).extracting(i -> i.getEvidence().getLocation())
                .containsExactly("downmix_policy_pack.pack_version", "downmix_policy_pack.matrices");
    }

    @Test
    @DisplayName("Should reject a pack_version that is not semantic")
    void shouldRejectBadVersion(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("pack.yaml"),
                "downmix_policy_pack:\n  policy_id: " + STANDARD + "\n  pack_version: v1\n  matrices: {}\n");

        PackLoadResult result = PolicyPackLoader.load(STANDARD, file);

        assertThat(result.getPack()).isPresent();
        assertThat(result.getIssues()).extracting(Issue::getRuleId).containsExactly(RuleId.PACK_003);
    }

    @Test
    @DisplayName("Should report an unparseable pack")
    void shouldReportParseError(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("pack.json"), "{ not json");

        PackLoadResult result = PolicyPackLoader.load(STANDARD, file);

        assertThat(result.getPack()).isEmpty();
        assertThat(result.getIssues()).extracting(Issue::getRuleId).containsExactly(RuleId.PACK_001);
    }
}
