package com.policysentinel.core.validation;

import com.policysentinel.core.model.Issue;
import com.policysentinel.core.model.IssueId;
import com.policysentinel.core.model.PolicyPack;
import com.policysentinel.core.model.Registry;
import com.policysentinel.core.model.RuleId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.policysentinel.core.validation.TestRegistries.context;
import static com.policysentinel.core.validation.TestRegistries.map;
import static com.policysentinel.core.validation.TestRegistries.pack;
import static com.policysentinel.core.validation.TestRegistries.policy;
import static com.policysentinel.core.validation.TestRegistries.registry;
import static com.policysentinel.core.validation.TestRegistries.standardMatrix;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReferenceValidator}.
 */
class ReferenceValidatorTest {

    private static final String STANDARD = "POLICY.DOWNMIX.STANDARD_V0";
    private static final String MATRIX = "DMX.STD.5_1_TO_2_0";

    private final ReferenceValidator validator = new ReferenceValidator();

    @Test
    @DisplayName("Should accept a conversion resolved through the default policy")
    void shouldAcceptDefaultPolicyConversion() {
        Registry registry = registry(map(STANDARD, policy("standard.yaml")),
                map("LAYOUT.5_1", STANDARD),
                List.of(conversion("LAYOUT.5_1", "LAYOUT.2_0", null, MATRIX)), null);

        assertThat(validate(registry, pack(STANDARD, standardMatrix(MATRIX)))).isEmpty();
    }

    @Test
    @DisplayName("Should report unknown layouts in supported layout lists")
    void shouldReportUnknownSupportedLayout() {
        Registry registry = registry(
                map(STANDARD, map("file", "standard.yaml",
                        "supports_source_layouts", List.of("LAYOUT.5_1", "LAYOUT.4_0"))),
                Map.of(), List.of(), null);

        assertThat(validate(registry, pack(STANDARD))).singleElement().satisfies(issue -> {
            assertThat(issue.getIssueId()).isEqualTo(IssueId.DOWNMIX_LAYOUT_UNKNOWN);
            assertThat(issue.getRuleId()).isEqualTo(RuleId.REG_014);
            assertThat(issue.getEvidence().getLayoutId()).isEqualTo("LAYOUT.4_0");
            assertThat(issue.getEvidence().getLocation())
                    .isEqualTo("policies." + STANDARD + ".supports_source_layouts");
        });
    }

    @Test
    @DisplayName("Should reject supported layouts that are not a list")
    void shouldRejectNonListSupportedLayouts() {
        Registry registry = registry(
                map(STANDARD, map("file", "standard.yaml", "supports_target_layouts", "LAYOUT.2_0")),
                Map.of(), List.of(), null);

        assertThat(validate(registry, pack(STANDARD))).singleElement()
                .satisfies(issue -> assertThat(issue.getIssueId()).isEqualTo(IssueId.POLICY_SCHEMA_INVALID));
    }

    @Test
    @DisplayName("Should fall back to the pack's supported layouts")
    void shouldCheckPackSupportedLayouts() {
        PolicyPack declaring = new PolicyPack(Path.of("/work/packs/standard.yaml"), STANDARD, "1.0.0",
                Map.of(), List.of("LAYOUT.9_9"), null);
        Registry registry = registry(map(STANDARD, policy("standard.yaml")), Map.of(), List.of(), null);

        assertThat(validate(registry, declaring)).singleElement().satisfies(issue -> {
            assertThat(issue.getRuleId()).isEqualTo(RuleId.REG_014);
            assertThat(issue.getEvidence().getFilePath()).isEqualTo("/work/packs/standard.yaml");
            assertThat(issue.getEvidence().getLocation()).isEqualTo("downmix_policy_pack.supports_source_layouts");
        });
    }

    @Test
    @DisplayName("Should report unknown layouts and unknown policies in defaults separately")
    void shouldReportDefaults() {
        Registry registry = registry(map(STANDARD, policy("standard.yaml")),
                map("LAYOUT.9_9", STANDARD, "LAYOUT.7_1", "POLICY.DOWNMIX.NOPE"), List.of(), null);

        List<Issue> issues = validate(registry, pack(STANDARD));

        assertThat(issues).extracting(Issue::getRuleId).containsOnly(RuleId.REG_020);
        assertThat(issues).extracting(Issue::getIssueId).containsExactlyInAnyOrder(
                IssueId.DOWNMIX_LAYOUT_UNKNOWN, IssueId.DOWNMIX_POLICY_ID_MISMATCH);
    }

    @Test
    @DisplayName("Should report a conversion without any resolvable policy")
    void shouldReportUnresolvablePolicy() {
        Registry registry = registry(map(STANDARD, policy("standard.yaml")), Map.of(),
                List.of(conversion("LAYOUT.5_1", "LAYOUT.2_0", null, MATRIX)), null);

        assertThat(validate(registry, pack(STANDARD, standardMatrix(MATRIX)))).singleElement().satisfies(issue -> {
            assertThat(issue.getIssueId()).isEqualTo(IssueId.DOWNMIX_POLICY_ID_MISMATCH);
            assertThat(issue.getRuleId()).isEqualTo(RuleId.REG_031);
            assertThat(issue.getEvidence().getLocation()).isEqualTo("conversions[0].policy_id");
        });
    }

    @Test
    @DisplayName("Should report a conversion naming an unknown policy")
    void shouldReportUnknownPolicy() {
        Registry registry = registry(map(STANDARD, policy("standard.yaml")), map("LAYOUT.5_1", STANDARD),
                List.of(conversion("LAYOUT.5_1", "LAYOUT.2_0", "POLICY.DOWNMIX.NOPE", MATRIX)), null);

        assertThat(validate(registry, pack(STANDARD, standardMatrix(MATRIX))))
                .extracting(Issue::getRuleId)
                .containsExactly(RuleId.REG_031);
    }

    @Test
    @DisplayName("Should report a conversion without a matrix ID")
    void shouldReportMissingMatrixId() {
        Registry registry = registry(map(STANDARD, policy("standard.yaml")), map("LAYOUT.5_1", STANDARD),
                List.of(conversion("LAYOUT.5_1", "LAYOUT.2_0", null, null)), null);

        assertThat(validate(registry, pack(STANDARD))).singleElement().satisfies(issue -> {
            assertThat(issue.getIssueId()).isEqualTo(IssueId.DOWNMIX_MATRIX_ID_MISSING);
            assertThat(issue.getRuleId()).isEqualTo(RuleId.REG_032);
        });
    }

    @Test
    @DisplayName("Should report a matrix the policy pack does not declare")
    void shouldReportUndeclaredMatrix() {
        Registry registry = registry(map(STANDARD, policy("standard.yaml")), map("LAYOUT.5_1", STANDARD),
                List.of(conversion("LAYOUT.5_1", "LAYOUT.2_0", null, "DMX.STD.MISSING")), null);

        assertThat(validate(registry, pack(STANDARD, standardMatrix(MATRIX)))).singleElement().satisfies(issue -> {
            assertThat(issue.getRuleId()).isEqualTo(RuleId.REG_032);
            assertThat(issue.getEvidence().getMatrixId()).isEqualTo("DMX.STD.MISSING");
            assertThat(issue.getEvidence().getPolicyId()).isEqualTo(STANDARD);
        });
    }

    @Test
    @DisplayName("Should skip matrix checks when the policy pack is unavailable")
    void shouldSkipUnavailablePack() {
        Registry registry = registry(map(STANDARD, policy("standard.yaml")), map("LAYOUT.5_1", STANDARD),
                List.of(conversion("LAYOUT.5_1", "LAYOUT.2_0", null, "DMX.STD.MISSING")), null);

        assertThat(TestRegistries.run(validator, context(registry, Set.of(STANDARD)))).isEmpty();
    }

    @Test
    @DisplayName("Should report a matrix whose layouts differ from the conversion")
    void shouldReportLayoutMismatch() {
        Registry registry = registry(map(STANDARD, policy("standard.yaml")), map("LAYOUT.5_1", STANDARD),
                List.of(conversion("LAYOUT.5_1", "LAYOUT.1_0", null, MATRIX)), null);

        assertThat(validate(registry, pack(STANDARD, standardMatrix(MATRIX)))).singleElement().satisfies(issue -> {
            assertThat(issue.getIssueId()).isEqualTo(IssueId.DOWNMIX_LAYOUT_SPEAKER_MISMATCH);
            assertThat(issue.getRuleId()).isEqualTo(RuleId.REG_033);
            assertThat(issue.getEvidence().getLocation()).isEqualTo("conversions[0].target_layout_id");
            assertThat(issue.getEvidence().getLayoutId()).isEqualTo("LAYOUT.1_0");
        });
    }

    @Test
    @DisplayName("Should keep checking a conversion after an unknown layout")
    void shouldNotStopAtUnknownLayout() {
        Registry registry = registry(map(STANDARD, policy("standard.yaml")), Map.of(),
                List.of(conversion("LAYOUT.9_9", "LAYOUT.2_0", STANDARD, "DMX.STD.MISSING")), null);

        assertThat(validate(registry, pack(STANDARD, standardMatrix(MATRIX))))
                .extracting(Issue::getIssueId)
                .containsExactly(IssueId.DOWNMIX_LAYOUT_UNKNOWN, IssueId.DOWNMIX_MATRIX_ID_MISSING);
    }

    @Test
    @DisplayName("Should reject conversions that are not mappings")
    void shouldRejectNonMappingConversion() {
        Registry registry = registry(Map.of(), Map.of(), List.of("LAYOUT.5_1 -> LAYOUT.2_0"), null);

        assertThat(validate(registry)).singleElement().satisfies(issue -> {
            assertThat(issue.getIssueId()).isEqualTo(IssueId.POLICY_SCHEMA_INVALID);
            assertThat(issue.getRuleId()).isEqualTo(RuleId.REG_030);
        });
    }

    private List<Issue> validate(Registry registry, PolicyPack... packs) {
        return TestRegistries.run(validator, context(registry, packs));
    }

    private static Map<String, Object> conversion(String source, String target, String policyId, String matrixId) {
        Map<String, Object> conversion = map("source_layout_id", source, "target_layout_id", target);
        if (policyId != null) {
            conversion.put("policy_id", policyId);
        }
        if (matrixId != null) {
            conversion.put("matrix_id", matrixId);
        }
        return conversion;
    }
}
