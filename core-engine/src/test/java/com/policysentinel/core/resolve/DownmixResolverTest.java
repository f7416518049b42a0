package com.policysentinel.core.resolve;

import com.policysentinel.core.TestResources;
import com.policysentinel.core.model.Registry;
import com.policysentinel.core.validation.PolicyValidationEngine;
import com.policysentinel.core.validation.ValidationRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DownmixResolver}.
 */
class DownmixResolverTest {

    private static final String CHAIN = "POLICY.DOWNMIX.CHAIN_V0";

    private PolicyValidationEngine engine;
    private DownmixResolver resolver;

    @BeforeEach
    void setUp() {
        engine = new PolicyValidationEngine(TestResources.catalog());
        resolver = DownmixResolver.from(engine.run(TestResources.path("registries/composition/registry.yaml")));
    }

    @Test
    @DisplayName("Should list policy IDs in sorted order")
    void shouldListPolicies() {
        assertThat(resolver.listPolicyIds()).containsExactly(CHAIN);
        assertThat(resolver.defaultPolicyForSource("LAYOUT.7_1")).contains(CHAIN);
        assertThat(resolver.defaultPolicyForSource("LAYOUT.2_0")).isEmpty();
    }

    @Test
    @DisplayName("Should resolve an explicit conversion directly")
    void shouldResolveDirect() {
        Resolution resolution = resolver.resolve(null, "LAYOUT.5_1", "LAYOUT.2_0");

        assertThat(resolution.isDirect()).isTrue();
        assertThat(resolution.getMatrixId()).contains("DMX.CHAIN.5_1_TO_2_0");
        assertThat(resolution.getPolicyId()).contains(CHAIN);
        assertThat(resolution.getStepMatrixIds()).containsExactly("DMX.CHAIN.5_1_TO_2_0");
    }

    @Test
    @DisplayName("Should resolve a conversion without policy through the source default")
    void shouldResolveThroughDefault() {
        Resolution resolution = resolver.resolve(null, "LAYOUT.7_1", "LAYOUT.5_1");

        assertThat(resolution.getMatrixId()).contains("DMX.CHAIN.7_1_TO_5_1");
        assertThat(resolution.getPolicyId()).contains(CHAIN);
    }

    @Test
    @DisplayName("Should fall back to a composition path")
    void shouldResolveComposed() {
        Resolution resolution = resolver.resolve(null, "LAYOUT.7_1_4", "LAYOUT.2_0");

        assertThat(resolution.isDirect()).isFalse();
        assertThat(resolution.getMatrixId()).isEmpty();
        assertThat(resolution.getStepMatrixIds()).containsExactly(
                "DMX.CHAIN.7_1_4_TO_7_1", "DMX.CHAIN.7_1_TO_5_1", "DMX.CHAIN.5_1_TO_2_0");
    }

    @Test
    @DisplayName("Should list known source layouts when nothing matches")
    void shouldRejectUnknownRoute() {
        assertThatThrownBy(() -> resolver.resolve(null, "LAYOUT.2_0", "LAYOUT.1_0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No conversion found: LAYOUT.2_0 -> LAYOUT.1_0. "
                        + "Known source layouts: LAYOUT.5_1, LAYOUT.7_1, LAYOUT.7_1_4");
    }

    @Test
    @DisplayName("Should ignore conversions of other policies")
    void shouldFilterByPolicy() {
        assertThatThrownBy(() -> resolver.resolve("POLICY.DOWNMIX.OTHER_V0", "LAYOUT.5_1", "LAYOUT.2_0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("No conversion found: LAYOUT.5_1 -> LAYOUT.2_0.");
    }

    @Test
    @DisplayName("Should break ties by policy ID then matrix ID")
    void shouldBreakTies() {
        Registry registry = new Registry(Path.of("/work/registry.yaml"), Map.of(), Map.of(), Map.of(),
                List.of(conversion("POLICY.DOWNMIX.B_V0", "DMX.M2"),
                        conversion("POLICY.DOWNMIX.A_V0", "DMX.M9"),
                        conversion("POLICY.DOWNMIX.A_V0", "DMX.M1")),
                null);

        Resolution resolution = new DownmixResolver(registry).resolve(null, "LAYOUT.5_1", "LAYOUT.2_0");

        assertThat(resolution.getPolicyId()).contains("POLICY.DOWNMIX.A_V0");
        assertThat(resolution.getMatrixId()).contains("DMX.M1");
    }

    @Test
    @DisplayName("Should refuse a run that has validation errors")
    void shouldRefuseFailingRun() {
        ValidationRun failing = engine.run(TestResources.path("registries/missing-pack/registry.yaml"));

        assertThatThrownBy(() -> DownmixResolver.from(failing))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("1 validation error(s)");
    }

    private static Map<String, Object> conversion(String policyId, String matrixId) {
        Map<String, Object> conversion = new LinkedHashMap<>();
        conversion.put("source_layout_id", "LAYOUT.5_1");
        conversion.put("target_layout_id", "LAYOUT.2_0");
        conversion.put("policy_id", policyId);
        conversion.put("matrix_id", matrixId);
        return conversion;
    }
}
