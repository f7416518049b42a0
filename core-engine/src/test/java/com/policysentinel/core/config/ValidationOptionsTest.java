package com.policysentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ValidationOptions}.
 */
class ValidationOptionsTest {

    @Test
    @DisplayName("Should default to a sequential run with documented limits")
    void shouldUseDefaults() {
        ValidationOptions options = ValidationOptions.defaults();

        assertThat(options.getParallelism()).isEqualTo(1);
        assertThat(options.isParallel()).isFalse();
        assertThat(options.getHardLimit()).isEqualTo(4.0);
        assertThat(options.getSoftLimit()).isEqualTo(2.0);
        assertThat(options.getSumWarnLimit()).isEqualTo(2.5);
        assertThat(options.getSumErrorLimit()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Should reject parallelism below one")
    void shouldRejectParallelism() {
        assertThatThrownBy(() -> ValidationOptions.builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
    }

    @Test
    @DisplayName("Should reject a soft limit above the hard limit")
    void shouldRejectInvertedLimits() {
        assertThatThrownBy(() -> ValidationOptions.builder().softLimit(5.0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("soft");
    }

    @Test
    @DisplayName("Should reject a sum warning above the sum error")
    void shouldRejectInvertedSumLimits() {
        assertThatThrownBy(() -> ValidationOptions.builder().sumWarnLimit(4.5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sum limits");
    }

    @Test
    @DisplayName("Should read parallelism from the environment")
    void shouldReadEnvironment() {
        ValidationOptions options = ValidationOptions.fromEnvironment(
                Map.of(ValidationOptions.ENV_PARALLELISM, " 4 "));

        assertThat(options.getParallelism()).isEqualTo(4);
        assertThat(options.isParallel()).isTrue();
        assertThat(options.getHardLimit()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Should fall back to defaults when the environment is blank")
    void shouldIgnoreBlankEnvironment() {
        assertThat(ValidationOptions.fromEnvironment(Map.of())).isSameAs(ValidationOptions.defaults());
        assertThat(ValidationOptions.fromEnvironment(Map.of(ValidationOptions.ENV_PARALLELISM, "  ")))
                .isSameAs(ValidationOptions.defaults());
    }

    @Test
    @DisplayName("Should fail on a non-numeric environment value")
    void shouldRejectNonNumericEnvironment() {
        assertThatThrownBy(() -> ValidationOptions.fromEnvironment(
                Map.of(ValidationOptions.ENV_PARALLELISM, "x")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(ValidationOptions.ENV_PARALLELISM);
    }
}
