package com.policysentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PolicyId}.
 */
class PolicyIdTest {

    @Test
    @DisplayName("Should parse prefixed policy IDs")
    void shouldParsePrefixedIds() {
        assertThat(PolicyId.parse("POLICY.DOWNMIX.STANDARD_FOLDOWN_V0"))
                .map(PolicyId::value)
                .contains("POLICY.DOWNMIX.STANDARD_FOLDOWN_V0");
    }

    @Test
    @DisplayName("Should reject missing prefixes, bare prefixes and null")
    void shouldRejectInvalidIds() {
        assertThat(PolicyId.parse("LEGACY_FOLDOWN")).isEmpty();
        assertThat(PolicyId.parse("POLICY.DOWNMIX.")).isEmpty();
        assertThat(PolicyId.parse(null)).isEmpty();
    }

    @Test
    @DisplayName("Should compare by value")
    void shouldCompareByValue() {
        PolicyId a = PolicyId.parse("POLICY.DOWNMIX.A").orElseThrow();
        PolicyId b = PolicyId.parse("POLICY.DOWNMIX.B").orElseThrow();

        assertThat(a).isLessThan(b);
        assertThat(a).isEqualTo(PolicyId.parse("POLICY.DOWNMIX.A").orElseThrow());
    }
}
