package com.policysentinel.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Identifier of a downmix policy, e.g. {@code POLICY.DOWNMIX.STANDARD_FOLDOWN_V0}.
 *
 * <p>
 * Only strings carrying the {@value #PREFIX} prefix can become a
 * {@code PolicyId}; use {@link #parse(String)} at the document boundary.
 * </p>
 *
 * @since 1.0.0
 */
public final class PolicyId implements Comparable<PolicyId> {

    /** Required prefix of every downmix policy ID. */
    public static final String PREFIX = "POLICY.DOWNMIX.";

    private final String value;

    private PolicyId(String value) {
        this.value = value;
    }

    /**
     * @param raw candidate policy ID
     * @return the typed ID, or empty if {@code raw} is null, lacks the prefix,
     *         or has nothing after it
     */
    public static Optional<PolicyId> parse(String raw) {
        if (raw == null || !raw.startsWith(PREFIX) || raw.length() == PREFIX.length()) {
            return Optional.empty();
        }
        return Optional.of(new PolicyId(raw));
    }

    public String value() {
        return value;
    }

    @Override
    public int compareTo(PolicyId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PolicyId that))
            return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
