package com.policysentinel.core.catalog;

import java.util.Objects;

/**
 * Identifier of a speaker known to a {@link Catalog}. Instances can only be
 * obtained from a catalog lookup, so holding a {@code SpeakerId} means the
 * speaker exists.
 *
 * @since 1.0.0
 */
public final class SpeakerId implements Comparable<SpeakerId> {

    private final String value;

    SpeakerId(String value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public String value() {
        return value;
    }

    @Override
    public int compareTo(SpeakerId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SpeakerId that))
            return false;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
