package com.policysentinel.core.catalog;

import java.util.Objects;

/**
 * Identifier of a layout known to a {@link Catalog}. Instances can only be
 * obtained from a catalog lookup, so holding a {@code LayoutId} means the
 * layout exists.
 *
 * @since 1.0.0
 */
public final class LayoutId implements Comparable<LayoutId> {

    private final String value;

    LayoutId(String value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public String value() {
        return value;
    }

    @Override
    public int compareTo(LayoutId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LayoutId that))
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
