package com.policysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Severity of a validation {@link Issue}.
 *
 * <p>
 * Constants are declared in ascending order, so {@link #compareTo(Enum)}
 * gives the total order {@code WARN < ERROR}. Aggregations such as
 * "highest severity in a report" are folds over that order.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    WARN("warn"),
    ERROR("error");

    private final String code;

    Severity(String code) {
        this.code = code;
    }

    /**
     * @return the wire code, {@code warn} or {@code error}
     */
    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Return the more severe of two severities.
     *
     * @param a first severity; must not be {@code null}
     * @param b second severity; must not be {@code null}
     * @return {@code a} if it ranks at least as high as {@code b}, otherwise {@code b}
     */
    public static Severity max(Severity a, Severity b) {
        Objects.requireNonNull(a, "Severity must not be null");
        Objects.requireNonNull(b, "Severity must not be null");
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Look up a severity by its wire code (case-insensitive).
     *
     * @param code {@code warn} or {@code error}
     * @return the matching severity, or empty for anything else
     */
    public static Optional<Severity> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.code.equals(normalized)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return code;
    }
}
