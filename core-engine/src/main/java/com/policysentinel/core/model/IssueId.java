package com.policysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Canonical {@code ISSUE.VALIDATION.*} codes raised by the policy validator.
 *
 * @since 1.0.0
 */
public enum IssueId {

    POLICY_PARSE_ERROR,
    POLICY_SCHEMA_INVALID,
    POLICY_FILE_MISSING,
    DOWNMIX_POLICY_ID_MISMATCH,
    DOWNMIX_LAYOUT_UNKNOWN,
    DOWNMIX_SPEAKER_UNKNOWN,
    DOWNMIX_LAYOUT_SPEAKER_MISMATCH,
    DOWNMIX_MATRIX_ID_MISSING,
    DOWNMIX_COEFFICIENT_INVALID,
    DOWNMIX_COEFFICIENT_HIGH;

    private static final String PREFIX = "ISSUE.VALIDATION.";

    /**
     * @return the full canonical code, e.g. {@code ISSUE.VALIDATION.POLICY_PARSE_ERROR}
     */
    @JsonValue
    public String code() {
        return PREFIX + name();
    }

    /**
     * Look up an issue ID by its canonical code.
     *
     * @param code full {@code ISSUE.VALIDATION.*} code
     * @return the matching issue ID, or empty if the code is not one of ours
     */
    public static Optional<IssueId> fromCode(String code) {
        if (code == null || !code.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String name = code.substring(PREFIX.length());
        for (IssueId id : values()) {
            if (id.name().equals(name)) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return code();
    }
}
