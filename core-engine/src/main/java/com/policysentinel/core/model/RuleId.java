package com.policysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Numbered validation rules. Each {@link Issue} records the rule that
 * produced it; the rule code is the primary key of the report order.
 *
 * @since 1.0.0
 */
public enum RuleId {

    /** Registry document must parse. */
    REG_001("DMX.REG.001"),
    /** Registry root must carry the required {@code downmix} sections. */
    REG_002("DMX.REG.002"),
    /** Policy key prefix and entry shape. */
    REG_010("DMX.REG.010"),
    /** Referenced policy pack file must exist. */
    REG_011("DMX.REG.011"),
    /** Pack {@code policy_id} must equal its registry key. */
    REG_013("DMX.REG.013"),
    /** Supported layout lists must reference known layouts. */
    REG_014("DMX.REG.014"),
    /** Default policy map must reference known layouts and policies. */
    REG_020("DMX.REG.020"),
    /** Conversion layouts must be known. */
    REG_030("DMX.REG.030"),
    /** Conversion policy must exist. */
    REG_031("DMX.REG.031"),
    /** Conversion matrix must exist in the resolved pack. */
    REG_032("DMX.REG.032"),
    /** Conversion layouts must match the matrix layouts. */
    REG_033("DMX.REG.033"),
    /** Composition step matrix must resolve. */
    REG_040("DMX.REG.040"),
    /** Composition path shape. */
    REG_041("DMX.REG.041"),
    /** Composition path declared layouts must be known. */
    REG_042("DMX.REG.042"),
    /** Composition chain must be contiguous and hit its declared endpoints. */
    REG_043("DMX.REG.043"),
    /** Composition policy context must exist. */
    REG_044("DMX.REG.044"),
    /** Pack document must parse. */
    PACK_001("DMX.PACK.001"),
    /** Pack must carry its required fields. */
    PACK_002("DMX.PACK.002"),
    /** Pack version must be a semantic version. */
    PACK_003("DMX.PACK.003"),
    /** Matrix layouts must be known. */
    PACK_010("DMX.PACK.010"),
    /** Matrix coefficients must be a nested mapping. */
    PACK_011("DMX.PACK.011"),
    /** Matrix speakers must be known. */
    PACK_012("DMX.PACK.012"),
    /** Target speaker set must equal the target layout. */
    PACK_013("DMX.PACK.013"),
    /** Source speakers must belong to the source layout. */
    PACK_014("DMX.PACK.014"),
    /** Coefficient must be a finite number. */
    COEFF_001("DMX.COEFF.001"),
    /** Coefficient magnitude hard limit. */
    COEFF_002("DMX.COEFF.002"),
    /** Coefficient magnitude soft limit. */
    COEFF_003("DMX.COEFF.003"),
    /** Per-target-channel magnitude sum. */
    COEFF_004("DMX.COEFF.004");

    private final String code;

    RuleId(String code) {
        this.code = code;
    }

    /**
     * @return the dotted rule code, e.g. {@code DMX.COEFF.002}
     */
    @JsonValue
    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
