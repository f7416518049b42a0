package com.policysentinel.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A downmix matrix declared inside a policy pack.
 *
 * <p>
 * {@code coefficients} maps target speaker to a mapping of source speaker to
 * linear gain. The raw value is exposed unchecked; the matrix validator owns
 * the shape rules.
 * </p>
 *
 * @since 1.0.0
 */
public final class Matrix extends DocumentNode {

    public static final String FIELD_SOURCE_LAYOUT = "source_layout_id";
    public static final String FIELD_TARGET_LAYOUT = "target_layout_id";
    public static final String FIELD_COEFFICIENTS = "coefficients";

    private final String matrixId;

    public Matrix(String matrixId, Object raw) {
        super("matrices." + Objects.requireNonNull(matrixId, "matrixId must not be null"), raw);
        this.matrixId = matrixId;
    }

    public String getMatrixId() {
        return matrixId;
    }

    public Optional<String> getSourceLayoutId() {
        return getStringField(FIELD_SOURCE_LAYOUT);
    }

    public Optional<String> getTargetLayoutId() {
        return getStringField(FIELD_TARGET_LAYOUT);
    }

    public Optional<Object> getCoefficients() {
        return getField(FIELD_COEFFICIENTS);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Matrix that))
            return false;
        return matrixId.equals(that.matrixId) && getFields().equals(that.getFields())
                && isMapping() == that.isMapping();
    }

    @Override
    public int hashCode() {
        return Objects.hash(matrixId, getFields());
    }

    @Override
    public String toString() {
        return "Matrix{" + matrixId + ": " + getSourceLayoutId().orElse("?")
                + " -> " + getTargetLayoutId().orElse("?") + '}';
    }
}
