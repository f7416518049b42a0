package com.policysentinel.core.model;

import java.util.Optional;

/**
 * One entry of the registry {@code conversions} list: a source/target layout
 * pair resolved through a policy and a matrix.
 *
 * @since 1.0.0
 */
public final class Conversion extends DocumentNode {

    public static final String FIELD_SOURCE_LAYOUT = "source_layout_id";
    public static final String FIELD_TARGET_LAYOUT = "target_layout_id";
    public static final String FIELD_POLICY = "policy_id";
    public static final String FIELD_MATRIX = "matrix_id";

    private final int index;

    public Conversion(int index, Object raw) {
        super("conversions[" + index + "]", raw);
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    public Optional<String> getSourceLayoutId() {
        return getStringField(FIELD_SOURCE_LAYOUT);
    }

    public Optional<String> getTargetLayoutId() {
        return getStringField(FIELD_TARGET_LAYOUT);
    }

    public Optional<String> getPolicyId() {
        return getStringField(FIELD_POLICY);
    }

    public Optional<String> getMatrixId() {
        return getStringField(FIELD_MATRIX);
    }

    @Override
    public String toString() {
        return "Conversion" + getLocation() + getFields();
    }
}
