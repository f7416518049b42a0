package com.policysentinel.core.model;

import java.util.Optional;

/**
 * One step of a {@link CompositionPath}. Only {@code matrix_id} is required;
 * {@code policy_id} narrows the policy context and the optional layout IDs
 * restate what the step's matrix is expected to map.
 *
 * @since 1.0.0
 */
public final class CompositionStep extends DocumentNode {

    public static final String FIELD_MATRIX = "matrix_id";
    public static final String FIELD_POLICY = "policy_id";
    public static final String FIELD_SOURCE_LAYOUT = "source_layout_id";
    public static final String FIELD_TARGET_LAYOUT = "target_layout_id";

    private final int index;

    public CompositionStep(String pathLocation, int index, Object raw) {
        super(pathLocation + ".steps[" + index + "]", raw);
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    public Optional<String> getMatrixId() {
        return getStringField(FIELD_MATRIX).filter(s -> !s.isBlank());
    }

    public Optional<String> getPolicyId() {
        return getStringField(FIELD_POLICY);
    }

    public Optional<String> getSourceLayoutId() {
        return getStringField(FIELD_SOURCE_LAYOUT);
    }

    public Optional<String> getTargetLayoutId() {
        return getStringField(FIELD_TARGET_LAYOUT);
    }
}
