package com.policysentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A declared multi-step fold-down, e.g. {@code 7.1 -> 5.1 -> 2.0}.
 *
 * <p>
 * Steps are kept as an ordered, index-addressed list; chain checks compare
 * {@code steps[i]} with {@code steps[i + 1]} and never need more than that.
 * </p>
 *
 * @since 1.0.0
 */
public final class CompositionPath extends DocumentNode {

    public static final String FIELD_SOURCE_LAYOUT = "source_layout_id";
    public static final String FIELD_TARGET_LAYOUT = "target_layout_id";
    public static final String FIELD_POLICY = "policy_id";
    public static final String FIELD_STEPS = "steps";

    private final int index;
    private final List<CompositionStep> steps;

    public CompositionPath(int index, Object raw) {
        super("composition_paths[" + index + "]", raw);
        this.index = index;
        List<CompositionStep> parsed = new ArrayList<>();
        getListField(FIELD_STEPS).ifPresent(list -> {
            for (int i = 0; i < list.size(); i++) {
                parsed.add(new CompositionStep(getLocation(), i, list.get(i)));
            }
        });
        this.steps = Collections.unmodifiableList(parsed);
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

    /**
     * @return {@code true} if {@code steps} is present and is a list
     */
    public boolean hasStepList() {
        return getListField(FIELD_STEPS).isPresent();
    }

    /**
     * @return the steps in declaration order; empty if missing or malformed
     */
    public List<CompositionStep> getSteps() {
        return steps;
    }

    @Override
    public String toString() {
        return "CompositionPath" + getLocation() + '{' + getSourceLayoutId().orElse("?")
                + " -> " + getTargetLayoutId().orElse("?") + ", steps=" + steps.size() + '}';
    }
}
