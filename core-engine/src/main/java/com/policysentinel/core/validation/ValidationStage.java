package com.policysentinel.core.validation;

import java.util.List;

/**
 * Contract for every validator in the pipeline.
 *
 * <p>
 * A stage splits its work into independent {@link ValidationTask}s (one per
 * conversion, one per matrix, one per composition path, ...). Tasks only read
 * the {@link ValidationContext} and only write to the issue collector, so the
 * engine may run them on any thread and in any order; the final report order
 * is fixed by {@link com.policysentinel.core.model.Issue#ORDER}.
 * </p>
 *
 * @since 1.0.0
 */
public interface ValidationStage {

    /**
     * Split this stage's work for the given run.
     *
     * @param context read-only run context
     * @return tasks to execute; never {@code null}
     */
    List<ValidationTask> plan(ValidationContext context);

    /**
     * @return short stage name used in log output
     */
    String getName();
}
