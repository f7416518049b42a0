package com.policysentinel.core.resolve;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A resolved fold-down route between two layouts: either one direct matrix
 * or an ordered chain of composition steps.
 *
 * @since 1.0.0
 */
public final class Resolution {

    private final String sourceLayoutId;
    private final String targetLayoutId;
    private final String policyId;
    private final String matrixId;
    private final List<String> stepMatrixIds;

    private Resolution(String sourceLayoutId, String targetLayoutId, String policyId, String matrixId,
            List<String> stepMatrixIds) {
        this.sourceLayoutId = Objects.requireNonNull(sourceLayoutId, "sourceLayoutId must not be null");
        this.targetLayoutId = Objects.requireNonNull(targetLayoutId, "targetLayoutId must not be null");
        this.policyId = policyId;
        this.matrixId = matrixId;
        this.stepMatrixIds = List.copyOf(stepMatrixIds);
    }

    static Resolution direct(String source, String target, String policyId, String matrixId) {
        return new Resolution(source, target, policyId,
                Objects.requireNonNull(matrixId, "matrixId must not be null"), List.of(matrixId));
    }

    static Resolution composed(String source, String target, String policyId, List<String> stepMatrixIds) {
        return new Resolution(source, target, policyId, null, stepMatrixIds);
    }

    public String getSourceLayoutId() {
        return sourceLayoutId;
    }

    public String getTargetLayoutId() {
        return targetLayoutId;
    }

    /**
     * @return the effective policy, empty when neither the caller nor the
     *         defaults named one
     */
    public Optional<String> getPolicyId() {
        return Optional.ofNullable(policyId);
    }

    /**
     * @return the matrix of a direct conversion; empty for a composition
     */
    public Optional<String> getMatrixId() {
        return Optional.ofNullable(matrixId);
    }

    /**
     * @return matrix IDs in application order; a single element for a
     *         direct conversion
     */
    public List<String> getStepMatrixIds() {
        return stepMatrixIds;
    }

    public boolean isDirect() {
        return matrixId != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Resolution that))
            return false;
        return sourceLayoutId.equals(that.sourceLayoutId)
                && targetLayoutId.equals(that.targetLayoutId)
                && Objects.equals(policyId, that.policyId)
                && Objects.equals(matrixId, that.matrixId)
                && stepMatrixIds.equals(that.stepMatrixIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceLayoutId, targetLayoutId, policyId, matrixId, stepMatrixIds);
    }

    @Override
    public String toString() {
        return "Resolution{" + sourceLayoutId + " -> " + targetLayoutId
                + ", policy=" + policyId
                + (isDirect() ? ", matrix=" + matrixId : ", steps=" + stepMatrixIds)
                + '}';
    }
}
