package com.policysentinel.core.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * A loaded {@code downmix_policy_pack}: a named, versioned set of matrices.
 *
 * <p>
 * Instances are immutable and compared by value, so loading the same file
 * twice yields equal packs.
 * </p>
 *
 * @since 1.0.0
 */
public final class PolicyPack {

    private final Path file;
    private final String policyId;
    private final String packVersion;
    private final SortedMap<String, Matrix> matrices;
    private final Object supportsSourceLayouts;
    private final Object supportsTargetLayouts;

    /**
     * @param file                  the file the pack was read from
     * @param policyId              the {@code policy_id} declared inside the pack
     * @param packVersion           the declared {@code pack_version}
     * @param matrices              matrices keyed by matrix ID
     * @param supportsSourceLayouts raw {@code supports_source_layouts}, may be {@code null}
     * @param supportsTargetLayouts raw {@code supports_target_layouts}, may be {@code null}
     */
    public PolicyPack(Path file, String policyId, String packVersion, Map<String, Matrix> matrices,
            Object supportsSourceLayouts, Object supportsTargetLayouts) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.policyId = policyId;
        this.packVersion = packVersion;
        this.matrices = Collections.unmodifiableSortedMap(
                new TreeMap<>(Objects.requireNonNull(matrices, "matrices must not be null")));
        this.supportsSourceLayouts = supportsSourceLayouts;
        this.supportsTargetLayouts = supportsTargetLayouts;
    }

    public Path getFile() {
        return file;
    }

    public String getPolicyId() {
        return policyId;
    }

    public String getPackVersion() {
        return packVersion;
    }

    /**
     * @return unmodifiable matrices sorted by matrix ID
     */
    public SortedMap<String, Matrix> getMatrices() {
        return matrices;
    }

    public Optional<Matrix> getMatrix(String matrixId) {
        return matrixId == null ? Optional.empty() : Optional.ofNullable(matrices.get(matrixId));
    }

    public Optional<Object> getSupportsSourceLayouts() {
        return Optional.ofNullable(supportsSourceLayouts);
    }

    public Optional<Object> getSupportsTargetLayouts() {
        return Optional.ofNullable(supportsTargetLayouts);
    }

    /**
     * Source layouts this pack can fold down from: the declared
     * {@code supports_source_layouts} when it is a list of strings, otherwise
     * the distinct source layouts of its matrices in sorted order.
     *
     * @return unmodifiable list of layout IDs
     */
    public List<String> supportedSourceLayouts() {
        return supported(supportsSourceLayouts, Matrix::getSourceLayoutId);
    }

    /**
     * Counterpart of {@link #supportedSourceLayouts()} for target layouts.
     *
     * @return unmodifiable list of layout IDs
     */
    public List<String> supportedTargetLayouts() {
        return supported(supportsTargetLayouts, Matrix::getTargetLayoutId);
    }

    private List<String> supported(Object declared,
            Function<Matrix, Optional<String>> fromMatrix) {
        if (declared instanceof List<?> list && list.stream().allMatch(String.class::isInstance)) {
            return list.stream().map(String.class::cast).toList();
        }
        return matrices.values().stream()
                .map(fromMatrix)
                .flatMap(Optional::stream)
                .distinct()
                .sorted()
                .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PolicyPack that))
            return false;
        return file.equals(that.file)
                && Objects.equals(policyId, that.policyId)
                && Objects.equals(packVersion, that.packVersion)
                && matrices.equals(that.matrices)
                && Objects.equals(supportsSourceLayouts, that.supportsSourceLayouts)
                && Objects.equals(supportsTargetLayouts, that.supportsTargetLayouts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, policyId, packVersion, matrices);
    }

    @Override
    public String toString() {
        return "PolicyPack{" +
                "policyId='" + policyId + '\'' +
                ", packVersion='" + packVersion + '\'' +
                ", file=" + file +
                ", matrices=" + matrices.keySet() +
                '}';
    }
}
