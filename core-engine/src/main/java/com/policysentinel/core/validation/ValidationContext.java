package com.policysentinel.core.validation;

import com.policysentinel.core.catalog.Catalog;
import com.policysentinel.core.config.ValidationOptions;
import com.policysentinel.core.model.Evidence;
import com.policysentinel.core.model.Matrix;
import com.policysentinel.core.model.PolicyPack;
import com.policysentinel.core.model.Registry;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Everything a {@link ValidationStage} may read during one run: the catalog,
 * the options, the registry and the packs that loaded.
 *
 * <p>
 * The context is immutable. Packs are keyed by the registry policy key that
 * referenced them.
 * </p>
 *
 * @since 1.0.0
 */
public final class ValidationContext {

    private final Catalog catalog;
    private final ValidationOptions options;
    private final Registry registry;
    private final SortedMap<String, PolicyPack> packs;
    private final Set<String> unavailablePolicies;

    /**
     * @param catalog             reference catalog
     * @param options             run options
     * @param registry            the loaded registry
     * @param packs               successfully loaded packs by policy key
     * @param unavailablePolicies policy keys whose pack was declared but failed to load
     */
    public ValidationContext(Catalog catalog, ValidationOptions options, Registry registry,
            Map<String, PolicyPack> packs, Set<String> unavailablePolicies) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.packs = Collections.unmodifiableSortedMap(
                new TreeMap<>(Objects.requireNonNull(packs, "packs must not be null")));
        this.unavailablePolicies = Collections.unmodifiableSet(
                new TreeSet<>(Objects.requireNonNull(unavailablePolicies, "unavailablePolicies must not be null")));
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public ValidationOptions getOptions() {
        return options;
    }

    public Registry getRegistry() {
        return registry;
    }

    /**
     * @return loaded packs sorted by policy key
     */
    public SortedMap<String, PolicyPack> getPacks() {
        return packs;
    }

    public Optional<PolicyPack> pack(String policyKey) {
        return policyKey == null ? Optional.empty() : Optional.ofNullable(packs.get(policyKey));
    }

    /**
     * @param policyKey registry policy key
     * @return {@code true} if the policy exists but its pack could not be
     *         loaded, in which case checks against its matrices are skipped
     */
    public boolean isPackUnavailable(String policyKey) {
        return policyKey != null && (unavailablePolicies.contains(policyKey)
                || (registry.hasPolicy(policyKey) && !packs.containsKey(policyKey)));
    }

    /**
     * Look up a matrix in one policy's pack.
     *
     * @param policyKey registry policy key
     * @param matrixId  matrix ID
     * @return the matrix, or empty if the pack is not loaded or lacks it
     */
    public Optional<Matrix> matrix(String policyKey, String matrixId) {
        return pack(policyKey).flatMap(p -> p.getMatrix(matrixId));
    }

    /**
     * @return evidence builder pointing at the registry document
     */
    public Evidence.Builder registryEvidence() {
        return Evidence.builder().filePath(registry.getFile().toString());
    }
}
