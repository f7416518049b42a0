package com.policysentinel.core.validation;

import com.policysentinel.core.model.PolicyPack;
import com.policysentinel.core.model.Registry;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Everything one call to {@link PolicyValidationEngine#run(java.nio.file.Path)}
 * produced: the report plus the documents that loaded, so callers such as
 * the conversion resolver can reuse them without parsing again.
 *
 * @since 1.0.0
 */
public final class ValidationRun {

    private final ValidationReport report;
    private final Registry registry;
    private final SortedMap<String, PolicyPack> packs;

    ValidationRun(ValidationReport report, Registry registry, Map<String, PolicyPack> packs) {
        this.report = Objects.requireNonNull(report, "report must not be null");
        this.registry = registry;
        this.packs = Collections.unmodifiableSortedMap(new TreeMap<>(packs));
    }

    public ValidationReport getReport() {
        return report;
    }

    /**
     * @return the registry, or empty if it failed to load
     */
    public Optional<Registry> getRegistry() {
        return Optional.ofNullable(registry);
    }

    /**
     * @return loaded packs keyed by registry policy key
     */
    public SortedMap<String, PolicyPack> getPacks() {
        return packs;
    }

    @Override
    public String toString() {
        return "ValidationRun{registry=" + (registry != null ? registry.getFile() : null)
                + ", packs=" + packs.keySet() + ", report=" + report + '}';
    }
}
