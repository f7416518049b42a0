package com.policysentinel.core.config;

import com.policysentinel.core.model.Issue;
import com.policysentinel.core.model.Registry;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link RegistryLoader#load(java.nio.file.Path)}: either a
 * {@link Registry} or the single fatal issue that prevented building one.
 *
 * @since 1.0.0
 */
public final class RegistryLoadResult {

    private final Registry registry;
    private final Issue fatalIssue;

    private RegistryLoadResult(Registry registry, Issue fatalIssue) {
        this.registry = registry;
        this.fatalIssue = fatalIssue;
    }

    static RegistryLoadResult loaded(Registry registry) {
        return new RegistryLoadResult(Objects.requireNonNull(registry, "registry must not be null"), null);
    }

    static RegistryLoadResult failed(Issue fatalIssue) {
        return new RegistryLoadResult(null, Objects.requireNonNull(fatalIssue, "fatalIssue must not be null"));
    }

    public Optional<Registry> getRegistry() {
        return Optional.ofNullable(registry);
    }

    public Optional<Issue> getFatalIssue() {
        return Optional.ofNullable(fatalIssue);
    }

    public boolean isLoaded() {
        return registry != null;
    }
}
