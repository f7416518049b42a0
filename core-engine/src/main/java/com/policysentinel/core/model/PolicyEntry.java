package com.policysentinel.core.model;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry of the registry {@code policies} mapping.
 *
 * @since 1.0.0
 */
public final class PolicyEntry extends DocumentNode {

    public static final String FIELD_FILE = "file";
    public static final String FIELD_SUPPORTS_SOURCE = "supports_source_layouts";
    public static final String FIELD_SUPPORTS_TARGET = "supports_target_layouts";

    private final String policyKey;

    /**
     * @param policyKey the registry key of this entry
     * @param raw       the parsed entry value
     */
    public PolicyEntry(String policyKey, Object raw) {
        super("policies." + Objects.requireNonNull(policyKey, "policyKey must not be null"), raw);
        this.policyKey = policyKey;
    }

    /**
     * @return the registry key, which may or may not be a valid {@link PolicyId}
     */
    public String getPolicyKey() {
        return policyKey;
    }

    /**
     * @return the declared pack file, if present and a non-blank string
     */
    public Optional<String> getFile() {
        return getStringField(FIELD_FILE).filter(f -> !f.isBlank());
    }

    /**
     * Resolve the pack file against the directory that contains the registry.
     * Absolute paths are kept as they are.
     *
     * @param registryDirectory directory of the registry document
     * @return the normalized pack path, or empty if no file is declared
     */
    public Optional<Path> resolveFile(Path registryDirectory) {
        Objects.requireNonNull(registryDirectory, "registryDirectory must not be null");
        return getFile().map(f -> registryDirectory.resolve(f).normalize());
    }

    @Override
    public String toString() {
        return "PolicyEntry{" + policyKey + ", file=" + getFile().orElse(null) + '}';
    }
}
