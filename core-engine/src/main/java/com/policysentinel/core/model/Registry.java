package com.policysentinel.core.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The root downmix registry document.
 *
 * <p>
 * A {@code Registry} only exists once the document has parsed and carries its
 * required sections; everything below that level is kept as read and checked
 * by the validators. Policies and default-policy keys are held in sorted
 * order, conversions and composition paths in declaration order.
 * </p>
 *
 * @since 1.0.0
 */
public final class Registry {

    private final Path file;
    private final Map<String, Object> meta;
    private final SortedMap<String, PolicyEntry> policies;
    private final SortedMap<String, Object> defaultPolicyBySourceLayout;
    private final List<Conversion> conversions;
    private final Object compositionPathsRaw;
    private final List<CompositionPath> compositionPaths;

    /**
     * @param file                        path of the registry document
     * @param meta                        the {@code _meta} section
     * @param policies                    raw {@code policies} mapping
     * @param defaultPolicyBySourceLayout raw {@code default_policy_by_source_layout} mapping
     * @param conversions                 raw {@code conversions} list
     * @param compositionPathsRaw         raw {@code composition_paths}, or {@code null} if absent
     */
    public Registry(Path file, Map<String, Object> meta, Map<String, Object> policies,
            Map<String, Object> defaultPolicyBySourceLayout, List<Object> conversions,
            Object compositionPathsRaw) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.meta = Collections.unmodifiableMap(Objects.requireNonNull(meta, "meta must not be null"));

        SortedMap<String, PolicyEntry> entries = new TreeMap<>();
        Objects.requireNonNull(policies, "policies must not be null")
                .forEach((key, value) -> entries.put(key, new PolicyEntry(key, value)));
        this.policies = Collections.unmodifiableSortedMap(entries);

        this.defaultPolicyBySourceLayout = Collections.unmodifiableSortedMap(new TreeMap<>(
                Objects.requireNonNull(defaultPolicyBySourceLayout,
                        "defaultPolicyBySourceLayout must not be null")));

        List<Conversion> parsedConversions = new ArrayList<>();
        List<Object> rawConversions = Objects.requireNonNull(conversions, "conversions must not be null");
        for (int i = 0; i < rawConversions.size(); i++) {
            parsedConversions.add(new Conversion(i, rawConversions.get(i)));
        }
        this.conversions = Collections.unmodifiableList(parsedConversions);

        this.compositionPathsRaw = compositionPathsRaw;
        List<CompositionPath> parsedPaths = new ArrayList<>();
        if (compositionPathsRaw instanceof List<?> rawPaths) {
            for (int i = 0; i < rawPaths.size(); i++) {
                parsedPaths.add(new CompositionPath(i, rawPaths.get(i)));
            }
        }
        this.compositionPaths = Collections.unmodifiableList(parsedPaths);
    }

    public Path getFile() {
        return file;
    }

    /**
     * @return the directory every relative pack {@code file} is resolved against
     */
    public Path getBaseDirectory() {
        Path parent = file.toAbsolutePath().getParent();
        return parent != null ? parent : file.toAbsolutePath();
    }

    public Map<String, Object> getMeta() {
        return meta;
    }

    /**
     * @return unmodifiable policy entries sorted by registry key
     */
    public SortedMap<String, PolicyEntry> getPolicies() {
        return policies;
    }

    public Optional<PolicyEntry> getPolicy(String policyKey) {
        return policyKey == null ? Optional.empty() : Optional.ofNullable(policies.get(policyKey));
    }

    public boolean hasPolicy(String policyKey) {
        return policyKey != null && policies.containsKey(policyKey);
    }

    /**
     * @return unmodifiable raw defaults sorted by source layout ID
     */
    public SortedMap<String, Object> getDefaultPolicyBySourceLayout() {
        return defaultPolicyBySourceLayout;
    }

    /**
     * @param sourceLayoutId source layout ID
     * @return the default policy for that layout, if declared as a string
     */
    public Optional<String> defaultPolicyFor(String sourceLayoutId) {
        if (sourceLayoutId == null) {
            return Optional.empty();
        }
        return defaultPolicyBySourceLayout.get(sourceLayoutId) instanceof String s
                ? Optional.of(s)
                : Optional.empty();
    }

    public List<Conversion> getConversions() {
        return conversions;
    }

    /**
     * @return {@code true} if the optional {@code composition_paths} key was present
     */
    public boolean hasCompositionPaths() {
        return compositionPathsRaw != null;
    }

    public Optional<Object> getCompositionPathsRaw() {
        return Optional.ofNullable(compositionPathsRaw);
    }

    /**
     * @return composition paths in declaration order; empty when absent or
     *         when {@code composition_paths} is not a list
     */
    public List<CompositionPath> getCompositionPaths() {
        return compositionPaths;
    }

    @Override
    public String toString() {
        return "Registry{" +
                "file=" + file +
                ", policies=" + policies.keySet() +
                ", conversions=" + conversions.size() +
                ", compositionPaths=" + compositionPaths.size() +
                '}';
    }
}
