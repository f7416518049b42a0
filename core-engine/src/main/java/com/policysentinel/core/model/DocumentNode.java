package com.policysentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over one mapping node of a parsed registry or pack document.
 *
 * <p>
 * Documents arrive as free-form YAML/JSON, so a node may be missing fields or
 * carry values of the wrong type. Accessors never throw on bad data: they
 * return empty and leave it to the validators to report what is wrong.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class DocumentNode {

    private final String location;
    private final Map<String, Object> fields;
    private final boolean mapping;

    /**
     * @param location document path of this node, e.g. {@code conversions[0]}
     * @param raw      the parsed node; anything other than a {@link Map} marks
     *                 the node as malformed
     */
    protected DocumentNode(String location, Object raw) {
        this.location = Objects.requireNonNull(location, "location must not be null");
        this.mapping = raw instanceof Map;
        this.fields = mapping ? copyOf((Map<?, ?>) raw) : Collections.emptyMap();
    }

    /**
     * @return document path of this node
     */
    public String getLocation() {
        return location;
    }

    /**
     * @return {@code true} if the parsed node was a mapping
     */
    public boolean isMapping() {
        return mapping;
    }

    /**
     * @return unmodifiable view of every field of this node
     */
    public Map<String, Object> getFields() {
        return fields;
    }

    /**
     * @param name field name
     * @return {@code true} if the field is present (even with a null value)
     */
    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    /**
     * @param name field name
     * @return the raw value, or empty if absent or null
     */
    public Optional<Object> getField(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    /**
     * @param name field name
     * @return the value if it is a string, otherwise empty
     */
    public Optional<String> getStringField(String name) {
        return fields.get(name) instanceof String s ? Optional.of(s) : Optional.empty();
    }

    /**
     * @param name field name
     * @return the value if it is a mapping, otherwise empty
     */
    public Optional<Map<String, Object>> getMapField(String name) {
        return fields.get(name) instanceof Map<?, ?> m ? Optional.of(copyOf(m)) : Optional.empty();
    }

    /**
     * @param name field name
     * @return the value if it is a list, otherwise empty
     */
    public Optional<List<Object>> getListField(String name) {
        if (fields.get(name) instanceof List<?> l) {
            return Optional.of(Collections.unmodifiableList(l));
        }
        return Optional.empty();
    }

    /**
     * Copy a parsed mapping into an insertion-ordered, unmodifiable map with
     * string keys. YAML permits non-string keys; they are stringified.
     *
     * @param raw parsed mapping
     * @return unmodifiable copy
     */
    public static Map<String, Object> copyOf(Map<?, ?> raw) {
        Map<String, Object> copy = new LinkedHashMap<>();
        raw.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return Collections.unmodifiableMap(copy);
    }
}
