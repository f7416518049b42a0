package com.policysentinel.core.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Read-only reference data: known layouts with their channel order, and
 * known speakers.
 *
 * <p>
 * A catalog is built once per run and passed explicitly to every validator.
 * It is immutable and safe to share between threads. Lookups by string
 * happen at the document boundary only; everything past that works with the
 * returned {@link Layout} / {@link SpeakerId} handles.
 * </p>
 *
 * @since 1.0.0
 */
public final class Catalog {

    private final SortedMap<String, Layout> layouts;
    private final SortedMap<String, SpeakerId> speakers;

    private Catalog(SortedMap<String, Layout> layouts, SortedMap<String, SpeakerId> speakers) {
        this.layouts = Collections.unmodifiableSortedMap(layouts);
        this.speakers = Collections.unmodifiableSortedMap(speakers);
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param layoutId raw layout ID
     * @return the layout, or empty if unknown
     */
    public Optional<Layout> layout(String layoutId) {
        return layoutId == null ? Optional.empty() : Optional.ofNullable(layouts.get(layoutId));
    }

    /**
     * @param speakerId raw speaker ID
     * @return the speaker, or empty if unknown
     */
    public Optional<SpeakerId> speaker(String speakerId) {
        return speakerId == null ? Optional.empty() : Optional.ofNullable(speakers.get(speakerId));
    }

    public boolean isKnownLayout(String layoutId) {
        return layout(layoutId).isPresent();
    }

    public boolean isKnownSpeaker(String speakerId) {
        return speaker(speakerId).isPresent();
    }

    /**
     * @return layout IDs in sorted order
     */
    public List<String> layoutIds() {
        return List.copyOf(layouts.keySet());
    }

    /**
     * @return speaker IDs in sorted order
     */
    public List<String> speakerIds() {
        return List.copyOf(speakers.keySet());
    }

    @Override
    public String toString() {
        return "Catalog{layouts=" + layouts.size() + ", speakers=" + speakers.size() + '}';
    }

    /**
     * Fluent builder for {@link Catalog}.
     *
     * <p>
     * {@link #build()} checks that every layout has a non-empty channel order
     * without duplicates and that every channel is a declared speaker. All
     * problems are collected and reported in a single exception.
     * </p>
     */
    public static class Builder {
        private final Set<String> speakers = new HashSet<>();
        private final Map<String, List<String>> layouts = new LinkedHashMap<>();

        public Builder speaker(String speakerId) {
            speakers.add(Objects.requireNonNull(speakerId, "speakerId must not be null"));
            return this;
        }

        public Builder speakers(String... speakerIds) {
            for (String id : speakerIds) {
                speaker(id);
            }
            return this;
        }

        public Builder layout(String layoutId, List<String> channelOrder) {
            Objects.requireNonNull(layoutId, "layoutId must not be null");
            layouts.put(layoutId, channelOrder == null ? List.of() : new ArrayList<>(channelOrder));
            return this;
        }

        public Builder layout(String layoutId, String... channelOrder) {
            return layout(layoutId, List.of(channelOrder));
        }

        /**
         * Build and validate the catalog.
         *
         * @return an immutable catalog
         * @throws IllegalStateException if any layout is invalid
         */
        public Catalog build() {
            List<String> errors = new ArrayList<>();
            SortedMap<String, SpeakerId> speakerIds = new TreeMap<>();
            speakers.forEach(id -> speakerIds.put(id, new SpeakerId(id)));

            SortedMap<String, Layout> built = new TreeMap<>();
            for (Map.Entry<String, List<String>> entry : layouts.entrySet()) {
                String layoutId = entry.getKey();
                List<String> order = entry.getValue();
                if (order.isEmpty()) {
                    errors.add("Layout " + layoutId + " missing or empty channel_order list");
                    continue;
                }
                Set<String> seen = new HashSet<>();
                List<SpeakerId> channels = new ArrayList<>();
                boolean valid = true;
                for (String channel : order) {
                    if (!seen.add(channel)) {
                        errors.add("Layout " + layoutId + " has duplicate channel in channel_order: " + channel);
                        valid = false;
                    }
                    SpeakerId speaker = speakerIds.get(channel);
                    if (speaker == null) {
                        errors.add("Layout " + layoutId + " references unknown speaker: " + channel);
                        valid = false;
                    }
                    channels.add(speaker);
                }
                if (valid) {
                    LayoutId id = new LayoutId(layoutId);
                    built.put(layoutId, new Layout(id, channels));
                }
            }

            if (!errors.isEmpty()) {
                throw new IllegalStateException(
                        "Catalog validation failed:\n  - " + String.join("\n  - ", errors));
            }
            return new Catalog(built, speakerIds);
        }
    }
}
