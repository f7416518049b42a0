package com.policysentinel.core.catalog;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named speaker configuration with its canonical channel order.
 *
 * @since 1.0.0
 */
public final class Layout {

    private final LayoutId id;
    private final List<SpeakerId> channelOrder;
    private final Set<String> channelSet;

    Layout(LayoutId id, List<SpeakerId> channelOrder) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.channelOrder = List.copyOf(channelOrder);
        Set<String> set = new LinkedHashSet<>();
        channelOrder.forEach(s -> set.add(s.value()));
        this.channelSet = Collections.unmodifiableSet(set);
    }

    public LayoutId getId() {
        return id;
    }

    /**
     * @return channels in canonical order
     */
    public List<SpeakerId> getChannelOrder() {
        return channelOrder;
    }

    /**
     * @return channel IDs as strings, in canonical order
     */
    public Set<String> channelSet() {
        return channelSet;
    }

    public boolean hasChannel(String speakerId) {
        return channelSet.contains(speakerId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Layout that))
            return false;
        return id.equals(that.id) && channelOrder.equals(that.channelOrder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, channelOrder);
    }

    @Override
    public String toString() {
        return "Layout{" + id + channelOrder + '}';
    }
}
