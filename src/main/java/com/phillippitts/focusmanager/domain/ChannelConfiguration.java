package com.phillippitts.focusmanager.domain;

import java.util.Objects;

/**
 * Immutable name/priority pair used to build a channel registry.
 *
 * <p>Lower priority values are more important: a channel with priority 100 preempts
 * a channel with priority 400.
 *
 * @param name     unique channel name (e.g., "Dialog", "Content")
 * @param priority unique, non-negative priority value
 */
public record ChannelConfiguration(String name, int priority) {

    /**
     * Compact constructor with validation.
     *
     * @throws NullPointerException if name is null
     * @throws IllegalArgumentException if name is blank or priority is negative
     */
    public ChannelConfiguration {
        Objects.requireNonNull(name, "Channel name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Channel name must not be blank");
        }
        if (priority < 0) {
            throw new IllegalArgumentException("Channel priority must be non-negative, got: " + priority);
        }
    }

    @Override
    public String toString() {
        return "{name:'" + name + "', priority:" + priority + "}";
    }
}
