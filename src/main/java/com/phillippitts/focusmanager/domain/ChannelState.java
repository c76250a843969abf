package com.phillippitts.focusmanager.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a channel, emitted as an activity record whenever the channel's
 * focus state actually changes.
 *
 * @param channelName   name of the channel
 * @param focusState    focus state at the time of the snapshot
 * @param interfaceName interface holding the channel, or {@code null} if unowned
 * @param timeAtIdle    last time the channel transitioned to {@link FocusState#NONE}
 */
public record ChannelState(
        String channelName,
        FocusState focusState,
        String interfaceName,
        Instant timeAtIdle
) {

    public ChannelState {
        Objects.requireNonNull(channelName, "Channel name must not be null");
        Objects.requireNonNull(focusState, "Focus state must not be null");
        Objects.requireNonNull(timeAtIdle, "Time at idle must not be null");
    }

    /**
     * @return {@code true} if the channel is held (FOREGROUND or BACKGROUND)
     */
    public boolean isActive() {
        return focusState != FocusState.NONE;
    }
}
