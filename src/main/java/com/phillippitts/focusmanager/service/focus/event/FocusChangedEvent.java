package com.phillippitts.focusmanager.service.focus.event;

import com.phillippitts.focusmanager.domain.FocusState;

import java.time.Instant;

/**
 * Published whenever a channel's focus state actually changes.
 *
 * @param focusManager name of the focus manager owning the channel (audio/visual)
 * @param channelName  channel whose focus changed
 * @param focusState   the new focus state
 * @param timestamp    when the change was applied
 */
public record FocusChangedEvent(
        String focusManager,
        String channelName,
        FocusState focusState,
        Instant timestamp
) {}
