package com.phillippitts.focusmanager.service.focus.event;

import com.phillippitts.focusmanager.domain.ChannelState;

import java.time.Instant;
import java.util.List;

/**
 * Published once per completed arbitration operation with the activity records it produced.
 *
 * @param focusManager name of the focus manager (audio/visual)
 * @param updates      channel snapshots in the order the changes were applied; may be empty
 * @param timestamp    when the operation completed
 */
public record ChannelActivityEvent(
        String focusManager,
        List<ChannelState> updates,
        Instant timestamp
) {

    public ChannelActivityEvent {
        updates = List.copyOf(updates);
    }
}
