package com.phillippitts.focusmanager.service.focus;

import com.phillippitts.focusmanager.domain.ChannelState;

import java.util.List;

/**
 * Receives the batch of channel activity records produced by one arbitration operation.
 *
 * <p>Invoked once at the end of every acquire, release or stop task, even when the batch is empty.
 * The list is an immutable copy and may be retained.
 */
@FunctionalInterface
public interface ActivityTracker {

    void notifyOfActivityUpdates(List<ChannelState> channelStates);
}
