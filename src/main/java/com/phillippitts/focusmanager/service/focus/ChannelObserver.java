package com.phillippitts.focusmanager.service.focus;

import com.phillippitts.focusmanager.domain.FocusState;

/**
 * Per-channel owner callback. The observer attached to a channel is told about every real focus
 * change of that channel, including the final transition to {@link FocusState#NONE} when it loses
 * the channel.
 *
 * <p>Called on the arbitration worker thread; implementations should return quickly and may call
 * back into the {@link FocusManager}.
 */
@FunctionalInterface
public interface ChannelObserver {

    void onFocusChanged(FocusState newFocus);
}
