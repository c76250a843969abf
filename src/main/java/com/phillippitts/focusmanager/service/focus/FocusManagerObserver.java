package com.phillippitts.focusmanager.service.focus;

import com.phillippitts.focusmanager.domain.FocusState;

/**
 * Global observer notified of focus changes on any channel of a {@link FocusManager}.
 */
@FunctionalInterface
public interface FocusManagerObserver {

    /**
     * @param channelName channel whose focus changed
     * @param newFocus    the new focus state
     */
    void onFocusChanged(String channelName, FocusState newFocus);
}
