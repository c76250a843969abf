package com.phillippitts.focusmanager.testutil;

import com.phillippitts.focusmanager.domain.FocusState;
import com.phillippitts.focusmanager.service.focus.FocusManagerObserver;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Global focus observer that records (channel, focus) pairs in arrival order.
 */
public class RecordingFocusManagerObserver implements FocusManagerObserver {

    public record Change(String channelName, FocusState focus) {}

    private final List<Change> changes = new CopyOnWriteArrayList<>();

    @Override
    public void onFocusChanged(String channelName, FocusState newFocus) {
        changes.add(new Change(channelName, newFocus));
    }

    public List<Change> changes() {
        return List.copyOf(changes);
    }
}
