package com.phillippitts.focusmanager.service.events;

import com.phillippitts.focusmanager.domain.ChannelState;
import com.phillippitts.focusmanager.domain.FocusState;
import com.phillippitts.focusmanager.service.focus.ActivityTracker;
import com.phillippitts.focusmanager.service.focus.FocusManagerObserver;
import com.phillippitts.focusmanager.service.focus.event.ChannelActivityEvent;
import com.phillippitts.focusmanager.service.focus.event.FocusChangedEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Republishes a focus manager's callbacks as Spring application events.
 *
 * <p>Registered as both the global observer and the activity tracker of one focus manager, so
 * that other beans can react with {@code @EventListener} instead of depending on the manager.
 *
 * @see FocusChangedEvent
 * @see ChannelActivityEvent
 */
public class FocusEventBridge implements FocusManagerObserver, ActivityTracker {

    private final String focusManager;
    private final ApplicationEventPublisher publisher;

    public FocusEventBridge(String focusManager, ApplicationEventPublisher publisher) {
        this.focusManager = Objects.requireNonNull(focusManager, "focusManager must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    @Override
    public void onFocusChanged(String channelName, FocusState newFocus) {
        publisher.publishEvent(new FocusChangedEvent(focusManager, channelName, newFocus, Instant.now()));
    }

    @Override
    public void notifyOfActivityUpdates(List<ChannelState> channelStates) {
        publisher.publishEvent(new ChannelActivityEvent(focusManager, channelStates, Instant.now()));
    }
}
