package com.phillippitts.focusmanager.service.events;

import com.phillippitts.focusmanager.domain.ChannelState;
import com.phillippitts.focusmanager.service.focus.event.ChannelActivityEvent;
import com.phillippitts.focusmanager.service.focus.event.FocusChangedEvent;
import com.phillippitts.focusmanager.service.metrics.FocusMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs focus changes and channel activity and feeds them into {@link FocusMetrics}.
 *
 * <p>Events are delivered synchronously on the arbitration worker thread, so handlers only log
 * and increment counters.
 */
@Component
class FocusEventsListener {
    private static final Logger LOG = LogManager.getLogger(FocusEventsListener.class);

    private final FocusMetrics metrics;

    FocusEventsListener(FocusMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onFocusChanged(FocusChangedEvent e) {
        LOG.info("Focus changed: manager={}, channel={}, focus={}", e.focusManager(), e.channelName(), e.focusState());
        metrics.recordFocusChange(e.focusManager(), e.channelName(), e.focusState());
    }

    @EventListener
    void onChannelActivity(ChannelActivityEvent e) {
        if (e.updates().isEmpty()) {
            return;
        }
        if (LOG.isDebugEnabled()) {
            for (ChannelState state : e.updates()) {
                LOG.debug("Channel activity: manager={}, channel={}, focus={}, interface={}",
                        e.focusManager(), state.channelName(), state.focusState(), state.interfaceName());
            }
        }
        metrics.recordActivityUpdates(e.focusManager(), e.updates().size());
    }
}
