package com.phillippitts.focusmanager.service.metrics;

import com.phillippitts.focusmanager.domain.FocusState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized metrics tracking for channel focus arbitration.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Focus transitions per manager, channel and resulting state</li>
 *   <li>Activity records emitted per manager</li>
 * </ul>
 *
 * <p>Queue depth and worker throughput gauges are registered separately by
 * {@code ArbitrationMetricsConfig}.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class FocusMetrics {

    private static final String METRIC_PREFIX = "focusmanager";

    private final MeterRegistry registry;

    public FocusMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the focus transition counter.
     *
     * @param focusManager manager name (audio, visual)
     * @param channelName channel whose focus changed
     * @param focusState new focus state
     */
    public void recordFocusChange(String focusManager, String channelName, FocusState focusState) {
        Counter.builder(METRIC_PREFIX + ".focus.changes")
                .description("Number of channel focus transitions")
                .tag("manager", focusManager)
                .tag("channel", channelName)
                .tag("state", focusState.name())
                .register(registry)
                .increment();
    }

    /**
     * Adds the size of one activity batch to the activity counter.
     *
     * @param focusManager manager name (audio, visual)
     * @param count number of activity records in the batch
     */
    public void recordActivityUpdates(String focusManager, int count) {
        Counter.builder(METRIC_PREFIX + ".activity.updates")
                .description("Number of channel activity records emitted")
                .tag("manager", focusManager)
                .register(registry)
                .increment(count);
    }
}
