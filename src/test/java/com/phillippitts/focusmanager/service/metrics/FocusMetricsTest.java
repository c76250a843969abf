package com.phillippitts.focusmanager.service.metrics;

import com.phillippitts.focusmanager.domain.FocusState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FocusMetricsTest {

    private MeterRegistry registry;
    private FocusMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new FocusMetrics(registry);
    }

    @Test
    void shouldCountFocusChangesPerChannelAndState() {
        metrics.recordFocusChange("audio", "Dialog", FocusState.FOREGROUND);
        metrics.recordFocusChange("audio", "Dialog", FocusState.FOREGROUND);
        metrics.recordFocusChange("audio", "Dialog", FocusState.NONE);

        Counter foreground = registry.find("focusmanager.focus.changes")
                .tag("manager", "audio")
                .tag("channel", "Dialog")
                .tag("state", "FOREGROUND")
                .counter();
        Counter none = registry.find("focusmanager.focus.changes")
                .tag("state", "NONE")
                .counter();

        assertThat(foreground).isNotNull();
        assertThat(foreground.count()).isEqualTo(2.0);
        assertThat(none).isNotNull();
        assertThat(none.count()).isEqualTo(1.0);
    }

    @Test
    void shouldKeepManagersSeparate() {
        metrics.recordFocusChange("audio", "Dialog", FocusState.FOREGROUND);
        metrics.recordFocusChange("visual", "Visual", FocusState.FOREGROUND);

        assertThat(registry.find("focusmanager.focus.changes").tag("manager", "audio").counters()).hasSize(1);
        assertThat(registry.find("focusmanager.focus.changes").tag("manager", "visual").counters()).hasSize(1);
    }

    @Test
    void shouldAddActivityBatchSize() {
        metrics.recordActivityUpdates("audio", 2);
        metrics.recordActivityUpdates("audio", 3);

        Counter counter = registry.find("focusmanager.activity.updates")
                .tag("manager", "audio")
                .counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(5.0);
    }
}
