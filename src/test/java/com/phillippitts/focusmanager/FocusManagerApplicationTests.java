package com.phillippitts.focusmanager;

import com.phillippitts.focusmanager.domain.ChannelState;
import com.phillippitts.focusmanager.domain.FocusState;
import com.phillippitts.focusmanager.service.focus.DefaultFocusManager;
import com.phillippitts.focusmanager.service.focus.event.FocusChangedEvent;
import com.phillippitts.focusmanager.service.health.FocusManagerHealthIndicator;
import com.phillippitts.focusmanager.testutil.RecordingChannelObserver;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.event.EventListener;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.focusmanager.testutil.ArbitrationTestSupport.awaitIdle;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@Import(FocusManagerApplicationTests.EventCaptureConfiguration.class)
@SpringBootTest(
    properties = {
        "spring.main.keep-alive=false"
    }
)
class FocusManagerApplicationTests {

    @Autowired
    private DefaultFocusManager audioFocusManager;

    @Autowired
    @Qualifier("visualFocusManager")
    private DefaultFocusManager visualFocusManager;

    @Autowired
    private FocusManagerHealthIndicator healthIndicator;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private FocusEventCapture capture;

    @Test
    void contextLoads() {
        assertThat(audioFocusManager.getName()).isEqualTo("audio");
        assertThat(audioFocusManager.getChannelStates())
                .extracting(ChannelState::channelName)
                .containsExactly("Dialog", "Alert", "Communications", "Content");
        assertThat(visualFocusManager.getChannelStates())
                .extracting(ChannelState::channelName)
                .containsExactly("Visual");
        assertThat(audioFocusManager.getExecutor().getName()).startsWith("audio-focus-");
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void shouldPublishFocusEventsAndMetrics() throws Exception {
        RecordingChannelObserver observer = new RecordingChannelObserver();

        visualFocusManager.acquireChannel("Visual", observer, "TemplateRuntime");
        awaitIdle(visualFocusManager);
        boolean released = visualFocusManager.releaseChannel("Visual", observer).get(5, TimeUnit.SECONDS);
        awaitIdle(visualFocusManager);

        assertThat(released).isTrue();
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(capture.events())
                        .filteredOn(e -> e.focusManager().equals("visual"))
                        .extracting(FocusChangedEvent::focusState)
                        .containsSubsequence(FocusState.FOREGROUND, FocusState.NONE));
        assertThat(meterRegistry.find("focusmanager.focus.changes")
                .tag("manager", "visual")
                .tag("state", "FOREGROUND")
                .counter()).isNotNull();
        assertThat(meterRegistry.find("focusmanager.arbitration.queued")
                .tag("manager", "audio")
                .tag("lane", "urgent")
                .gauge()).isNotNull();
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                assertThat(meterRegistry.get("focusmanager.arbitration.completed")
                        .tag("manager", "visual")
                        .gauge().value()).isGreaterThanOrEqualTo(2.0));
        assertThat(meterRegistry.get("focusmanager.channels.active")
                .tag("manager", "visual")
                .gauge().value()).isZero();
    }

    static class FocusEventCapture {
        private final List<FocusChangedEvent> events = new CopyOnWriteArrayList<>();

        @EventListener
        void onFocusChanged(FocusChangedEvent event) {
            events.add(event);
        }

        List<FocusChangedEvent> events() {
            return List.copyOf(events);
        }
    }

    @TestConfiguration
    static class EventCaptureConfiguration {
        @Bean
        FocusEventCapture focusEventCapture() {
            return new FocusEventCapture();
        }
    }
}
