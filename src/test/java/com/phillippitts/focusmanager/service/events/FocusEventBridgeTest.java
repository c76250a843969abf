package com.phillippitts.focusmanager.service.events;

import com.phillippitts.focusmanager.domain.ChannelState;
import com.phillippitts.focusmanager.domain.FocusState;
import com.phillippitts.focusmanager.service.focus.DefaultChannels;
import com.phillippitts.focusmanager.service.focus.DefaultFocusManager;
import com.phillippitts.focusmanager.service.focus.event.ChannelActivityEvent;
import com.phillippitts.focusmanager.service.focus.event.FocusChangedEvent;
import com.phillippitts.focusmanager.testutil.RecordingChannelObserver;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.phillippitts.focusmanager.testutil.ArbitrationTestSupport.awaitIdle;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class FocusEventBridgeTest {

    @Test
    void shouldPublishFocusChangedEvent() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        FocusEventBridge bridge = new FocusEventBridge("audio", publisher);

        bridge.onFocusChanged("Dialog", FocusState.FOREGROUND);

        ArgumentCaptor<FocusChangedEvent> captor = ArgumentCaptor.forClass(FocusChangedEvent.class);
        verify(publisher).publishEvent(captor.capture());
        FocusChangedEvent event = captor.getValue();
        assertThat(event.focusManager()).isEqualTo("audio");
        assertThat(event.channelName()).isEqualTo("Dialog");
        assertThat(event.focusState()).isEqualTo(FocusState.FOREGROUND);
        assertThat(event.timestamp()).isNotNull();
    }

    @Test
    void shouldPublishActivityBatchAsImmutableCopy() {
        ApplicationEventPublisher publisher = mock(ApplicationEventPublisher.class);
        FocusEventBridge bridge = new FocusEventBridge("visual", publisher);
        List<ChannelState> batch = new ArrayList<>();
        batch.add(new ChannelState("Visual", FocusState.FOREGROUND, "TemplateRuntime", Instant.now()));

        bridge.notifyOfActivityUpdates(batch);
        batch.clear();

        ArgumentCaptor<ChannelActivityEvent> captor = ArgumentCaptor.forClass(ChannelActivityEvent.class);
        verify(publisher).publishEvent(captor.capture());
        assertThat(captor.getValue().focusManager()).isEqualTo("visual");
        assertThat(captor.getValue().updates()).hasSize(1);
    }

    @Test
    void shouldPublishEventsFromFocusManagerInOrder() throws Exception {
        List<Object> published = new ArrayList<>();
        ApplicationEventPublisher publisher = published::add;
        FocusEventBridge bridge = new FocusEventBridge("audio", publisher);

        try (DefaultFocusManager manager = new DefaultFocusManager("audio", DefaultChannels.audioChannels(), bridge)) {
            manager.addObserver(bridge);
            manager.acquireChannel(DefaultChannels.CONTENT_CHANNEL_NAME, new RecordingChannelObserver(), "AudioPlayer");
            awaitIdle(manager);
        }

        assertThat(published).hasSize(2);
        assertThat(published.get(0)).isInstanceOfSatisfying(FocusChangedEvent.class,
                e -> assertThat(e.focusState()).isEqualTo(FocusState.FOREGROUND));
        assertThat(published.get(1)).isInstanceOfSatisfying(ChannelActivityEvent.class,
                e -> assertThat(e.updates()).extracting(ChannelState::interfaceName).containsExactly("AudioPlayer"));
    }
}
