package com.phillippitts.focusmanager.service.focus;

import com.phillippitts.focusmanager.domain.ChannelConfiguration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelRegistryTest {

    @Test
    void shouldKeepConfigurationOrder() {
        ChannelRegistry registry = new ChannelRegistry(DefaultChannels.audioChannels());

        assertThat(registry.getChannels())
                .extracting(Channel::getName)
                .containsExactly("Dialog", "Alert", "Communications", "Content");
        assertThat(registry.size()).isEqualTo(4);
    }

    @Test
    void shouldDropEntryWithDuplicatePriority() {
        ChannelRegistry registry = new ChannelRegistry(List.of(
                new ChannelConfiguration("A", 1),
                new ChannelConfiguration("B", 1)));

        assertThat(registry.getChannel("A")).isPresent();
        assertThat(registry.getChannel("B")).isEmpty();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void shouldDropEntryWithDuplicateName() {
        ChannelRegistry registry = new ChannelRegistry(List.of(
                new ChannelConfiguration("Dialog", 100),
                new ChannelConfiguration("Dialog", 150),
                new ChannelConfiguration("Content", 400)));

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.getChannel("Dialog").orElseThrow().getPriority()).isEqualTo(100);
    }

    @Test
    void shouldAllowPriorityOfDroppedEntryToBeReused() {
        // The duplicate-name entry is rejected before its priority is claimed
        ChannelRegistry registry = new ChannelRegistry(List.of(
                new ChannelConfiguration("Dialog", 100),
                new ChannelConfiguration("Dialog", 150),
                new ChannelConfiguration("Alert", 150)));

        assertThat(registry.getChannel("Alert")).isPresent();
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void shouldReturnEmptyForUnknownOrNullName() {
        ChannelRegistry registry = new ChannelRegistry(DefaultChannels.visualChannels());

        assertThat(registry.getChannel("Dialog")).isEmpty();
        assertThat(registry.getChannel(null)).isEmpty();
        assertThat(registry.getChannel("Visual")).isPresent();
    }

    @Test
    void shouldAllowEmptyConfiguration() {
        ChannelRegistry registry = new ChannelRegistry(List.of());

        assertThat(registry.size()).isZero();
        assertThat(registry.getChannels()).isEmpty();
    }

    @Test
    void shouldRejectNullConfigurationList() {
        assertThatThrownBy(() -> new ChannelRegistry(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldExposeUnmodifiableChannels() {
        ChannelRegistry registry = new ChannelRegistry(DefaultChannels.audioChannels());

        assertThatThrownBy(() -> registry.getChannels().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
