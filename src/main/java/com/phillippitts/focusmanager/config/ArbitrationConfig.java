package com.phillippitts.focusmanager.config;

import com.phillippitts.focusmanager.config.logging.MdcTaskDecorator;
import com.phillippitts.focusmanager.config.properties.FocusProperties;
import com.phillippitts.focusmanager.service.arbitration.SerialArbitrationExecutor;
import com.phillippitts.focusmanager.service.events.FocusEventBridge;
import com.phillippitts.focusmanager.service.focus.ChannelRegistry;
import com.phillippitts.focusmanager.service.focus.DefaultFocusManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.task.TaskDecorator;

import java.time.Duration;

/**
 * Wires the audio and visual focus managers, each with its own channel registry and arbitration worker.
 *
 * <p>Both managers publish their focus changes and activity batches as Spring events through a
 * {@link FocusEventBridge}. Managers are closed on context shutdown, which drains their queues.
 */
@Configuration
public class ArbitrationConfig {

    private static final Logger LOG = LogManager.getLogger(ArbitrationConfig.class);

    public static final String AUDIO_FOCUS_MANAGER = "audio";
    public static final String VISUAL_FOCUS_MANAGER = "visual";

    private final FocusProperties focusProperties;
    private final ApplicationEventPublisher publisher;

    public ArbitrationConfig(FocusProperties focusProperties, ApplicationEventPublisher publisher) {
        this.focusProperties = focusProperties;
        this.publisher = publisher;
    }

    /**
     * Propagates the caller's Log4j2 ThreadContext onto arbitration workers.
     */
    @Bean
    public TaskDecorator arbitrationTaskDecorator() {
        return new MdcTaskDecorator();
    }

    /**
     * Focus manager for the audio channels (dialog, alert, communications, content by default).
     */
    @Bean(destroyMethod = "close")
    @Primary
    public DefaultFocusManager audioFocusManager(TaskDecorator arbitrationTaskDecorator) {
        return createFocusManager(AUDIO_FOCUS_MANAGER, focusProperties.getAudio(), arbitrationTaskDecorator);
    }

    /**
     * Focus manager for the visual channel.
     */
    @Bean(destroyMethod = "close")
    public DefaultFocusManager visualFocusManager(TaskDecorator arbitrationTaskDecorator) {
        return createFocusManager(VISUAL_FOCUS_MANAGER, focusProperties.getVisual(), arbitrationTaskDecorator);
    }

    private DefaultFocusManager createFocusManager(String name,
                                                   FocusProperties.ManagerProperties props,
                                                   TaskDecorator taskDecorator) {
        ChannelRegistry registry = new ChannelRegistry(props.toChannelConfigurations());
        SerialArbitrationExecutor executor = new SerialArbitrationExecutor(
                props.getThreadNamePrefix(),
                taskDecorator,
                Duration.ofSeconds(props.getShutdownTimeoutSeconds()));
        FocusEventBridge bridge = new FocusEventBridge(name, publisher);

        DefaultFocusManager manager = new DefaultFocusManager(name, registry, bridge, executor);
        manager.addObserver(bridge);
        LOG.info("Focus manager '{}' ready with {} channels (worker={})",
                name, registry.size(), executor.getName());
        return manager;
    }
}
