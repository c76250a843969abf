package com.phillippitts.focusmanager.config.properties;

import com.phillippitts.focusmanager.domain.ChannelConfiguration;
import com.phillippitts.focusmanager.service.focus.DefaultChannels;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the audio and visual focus managers.
 *
 * <p>Channel tables default to {@link DefaultChannels}. Overriding any {@code channels[n]} entry
 * replaces the whole table for that manager. Entries with duplicate names or priorities are not
 * rejected here; the channel registry drops them with an error log.
 *
 * <p>Properties (per manager, {@code audio} or {@code visual}):
 * <ul>
 *   <li>focus.audio.channels[n].name / .priority - channel table (lower priority = more important)</li>
 *   <li>focus.audio.thread-name-prefix - arbitration worker thread prefix (default: audio-focus-)</li>
 *   <li>focus.audio.shutdown-timeout-seconds - drain timeout on shutdown (default: 30)</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "focus")
public class FocusProperties {

    @Valid
    private ManagerProperties audio = new ManagerProperties(DefaultChannels.audioChannels(), "audio-focus-");

    @Valid
    private ManagerProperties visual = new ManagerProperties(DefaultChannels.visualChannels(), "visual-focus-");

    public ManagerProperties getAudio() {
        return audio;
    }

    public void setAudio(ManagerProperties audio) {
        this.audio = audio;
    }

    public ManagerProperties getVisual() {
        return visual;
    }

    public void setVisual(ManagerProperties visual) {
        this.visual = visual;
    }

    /**
     * Settings for one focus manager.
     */
    public static class ManagerProperties {
        @Valid
        @NotNull
        private List<ChannelProperties> channels = new ArrayList<>();

        @NotBlank
        private String threadNamePrefix;

        @Positive(message = "Shutdown timeout must be positive")
        private int shutdownTimeoutSeconds = 30;

        public ManagerProperties() {
        }

        ManagerProperties(List<ChannelConfiguration> defaults, String threadNamePrefix) {
            for (ChannelConfiguration config : defaults) {
                channels.add(new ChannelProperties(config.name(), config.priority()));
            }
            this.threadNamePrefix = threadNamePrefix;
        }

        /**
         * @return channel table in configured order
         */
        public List<ChannelConfiguration> toChannelConfigurations() {
            return channels.stream()
                    .map(c -> new ChannelConfiguration(c.getName(), c.getPriority()))
                    .toList();
        }

        public List<ChannelProperties> getChannels() {
            return channels;
        }

        public void setChannels(List<ChannelProperties> channels) {
            this.channels = channels;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getShutdownTimeoutSeconds() {
            return shutdownTimeoutSeconds;
        }

        public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
            this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        }
    }

    /**
     * One channel table entry.
     */
    public static class ChannelProperties {
        @NotBlank(message = "Channel name must not be blank")
        private String name;

        @Min(value = 0, message = "Channel priority must be non-negative")
        private int priority;

        public ChannelProperties() {
        }

        public ChannelProperties(String name, int priority) {
            this.name = name;
            this.priority = priority;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }
    }
}
