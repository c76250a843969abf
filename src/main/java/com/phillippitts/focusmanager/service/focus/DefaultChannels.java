package com.phillippitts.focusmanager.service.focus;

import com.phillippitts.focusmanager.domain.ChannelConfiguration;

import java.util.List;

/**
 * Conventional channel names and priorities for the audio and visual focus managers.
 *
 * <p>Audio channels, most important first: dialog, alert, communications, content. The visual
 * focus manager has a single channel.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FocusManager audio = new DefaultFocusManager("audio", DefaultChannels.audioChannels(), tracker);
 * audio.acquireChannel(DefaultChannels.DIALOG_CHANNEL_NAME, observer, "SpeechSynthesizer");
 * }</pre>
 *
 * @since 1.0
 */
public final class DefaultChannels {

    /** Spoken interaction with the user: speech recognition and speech output. */
    public static final String DIALOG_CHANNEL_NAME = "Dialog";
    public static final int DIALOG_CHANNEL_PRIORITY = 100;

    /** Alarms, timers and reminders. */
    public static final String ALERT_CHANNEL_NAME = "Alert";
    public static final int ALERT_CHANNEL_PRIORITY = 200;

    /** Calls and other two-way communication. */
    public static final String COMMUNICATIONS_CHANNEL_NAME = "Communications";
    public static final int COMMUNICATIONS_CHANNEL_PRIORITY = 300;

    /** Long-running media playback. */
    public static final String CONTENT_CHANNEL_NAME = "Content";
    public static final int CONTENT_CHANNEL_PRIORITY = 400;

    /** The display. */
    public static final String VISUAL_CHANNEL_NAME = "Visual";
    public static final int VISUAL_CHANNEL_PRIORITY = 100;

    private DefaultChannels() {
        // Utility class - prevent instantiation
    }

    public static List<ChannelConfiguration> audioChannels() {
        return List.of(
                new ChannelConfiguration(DIALOG_CHANNEL_NAME, DIALOG_CHANNEL_PRIORITY),
                new ChannelConfiguration(ALERT_CHANNEL_NAME, ALERT_CHANNEL_PRIORITY),
                new ChannelConfiguration(COMMUNICATIONS_CHANNEL_NAME, COMMUNICATIONS_CHANNEL_PRIORITY),
                new ChannelConfiguration(CONTENT_CHANNEL_NAME, CONTENT_CHANNEL_PRIORITY));
    }

    public static List<ChannelConfiguration> visualChannels() {
        return List.of(new ChannelConfiguration(VISUAL_CHANNEL_NAME, VISUAL_CHANNEL_PRIORITY));
    }
}
