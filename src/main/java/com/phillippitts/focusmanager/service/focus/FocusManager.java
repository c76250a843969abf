package com.phillippitts.focusmanager.service.focus;

import com.phillippitts.focusmanager.domain.ChannelState;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Arbitrates exclusive use of a fixed set of prioritized channels among competing interfaces.
 *
 * <p>At most one interface holds a channel at a time. Among the channels in use, the one with the
 * best (numerically lowest) priority is FOREGROUND and all others are BACKGROUND.
 *
 * <p><b>Thread Safety:</b> all methods may be called from any thread. State-changing requests are
 * queued and executed one at a time; acquire and stop requests return once accepted, not once
 * applied. Stop requests jump ahead of queued acquire/release requests that have not started.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * ChannelObserver observer = focus -> LOG.info("Dialog focus is now {}", focus);
 * focusManager.acquireChannel(DefaultChannels.DIALOG_CHANNEL_NAME, observer, "SpeechRecognizer");
 *
 * // Later, give the channel back
 * boolean released = focusManager.releaseChannel(DefaultChannels.DIALOG_CHANNEL_NAME, observer).join();
 * }</pre>
 *
 * @since 1.0
 */
public interface FocusManager {

    /**
     * Requests a channel for an interface.
     *
     * <p>Any previous owner of the channel is told it lost the channel (NONE), then the new observer
     * receives FOREGROUND or BACKGROUND depending on the other active channels.
     *
     * @param channelName   channel to acquire
     * @param observer      owner to notify of focus changes on this channel
     * @param interfaceName name of the requesting interface
     * @return {@code true} if the request was queued, {@code false} if the channel does not exist
     *         or the manager is shut down
     */
    boolean acquireChannel(String channelName, ChannelObserver observer, String interfaceName);

    /**
     * Releases a channel held by the given observer.
     *
     * @param channelName channel to release
     * @param observer    observer that acquired the channel
     * @return future completed with {@code true} once released, or {@code false} if the channel
     *         does not exist or the observer does not own it
     */
    CompletableFuture<Boolean> releaseChannel(String channelName, ChannelObserver observer);

    /**
     * Stops whatever currently holds the foreground channel. No-op when nothing is active or when
     * ownership of that channel changes before the request runs.
     */
    void stopForegroundActivity();

    /**
     * Stops every active channel. Channels whose ownership changes before the request runs are left
     * untouched.
     */
    void stopAllActivities();

    void addObserver(FocusManagerObserver observer);

    void removeObserver(FocusManagerObserver observer);

    /**
     * @return name of this focus manager (e.g., "audio", "visual")
     */
    String getName();

    /**
     * @return name of the current foreground channel, or empty if no channel is active
     */
    Optional<String> getForegroundChannel();

    /**
     * @return snapshot of every channel in registry order
     */
    List<ChannelState> getChannelStates();
}
