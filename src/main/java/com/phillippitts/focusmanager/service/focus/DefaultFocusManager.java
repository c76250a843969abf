package com.phillippitts.focusmanager.service.focus;

import com.phillippitts.focusmanager.domain.ChannelConfiguration;
import com.phillippitts.focusmanager.domain.ChannelState;
import com.phillippitts.focusmanager.domain.FocusState;
import com.phillippitts.focusmanager.exception.ArbitrationRejectedException;
import com.phillippitts.focusmanager.service.arbitration.SerialArbitrationExecutor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Default implementation of {@link FocusManager} backed by a {@link ChannelRegistry} and a
 * {@link SerialArbitrationExecutor}.
 *
 * <p><b>Request Flow:</b> each public request runs a short synchronous check on the caller thread
 * (does the channel exist, who holds the foreground channel) and then hands a task to the executor.
 * Acquire and release use the normal lane; stop requests use the urgent lane.
 *
 * <p><b>State Management:</b> the active-channel set and the observer set are guarded by one lock.
 * The lock is held only for short reads and updates and is always released before channel observers,
 * global observers or the activity tracker are called, so callbacks may re-enter this manager.
 *
 * <p><b>Stale Requests:</b> stop requests capture the owning interface name at call time. The queued
 * task re-checks it and skips the channel if ownership changed in between.
 *
 * <p><b>Activity Batching:</b> every real focus change appends a {@link ChannelState} to a pending
 * batch that is handed to the {@link ActivityTracker} when the task finishes. The batch is only ever
 * touched by the arbitration worker. The batch is flushed even when a callback fails part way.
 *
 * <p><b>Callback Failures:</b> an exception from a channel observer, global observer or the activity
 * tracker is logged at ERROR and the remaining notifications still run.
 *
 * @since 1.0
 */
public class DefaultFocusManager implements FocusManager, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(DefaultFocusManager.class);

    private final String name;
    private final ChannelRegistry registry;
    private final ActivityTracker activityTracker;
    private final SerialArbitrationExecutor executor;

    private final Lock lock = new ReentrantLock();
    private final NavigableSet<Channel> activeChannels = new TreeSet<>(Channel.PRIORITY_ORDER);
    private final Set<FocusManagerObserver> observers = new LinkedHashSet<>();

    // Worker thread only
    private final List<ChannelState> activityUpdates = new ArrayList<>();

    /**
     * Creates a focus manager with its own arbitration worker.
     *
     * @param name           manager name, also used as the worker thread prefix
     * @param configurations ordered channel configurations; conflicting entries are dropped
     * @param activityTracker tracker notified after every operation (nullable)
     */
    public DefaultFocusManager(String name,
                               List<ChannelConfiguration> configurations,
                               ActivityTracker activityTracker) {
        this(name, new ChannelRegistry(configurations), activityTracker,
                new SerialArbitrationExecutor(name + "-focus-"));
    }

    /**
     * Constructs a DefaultFocusManager from pre-built collaborators.
     *
     * @param name            manager name used in logs and events
     * @param registry        channels this manager arbitrates
     * @param activityTracker tracker notified after every operation (nullable)
     * @param executor        worker that serializes all state changes; owned by this manager
     * @throws NullPointerException if name, registry or executor is null
     */
    public DefaultFocusManager(String name,
                               ChannelRegistry registry,
                               ActivityTracker activityTracker,
                               SerialArbitrationExecutor executor) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.activityTracker = activityTracker;
        if (activityTracker == null) {
            LOG.debug("Focus manager '{}' created without activity tracker", name);
        }
    }

    @Override
    public boolean acquireChannel(String channelName, ChannelObserver observer, String interfaceName) {
        Objects.requireNonNull(observer, "observer must not be null");
        Objects.requireNonNull(interfaceName, "interfaceName must not be null");
        LOG.debug("acquireChannel (manager={}, channel={}, interface={})", name, channelName, interfaceName);

        Optional<Channel> channel = registry.getChannel(channelName);
        if (channel.isEmpty()) {
            LOG.warn("acquireChannel failed: channel not found (manager={}, channel={})", name, channelName);
            return false;
        }

        Channel channelToAcquire = channel.get();
        try {
            executor.submit(() -> acquireChannelHelper(channelToAcquire, observer, interfaceName));
        } catch (ArbitrationRejectedException e) {
            LOG.warn("acquireChannel rejected (manager={}, channel={}): {}", name, channelName, e.getMessage());
            return false;
        }
        return true;
    }

    @Override
    public CompletableFuture<Boolean> releaseChannel(String channelName, ChannelObserver observer) {
        Objects.requireNonNull(observer, "observer must not be null");
        LOG.debug("releaseChannel (manager={}, channel={})", name, channelName);

        CompletableFuture<Boolean> result = new CompletableFuture<>();
        Optional<Channel> channel = registry.getChannel(channelName);
        if (channel.isEmpty()) {
            LOG.warn("releaseChannel failed: channel not found (manager={}, channel={})", name, channelName);
            result.complete(false);
            return result;
        }

        Channel channelToRelease = channel.get();
        try {
            executor.submit(() -> releaseChannelHelper(channelToRelease, observer, result));
        } catch (ArbitrationRejectedException e) {
            LOG.warn("releaseChannel rejected (manager={}, channel={}): {}", name, channelName, e.getMessage());
            result.complete(false);
        }
        return result;
    }

    @Override
    public void stopForegroundActivity() {
        Channel foregroundChannel;
        String foregroundInterface;
        lock.lock();
        try {
            foregroundChannel = getHighestPriorityActiveChannelLocked();
            if (foregroundChannel == null) {
                LOG.debug("stopForegroundActivity ignored: no foreground activity (manager={})", name);
                return;
            }
            foregroundInterface = foregroundChannel.getInterface();
        } finally {
            lock.unlock();
        }

        try {
            executor.submitToFront(() -> stopForegroundActivityHelper(foregroundChannel, foregroundInterface));
        } catch (ArbitrationRejectedException e) {
            LOG.warn("stopForegroundActivity rejected (manager={}): {}", name, e.getMessage());
        }
    }

    @Override
    public void stopAllActivities() {
        Map<Channel, String> channelOwners = new LinkedHashMap<>();
        lock.lock();
        try {
            if (activeChannels.isEmpty()) {
                LOG.debug("stopAllActivities ignored: no active channels (manager={})", name);
                return;
            }
            for (Channel channel : activeChannels) {
                channelOwners.put(channel, channel.getInterface());
            }
        } finally {
            lock.unlock();
        }

        try {
            executor.submitToFront(() -> stopAllActivitiesHelper(channelOwners));
        } catch (ArbitrationRejectedException e) {
            LOG.warn("stopAllActivities rejected (manager={}): {}", name, e.getMessage());
        }
    }

    @Override
    public void addObserver(FocusManagerObserver observer) {
        Objects.requireNonNull(observer, "observer must not be null");
        lock.lock();
        try {
            observers.add(observer);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void removeObserver(FocusManagerObserver observer) {
        lock.lock();
        try {
            observers.remove(observer);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Optional<String> getForegroundChannel() {
        lock.lock();
        try {
            Channel foreground = getHighestPriorityActiveChannelLocked();
            return foreground == null ? Optional.empty() : Optional.of(foreground.getName());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ChannelState> getChannelStates() {
        return registry.getChannels().stream()
                .map(Channel::getState)
                .toList();
    }

    /**
     * @return the worker serializing this manager's state changes
     */
    public SerialArbitrationExecutor getExecutor() {
        return executor;
    }

    /**
     * Stops accepting requests and waits for queued ones to finish.
     */
    @Override
    public void close() {
        LOG.info("Closing focus manager '{}'", name);
        executor.close();
    }

    private void acquireChannelHelper(Channel channelToAcquire, ChannelObserver observer, String interfaceName) {
        try {
            // Tell the previous owner, if any, that it lost the channel before it is detached
            setChannelFocus(channelToAcquire, FocusState.NONE);

            Channel foregroundChannel;
            lock.lock();
            try {
                foregroundChannel = getHighestPriorityActiveChannelLocked();
                channelToAcquire.setInterface(interfaceName);
                activeChannels.add(channelToAcquire);
            } finally {
                lock.unlock();
            }

            channelToAcquire.setObserver(observer);

            if (foregroundChannel == null || foregroundChannel == channelToAcquire) {
                setChannelFocus(channelToAcquire, FocusState.FOREGROUND);
            } else if (channelToAcquire.isHigherPriorityThan(foregroundChannel)) {
                setChannelFocus(foregroundChannel, FocusState.BACKGROUND);
                setChannelFocus(channelToAcquire, FocusState.FOREGROUND);
            } else {
                setChannelFocus(channelToAcquire, FocusState.BACKGROUND);
            }
        } finally {
            notifyActivityTracker();
        }
    }

    private void releaseChannelHelper(Channel channelToRelease,
                                      ChannelObserver observer,
                                      CompletableFuture<Boolean> result) {
        if (!channelToRelease.doesObserverOwnChannel(observer)) {
            LOG.error("releaseChannel failed: observer does not own channel (manager={}, channel={})",
                    name, channelToRelease.getName());
            result.complete(false);
            return;
        }

        result.complete(true);
        try {
            boolean wasForegrounded;
            lock.lock();
            try {
                wasForegrounded = getHighestPriorityActiveChannelLocked() == channelToRelease;
                activeChannels.remove(channelToRelease);
            } finally {
                lock.unlock();
            }

            vacateChannel(channelToRelease);
            if (wasForegrounded) {
                foregroundHighestPriorityActiveChannel();
            }
        } finally {
            notifyActivityTracker();
        }
    }

    private void stopForegroundActivityHelper(Channel foregroundChannel, String foregroundInterface) {
        if (!Objects.equals(foregroundInterface, foregroundChannel.getInterface())) {
            LOG.debug("stopForegroundActivity skipped: channel {} changed owner from {} to {} (manager={})",
                    foregroundChannel.getName(), foregroundInterface, foregroundChannel.getInterface(), name);
            return;
        }
        if (!foregroundChannel.hasObserver()) {
            LOG.debug("stopForegroundActivity skipped: channel {} already vacated (manager={})",
                    foregroundChannel.getName(), name);
            return;
        }

        try {
            vacateChannel(foregroundChannel);
            lock.lock();
            try {
                activeChannels.remove(foregroundChannel);
            } finally {
                lock.unlock();
            }
            foregroundHighestPriorityActiveChannel();
        } finally {
            notifyActivityTracker();
        }
    }

    private void stopAllActivitiesHelper(Map<Channel, String> channelOwners) {
        try {
            List<Channel> channelsToClear = new ArrayList<>();
            lock.lock();
            try {
                for (Map.Entry<Channel, String> entry : channelOwners.entrySet()) {
                    Channel channel = entry.getKey();
                    String currentInterface = channel.getInterface();
                    if (Objects.equals(currentInterface, entry.getValue())) {
                        activeChannels.remove(channel);
                        channelsToClear.add(channel);
                    } else {
                        LOG.info("stopAllActivities skipped channel with other ownership "
                                        + "(manager={}, channel={}, currentInterface={}, originalInterface={})",
                                name, channel.getName(), currentInterface, entry.getValue());
                    }
                }
            } finally {
                lock.unlock();
            }

            for (Channel channel : channelsToClear) {
                vacateChannel(channel);
            }
            foregroundHighestPriorityActiveChannel();
        } finally {
            notifyActivityTracker();
        }
    }

    /**
     * Tells the owner it lost the channel, then detaches it.
     */
    private void vacateChannel(Channel channel) {
        setChannelFocus(channel, FocusState.NONE);
        channel.clearOwnership();
    }

    private void foregroundHighestPriorityActiveChannel() {
        Channel channelToForeground;
        lock.lock();
        try {
            channelToForeground = getHighestPriorityActiveChannelLocked();
        } finally {
            lock.unlock();
        }
        if (channelToForeground != null) {
            setChannelFocus(channelToForeground, FocusState.FOREGROUND);
        }
    }

    private void setChannelFocus(Channel channel, FocusState focus) {
        if (!channel.setFocus(focus)) {
            return;
        }
        List<FocusManagerObserver> observersToNotify;
        lock.lock();
        try {
            observersToNotify = new ArrayList<>(observers);
        } finally {
            lock.unlock();
        }
        activityUpdates.add(channel.getState());
        for (FocusManagerObserver observer : observersToNotify) {
            try {
                observer.onFocusChanged(channel.getName(), focus);
            } catch (Exception e) {
                LOG.error("Focus manager observer failed (manager={}, channel={}, focus={})",
                        name, channel.getName(), focus, e);
            }
        }
    }

    private void notifyActivityTracker() {
        List<ChannelState> batch = List.copyOf(activityUpdates);
        activityUpdates.clear();
        if (activityTracker == null) {
            return;
        }
        try {
            activityTracker.notifyOfActivityUpdates(batch);
        } catch (Exception e) {
            LOG.error("Activity tracker failed (manager={}, updates={})", name, batch.size(), e);
        }
    }

    // Caller must hold lock
    private Channel getHighestPriorityActiveChannelLocked() {
        return activeChannels.isEmpty() ? null : activeChannels.first();
    }
}
