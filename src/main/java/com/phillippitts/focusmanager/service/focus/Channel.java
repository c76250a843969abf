package com.phillippitts.focusmanager.service.focus;

import com.phillippitts.focusmanager.domain.ChannelState;
import com.phillippitts.focusmanager.domain.FocusState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A named, prioritized resource that at most one interface can hold at a time.
 *
 * <p>Holds the focus state and the current owner (observer plus interface name). Name and priority
 * are fixed at construction; everything else is mutated only by the owning focus manager's
 * arbitration worker. Reads may come from any thread.
 *
 * <p><b>Observer protocol:</b> {@link #setObserver(ChannelObserver)} does not notify anyone. Callers
 * must move the channel to {@link FocusState#NONE} via {@link #setFocus(FocusState)} before replacing
 * the observer, otherwise the outgoing owner never learns it lost the channel.
 *
 * @since 1.0
 */
public final class Channel {

    private static final Logger LOG = LogManager.getLogger(Channel.class);

    /** Most important (numerically lowest priority) first. */
    public static final Comparator<Channel> PRIORITY_ORDER = Comparator.comparingInt(Channel::getPriority);

    private final String name;
    private final int priority;

    private final Lock lock = new ReentrantLock();
    private FocusState focusState = FocusState.NONE;
    private ChannelObserver observer;
    private String interfaceName;
    private Instant timeAtIdle = Instant.now();

    public Channel(String name, int priority) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.priority = priority;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Updates the focus state and notifies the attached observer.
     *
     * <p>The observer is called outside the channel lock. An exception thrown by the observer is
     * logged and does not undo the state change.
     *
     * @param focus new focus state
     * @return {@code true} if the state changed, {@code false} if it already had this state
     */
    public boolean setFocus(FocusState focus) {
        Objects.requireNonNull(focus, "focus must not be null");
        ChannelObserver toNotify;
        lock.lock();
        try {
            if (focusState == focus) {
                return false;
            }
            focusState = focus;
            if (focus == FocusState.NONE) {
                timeAtIdle = Instant.now();
            }
            toNotify = observer;
        } finally {
            lock.unlock();
        }
        if (toNotify != null) {
            try {
                toNotify.onFocusChanged(focus);
            } catch (Exception e) {
                LOG.error("Channel observer failed (channel={}, focus={})", name, focus, e);
            }
        }
        return true;
    }

    public FocusState getFocusState() {
        lock.lock();
        try {
            return focusState;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the attached observer without notifying anyone.
     *
     * @param newObserver new owner, or {@code null} to detach
     */
    public void setObserver(ChannelObserver newObserver) {
        lock.lock();
        try {
            observer = newObserver;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if an observer is attached
     */
    public boolean hasObserver() {
        lock.lock();
        try {
            return observer != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Identity check against the attached observer. A {@code null} observer never owns a channel.
     */
    public boolean doesObserverOwnChannel(ChannelObserver candidate) {
        if (candidate == null) {
            return false;
        }
        lock.lock();
        try {
            return observer == candidate;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the interface currently holding this channel.
     *
     * @param interfaceName owning interface, or {@code null} when unowned
     */
    public void setInterface(String interfaceName) {
        lock.lock();
        try {
            this.interfaceName = interfaceName;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return interface currently holding this channel, or {@code null} when unowned
     */
    public String getInterface() {
        lock.lock();
        try {
            return interfaceName;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Detaches the observer and interface name. Call only after {@code setFocus(NONE)}.
     */
    void clearOwnership() {
        lock.lock();
        try {
            observer = null;
            interfaceName = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if this channel's priority value is numerically smaller than {@code other}'s
     */
    public boolean isHigherPriorityThan(Channel other) {
        return priority < other.priority;
    }

    /**
     * @return immutable snapshot of this channel's current state
     */
    public ChannelState getState() {
        lock.lock();
        try {
            return new ChannelState(name, focusState, interfaceName, timeAtIdle);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "Channel{name='" + name + "', priority=" + priority + ", focus=" + getFocusState() + "}";
    }
}
