package com.phillippitts.focusmanager.service.focus;

import com.phillippitts.focusmanager.domain.ChannelConfiguration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping of channel name to {@link Channel}, built once from an ordered configuration list.
 *
 * <p>Entries whose name or priority is already taken by an earlier entry are dropped with an error
 * log; construction never fails because of a conflicting entry.
 *
 * @since 1.0
 */
public final class ChannelRegistry {

    private static final Logger LOG = LogManager.getLogger(ChannelRegistry.class);

    private final Map<String, Channel> channels;

    public ChannelRegistry(List<ChannelConfiguration> configurations) {
        Objects.requireNonNull(configurations, "configurations must not be null");
        Map<String, Channel> byName = new LinkedHashMap<>();
        Set<Integer> priorities = new HashSet<>();
        for (ChannelConfiguration config : configurations) {
            if (byName.containsKey(config.name())) {
                LOG.error("Channel creation failed: reason=channelNameExists, config={}", config);
                continue;
            }
            if (!priorities.add(config.priority())) {
                LOG.error("Channel creation failed: reason=channelPriorityExists, config={}", config);
                continue;
            }
            byName.put(config.name(), new Channel(config.name(), config.priority()));
        }
        this.channels = Collections.unmodifiableMap(byName);
        LOG.debug("Channel registry built with channels={}", channels.keySet());
    }

    /**
     * @param channelName channel to look up (nullable)
     * @return the channel, or empty if no channel has this name
     */
    public Optional<Channel> getChannel(String channelName) {
        if (channelName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(channels.get(channelName));
    }

    /**
     * @return all channels in configuration order
     */
    public Collection<Channel> getChannels() {
        return channels.values();
    }

    public int size() {
        return channels.size();
    }
}
