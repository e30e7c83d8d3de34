package com.enms.analytics.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fan-out of bus events to live subscribers grouped by channel.
 * Subscribers whose send fails are pruned on the spot.
 */
@Component
@Slf4j
public class LiveChannelManager {

    private final Map<ChannelGroup, Map<String, LiveSubscriber>> subscribers = new EnumMap<>(ChannelGroup.class);
    private final Clock clock;

    public LiveChannelManager(Clock clock) {
        this.clock = clock;
        for (ChannelGroup group : ChannelGroup.values()) {
            subscribers.put(group, new ConcurrentHashMap<>());
        }
    }

    /**
     * Join a group and greet the subscriber with a {@code connection} envelope.
     */
    public void register(ChannelGroup group, LiveSubscriber subscriber) {
        subscribers.get(group).put(subscriber.getId(), subscriber);
        log.info("Subscriber {} joined {} ({} connections total)",
                subscriber.getId(), group.getWireName(), getConnectionCount());

        Map<String, Object> welcome = new LinkedHashMap<>();
        welcome.put("status", "connected");
        welcome.put("clientId", subscriber.getId());
        welcome.put("connectionType", group.getWireName());
        send(group, subscriber, new EventEnvelope("connection", welcome, Instant.now(clock)));
    }

    public void unregister(ChannelGroup group, String subscriberId) {
        if (subscribers.get(group).remove(subscriberId) != null) {
            log.info("Subscriber {} left {} ({} connections total)",
                    subscriberId, group.getWireName(), getConnectionCount());
        }
    }

    @EventListener
    public void onEvent(EnergyEvent event) {
        for (ChannelGroup group : event.topic().getGroups()) {
            broadcast(group, event.envelope());
        }
    }

    public void broadcast(ChannelGroup group, EventEnvelope envelope) {
        List<LiveSubscriber> targets = new ArrayList<>(subscribers.get(group).values());
        for (LiveSubscriber subscriber : targets) {
            send(group, subscriber, envelope);
        }
    }

    private void send(ChannelGroup group, LiveSubscriber subscriber, EventEnvelope envelope) {
        try {
            subscriber.send(envelope);
        } catch (IOException | RuntimeException e) {
            log.debug("Dropping subscriber {} from {}: {}", subscriber.getId(), group.getWireName(), e.getMessage());
            unregister(group, subscriber.getId());
            subscriber.close();
        }
    }

    public int getConnectionCount() {
        return subscribers.values().stream().mapToInt(Map::size).sum();
    }

    public Map<String, Integer> getConnectionsByGroup() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        subscribers.forEach((group, members) -> counts.put(group.getWireName(), members.size()));
        return counts;
    }
}
