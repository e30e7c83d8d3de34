package com.enms.analytics.event;

import java.util.EnumSet;
import java.util.Set;

/**
 * Event bus topics and the channel groups they fan out to.
 * The generic {@link ChannelGroup#EVENTS} group receives every topic.
 */
public enum EventTopic {
    ANOMALY_DETECTED("anomaly_detected", EnumSet.of(ChannelGroup.DASHBOARD, ChannelGroup.ANOMALIES)),
    METRIC_UPDATED("metric_updated", EnumSet.of(ChannelGroup.DASHBOARD)),
    TRAINING_STARTED("training_started", EnumSet.of(ChannelGroup.TRAINING)),
    TRAINING_PROGRESS("training_progress", EnumSet.of(ChannelGroup.TRAINING)),
    TRAINING_COMPLETED("training_completed", EnumSet.of(ChannelGroup.TRAINING, ChannelGroup.DASHBOARD)),
    SYSTEM_ALERT("system_alert", EnumSet.noneOf(ChannelGroup.class));

    private final String wireName;
    private final Set<ChannelGroup> groups;

    EventTopic(String wireName, Set<ChannelGroup> groups) {
        this.wireName = wireName;
        this.groups = EnumSet.of(ChannelGroup.EVENTS);
        this.groups.addAll(groups);
    }

    public String getWireName() {
        return wireName;
    }

    public Set<ChannelGroup> getGroups() {
        return groups;
    }
}
