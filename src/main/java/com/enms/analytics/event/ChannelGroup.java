package com.enms.analytics.event;

import java.util.Arrays;

/**
 * Fixed set of live subscriber groups.
 */
public enum ChannelGroup {
    DASHBOARD("dashboard"),
    ANOMALIES("anomalies"),
    TRAINING("training"),
    EVENTS("events");

    private final String wireName;

    ChannelGroup(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static ChannelGroup fromWireName(String name) {
        return Arrays.stream(values())
                .filter(group -> group.wireName.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown channel group: " + name));
    }
}
