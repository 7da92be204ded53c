package com.questrail.tommy.transport;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Closed set of broker topics the bridge consumes.
 *
 * <p>Handler registries are keyed by this enum, so a misspelled topic is a
 * compile error rather than a silent non-delivery.</p>
 */
public enum ZoneTopic {
    ZONE_CONFIG("/topic/zone-config"),
    ZONE_STATE("/topic/zone-state");

    private final String topicName;

    ZoneTopic(String topicName) {
        this.topicName = topicName;
    }

    /**
     * Wire name as published by the hub.
     */
    public String topicName() {
        return topicName;
    }

    public static Optional<ZoneTopic> fromTopicName(String topicName) {
        for (ZoneTopic t : values()) {
            if (t.topicName.equals(topicName)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /**
     * Wire names of every topic, in declaration order; the subscription set.
     */
    public static List<String> topicNames() {
        return Arrays.stream(values()).map(ZoneTopic::topicName).toList();
    }
}
