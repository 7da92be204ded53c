package com.questrail.tommy.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a decode anomaly.
 *
 * <p>{@link Kind#NON_JSON} and {@link Kind#UNEXPECTED_FORMAT} mean the message
 * was dropped. {@link Kind#UNKNOWN_MOTION_STATE} means the message was kept
 * and its motion defaulted to "no motion".</p>
 *
 * @param timestamp when the message was decoded
 * @param topic     wire topic name
 * @param kind      anomaly classification
 * @param detail    raw payload or offending value, for diagnostics
 */
public record ZoneDecodeEvent(
    Instant timestamp,
    String topic,
    Kind kind,
    String detail
) {
    public enum Kind {
        NON_JSON,
        UNEXPECTED_FORMAT,
        UNKNOWN_MOTION_STATE
    }

    public ZoneDecodeEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }

    public boolean dropped() {
        return kind != Kind.UNKNOWN_MOTION_STATE;
    }
}
