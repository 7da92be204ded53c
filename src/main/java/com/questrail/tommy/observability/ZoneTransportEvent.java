package com.questrail.tommy.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a broker connection event.
 *
 * @param timestamp when the event was observed
 * @param kind      what happened
 * @param detail    human-readable detail (endpoint, topic, delay, return code)
 * @param cause     underlying failure; {@code null} when not applicable
 */
public record ZoneTransportEvent(
    Instant timestamp,
    Kind kind,
    String detail,
    Throwable cause
) {
    public enum Kind {
        CONNECTING,
        CONNECTED,
        CONNECTION_REFUSED,
        CONNECT_FAILED,
        DISCONNECTED,
        RECONNECT_SCHEDULED,
        SUBSCRIBED,
        SUBSCRIBE_REJECTED,
        ALREADY_STARTED,
        UNROUTED_MESSAGE,
        STOPPED
    }

    public ZoneTransportEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(detail, "detail");
    }

    public static ZoneTransportEvent of(Instant timestamp, Kind kind, String detail) {
        return new ZoneTransportEvent(timestamp, kind, detail, null);
    }
}
