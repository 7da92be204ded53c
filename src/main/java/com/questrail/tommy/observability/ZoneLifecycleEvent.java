package com.questrail.tommy.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Record representing a zone lifecycle operation performed by the reconciler.
 *
 * @param timestamp when the operation completed
 * @param kind      operation performed
 * @param zoneId    affected zone; {@code "*"} for batch-level events
 * @param detail    human-readable detail (zone name, counts)
 */
public record ZoneLifecycleEvent(
    Instant timestamp,
    Kind kind,
    String zoneId,
    String detail
) {
    public enum Kind {
        CREATED,
        REMOVED,
        RENAMED,
        CREATION_SKIPPED
    }

    public ZoneLifecycleEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(zoneId, "zoneId");
        Objects.requireNonNull(detail, "detail");
    }
}
