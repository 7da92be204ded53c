package com.questrail.tommy.observability;

import java.time.Instant;

/**
 * Record representing an error that was caught and contained by the bridge.
 */
public record ZoneErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
