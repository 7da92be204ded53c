package com.questrail.tommy.observability;

import java.time.Instant;

/**
 * Record representing a motion flag change that was delivered to a sensor.
 */
public record ZoneMotionEvent(
    Instant timestamp,
    String zoneId,
    boolean motion
) {
}
