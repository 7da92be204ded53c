package com.questrail.tommy.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to timestamp observability events and inbound
 * messages.
 *
 * <p>It MUST NOT drive operational timing. Reconnect backoff is scheduled on
 * the transport's own event loop.</p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}
