package com.questrail.tommy.api;

import java.util.List;

/**
 * Receives every complete zone roster carried by a valid zone-state message.
 *
 * <p>The roster is authoritative, not a delta. Invoked on the consumer
 * context only.</p>
 */
@FunctionalInterface
public interface ZoneConfigListener
{
    void onZoneConfigUpdate(List<ZoneInfo> zones);
}
