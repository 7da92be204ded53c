package com.questrail.tommy.api;

/**
 * Receives the motion flag of the zone that produced a zone-state message.
 *
 * <p>Always invoked after the {@link ZoneConfigListener} call for the same
 * message, on the consumer context.</p>
 */
@FunctionalInterface
public interface ZoneMotionListener
{
    void onZoneMotionUpdate(String zoneId, boolean motion);
}
