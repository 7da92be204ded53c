package com.questrail.tommy.api;

import java.util.List;

/**
 * ZoneEntityPlatform
 * -----------------------------------------------------------------------------
 * Host-provided collaborator that turns sensor specs into live
 * presentation-layer entities.
 *
 * <p>The reconciler registers every zone created by a single roster update
 * with one call. Implementations typically call
 * {@link MotionSensorHandle#attach(SensorStateListener)} for each spec once
 * the entity is live.</p>
 */
@FunctionalInterface
public interface ZoneEntityPlatform
{
    void createSensorEntities(List<SensorSpec> batch);
}
