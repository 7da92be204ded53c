package com.questrail.tommy.api;

import java.util.Objects;

/**
 * Everything the entity platform needs to register one zone motion entity.
 *
 * @param zoneId     zone identifier
 * @param zoneName   zone name at creation time
 * @param uniqueId   entity unique id, {@code <session>_zone_<zone>_motion}
 * @param deviceInfo device the entity belongs to
 * @param sensor     live handle the platform attaches to
 */
public record SensorSpec(String zoneId,
                         String zoneName,
                         String uniqueId,
                         DeviceInfo deviceInfo,
                         MotionSensorHandle sensor)
{
    public SensorSpec {
        Objects.requireNonNull(zoneId, "zoneId");
        Objects.requireNonNull(zoneName, "zoneName");
        Objects.requireNonNull(uniqueId, "uniqueId");
        Objects.requireNonNull(deviceInfo, "deviceInfo");
        Objects.requireNonNull(sensor, "sensor");
    }
}
