package com.questrail.tommy.internal.zone;

import com.questrail.tommy.api.ZoneInfo;

import java.util.Objects;

/**
 * One known zone: its last roster entry and the sensor handle that owns its
 * motion state.
 */
public final class ZoneRecord
{
    private ZoneInfo info;
    private final ZoneMotionSensor sensor;

    ZoneRecord(ZoneInfo info, ZoneMotionSensor sensor) {
        this.info = Objects.requireNonNull(info, "info");
        this.sensor = Objects.requireNonNull(sensor, "sensor");
        if (!info.id().equals(sensor.zoneId())) {
            throw new IllegalArgumentException("Sensor zone " + sensor.zoneId() + " does not match " + info.id());
        }
    }

    public String zoneId() {
        return info.id();
    }

    public ZoneInfo info() {
        return info;
    }

    public ZoneMotionSensor sensor() {
        return sensor;
    }

    void rename(String name) {
        info = info.withName(name);
    }
}
