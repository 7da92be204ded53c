package com.questrail.tommy.internal.zone;

import com.questrail.tommy.api.DeviceInfo;
import com.questrail.tommy.api.MotionSensorHandle;
import com.questrail.tommy.api.SensorStateListener;

import java.util.Objects;
import java.util.Optional;

/**
 * ZoneMotionSensor
 * -----------------------------------------------------------------------------
 * Engine-owned {@link MotionSensorHandle} for one zone.
 *
 * <p>State changes only through {@link MotionRouter} (motion) and
 * {@link ZoneReconciler} (name, device info, removal). Both run on the
 * consumer context; fields are volatile so the presentation layer may read
 * them from elsewhere.</p>
 */
public final class ZoneMotionSensor implements MotionSensorHandle
{
    private final String zoneId;
    private final String uniqueId;

    private volatile String name;
    private volatile DeviceInfo deviceInfo;
    private volatile Boolean lastMotion;
    private volatile SensorStateListener listener;
    private volatile boolean removed;

    ZoneMotionSensor(String zoneId, String uniqueId, String name, DeviceInfo deviceInfo) {
        this.zoneId = Objects.requireNonNull(zoneId, "zoneId");
        this.uniqueId = Objects.requireNonNull(uniqueId, "uniqueId");
        this.name = Objects.requireNonNull(name, "name");
        this.deviceInfo = Objects.requireNonNull(deviceInfo, "deviceInfo");
    }

    @Override
    public String zoneId() {
        return zoneId;
    }

    @Override
    public String uniqueId() {
        return uniqueId;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DeviceInfo deviceInfo() {
        return deviceInfo;
    }

    @Override
    public Optional<Boolean> currentState() {
        return Optional.ofNullable(lastMotion);
    }

    @Override
    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public void setDeviceInfo(DeviceInfo deviceInfo) {
        this.deviceInfo = Objects.requireNonNull(deviceInfo, "deviceInfo");
    }

    @Override
    public void attach(SensorStateListener listener) {
        if (removed) {
            throw new IllegalStateException("Sensor for zone " + zoneId + " has been removed");
        }
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void detach() {
        this.listener = null;
    }

    @Override
    public boolean isAttached() {
        return listener != null;
    }

    @Override
    public void publishState() {
        SensorStateListener l = listener;
        if (l != null) {
            l.onStateChanged(this);
        }
    }

    public boolean isRemoved() {
        return removed;
    }

    /**
     * Stores the new motion value and notifies the presentation layer once.
     */
    void applyMotion(boolean motion) {
        lastMotion = motion;
        publishState();
    }

    void markRemoved() {
        removed = true;
        listener = null;
    }

    @Override
    public String toString() {
        return "ZoneMotionSensor[" + zoneId + ", " + name + ", motion=" + lastMotion + "]";
    }
}
