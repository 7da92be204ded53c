package com.questrail.tommy.api;

import java.util.Optional;

/**
 * MotionSensorHandle
 * =============================================================================
 * Presentation-facing handle for one zone's motion state.
 *
 * <h2>Role</h2>
 * A handle is created by the zone reconciler, handed to the
 * {@link ZoneEntityPlatform} in a {@link SensorSpec}, and attached by the
 * platform once the entity is live. From then on the platform observes state
 * through {@link SensorStateListener} callbacks.
 *
 * <h2>Mutation</h2>
 * The handle is a value holder. It has no polling behavior and changes only
 * when the engine calls it. Name and device info are changed through
 * {@link #setName(String)} and {@link #setDeviceInfo(DeviceInfo)}; nothing
 * outside the handle touches its fields.
 */
public interface MotionSensorHandle
{
    /** Device class reported to the presentation layer. */
    String DEVICE_CLASS = "motion";

    /** Translation key for the entity label; the label itself is derived, not stored. */
    String TRANSLATION_KEY = "motion";

    String zoneId();

    String uniqueId();

    String name();

    DeviceInfo deviceInfo();

    /**
     * Last known motion state; empty until the first motion update for the zone.
     */
    Optional<Boolean> currentState();

    /**
     * The label is derived from the device name plus the translation key.
     */
    default boolean hasEntityName() {
        return true;
    }

    void setName(String name);

    void setDeviceInfo(DeviceInfo deviceInfo);

    /**
     * Binds the handle to the presentation layer. Replaces any earlier listener.
     */
    void attach(SensorStateListener listener);

    void detach();

    boolean isAttached();

    /**
     * Pushes the current state to the attached listener, if any.
     */
    void publishState();
}
