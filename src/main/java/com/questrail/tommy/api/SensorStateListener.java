package com.questrail.tommy.api;

/**
 * Notification hook through which an attached presentation entity learns
 * that a sensor's state or naming changed and should be re-published.
 */
@FunctionalInterface
public interface SensorStateListener
{
    void onStateChanged(MotionSensorHandle sensor);
}
