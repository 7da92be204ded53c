package com.questrail.tommy.observability;

/**
 * Main interface for receiving zone bridge observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive from two threads: transport events from the network
 * thread, everything else from the consumer context. Implementations must be
 * safe for that.</p>
 */
public interface ZoneObservabilitySink {
    /**
     * Called when the broker connection changes or a reconnect is scheduled.
     * @param event the transport event
     */
    void onTransportEvent(ZoneTransportEvent event);

    /**
     * Called when an inbound payload is dropped or needed a fallback.
     * @param event the decode event
     */
    void onDecodeEvent(ZoneDecodeEvent event);

    /**
     * Called when a zone is created, removed, or renamed, or when creation is skipped.
     * @param event the lifecycle event
     */
    void onZoneLifecycleEvent(ZoneLifecycleEvent event);

    /**
     * Called when a zone's motion flag actually changes.
     * @param event the motion event
     */
    void onMotionEvent(ZoneMotionEvent event);

    /**
     * Called when an error is caught and contained.
     * @param event the error event
     */
    void onError(ZoneErrorEvent event);
}
