package com.questrail.tommy.observability;

/**
 * No-op implementation of ZoneObservabilitySink.
 */
public final class NullObservabilitySink implements ZoneObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportEvent(ZoneTransportEvent event) {}

    @Override
    public void onDecodeEvent(ZoneDecodeEvent event) {}

    @Override
    public void onZoneLifecycleEvent(ZoneLifecycleEvent event) {}

    @Override
    public void onMotionEvent(ZoneMotionEvent event) {}

    @Override
    public void onError(ZoneErrorEvent event) {}
}
