package com.questrail.tommy.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ZoneObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jZoneObservabilitySink implements ZoneObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jZoneObservabilitySink.class);

    @Override
    public void onTransportEvent(ZoneTransportEvent event) {
        switch (event.kind()) {
            case CONNECTED, SUBSCRIBED, STOPPED, CONNECTING ->
                log.info("MQTT {}: {}", event.kind(), event.detail());
            case RECONNECT_SCHEDULED, UNROUTED_MESSAGE ->
                log.debug("MQTT {}: {}", event.kind(), event.detail());
            case ALREADY_STARTED ->
                log.warn("MQTT {}: {}", event.kind(), event.detail());
            case DISCONNECTED ->
                log.warn("MQTT disconnected from TOMMY: {}", event.detail(), event.cause());
            case CONNECTION_REFUSED, CONNECT_FAILED, SUBSCRIBE_REJECTED ->
                log.error("MQTT {}: {}", event.kind(), event.detail(), event.cause());
        }
    }

    @Override
    public void onDecodeEvent(ZoneDecodeEvent event) {
        switch (event.kind()) {
            case NON_JSON ->
                log.warn("Received non-JSON message on topic {}: {}", event.topic(), event.detail());
            case UNEXPECTED_FORMAT ->
                log.warn("Received unexpected message format on topic {}: {}", event.topic(), event.detail());
            case UNKNOWN_MOTION_STATE ->
                log.warn("Unknown or missing motion state, defaulting to no motion: {}", event.detail());
        }
    }

    @Override
    public void onZoneLifecycleEvent(ZoneLifecycleEvent event) {
        if (event.kind() == ZoneLifecycleEvent.Kind.CREATION_SKIPPED) {
            log.warn("Cannot create zone entities: {}", event.detail());
            return;
        }
        log.info("Zone {} {}: {}", event.zoneId(), event.kind(), event.detail());
    }

    @Override
    public void onMotionEvent(ZoneMotionEvent event) {
        log.debug("Zone {} motion -> {}", event.zoneId(), event.motion());
    }

    @Override
    public void onError(ZoneErrorEvent event) {
        log.error("TOMMY Error: {}", event.message(), event.cause());
    }
}
