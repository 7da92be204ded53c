package com.questrail.tommy.runtime;

import com.questrail.tommy.api.ZoneConfigListener;
import com.questrail.tommy.api.ZoneMotionListener;
import com.questrail.tommy.internal.decode.ZoneStateDecoder;
import com.questrail.tommy.internal.decode.ZoneStateMessage;
import com.questrail.tommy.internal.exec.ConsumerContext;
import com.questrail.tommy.internal.time.WallClock;
import com.questrail.tommy.observability.NullObservabilitySink;
import com.questrail.tommy.observability.ZoneErrorEvent;
import com.questrail.tommy.observability.ZoneObservabilitySink;
import com.questrail.tommy.observability.ZoneTransportEvent;
import com.questrail.tommy.transport.BrokerEndpoint;
import com.questrail.tommy.transport.InboundMessage;
import com.questrail.tommy.transport.MqttTransport;
import com.questrail.tommy.transport.TopicHandler;
import com.questrail.tommy.transport.TransportConnectException;
import com.questrail.tommy.transport.ZoneTopic;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * TommyApi
 * =============================================================================
 * Binds the transport to the decoder and to the two zone listeners.
 *
 * <h2>Per message</h2>
 * <pre>
 *   InboundMessage ─▶ ZoneStateDecoder ─▶ ZoneConfigListener.onZoneConfigUpdate(zones)
 *                                     └▶ ZoneMotionListener.onZoneMotionUpdate(zoneId, motion)
 * </pre>
 * The roster is always applied before the motion value, so motion for a zone
 * that first appears in the same message resolves to its new handle. The
 * two listener calls are isolated from each other.
 *
 * <p>Both {@link ZoneTopic}s carry the same payload shape and are handled
 * identically.</p>
 *
 * <h2>Lifecycle</h2>
 * {@link #start} creates a fresh transport from the endpoint supplier;
 * {@link #stop} disconnects and discards it. The pair may be repeated.
 */
public final class TommyApi
{
    private final Supplier<BrokerEndpoint> endpointFactory;
    private final ConsumerContext consumer;
    private final ZoneStateDecoder decoder;
    private final WallClock clock;
    private final Duration connectWait;
    private final ZoneObservabilitySink observabilitySink;

    private volatile MqttTransport transport;

    public TommyApi(Supplier<BrokerEndpoint> endpointFactory,
                    ConsumerContext consumer,
                    ZoneStateDecoder decoder,
                    WallClock clock,
                    Duration connectWait,
                    ZoneObservabilitySink observabilitySink)
    {
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.connectWait = Objects.requireNonNull(connectWait, "connectWait");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Subscribes to both zone topics and connects.
     *
     * @throws TransportConnectException if the broker cannot be attempted at all;
     *         nothing is left running in that case
     */
    public synchronized void start(ZoneConfigListener configListener, ZoneMotionListener motionListener) {
        Objects.requireNonNull(configListener, "configListener");
        Objects.requireNonNull(motionListener, "motionListener");

        if (transport != null) {
            observabilitySink.onTransportEvent(ZoneTransportEvent.of(
                    clock.now(), ZoneTransportEvent.Kind.ALREADY_STARTED, "TOMMY API already started"));
            return;
        }

        MqttTransport t = new MqttTransport(endpointFactory.get(), consumer, clock, connectWait, observabilitySink);
        TopicHandler handler = message -> onMessage(message, configListener, motionListener);
        t.subscribe(ZoneTopic.ZONE_CONFIG, handler);
        t.subscribe(ZoneTopic.ZONE_STATE, handler);

        try {
            t.connect();
        } catch (TransportConnectException e) {
            t.disconnect();
            throw e;
        }
        transport = t;
    }

    /**
     * Disconnects and waits for the network thread. Idempotent.
     */
    public synchronized void stop() {
        MqttTransport t = transport;
        transport = null;
        if (t != null) {
            t.disconnect();
        }
    }

    public boolean connected() {
        MqttTransport t = transport;
        return t != null && t.isConnected();
    }

    // Consumer context.
    private void onMessage(InboundMessage message,
                           ZoneConfigListener configListener,
                           ZoneMotionListener motionListener)
    {
        ZoneStateMessage decoded = decoder.decode(message).orElse(null);
        if (decoded == null) {
            return;
        }

        try {
            configListener.onZoneConfigUpdate(decoded.zones());
        } catch (RuntimeException e) {
            observabilitySink.onError(new ZoneErrorEvent(clock.now(), "Zone roster update failed", e));
        }

        try {
            motionListener.onZoneMotionUpdate(decoded.zoneId(), decoded.motionDetected());
        } catch (RuntimeException e) {
            observabilitySink.onError(new ZoneErrorEvent(
                    clock.now(), "Motion update failed for zone " + decoded.zoneId(), e));
        }
    }
}
