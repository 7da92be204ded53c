package com.questrail.tommy.transport;

import com.questrail.tommy.internal.exec.ConsumerContext;
import com.questrail.tommy.internal.time.WallClock;
import com.questrail.tommy.observability.NullObservabilitySink;
import com.questrail.tommy.observability.ZoneErrorEvent;
import com.questrail.tommy.observability.ZoneObservabilitySink;
import com.questrail.tommy.observability.ZoneTransportEvent;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * MqttTransport
 * =============================================================================
 * Topic-typed dispatch on top of a {@link BrokerEndpoint}, with an explicit
 * hand-off into the {@link ConsumerContext}.
 *
 * <h2>Inbound path</h2>
 *
 * <pre>
 *   BrokerEndpoint (network thread)
 *        → Listener.onMessage            topic name → {@link ZoneTopic}
 *            → ConsumerContext.execute   the hand-off
 *                → TopicHandler...       consumer thread, registration order
 * </pre>
 *
 * <p>Handlers are never invoked on the network thread. A handler that throws
 * is reported and does not prevent the remaining handlers, or later messages,
 * from being delivered.</p>
 *
 * <h2>Connectivity</h2>
 * {@link #isConnected()} reflects only what the endpoint reported through
 * its connect/disconnect callbacks; it is never inferred.
 *
 * <h2>Lifecycle</h2>
 * A transport is single-use: {@link #connect()} once, {@link #disconnect()}
 * any number of times.
 */
public final class MqttTransport
{
    private final BrokerEndpoint endpoint;
    private final ConsumerContext consumer;
    private final WallClock clock;
    private final Duration connectWait;
    private final ZoneObservabilitySink observabilitySink;

    // One list per topic, created up front; the map itself is never modified.
    private final Map<ZoneTopic, List<TopicHandler>> handlers = new EnumMap<>(ZoneTopic.class);

    private final CountDownLatch firstAttempt = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile boolean connected;

    public MqttTransport(BrokerEndpoint endpoint,
                         ConsumerContext consumer,
                         WallClock clock,
                         Duration connectWait,
                         ZoneObservabilitySink observabilitySink)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.connectWait = Objects.requireNonNull(connectWait, "connectWait");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        for (ZoneTopic topic : ZoneTopic.values()) {
            handlers.put(topic, new CopyOnWriteArrayList<>());
        }

        this.endpoint.setListener(new Listener());
    }

    /**
     * Register a handler for every message on {@code topic}.
     */
    public void subscribe(ZoneTopic topic, TopicHandler handler) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(handler, "handler");
        handlers.get(topic).add(handler);
    }

    /**
     * Remove a previously registered handler. Unknown handlers are ignored.
     */
    public void unsubscribe(ZoneTopic topic, TopicHandler handler) {
        Objects.requireNonNull(topic, "topic");
        handlers.get(topic).remove(handler);
    }

    /**
     * Start the endpoint and wait briefly for the first connection attempt.
     *
     * <p>Returning normally does not mean the broker session is up; check
     * {@link #isConnected()}. Reconnects continue in the background.</p>
     *
     * @throws TransportConnectException if the connection cannot be attempted at all
     */
    public void connect() {
        if (!started.compareAndSet(false, true)) {
            observabilitySink.onTransportEvent(ZoneTransportEvent.of(
                    clock.now(), ZoneTransportEvent.Kind.ALREADY_STARTED, "MQTT transport already connecting/connected"));
            return;
        }

        endpoint.start();

        try {
            // A pending first attempt is not an error; reconnects carry on.
            firstAttempt.await(connectWait.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stop the endpoint, waiting for its network thread to terminate, and drop
     * all handlers. No-op if never connected or already disconnected.
     */
    public void disconnect() {
        if (!started.get() || !stopped.compareAndSet(false, true)) {
            return;
        }

        try {
            endpoint.stop();
        } catch (RuntimeException e) {
            observabilitySink.onError(new ZoneErrorEvent(clock.now(), "Error disconnecting MQTT endpoint", e));
        }

        connected = false;
        handlers.values().forEach(List::clear);
    }

    public boolean isConnected() {
        return connected;
    }

    /**
     * Number of handlers currently registered for {@code topic}.
     */
    public int handlerCount(ZoneTopic topic) {
        return handlers.get(topic).size();
    }

    // Runs on the consumer context.
    private void dispatch(InboundMessage message) {
        if (stopped.get()) {
            return;
        }

        for (TopicHandler handler : handlers.get(message.topic())) {
            try {
                handler.onMessage(message);
            } catch (RuntimeException e) {
                observabilitySink.onError(new ZoneErrorEvent(
                        clock.now(),
                        "Error in message handler for topic " + message.topic().topicName(),
                        e));
            }
        }
    }

    // -------------------------------------------------------------------------
    // BrokerEndpointListener (network thread)
    // -------------------------------------------------------------------------

    private final class Listener implements BrokerEndpointListener {
        @Override
        public void onConnected() {
            connected = true;
            firstAttempt.countDown();
        }

        @Override
        public void onDisconnected(Throwable cause) {
            connected = false;
            firstAttempt.countDown();
        }

        @Override
        public void onMessage(String topic, byte[] payload) {
            ZoneTopic zoneTopic = ZoneTopic.fromTopicName(topic).orElse(null);
            if (zoneTopic == null) {
                observabilitySink.onTransportEvent(ZoneTransportEvent.of(
                        clock.now(), ZoneTransportEvent.Kind.UNROUTED_MESSAGE, "Ignoring message on topic " + topic));
                return;
            }

            InboundMessage message = new InboundMessage(zoneTopic, payload, clock.now());
            consumer.execute(() -> dispatch(message));
        }
    }
}
