package com.questrail.tommy.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.tommy.api.ZoneEntityPlatform;
import com.questrail.tommy.api.ZoneInfo;
import com.questrail.tommy.api.ZoneRegistry;
import com.questrail.tommy.config.TommyConfig;
import com.questrail.tommy.internal.decode.ZoneStateDecoder;
import com.questrail.tommy.internal.exec.ZoneEventLoop;
import com.questrail.tommy.internal.time.SystemWallClock;
import com.questrail.tommy.internal.time.WallClock;
import com.questrail.tommy.internal.zone.MotionRouter;
import com.questrail.tommy.internal.zone.ZoneIdentifiers;
import com.questrail.tommy.internal.zone.ZoneReconciler;
import com.questrail.tommy.internal.zone.ZoneTable;
import com.questrail.tommy.observability.Slf4jZoneObservabilitySink;
import com.questrail.tommy.observability.ZoneErrorEvent;
import com.questrail.tommy.observability.ZoneObservabilitySink;
import com.questrail.tommy.transport.BrokerEndpoint;
import com.questrail.tommy.transport.TransportConnectException;
import com.questrail.tommy.transport.ZoneTopic;
import com.questrail.tommy.transport.mqtt.netty.NettyMqttBrokerEndpoint;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * TommyZoneRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one TOMMY hub session.
 *
 * <h2>Wiring</h2>
 * <pre>
 *   NettyMqttBrokerEndpoint ─▶ MqttTransport ─▶ ZoneEventLoop
 *       ─▶ TommyApi (ZoneStateDecoder)
 *           ─▶ ZoneReconciler.update ─▶ ZoneTable ◀─ MotionRouter.update
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} starts the consumer loop, registers the hub device on it,
 * and connects. {@link #stop()} disconnects (waiting for the network
 * thread), stops the consumer loop, and then discards the zone table. The
 * table is only discarded once the consumer thread has terminated. It is
 * safe after a failed or partial start.
 */
public final class TommyZoneRuntime
{
    private final TommyConfig config;
    private final ZoneRegistry registry;
    private final ZoneEventLoop eventLoop;
    private final ZoneReconciler reconciler;
    private final MotionRouter router;
    private final ZoneTable table;
    private final TommyApi api;
    private final WallClock clock;
    private final ZoneObservabilitySink observabilitySink;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private TommyZoneRuntime(TommyConfig config,
                             ZoneRegistry registry,
                             ZoneEventLoop eventLoop,
                             ZoneReconciler reconciler,
                             MotionRouter router,
                             ZoneTable table,
                             TommyApi api,
                             WallClock clock,
                             ZoneObservabilitySink observabilitySink)
    {
        this.config = config;
        this.registry = registry;
        this.eventLoop = eventLoop;
        this.reconciler = reconciler;
        this.router = router;
        this.table = table;
        this.api = api;
        this.clock = clock;
        this.observabilitySink = observabilitySink;
    }

    /**
     * @throws TransportConnectException if the broker host cannot be resolved;
     *         everything started so far is stopped again
     * @throws IllegalStateException if already started
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Runtime already started");
        }

        eventLoop.start();
        eventLoop.execute(this::registerHubDevice);

        try {
            api.start(reconciler::update, router::update);
        } catch (TransportConnectException e) {
            stop();
            throw e;
        }
    }

    public void stop() {
        api.stop();
        if (eventLoop.stop()) {
            reconciler.clear();
        } else {
            // The zone table is still owned by the task that outlived the wait.
            observabilitySink.onError(new ZoneErrorEvent(
                    clock.now(), "Consumer thread did not stop in time; zone table kept", null));
        }
        started.set(false);
    }

    public boolean connected() {
        return api.connected();
    }

    /**
     * Wires the presentation platform. Zones already announced but not yet
     * created are picked up with the next roster.
     */
    public void attachEntityPlatform(ZoneEntityPlatform platform) {
        Objects.requireNonNull(platform, "platform");
        if (eventLoop.isRunning()) {
            eventLoop.execute(() -> reconciler.attachEntityPlatform(platform));
        } else {
            reconciler.attachEntityPlatform(platform);
        }
    }

    /**
     * Last roster applied. Read from the consumer context for a consistent view.
     */
    public List<ZoneInfo> knownZones() {
        return reconciler.knownZones();
    }

    public TommyConfig config() {
        return config;
    }

    ZoneTable zoneTable() {
        return table;
    }

    ZoneEventLoop eventLoop() {
        return eventLoop;
    }

    // Consumer context.
    private void registerHubDevice() {
        try {
            registry.getOrCreateDevice(
                    ZoneIdentifiers.hubDeviceIdentifier(config.sessionId()),
                    ZoneIdentifiers.HUB_DEVICE_NAME);
        } catch (RuntimeException e) {
            observabilitySink.onError(new ZoneErrorEvent(clock.now(), "Failed to register hub device", e));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TommyConfig config;
        private ZoneRegistry registry;
        private ZoneEntityPlatform entityPlatform;
        private ZoneObservabilitySink observabilitySink;
        private WallClock clock = SystemWallClock.INSTANCE;
        private Function<TommyConfig, BrokerEndpoint> endpointFactory;

        public Builder withConfig(TommyConfig config) {
            this.config = config;
            return this;
        }

        public Builder withRegistry(ZoneRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withEntityPlatform(ZoneEntityPlatform entityPlatform) {
            this.entityPlatform = entityPlatform;
            return this;
        }

        public Builder withObservabilitySink(ZoneObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Replaces the Netty MQTT endpoint, e.g. with a test harness. Called
         * once per {@link TommyZoneRuntime#start()}.
         */
        public Builder withEndpointFactory(Function<TommyConfig, BrokerEndpoint> endpointFactory) {
            this.endpointFactory = endpointFactory;
            return this;
        }

        public TommyZoneRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(registry, "registry");
            Objects.requireNonNull(clock, "clock");

            ZoneObservabilitySink sink = observabilitySink != null
                    ? observabilitySink
                    : new Slf4jZoneObservabilitySink();

            Function<TommyConfig, BrokerEndpoint> endpoints = endpointFactory != null
                    ? endpointFactory
                    : c -> new NettyMqttBrokerEndpoint(
                            c.host(),
                            c.mqttPort(),
                            c.clientId(),
                            c.keepAlive(),
                            c.reconnectPolicy(),
                            ZoneTopic.topicNames(),
                            clock,
                            sink);

            // 1. Consumer context and zone state
            ZoneEventLoop eventLoop = new ZoneEventLoop("tommy-zones-" + config.sessionId(), sink);
            ZoneTable table = new ZoneTable();
            ZoneReconciler reconciler = new ZoneReconciler(config.sessionId(), registry, table, clock, sink);
            if (entityPlatform != null) {
                reconciler.attachEntityPlatform(entityPlatform);
            }
            MotionRouter router = new MotionRouter(table, clock, sink);

            // 2. Decoder and API over the transport
            ZoneStateDecoder decoder = new ZoneStateDecoder(new ObjectMapper(), clock, sink);
            TommyConfig cfg = config;
            TommyApi api = new TommyApi(
                    () -> endpoints.apply(cfg),
                    eventLoop,
                    decoder,
                    clock,
                    cfg.connectWait(),
                    sink);

            return new TommyZoneRuntime(cfg, registry, eventLoop, reconciler, router, table, api, clock, sink);
        }
    }
}
