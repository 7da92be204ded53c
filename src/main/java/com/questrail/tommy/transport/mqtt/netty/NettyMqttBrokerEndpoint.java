package com.questrail.tommy.transport.mqtt.netty;

import com.questrail.tommy.config.ReconnectPolicy;
import com.questrail.tommy.internal.time.WallClock;
import com.questrail.tommy.observability.NullObservabilitySink;
import com.questrail.tommy.observability.ZoneErrorEvent;
import com.questrail.tommy.observability.ZoneObservabilitySink;
import com.questrail.tommy.observability.ZoneTransportEvent;
import com.questrail.tommy.transport.BrokerEndpoint;
import com.questrail.tommy.transport.BrokerEndpointListener;
import com.questrail.tommy.transport.TransportConnectException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.mqtt.MqttConnAckMessage;
import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.netty.handler.codec.mqtt.MqttDecoder;
import io.netty.handler.codec.mqtt.MqttEncoder;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageBuilders;
import io.netty.handler.codec.mqtt.MqttMessageIdVariableHeader;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPubAckMessage;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttSubAckMessage;
import io.netty.handler.codec.mqtt.MqttSubscribeMessage;
import io.netty.handler.codec.mqtt.MqttSubscribePayload;
import io.netty.handler.codec.mqtt.MqttTopicSubscription;
import io.netty.handler.codec.mqtt.MqttVersion;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.ScheduledFuture;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyMqttBrokerEndpoint
 * =============================================================================
 * Netty-backed MQTT 3.1.1 client implementing the {@link BrokerEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It owns the socket,
 * the MQTT session handshake, keep-alive pings, subscription, and reconnect
 * backoff.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Parse payloads</li>
 *   <li>Know about zones, rosters, or motion</li>
 *   <li>Invoke application handlers directly</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound payloads are copied into
 * {@code byte[]}; reference-counted buffers are released internally.
 *
 * <h2>Threading</h2>
 * A dedicated single-thread {@link NioEventLoopGroup} is the network thread.
 * All listener callbacks, reconnect scheduling, and session bookkeeping run
 * on it.
 *
 * <h2>Session</h2>
 * <pre>
 *   TCP connect → CONNECT(clean session) → CONNACK accepted
 *        → listener.onConnected() → SUBSCRIBE(all topics, QoS 0)
 *   channel inactive / connect failure / nothing read for 1.5 × keep-alive
 *        → listener.onDisconnected(cause) → reconnect after backoff
 * </pre>
 * PINGREQ goes out after one keep-alive interval without writes. The broker
 * answers with PINGRESP, so a silent inbound side means the session is dead
 * even if the socket is still open.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} resolves the broker address and begins connecting.
 * - {@link #stop()} sends DISCONNECT, closes the channel, and shuts down the
 *   event loop group, waiting for its thread to finish.
 */
public final class NettyMqttBrokerEndpoint implements BrokerEndpoint
{
    private static final int MAX_MESSAGE_BYTES = 256 * 1024;
    private static final long CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final String host;
    private final int port;
    private final String clientId;
    private final Duration keepAlive;
    private final ReconnectPolicy reconnectPolicy;
    private final List<String> topics;
    private final WallClock clock;
    private final ZoneObservabilitySink observabilitySink;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile BrokerEndpointListener listener;
    private volatile Channel channel;
    private volatile InetSocketAddress remote;
    private volatile ScheduledFuture<?> pendingReconnect;

    // Event-loop confined.
    private int failedAttempts;
    private int nextPacketId = 1;
    private Throwable lastFailure;

    public NettyMqttBrokerEndpoint(String host,
                                   int port,
                                   String clientId,
                                   Duration keepAlive,
                                   ReconnectPolicy reconnectPolicy,
                                   List<String> topics,
                                   WallClock clock,
                                   ZoneObservabilitySink observabilitySink)
    {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.keepAlive = Objects.requireNonNull(keepAlive, "keepAlive");
        this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        this.topics = List.copyOf(topics);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        if (this.topics.isEmpty()) {
            throw new IllegalArgumentException("At least one topic required");
        }

        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("tommy-mqtt", true));
        this.bootstrap = new Bootstrap();

        int keepAliveSeconds = (int) keepAlive.toSeconds();
        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) CONNECT_TIMEOUT_MILLIS)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (keepAliveSeconds > 0) {
                            long writerIdleMillis = keepAliveSeconds * 1000L;
                            p.addLast("idle", new IdleStateHandler(
                                    writerIdleMillis * 3 / 2, writerIdleMillis, 0, TimeUnit.MILLISECONDS));
                        }
                        p.addLast("decoder", new MqttDecoder(MAX_MESSAGE_BYTES));
                        p.addLast("encoder", MqttEncoder.INSTANCE);
                        p.addLast("session", new SessionHandler(keepAliveSeconds));
                    }
                });
    }

    @Override
    public void setListener(BrokerEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        requireListener();
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Endpoint already started");
        }

        InetSocketAddress address = new InetSocketAddress(host, port);
        if (address.isUnresolved()) {
            stopped.set(true);
            group.shutdownGracefully(0, 0, TimeUnit.SECONDS);
            throw new TransportConnectException("Cannot resolve MQTT broker host " + host);
        }
        remote = address;

        emit(ZoneTransportEvent.Kind.CONNECTING, "Connecting to TOMMY MQTT broker at " + host + ":" + port);
        group.execute(this::connectNow);
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        ScheduledFuture<?> reconnect = pendingReconnect;
        if (reconnect != null) {
            reconnect.cancel(false);
        }

        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(fixedHeaderOnly(MqttMessageType.DISCONNECT))
                    .addListener(ChannelFutureListener.CLOSE);
            ch.closeFuture().awaitUninterruptibly(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        }

        // Shut down the event loop group and wait for the network thread.
        group.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .awaitUninterruptibly(SHUTDOWN_TIMEOUT_SECONDS * 2, TimeUnit.SECONDS);

        emit(ZoneTransportEvent.Kind.STOPPED, "MQTT connection stopped");
    }

    private BrokerEndpointListener requireListener()
    {
        BrokerEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("BrokerEndpointListener must be set before start()");
        }
        return l;
    }

    // Event loop only.
    private void connectNow()
    {
        pendingReconnect = null;
        if (stopped.get()) {
            return;
        }

        bootstrap.connect(remote).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
                // CONNECT is written from channelActive.
                return;
            }
            if (stopped.get()) {
                return;
            }
            observabilitySink.onTransportEvent(new ZoneTransportEvent(
                    clock.now(),
                    ZoneTransportEvent.Kind.CONNECT_FAILED,
                    "Connection to " + host + ":" + port + " failed",
                    future.cause()));
            requireListener().onDisconnected(future.cause());
            scheduleReconnect();
        });
    }

    // Event loop only.
    private void scheduleReconnect()
    {
        if (stopped.get() || group.isShuttingDown()) {
            return;
        }

        Duration delay = reconnectPolicy.delayForAttempt(failedAttempts);
        failedAttempts = Math.min(failedAttempts + 1, 30);

        emit(ZoneTransportEvent.Kind.RECONNECT_SCHEDULED, "Reconnecting in " + delay.toMillis() + " ms");
        pendingReconnect = group.schedule(this::connectNow, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private int nextPacketId()
    {
        int id = nextPacketId;
        nextPacketId = id == 0xFFFF ? 1 : id + 1;
        return id;
    }

    private void emit(ZoneTransportEvent.Kind kind, String detail)
    {
        observabilitySink.onTransportEvent(ZoneTransportEvent.of(clock.now(), kind, detail));
    }

    private static MqttMessage fixedHeaderOnly(MqttMessageType type)
    {
        return new MqttMessage(new MqttFixedHeader(type, false, MqttQoS.AT_MOST_ONCE, false, 0));
    }

    /**
     * SessionHandler
     * -------------------------------------------------------------------------
     * Drives the MQTT session on one channel and forwards publishes, as raw
     * bytes, to the port listener.
     */
    private final class SessionHandler extends SimpleChannelInboundHandler<MqttMessage>
    {
        private final int keepAliveSeconds;

        private SessionHandler(int keepAliveSeconds)
        {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            ctx.writeAndFlush(MqttMessageBuilders.connect()
                    .clientId(clientId)
                    .protocolVersion(MqttVersion.MQTT_3_1_1)
                    .cleanSession(true)
                    .keepAlive(keepAliveSeconds)
                    .build());
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, MqttMessage msg)
        {
            if (msg.decoderResult().isFailure()) {
                observabilitySink.onError(new ZoneErrorEvent(
                        clock.now(), "Malformed MQTT packet from broker", msg.decoderResult().cause()));
                ctx.close();
                return;
            }

            switch (msg.fixedHeader().messageType()) {
                case CONNACK -> onConnAck(ctx, (MqttConnAckMessage) msg);
                case SUBACK -> onSubAck((MqttSubAckMessage) msg);
                case PUBLISH -> onPublish(ctx, (MqttPublishMessage) msg);
                default -> {
                    // PINGRESP and anything else carry no information for us.
                }
            }
        }

        private void onConnAck(ChannelHandlerContext ctx, MqttConnAckMessage msg)
        {
            MqttConnectReturnCode code = msg.variableHeader().connectReturnCode();
            if (code != MqttConnectReturnCode.CONNECTION_ACCEPTED) {
                observabilitySink.onTransportEvent(ZoneTransportEvent.of(
                        clock.now(),
                        ZoneTransportEvent.Kind.CONNECTION_REFUSED,
                        "MQTT connection failed with code " + code));
                ctx.close();
                return;
            }

            failedAttempts = 0;
            emit(ZoneTransportEvent.Kind.CONNECTED, "MQTT connected to " + host + ":" + port);
            requireListener().onConnected();

            List<MqttTopicSubscription> subscriptions = new ArrayList<>(topics.size());
            for (String topic : topics) {
                subscriptions.add(new MqttTopicSubscription(topic, MqttQoS.AT_MOST_ONCE));
            }
            ctx.writeAndFlush(new MqttSubscribeMessage(
                    new MqttFixedHeader(MqttMessageType.SUBSCRIBE, false, MqttQoS.AT_LEAST_ONCE, false, 0),
                    MqttMessageIdVariableHeader.from(nextPacketId()),
                    new MqttSubscribePayload(subscriptions)));
        }

        private void onSubAck(MqttSubAckMessage msg)
        {
            // Granted levels come back in SUBSCRIBE order.
            List<Integer> granted = msg.payload().grantedQoSLevels();
            List<String> rejected = new ArrayList<>();
            for (int i = 0; i < topics.size(); i++) {
                if (i >= granted.size() || granted.get(i) == MqttQoS.FAILURE.value()) {
                    rejected.add(topics.get(i));
                }
            }

            if (rejected.isEmpty()) {
                emit(ZoneTransportEvent.Kind.SUBSCRIBED, "Subscribed to " + String.join(", ", topics));
            } else {
                emit(ZoneTransportEvent.Kind.SUBSCRIBE_REJECTED,
                        "Broker rejected subscription to " + String.join(", ", rejected));
            }
        }

        private void onPublish(ChannelHandlerContext ctx, MqttPublishMessage msg)
        {
            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = msg.payload();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            if (msg.fixedHeader().qosLevel() == MqttQoS.AT_LEAST_ONCE) {
                ctx.writeAndFlush(new MqttPubAckMessage(
                        new MqttFixedHeader(MqttMessageType.PUBACK, false, MqttQoS.AT_MOST_ONCE, false, 0),
                        MqttMessageIdVariableHeader.from(msg.variableHeader().packetId())));
            }

            requireListener().onMessage(msg.variableHeader().topicName(), bytes);
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt instanceof IdleStateEvent idle) {
                if (idle.state() == IdleState.WRITER_IDLE) {
                    ctx.writeAndFlush(fixedHeaderOnly(MqttMessageType.PINGREQ));
                } else if (idle.state() == IdleState.READER_IDLE) {
                    lastFailure = new IOException(
                            "No traffic from broker within " + (keepAliveSeconds * 1500L) + " ms");
                    ctx.close();
                }
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            channel = null;
            Throwable cause = lastFailure;
            lastFailure = null;

            if (!stopped.get()) {
                observabilitySink.onTransportEvent(new ZoneTransportEvent(
                        clock.now(),
                        ZoneTransportEvent.Kind.DISCONNECTED,
                        "Connection to " + host + ":" + port + " lost",
                        cause));
            }
            requireListener().onDisconnected(cause);
            scheduleReconnect();
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            lastFailure = cause;
            ctx.close();
        }
    }
}
