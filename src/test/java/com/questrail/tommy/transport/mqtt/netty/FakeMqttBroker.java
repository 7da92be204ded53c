package com.questrail.tommy.transport.mqtt.netty;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.mqtt.MqttConnAckMessage;
import io.netty.handler.codec.mqtt.MqttConnAckVariableHeader;
import io.netty.handler.codec.mqtt.MqttConnectMessage;
import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.netty.handler.codec.mqtt.MqttDecoder;
import io.netty.handler.codec.mqtt.MqttEncoder;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageIdVariableHeader;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPubAckMessage;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.codec.mqtt.MqttPublishVariableHeader;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttSubAckMessage;
import io.netty.handler.codec.mqtt.MqttSubAckPayload;
import io.netty.handler.codec.mqtt.MqttSubscribeMessage;
import io.netty.handler.codec.mqtt.MqttTopicSubscription;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * FakeMqttBroker
 * -----------------------------------------------------------------------------
 * Minimal in-process MQTT 3.1.1 broker on an ephemeral loopback port.
 *
 * <p>It accepts (or refuses) CONNECT, acknowledges SUBSCRIBE, answers PINGREQ,
 * records what clients send (optionally ignoring pings or rejecting topics), and lets tests publish to every connected
 * client or drop them.</p>
 */
final class FakeMqttBroker implements AutoCloseable {

    private final EventLoopGroup group = new NioEventLoopGroup(1);
    private final ChannelGroup clients = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final Channel serverChannel;

    private final AtomicInteger refuseRemaining = new AtomicInteger();
    private final AtomicBoolean silent = new AtomicBoolean();
    private final Set<String> rejectedTopics = ConcurrentHashMap.newKeySet();

    private final List<String> clientIds = new ArrayList<>();
    private final List<List<String>> subscriptions = new ArrayList<>();
    private final List<Integer> pubAcks = new ArrayList<>();
    private int disconnects;
    private int refused;

    FakeMqttBroker() throws InterruptedException {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new MqttDecoder());
                        ch.pipeline().addLast(MqttEncoder.INSTANCE);
                        ch.pipeline().addLast(new BrokerHandler());
                    }
                });
        serverChannel = bootstrap.bind(new InetSocketAddress("127.0.0.1", 0)).sync().channel();
    }

    int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    /**
     * Refuses the next {@code count} CONNECT packets with "not authorized".
     */
    void refuseNext(int count) {
        refuseRemaining.set(count);
    }

    /**
     * Stops answering PINGREQ while keeping the socket open, like a hung broker.
     */
    void ignorePings(boolean ignore) {
        silent.set(ignore);
    }

    /**
     * Answers subscriptions to {@code topic} with the SUBACK failure code.
     */
    void rejectTopic(String topic) {
        rejectedTopics.add(topic);
    }

    void publish(String topic, String payload, MqttQoS qos, int packetId) {
        MqttPublishMessage message = new MqttPublishMessage(
                new MqttFixedHeader(MqttMessageType.PUBLISH, false, qos, false, 0),
                new MqttPublishVariableHeader(topic, qos == MqttQoS.AT_MOST_ONCE ? 0 : packetId),
                Unpooled.copiedBuffer(payload, StandardCharsets.UTF_8));
        clients.writeAndFlush(message);
    }

    void dropClients() {
        clients.close().awaitUninterruptibly(2, TimeUnit.SECONDS);
    }

    synchronized List<String> clientIds() {
        return List.copyOf(clientIds);
    }

    synchronized List<List<String>> subscriptions() {
        return List.copyOf(subscriptions);
    }

    synchronized List<Integer> pubAcks() {
        return List.copyOf(pubAcks);
    }

    synchronized int disconnects() {
        return disconnects;
    }

    synchronized int refused() {
        return refused;
    }

    @Override
    public void close() {
        clients.close().awaitUninterruptibly(2, TimeUnit.SECONDS);
        serverChannel.close().awaitUninterruptibly(2, TimeUnit.SECONDS);
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly(5, TimeUnit.SECONDS);
    }

    private static MqttFixedHeader header(MqttMessageType type) {
        return new MqttFixedHeader(type, false, MqttQoS.AT_MOST_ONCE, false, 0);
    }

    private final class BrokerHandler extends SimpleChannelInboundHandler<MqttMessage> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, MqttMessage msg) {
            switch (msg.fixedHeader().messageType()) {
                case CONNECT -> onConnect(ctx, (MqttConnectMessage) msg);
                case SUBSCRIBE -> onSubscribe(ctx, (MqttSubscribeMessage) msg);
                case PUBACK -> {
                    synchronized (FakeMqttBroker.this) {
                        pubAcks.add(((MqttPubAckMessage) msg).variableHeader().messageId());
                    }
                }
                case PINGREQ -> {
                    if (!silent.get()) {
                        ctx.writeAndFlush(new MqttMessage(header(MqttMessageType.PINGRESP)));
                    }
                }
                case DISCONNECT -> {
                    synchronized (FakeMqttBroker.this) {
                        disconnects++;
                    }
                    ctx.close();
                }
                default -> {
                }
            }
        }

        private void onConnect(ChannelHandlerContext ctx, MqttConnectMessage msg) {
            boolean refuse = refuseRemaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0;
            synchronized (FakeMqttBroker.this) {
                clientIds.add(msg.payload().clientIdentifier());
                if (refuse) {
                    refused++;
                }
            }
            MqttConnectReturnCode code = refuse
                    ? MqttConnectReturnCode.CONNECTION_REFUSED_NOT_AUTHORIZED
                    : MqttConnectReturnCode.CONNECTION_ACCEPTED;
            if (!refuse) {
                clients.add(ctx.channel());
            }
            ctx.writeAndFlush(new MqttConnAckMessage(
                    header(MqttMessageType.CONNACK),
                    new MqttConnAckVariableHeader(code, false)));
        }

        private void onSubscribe(ChannelHandlerContext ctx, MqttSubscribeMessage msg) {
            List<String> topics = new ArrayList<>();
            int[] granted = new int[msg.payload().topicSubscriptions().size()];
            int i = 0;
            for (MqttTopicSubscription s : msg.payload().topicSubscriptions()) {
                topics.add(s.topicName());
                granted[i++] = rejectedTopics.contains(s.topicName())
                        ? MqttQoS.FAILURE.value()
                        : s.qualityOfService().value();
            }
            synchronized (FakeMqttBroker.this) {
                subscriptions.add(topics);
            }
            ctx.writeAndFlush(new MqttSubAckMessage(
                    header(MqttMessageType.SUBACK),
                    MqttMessageIdVariableHeader.from(msg.variableHeader().messageId()),
                    new MqttSubAckPayload(granted)));
        }
    }
}
