package com.questrail.tommy.transport;

/**
 * Callback registered with {@link MqttTransport#subscribe(ZoneTopic, TopicHandler)}.
 *
 * <p>Always invoked on the consumer context, never on the network thread.
 * Exceptions thrown here are caught and reported by the transport.</p>
 */
@FunctionalInterface
public interface TopicHandler
{
    void onMessage(InboundMessage message);
}
