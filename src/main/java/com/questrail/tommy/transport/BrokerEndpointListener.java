package com.questrail.tommy.transport;

/**
 * BrokerEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link BrokerEndpoint}.
 *
 * <p>Callbacks are delivered serialized, on the endpoint's network thread.
 * Implementations must not block and must not run application logic inline.</p>
 */
public interface BrokerEndpointListener
{
    /**
     * Called when a broker session is established (connection accepted).
     */
    void onConnected();

    /**
     * Called when an established or pending connection is lost.
     *
     * @param cause diagnostic cause; may be {@code null} for orderly shutdown
     */
    void onDisconnected(Throwable cause);

    /**
     * Called for each message published on a subscribed topic.
     *
     * <p>The payload is a private copy; no transport buffers escape.</p>
     *
     * @param topic   topic name as received
     * @param payload raw payload
     */
    void onMessage(String topic, byte[] payload);
}
