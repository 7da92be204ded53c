package com.questrail.tommy.transport;

/**
 * BrokerEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a publish/subscribe broker connection.
 *
 * <p>The endpoint owns the socket, the network thread, reconnect backoff, and
 * re-subscription after every (re)connect. Higher layers are responsible for:</p>
 * <ul>
 *   <li>handing inbound messages off to the consumer context</li>
 *   <li>decoding payloads</li>
 *   <li>dispatching to topic handlers</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, another MQTT client, or a test
 * harness. An endpoint is single-use: once stopped it cannot be restarted.</p>
 */
public interface BrokerEndpoint
{
    /**
     * Begin connecting and keep the connection alive until {@link #stop()}.
     *
     * <p>Returns immediately; the outcome is reported through the listener.</p>
     *
     * @throws TransportConnectException if the connection cannot be attempted at all
     */
    void start();

    /**
     * Close the connection and stop the network thread.
     *
     * <p>When this method returns, the listener receives no further callbacks.
     * Idempotent.</p>
     */
    void stop();

    /**
     * Register the listener that receives inbound messages and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(BrokerEndpointListener listener);
}
