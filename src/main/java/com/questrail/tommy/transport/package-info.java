/**
 * TOMMY Transport Ports
 * =============================================================================
 *
 * The boundary between a concrete broker client (Netty MQTT, a test double)
 * and the zone engine.
 *
 * <p>Everything above {@link com.questrail.tommy.transport.MqttTransport} sees
 * only:</p>
 * <ul>
 *   <li>Topic-typed messages ({@link com.questrail.tommy.transport.ZoneTopic})
 *       with raw {@code byte[]} payloads</li>
 *   <li>Connectivity as reported by the endpoint callbacks</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Endpoint implementations MUST:
 * <ul>
 *   <li>Perform broker I/O, keep-alive, reconnect, and re-subscription only</li>
 *   <li>Not parse payloads</li>
 *   <li>Not invoke topic handlers; delivery goes through the consumer context</li>
 * </ul>
 */
package com.questrail.tommy.transport;
