package com.questrail.tommy.transport;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

/**
 * One message received from the broker, already mapped to a known topic and
 * copied out of transport buffers.
 *
 * @param topic      topic the message arrived on
 * @param payload    raw payload bytes, exactly as published
 * @param receivedAt wall-clock receive time, for diagnostics only
 */
public record InboundMessage(ZoneTopic topic, byte[] payload, Instant receivedAt)
{
    public InboundMessage {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(receivedAt, "receivedAt");
    }

    /**
     * Payload decoded as UTF-8; malformed sequences are replaced.
     */
    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }
}
