package com.questrail.tommy.internal.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.tommy.api.ZoneInfo;
import com.questrail.tommy.internal.time.WallClock;
import com.questrail.tommy.observability.NullObservabilitySink;
import com.questrail.tommy.observability.ZoneDecodeEvent;
import com.questrail.tommy.observability.ZoneObservabilitySink;
import com.questrail.tommy.transport.InboundMessage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ZoneStateDecoder
 * ============================================================================
 * Converts a raw inbound payload into a validated {@link ZoneStateMessage}.
 *
 * <h2>Architectural Role</h2>
 * This class is the boundary between wire bytes and engine semantics. The
 * reconciler and router operate only on {@link ZoneStateMessage} and never
 * see JSON.
 *
 * <h2>Accepted shape</h2>
 * <pre>
 *   { "zoneId": string,
 *     "motion": string,
 *     "zones":  [ { "id": string, "name": string }, ... ] }
 * </pre>
 * Extra fields are ignored.
 *
 * <h2>Failure handling</h2>
 * <ul>
 *   <li>Not JSON: {@link ZoneDecodeEvent.Kind#NON_JSON}, dropped.</li>
 *   <li>JSON of any other shape: {@link ZoneDecodeEvent.Kind#UNEXPECTED_FORMAT},
 *       dropped. No partial {@link ZoneInfo} is ever built.</li>
 *   <li>Unrecognized motion literal: {@link ZoneDecodeEvent.Kind#UNKNOWN_MOTION_STATE},
 *       message kept with {@link MotionState#UNKNOWN}.</li>
 * </ul>
 *
 * <p>Runs on the consumer context only. The decoder holds no state between
 * messages.</p>
 */
public final class ZoneStateDecoder
{
    private final ObjectMapper mapper;
    private final WallClock clock;
    private final ZoneObservabilitySink observabilitySink;

    public ZoneStateDecoder(ObjectMapper mapper, WallClock clock, ZoneObservabilitySink observabilitySink) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Decodes one inbound message.
     *
     * @return the decoded message, or empty if it was dropped
     */
    public Optional<ZoneStateMessage> decode(InboundMessage message) {
        Objects.requireNonNull(message, "message");
        String topic = message.topic().topicName();

        JsonNode root;
        try {
            root = mapper.readTree(message.payload());
        } catch (IOException e) {
            report(topic, ZoneDecodeEvent.Kind.NON_JSON, message.payloadAsString());
            return Optional.empty();
        }

        try {
            return Optional.of(toMessage(topic, root));
        } catch (ZoneDecodeException e) {
            report(topic, ZoneDecodeEvent.Kind.UNEXPECTED_FORMAT, e.getMessage() + ": " + message.payloadAsString());
            return Optional.empty();
        }
    }

    private ZoneStateMessage toMessage(String topic, JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ZoneDecodeException("not a JSON object");
        }

        String zoneId = requireText(root, "zoneId");
        if (!root.has("motion")) {
            throw new ZoneDecodeException("missing motion");
        }
        JsonNode zonesNode = root.get("zones");
        if (zonesNode == null || !zonesNode.isArray()) {
            throw new ZoneDecodeException("zones is not an array");
        }

        List<ZoneInfo> zones = new ArrayList<>(zonesNode.size());
        for (JsonNode zone : zonesNode) {
            if (!zone.isObject()) {
                throw new ZoneDecodeException("zone entry is not an object");
            }
            zones.add(new ZoneInfo(requireText(zone, "id"), requireText(zone, "name")));
        }

        JsonNode motionNode = root.get("motion");
        String literal = motionNode.isTextual() ? motionNode.asText() : null;
        MotionState motion = MotionState.fromLiteral(literal);
        if (motion == MotionState.UNKNOWN) {
            report(topic, ZoneDecodeEvent.Kind.UNKNOWN_MOTION_STATE,
                    "'" + (literal != null ? literal : motionNode.toString()) + "' for zone " + zoneId);
        }

        return new ZoneStateMessage(zoneId, motion, zones);
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new ZoneDecodeException("missing or non-text " + field);
        }
        return value.asText();
    }

    private void report(String topic, ZoneDecodeEvent.Kind kind, String detail) {
        observabilitySink.onDecodeEvent(new ZoneDecodeEvent(clock.now(), topic, kind, detail));
    }
}
