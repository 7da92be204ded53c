package com.questrail.tommy.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.tommy.api.DeviceEntry;
import com.questrail.tommy.internal.decode.ZoneStateDecoder;
import com.questrail.tommy.internal.exec.ManualConsumerContext;
import com.questrail.tommy.internal.time.WallClock;
import com.questrail.tommy.internal.zone.MotionRouter;
import com.questrail.tommy.internal.zone.ZoneRecord;
import com.questrail.tommy.internal.zone.ZoneReconciler;
import com.questrail.tommy.internal.zone.ZoneTable;
import com.questrail.tommy.observability.RecordingObservabilitySink;
import com.questrail.tommy.observability.ZoneDecodeEvent;
import com.questrail.tommy.observability.ZoneTransportEvent;
import com.questrail.tommy.registry.InMemoryZoneRegistry;
import com.questrail.tommy.registry.RecordingEntityPlatform;
import com.questrail.tommy.transport.FakeBrokerEndpoint;
import com.questrail.tommy.transport.TransportConnectException;
import com.questrail.tommy.transport.ZoneTopic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TommyApiTest
 * -----------------------------------------------------------------------------
 * End-to-end over the fake endpoint: payload in, zone table and registry
 * effects out, on a manually drained consumer context.
 */
class TommyApiTest {

    private static final WallClock CLOCK = () -> Instant.EPOCH;

    private FakeBrokerEndpoint endpoint;
    private ManualConsumerContext consumer;
    private RecordingObservabilitySink sink;
    private InMemoryZoneRegistry registry;
    private RecordingEntityPlatform platform;
    private ZoneTable table;
    private ZoneReconciler reconciler;
    private MotionRouter router;
    private TommyApi api;

    @BeforeEach
    void setUp() {
        endpoint = new FakeBrokerEndpoint();
        consumer = new ManualConsumerContext();
        sink = new RecordingObservabilitySink();
        registry = new InMemoryZoneRegistry();
        platform = new RecordingEntityPlatform(registry);
        table = new ZoneTable();
        reconciler = new ZoneReconciler("entry1", registry, table, CLOCK, sink);
        reconciler.attachEntityPlatform(platform);
        router = new MotionRouter(table, CLOCK, sink);

        api = new TommyApi(
                () -> endpoint,
                consumer,
                new ZoneStateDecoder(new ObjectMapper(), CLOCK, sink),
                CLOCK,
                Duration.ofMillis(50),
                sink);
    }

    @Test
    void hallwayRenamedThenRemoved() {
        api.start(reconciler::update, router::update);
        assertTrue(api.connected());

        publish(ZoneTopic.ZONE_CONFIG, "z1", "clear", "[{\"id\":\"z1\",\"name\":\"Hallway\"}]");
        assertEquals(1, table.size());
        // The "clear" of the first message is the first stored value.
        assertEquals(Optional.of(false), record("z1").sensor().currentState());

        publish(ZoneTopic.ZONE_STATE, "z1", "detected", "[{\"id\":\"z1\",\"name\":\"Hallway\"}]");
        assertEquals(Optional.of(true), record("z1").sensor().currentState());
        assertEquals(List.of("z1=false", "z1=true"), platform.stateWrites());

        publish(ZoneTopic.ZONE_STATE, "z1", "detected", "[{\"id\":\"z1\",\"name\":\"Hall\"}]");
        assertEquals("Hall", record("z1").info().name());
        assertEquals(Optional.of(true), record("z1").sensor().currentState());
        assertEquals("TOMMY (Hall)", registry.lookupDevice("entry1_z1").map(DeviceEntry::name).orElseThrow());
        // Rename re-publishes; the repeated "detected" does not.
        assertEquals(List.of("z1=false", "z1=true", "z1=true"), platform.stateWrites());

        String entityId = registry.lookupEntityByUniqueId("entry1_zone_z1_motion").orElseThrow().entityId();
        String deviceId = registry.lookupDevice("entry1_z1").orElseThrow().deviceId();
        registry.clearOperations();

        publish(ZoneTopic.ZONE_STATE, "z1", "clear", "[]");
        assertEquals(0, table.size());
        assertEquals(List.of("removeEntity:" + entityId, "removeDevice:" + deviceId), registry.operations());
        assertEquals(List.of("z1=false", "z1=true", "z1=true"), platform.stateWrites());
    }

    @Test
    void motionForBrandNewZoneResolvesInSameMessage() {
        api.start(reconciler::update, router::update);

        publish(ZoneTopic.ZONE_STATE, "7", "holding", "[{\"id\":\"7\",\"name\":\"Garage\"}]");

        assertEquals(Optional.of(true), record("7").sensor().currentState());
    }

    @Test
    void malformedMessageDoesNotAffectLaterOnes() {
        api.start(reconciler::update, router::update);

        endpoint.publish(ZoneTopic.ZONE_STATE, "{\"foo\": 1}");
        consumer.drain();
        publish(ZoneTopic.ZONE_STATE, "1", "detected", "[{\"id\":\"1\",\"name\":\"A\"}]");

        assertEquals(ZoneDecodeEvent.Kind.UNEXPECTED_FORMAT, sink.decodeEvents().get(0).kind());
        assertEquals(Optional.of(true), record("1").sensor().currentState());
    }

    @Test
    void rosterIsAppliedBeforeMotionAndFailuresAreIsolated() {
        List<String> calls = new ArrayList<>();
        api.start(
                roster -> {
                    calls.add("roster:" + roster.size());
                    throw new IllegalStateException("roster listener broke");
                },
                (zoneId, motion) -> calls.add("motion:" + zoneId + "=" + motion));

        publish(ZoneTopic.ZONE_CONFIG, "1", "lingering", "[{\"id\":\"1\",\"name\":\"A\"}]");

        assertEquals(List.of("roster:1", "motion:1=false"), calls);
        assertEquals(1, sink.errors().size());
        assertEquals(ZoneDecodeEvent.Kind.UNKNOWN_MOTION_STATE, sink.decodeEvents().get(0).kind());
    }

    @Test
    void stopDisconnectsAndIsIdempotent() {
        api.start(reconciler::update, router::update);

        api.stop();
        api.stop();

        assertTrue(endpoint.isStopped());
        assertFalse(api.connected());
    }

    @Test
    void secondStartIsIgnored() {
        api.start(reconciler::update, router::update);
        api.start(reconciler::update, router::update);

        assertEquals(1, endpoint.startCount());
        ZoneTransportEvent warning = sink.eventsOfType(ZoneTransportEvent.class).get(0);
        assertEquals(ZoneTransportEvent.Kind.ALREADY_STARTED, warning.kind());
        assertEquals("TOMMY API already started", warning.detail());
    }

    @Test
    void unresolvableHostLeavesNothingRunning() {
        endpoint.failOnStart(new TransportConnectException("Cannot resolve MQTT broker host nowhere"));

        assertThrows(TransportConnectException.class, () -> api.start(reconciler::update, router::update));

        assertTrue(endpoint.isStopped());
        assertFalse(api.connected());
    }

    @Test
    void connectedFalseBeforeStart() {
        assertFalse(api.connected());
    }

    private void publish(ZoneTopic topic, String zoneId, String motion, String zonesJson) {
        endpoint.publish(topic, "{\"zoneId\":\"" + zoneId + "\",\"motion\":\"" + motion + "\",\"zones\":" + zonesJson + "}");
        consumer.drain();
    }

    private ZoneRecord record(String zoneId) {
        return table.get(zoneId).orElseThrow();
    }
}
