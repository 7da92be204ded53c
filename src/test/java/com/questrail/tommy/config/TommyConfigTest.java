package com.questrail.tommy.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class TommyConfigTest {

    @Test
    void builderAppliesDefaults() {
        TommyConfig config = TommyConfig.builder().withHost("tommy.local").build();

        assertEquals("tommy.local", config.host());
        assertEquals(1886, config.mqttPort());
        assertEquals("tommy_hub", config.sessionId());
        assertEquals("tommy-tommy_hub", config.clientId());
        assertEquals(Duration.ofSeconds(60), config.keepAlive());
        assertEquals(Duration.ofSeconds(1), config.connectWait());
        assertEquals(ReconnectPolicy.defaults(), config.reconnectPolicy());
    }

    @Test
    void clientIdFollowsSessionIdUnlessSet() {
        assertEquals("tommy-entry42",
                TommyConfig.builder().withHost("h").withSessionId("entry42").build().clientId());
        assertEquals("custom",
                TommyConfig.builder().withHost("h").withClientId("custom").build().clientId());
    }

    @Test
    void builderReportsEveryProblem() {
        TommyConfigurationException e = assertThrows(TommyConfigurationException.class,
                () -> TommyConfig.builder().withMqttPort(70000).withSessionId(" ").build());

        assertEquals(3, e.problems().size(), e.problems().toString());
        assertTrue(e.problems().contains("host is required"));
        assertTrue(e.problems().contains("mqttPort must be 1-65535, was 70000"));
        assertTrue(e.problems().contains("sessionId is required"));
    }

    @Test
    void readsProperties() {
        Properties p = new Properties();
        p.setProperty("tommy.host", " 192.168.1.20 ");
        p.setProperty("tommy.mqtt-port", "1886");
        p.setProperty("tommy.session-id", "abc");
        p.setProperty("tommy.keep-alive-seconds", "30");
        p.setProperty("tommy.reconnect.min-delay-ms", "500");
        p.setProperty("tommy.reconnect.max-delay-ms", "10000");

        TommyConfig config = TommyConfig.fromProperties(p);

        assertEquals("192.168.1.20", config.host());
        assertEquals(1886, config.mqttPort());
        assertEquals("abc", config.sessionId());
        assertEquals("tommy-abc", config.clientId());
        assertEquals(Duration.ofSeconds(30), config.keepAlive());
        assertEquals(new ReconnectPolicy(Duration.ofMillis(500), Duration.ofSeconds(10)), config.reconnectPolicy());
    }

    @Test
    void missingHostAndPortAreNamed() {
        TommyConfigurationException e = assertThrows(TommyConfigurationException.class,
                () -> TommyConfig.fromProperties(new Properties()));

        assertEquals(2, e.problems().size());
        assertTrue(e.getMessage().contains("tommy.host is missing"));
        assertTrue(e.getMessage().contains("tommy.mqtt-port is missing"));
    }

    @Test
    void nonNumericValuesAreReported() {
        Properties p = new Properties();
        p.setProperty("tommy.host", "h");
        p.setProperty("tommy.mqtt-port", "mqtt");
        p.setProperty("tommy.keep-alive-seconds", "sixty");

        TommyConfigurationException e = assertThrows(TommyConfigurationException.class,
                () -> TommyConfig.fromProperties(p));

        assertTrue(e.problems().contains("tommy.mqtt-port is not an integer: mqtt"));
        assertTrue(e.problems().contains("tommy.keep-alive-seconds is not an integer: sixty"));
    }

    @Test
    void keepAliveOutsideSixteenBitRangeIsRejected() {
        TommyConfigurationException negative = assertThrows(TommyConfigurationException.class,
                () -> TommyConfig.builder().withHost("h").withKeepAlive(Duration.ofSeconds(-5)).build());
        assertEquals(List.of("keepAlive must be 0-65535 s, was -5 s"), negative.problems());

        TommyConfigurationException tooLarge = assertThrows(TommyConfigurationException.class,
                () -> TommyConfig.builder().withHost("h").withKeepAlive(Duration.ofSeconds(65536)).build());
        assertEquals(List.of("keepAlive must be 0-65535 s, was 65536 s"), tooLarge.problems());

        assertEquals(Duration.ofSeconds(65535),
                TommyConfig.builder().withHost("h").withKeepAlive(Duration.ofSeconds(65535)).build().keepAlive());
        assertEquals(Duration.ZERO,
                TommyConfig.builder().withHost("h").withKeepAlive(Duration.ZERO).build().keepAlive());
    }

    @Test
    void keepAlivePropertyOutOfRangeIsListedWithOtherProblems() {
        Properties p = new Properties();
        p.setProperty("tommy.host", "h");
        p.setProperty("tommy.mqtt-port", "mqtt");
        p.setProperty("tommy.keep-alive-seconds", "70000");

        TommyConfigurationException e = assertThrows(TommyConfigurationException.class,
                () -> TommyConfig.fromProperties(p));

        assertEquals(2, e.problems().size(), e.problems().toString());
        assertTrue(e.problems().contains("tommy.keep-alive-seconds must be 0-65535, was 70000"));
    }

    @Test
    void invalidReconnectBoundsAreReported() {
        Properties p = new Properties();
        p.setProperty("tommy.host", "h");
        p.setProperty("tommy.mqtt-port", "1886");
        p.setProperty("tommy.reconnect.min-delay-ms", "5000");
        p.setProperty("tommy.reconnect.max-delay-ms", "1000");

        TommyConfigurationException e = assertThrows(TommyConfigurationException.class,
                () -> TommyConfig.fromProperties(p));

        assertEquals(1, e.problems().size());
        assertTrue(e.problems().get(0).startsWith("reconnect policy:"));
    }
}
