package com.questrail.tommy.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Aggregated configuration for one TOMMY hub session.
 *
 * <p>{@code host} and {@code mqttPort} are required; every other value has a
 * default. Validation collects all problems and reports them together in a
 * single {@link TommyConfigurationException}.</p>
 *
 * @param host            broker host name or address
 * @param mqttPort        broker port
 * @param sessionId       id of this hub session; prefixes every derived identifier
 * @param clientId        MQTT client id
 * @param keepAlive       MQTT keep-alive interval
 * @param connectWait     how long {@code connect()} waits for the first attempt
 * @param reconnectPolicy backoff between reconnect attempts
 */
public record TommyConfig(
    String host,
    int mqttPort,
    String sessionId,
    String clientId,
    Duration keepAlive,
    Duration connectWait,
    ReconnectPolicy reconnectPolicy
) {
    public static final int DEFAULT_MQTT_PORT = 1886;
    public static final String DEFAULT_SESSION_ID = "tommy_hub";

    /** Upper bound of the 16-bit CONNECT keep-alive field. */
    public static final long MAX_KEEP_ALIVE_SECONDS = 65535;

    public static final String KEY_HOST = "tommy.host";
    public static final String KEY_MQTT_PORT = "tommy.mqtt-port";
    public static final String KEY_SESSION_ID = "tommy.session-id";
    public static final String KEY_CLIENT_ID = "tommy.client-id";
    public static final String KEY_KEEP_ALIVE_SECONDS = "tommy.keep-alive-seconds";
    public static final String KEY_RECONNECT_MIN_DELAY_MS = "tommy.reconnect.min-delay-ms";
    public static final String KEY_RECONNECT_MAX_DELAY_MS = "tommy.reconnect.max-delay-ms";

    public TommyConfig {
        List<String> problems = new ArrayList<>();
        if (host == null || host.isBlank()) {
            problems.add("host is required");
        }
        if (mqttPort < 1 || mqttPort > 65535) {
            problems.add("mqttPort must be 1-65535, was " + mqttPort);
        }
        if (sessionId == null || sessionId.isBlank()) {
            problems.add("sessionId is required");
        }
        if (clientId == null || clientId.isBlank()) {
            problems.add("clientId is required");
        }
        if (keepAlive != null && (keepAlive.isNegative() || keepAlive.toSeconds() > MAX_KEEP_ALIVE_SECONDS)) {
            problems.add("keepAlive must be 0-" + MAX_KEEP_ALIVE_SECONDS + " s, was " + keepAlive.toSeconds() + " s");
        }
        if (!problems.isEmpty()) {
            throw new TommyConfigurationException(problems);
        }

        Objects.requireNonNull(keepAlive, "keepAlive");
        Objects.requireNonNull(connectWait, "connectWait");
        Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
    }

    /**
     * Reads a configuration from flat properties.
     *
     * <p>Missing {@value #KEY_HOST} or {@value #KEY_MQTT_PORT} is a setup
     * failure; the exception names every missing key.</p>
     */
    public static TommyConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");

        List<String> problems = new ArrayList<>();
        Builder builder = builder();

        String host = trimmed(properties.getProperty(KEY_HOST));
        String port = trimmed(properties.getProperty(KEY_MQTT_PORT));

        if (host == null) {
            problems.add(KEY_HOST + " is missing");
        } else {
            builder.withHost(host);
        }

        if (port == null) {
            problems.add(KEY_MQTT_PORT + " is missing");
        } else {
            Integer parsed = parseInt(KEY_MQTT_PORT, port, problems);
            if (parsed != null) {
                builder.withMqttPort(parsed);
            }
        }

        String sessionId = trimmed(properties.getProperty(KEY_SESSION_ID));
        if (sessionId != null) {
            builder.withSessionId(sessionId);
        }
        String clientId = trimmed(properties.getProperty(KEY_CLIENT_ID));
        if (clientId != null) {
            builder.withClientId(clientId);
        }

        String keepAlive = trimmed(properties.getProperty(KEY_KEEP_ALIVE_SECONDS));
        if (keepAlive != null) {
            Integer seconds = parseInt(KEY_KEEP_ALIVE_SECONDS, keepAlive, problems);
            if (seconds != null && (seconds < 0 || seconds > MAX_KEEP_ALIVE_SECONDS)) {
                problems.add(KEY_KEEP_ALIVE_SECONDS + " must be 0-" + MAX_KEEP_ALIVE_SECONDS + ", was " + seconds);
            } else if (seconds != null) {
                builder.withKeepAlive(Duration.ofSeconds(seconds));
            }
        }

        ReconnectPolicy defaults = ReconnectPolicy.defaults();
        String minDelay = trimmed(properties.getProperty(KEY_RECONNECT_MIN_DELAY_MS));
        String maxDelay = trimmed(properties.getProperty(KEY_RECONNECT_MAX_DELAY_MS));
        if (minDelay != null || maxDelay != null) {
            Integer min = minDelay == null ? null : parseInt(KEY_RECONNECT_MIN_DELAY_MS, minDelay, problems);
            Integer max = maxDelay == null ? null : parseInt(KEY_RECONNECT_MAX_DELAY_MS, maxDelay, problems);
            try {
                builder.withReconnectPolicy(new ReconnectPolicy(
                        min == null ? defaults.minDelay() : Duration.ofMillis(min),
                        max == null ? defaults.maxDelay() : Duration.ofMillis(max)));
            } catch (IllegalArgumentException e) {
                problems.add("reconnect policy: " + e.getMessage());
            }
        }

        if (!problems.isEmpty()) {
            throw new TommyConfigurationException(problems);
        }
        return builder.build();
    }

    private static String trimmed(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static Integer parseInt(String key, String value, List<String> problems) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            problems.add(key + " is not an integer: " + value);
            return null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host;
        private int mqttPort = DEFAULT_MQTT_PORT;
        private String sessionId = DEFAULT_SESSION_ID;
        private String clientId;
        private Duration keepAlive = Duration.ofSeconds(60);
        private Duration connectWait = Duration.ofSeconds(1);
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.defaults();

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withMqttPort(int mqttPort) {
            this.mqttPort = mqttPort;
            return this;
        }

        public Builder withSessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder withClientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder withKeepAlive(Duration keepAlive) {
            this.keepAlive = keepAlive;
            return this;
        }

        public Builder withConnectWait(Duration connectWait) {
            this.connectWait = connectWait;
            return this;
        }

        public Builder withReconnectPolicy(ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = reconnectPolicy;
            return this;
        }

        public TommyConfig build() {
            String effectiveClientId = clientId != null ? clientId : "tommy-" + sessionId;
            return new TommyConfig(host, mqttPort, sessionId, effectiveClientId,
                    keepAlive, connectWait, reconnectPolicy);
        }
    }
}
