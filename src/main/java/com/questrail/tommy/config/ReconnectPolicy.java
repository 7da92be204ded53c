package com.questrail.tommy.config;

import java.time.Duration;
import java.util.Objects;

/**
 * ReconnectPolicy
 * -----------------------------------------------------------------------------
 * Bounded exponential backoff for broker reconnects.
 *
 * <p>This is <em>operational only</em>: it decides how long to wait before the
 * next connect attempt and nothing else. The first retry waits
 * {@code minDelay}; each further consecutive failure doubles the wait until it
 * reaches {@code maxDelay}. A successful connect resets the sequence.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>minDelay</b>: delay before the first reconnect attempt.</li>
 *   <li><b>maxDelay</b>: ceiling for every later delay.</li>
 * </ul>
 */
public record ReconnectPolicy(
        Duration minDelay,
        Duration maxDelay
) {
    public ReconnectPolicy {
        Objects.requireNonNull(minDelay, "minDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");

        if (minDelay.isNegative() || minDelay.isZero()) {
            throw new IllegalArgumentException("minDelay must be positive");
        }
        if (maxDelay.compareTo(minDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= minDelay");
        }
    }

    /**
     * Default policy: 1 second doubling up to 120 seconds.
     */
    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(120));
    }

    /**
     * Returns the delay before reconnect attempt {@code attempt}.
     *
     * @param attempt zero-based count of consecutive failed attempts
     * @return delay, always within {@code [minDelay, maxDelay]}
     */
    public Duration delayForAttempt(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }

        Duration delay = minDelay;
        for (int i = 0; i < attempt; i++) {
            delay = delay.multipliedBy(2);
            if (delay.compareTo(maxDelay) >= 0) {
                return maxDelay;
            }
        }
        return delay;
    }
}
