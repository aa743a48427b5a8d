package com.shellbridge.core.engine;

import java.time.Duration;

/**
 * Engine-wide execution limits.
 *
 * @param defaultTimeout timeout applied when the caller gives none
 * @param gracePeriod    delay between the graceful and the forceful kill
 * @param pollInterval   how often the process wait checks deadline and cancellation
 * @param maxOutputBytes per-stream capture cap
 */
public record ExecutionSettings(
    Duration defaultTimeout,
    Duration gracePeriod,
    Duration pollInterval,
    long maxOutputBytes
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);
    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(5);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(50);
    public static final long DEFAULT_MAX_OUTPUT_BYTES = 10L * 1024 * 1024;

    public ExecutionSettings {
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()
                || gracePeriod.isNegative() || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("timeouts must be positive");
        }
        if (maxOutputBytes < 0) {
            throw new IllegalArgumentException("maxOutputBytes must be >= 0");
        }
    }

    public static ExecutionSettings defaults() {
        return new ExecutionSettings(DEFAULT_TIMEOUT, DEFAULT_GRACE_PERIOD, DEFAULT_POLL_INTERVAL,
                DEFAULT_MAX_OUTPUT_BYTES);
    }

    public ExecutionSettings withGracePeriod(Duration gracePeriod) {
        return new ExecutionSettings(defaultTimeout, gracePeriod, pollInterval, maxOutputBytes);
    }
}
