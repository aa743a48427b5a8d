package com.shellbridge.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of executor performance since the last reset.
 */
public record PerformanceMetrics(
    long commandsExecuted,
    Duration totalDuration,
    Duration averageDuration,
    double successRate,
    Instant lastReset
) {

    public static PerformanceMetrics empty(Instant at) {
        return new PerformanceMetrics(0, Duration.ZERO, Duration.ZERO, 1.0, at);
    }
}
