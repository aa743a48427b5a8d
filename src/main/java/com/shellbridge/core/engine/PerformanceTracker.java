package com.shellbridge.core.engine;

import com.shellbridge.core.model.PerformanceMetrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Running totals behind {@link PerformanceMetrics}. All access is synchronized.
 */
final class PerformanceTracker {

    private final Clock clock;
    private long executed;
    private long succeeded;
    private Duration total = Duration.ZERO;
    private Instant lastReset;

    PerformanceTracker(Clock clock) {
        this.clock = clock;
        this.lastReset = clock.instant();
    }

    synchronized void record(Duration duration, boolean success) {
        executed++;
        if (success) {
            succeeded++;
        }
        total = total.plus(duration);
    }

    synchronized PerformanceMetrics snapshot() {
        if (executed == 0) {
            return PerformanceMetrics.empty(lastReset);
        }
        return new PerformanceMetrics(executed, total, total.dividedBy(executed),
                (double) succeeded / executed, lastReset);
    }

    synchronized void reset() {
        executed = 0;
        succeeded = 0;
        total = Duration.ZERO;
        lastReset = clock.instant();
    }
}
