package com.shellbridge.core.metrics;

import com.shellbridge.core.model.BackendKind;
import com.shellbridge.core.model.CommandResult;
import com.shellbridge.core.model.ErrorCode;
import com.shellbridge.core.pool.ProcessPool;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

/**
 * Centralised Micrometer metrics for command execution.
 */
@Service
public class ShellbridgeMetrics {

    private final MeterRegistry registry;

    public ShellbridgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one finished run, tagged by backend and outcome
     * ({@code success} or the lower-cased error category).
     */
    public void recordCommand(CommandResult result) {
        String outcome = result.error()
                .map(e -> e.category().name().toLowerCase())
                .orElse("success");
        Timer.builder("shellbridge.command.duration")
                .tag("backend", backendTag(result.backend()))
                .tag("outcome", outcome)
                .register(registry)
                .record(result.duration());
    }

    public void recordRejection(ErrorCode code) {
        Counter.builder("shellbridge.command.rejections")
                .description("Commands refused before a process was spawned")
                .tag("code", code.name())
                .register(registry)
                .increment();
    }

    public void recordWave(int size) {
        Counter.builder("shellbridge.batch.waves")
                .description("Batch waves executed")
                .register(registry)
                .increment();

        DistributionSummary.builder("shellbridge.batch.wave_size")
                .description("Number of commands per wave")
                .register(registry)
                .record(size);
    }

    public void recordKillAll(int killed) {
        Counter.builder("shellbridge.pool.killed")
                .description("Processes terminated by a pool-wide shutdown")
                .register(registry)
                .increment(killed);
    }

    /**
     * Publishes the pool's live admission count.
     */
    public void bindPool(ProcessPool pool) {
        Gauge.builder("shellbridge.pool.active", pool, ProcessPool::activeCount)
                .description("Admitted pool slots")
                .register(registry);
    }

    private static String backendTag(BackendKind backend) {
        return backend == null ? "none" : backend.name().toLowerCase();
    }
}
