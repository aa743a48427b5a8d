package com.shellbridge.core.scheduler;

import com.shellbridge.core.engine.CancellationToken;
import com.shellbridge.core.engine.CommandExecutor;
import com.shellbridge.core.logging.MdcContext;
import com.shellbridge.core.metrics.ShellbridgeMetrics;
import com.shellbridge.core.model.CommandResult;
import com.shellbridge.core.model.ExecutionError;
import com.shellbridge.core.model.ExecutionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a list of commands in waves sized to the pool's concurrency bound.
 * Each wave runs concurrently and is awaited fully before the next starts.
 *
 * <p>The returned list always has one result per input, in input order. A fault
 * in one item never aborts the batch: it becomes an {@code INTERNAL_ERROR}
 * failure in that item's slot.
 */
public class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final CommandExecutor executor;
    private final int waveSize;
    private final ShellbridgeMetrics metrics;
    private final ExecutorService workers;

    public BatchRunner(CommandExecutor executor, ShellbridgeMetrics metrics) {
        this(executor, executor.pool().maxConcurrent(), metrics);
    }

    BatchRunner(CommandExecutor executor, int waveSize) {
        this(executor, waveSize, null);
    }

    BatchRunner(CommandExecutor executor, int waveSize, ShellbridgeMetrics metrics) {
        if (waveSize < 1) {
            throw new IllegalArgumentException("waveSize must be >= 1: " + waveSize);
        }
        this.executor = executor;
        this.waveSize = waveSize;
        this.metrics = metrics;
        var threadIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(waveSize, r -> {
            Thread t = new Thread(r, "shellbridge-batch-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public List<CommandResult> runBatch(List<String> commands) {
        return runBatch(commands, ExecutionOptions.defaults(), CancellationToken.NONE);
    }

    public List<CommandResult> runBatch(List<String> commands, ExecutionOptions options) {
        return runBatch(commands, options, CancellationToken.NONE);
    }

    public List<CommandResult> runBatch(List<String> commands, ExecutionOptions options,
                                        CancellationToken cancellation) {
        Objects.requireNonNull(commands, "commands");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(cancellation, "cancellation");

        var waves = partition(commands, waveSize);
        log.info("Running batch of {} command(s) in {} wave(s) of up to {}", commands.size(), waves.size(), waveSize);

        var results = new ArrayList<CommandResult>(commands.size());
        try {
            for (int i = 0; i < waves.size(); i++) {
                results.addAll(runWave(waves.get(i), i + 1, options, cancellation));
            }
        } finally {
            MdcContext.clear();
        }
        return List.copyOf(results);
    }

    private List<CommandResult> runWave(List<String> wave, int waveNumber, ExecutionOptions options,
                                        CancellationToken cancellation) {
        MdcContext.setWave(waveNumber);
        log.info("Wave {}: dispatching {} command(s)", waveNumber, wave.size());
        if (metrics != null) {
            metrics.recordWave(wave.size());
        }

        var futures = new ArrayList<CompletableFuture<CommandResult>>(wave.size());
        for (String command : wave) {
            try {
                futures.add(CompletableFuture.supplyAsync(
                        () -> runIsolated(command, waveNumber, options, cancellation), workers));
            } catch (RejectedExecutionException e) {
                log.error("Batch worker pool rejected '{}': {}", command, e.getMessage());
                futures.add(CompletableFuture.completedFuture(internalFailure(command, e)));
            }
        }

        var results = new ArrayList<CommandResult>(wave.size());
        int passed = 0;
        for (int i = 0; i < futures.size(); i++) {
            CommandResult result;
            try {
                result = futures.get(i).join();
            } catch (CompletionException | CancellationException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Unexpected error collecting result for '{}'", wave.get(i), cause);
                result = internalFailure(wave.get(i), cause);
            }
            if (result.success()) {
                passed++;
            }
            results.add(result);
        }
        log.info("Wave {} complete: {} passed, {} failed", waveNumber, passed, results.size() - passed);
        return results;
    }

    private CommandResult runIsolated(String command, int waveNumber, ExecutionOptions options,
                                      CancellationToken cancellation) {
        MdcContext.setWave(waveNumber);
        try {
            return executor.run(command, options, cancellation);
        } catch (RuntimeException e) {
            log.error("Infrastructure error running batch item '{}': {}", command, e.getMessage(), e);
            return internalFailure(command, e);
        } finally {
            MdcContext.clear();
        }
    }

    private static CommandResult internalFailure(String command, Throwable cause) {
        return CommandResult.rejected(command == null ? "" : command, null,
                ExecutionError.internal(cause), Duration.ZERO);
    }

    /**
     * Splits {@code commands} into consecutive groups of at most {@code size}.
     */
    static List<List<String>> partition(List<String> commands, int size) {
        var waves = new ArrayList<List<String>>();
        for (int start = 0; start < commands.size(); start += size) {
            waves.add(commands.subList(start, Math.min(start + size, commands.size())));
        }
        return waves;
    }

    public int waveSize() {
        return waveSize;
    }

    public void shutdown() {
        workers.shutdownNow();
    }
}
