package com.shellbridge.core.engine;

import com.shellbridge.core.audit.AuditLog;
import com.shellbridge.core.logging.MdcContext;
import com.shellbridge.core.metrics.ShellbridgeMetrics;
import com.shellbridge.core.model.BackendKind;
import com.shellbridge.core.model.Command;
import com.shellbridge.core.model.CommandResult;
import com.shellbridge.core.model.ErrorCategory;
import com.shellbridge.core.model.ExecutionError;
import com.shellbridge.core.model.ExecutionOptions;
import com.shellbridge.core.model.LogLevel;
import com.shellbridge.core.model.PerformanceMetrics;
import com.shellbridge.core.model.ShellPlan;
import com.shellbridge.core.pool.PoolSlot;
import com.shellbridge.core.pool.ProcessPool;
import com.shellbridge.core.security.CommandSafetyPolicy;
import com.shellbridge.core.shell.CommandNormalizer;
import com.shellbridge.core.shell.ShellClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one command end to end: validate, normalize, classify, admit into the
 * {@link ProcessPool}, spawn, capture output, enforce timeout and cancellation,
 * and report a {@link CommandResult}.
 * <p>
 * Operational faults never escape as exceptions; each is reported as a
 * {@link CommandResult.Failure} whose error category tells the caller what went
 * wrong. Only programmer errors (null options, null token) throw.
 * <p>
 * Timeout and cancellation share the grace-kill path: a graceful termination
 * request to the child and its descendants, then a forceful one if the child is
 * still alive after {@link ExecutionSettings#gracePeriod()}.
 */
public class CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    static final String COMPONENT = "CommandExecutor";
    private static final Duration STREAM_DRAIN_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration FORCED_EXIT_WAIT = Duration.ofSeconds(2);

    private enum Termination { EXITED, TIMED_OUT, CANCELLED }

    private final CommandNormalizer normalizer;
    private final ShellClassifier classifier;
    private final ProcessPool pool;
    private final AuditLog auditLog;
    private final CommandSafetyPolicy safetyPolicy;
    private final ShellbridgeMetrics metrics;
    private final ExecutionSettings settings;
    private final PerformanceTracker tracker;
    private final ExecutorService streamReaders;
    private final Clock clock;

    public CommandExecutor(CommandNormalizer normalizer, ShellClassifier classifier, ProcessPool pool,
                           AuditLog auditLog, CommandSafetyPolicy safetyPolicy,
                           ShellbridgeMetrics metrics, ExecutionSettings settings) {
        this(normalizer, classifier, pool, auditLog, safetyPolicy, metrics, settings, Clock.systemUTC());
    }

    CommandExecutor(CommandNormalizer normalizer, ShellClassifier classifier, ProcessPool pool,
                    AuditLog auditLog, CommandSafetyPolicy safetyPolicy,
                    ShellbridgeMetrics metrics, ExecutionSettings settings, Clock clock) {
        this.normalizer = normalizer;
        this.classifier = classifier;
        this.pool = pool;
        this.auditLog = auditLog;
        this.safetyPolicy = safetyPolicy;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        this.tracker = new PerformanceTracker(clock);
        var threadIds = new AtomicInteger();
        this.streamReaders = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "shellbridge-stream-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public CommandResult run(String raw) {
        return run(raw, ExecutionOptions.defaults(), CancellationToken.NONE);
    }

    public CommandResult run(String raw, ExecutionOptions options) {
        return run(raw, options, CancellationToken.NONE);
    }

    public CommandResult run(String raw, ExecutionOptions options, CancellationToken cancellation) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(cancellation, "cancellation");

        long startNanos = System.nanoTime();
        String correlationId = auditLog.nextCorrelationId();
        MdcContext.setExecution(correlationId);
        try {
            CommandResult result = execute(raw, options, cancellation, startNanos, correlationId);
            tracker.record(result.duration(), result.success());
            if (metrics != null) {
                metrics.recordCommand(result);
            }
            return result;
        } finally {
            MdcContext.clearExecution();
        }
    }

    private CommandResult execute(String raw, ExecutionOptions options, CancellationToken cancellation,
                                  long startNanos, String correlationId) {
        Optional<String> problem = Command.problem(raw);
        if (problem.isPresent()) {
            return reject(raw, null, ExecutionError.invalidCommand(problem.get()), startNanos, correlationId);
        }
        Optional<String> violation = safetyPolicy.findViolation(raw);
        if (violation.isPresent()) {
            return reject(raw, null, ExecutionError.dangerousCommand(violation.get()), startNanos, correlationId);
        }
        if (cancellation.isCancelled()) {
            return reject(raw, null, ExecutionError.cancelled(), startNanos, correlationId);
        }

        Command command = normalizer.normalize(raw);
        ShellPlan plan = classifier.classify(command, options.shellOverride());
        MdcContext.setBackend(plan.backend().name());

        Optional<PoolSlot> admitted = pool.tryAdmit();
        if (admitted.isEmpty()) {
            return reject(command.text(), plan.backend(),
                    ExecutionError.poolExhausted(pool.maxConcurrent()), startNanos, correlationId);
        }
        PoolSlot slot = admitted.get();
        try {
            return spawnAndAwait(raw, command, plan, options, cancellation, slot, startNanos, correlationId);
        } finally {
            slot.release();
        }
    }

    private CommandResult spawnAndAwait(String raw, Command command, ShellPlan plan, ExecutionOptions options,
                                        CancellationToken cancellation, PoolSlot slot,
                                        long startNanos, String correlationId) {
        long timeoutMs = options.effectiveTimeoutMillis(settings.defaultTimeout().toMillis());
        List<String> argv = plan.argv(command);

        var started = payload();
        started.put("original", raw);
        started.put("fixed", command.text());
        started.put("shell", plan.executable());
        started.put("args", argv.subList(1, argv.size()));
        started.put("backend", plan.backend().name());
        started.put("rule", plan.rule().name());
        started.put("description", options.description());
        started.put("timeoutMs", timeoutMs);
        auditLog.record(LogLevel.INFO, "Executing command", started, COMPONENT, correlationId);
        log.debug("Spawning {} via {} ({})", command, plan.executable(), plan.rule());

        var builder = new ProcessBuilder(argv);
        if (options.workingDirectory() != null) {
            builder.directory(options.workingDirectory().toFile());
        }
        builder.environment().putAll(options.extraEnvironment());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("Spawn failed for {}: {}", plan.executable(), e.getMessage());
            return reject(command.text(), plan.backend(), ExecutionError.spawnFailed(e), startNanos, correlationId);
        }
        slot.bind(process);
        closeStdin(process);

        var stdout = new OutputBuffer(settings.maxOutputBytes());
        var stderr = new OutputBuffer(settings.maxOutputBytes());
        Future<?> outReader = drainAsync(process.getInputStream(), stdout);
        Future<?> errReader = drainAsync(process.getErrorStream(), stderr);

        boolean interrupted = false;
        Termination termination;
        try {
            termination = awaitExit(process, timeoutMs, cancellation);
        } catch (InterruptedException e) {
            interrupted = true;
            termination = Termination.CANCELLED;
        }
        if (termination != Termination.EXITED) {
            log.info("Terminating pid {} ({})", process.pid(), termination);
            terminate(process);
        }
        joinReader(outReader, "stdout");
        joinReader(errReader, "stderr");
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        Duration duration = elapsed(startNanos);
        String out = stdout.decode(options.outputEncoding());
        String err = stderr.decode(options.outputEncoding());
        int exitCode = process.isAlive() ? -1 : process.exitValue();

        CommandResult result = switch (termination) {
            case TIMED_OUT -> new CommandResult.Failure(command.text(), plan.backend(), out, err, exitCode,
                    duration, clock.instant(), ExecutionError.timeout(timeoutMs));
            case CANCELLED -> new CommandResult.Failure(command.text(), plan.backend(), out, err, exitCode,
                    duration, clock.instant(), ExecutionError.cancelled());
            case EXITED -> exitCode == 0
                    ? new CommandResult.Success(command.text(), plan.backend(), out, err, duration, clock.instant())
                    : new CommandResult.Failure(command.text(), plan.backend(), out, err, exitCode,
                            duration, clock.instant(), ExecutionError.nonZeroExit(exitCode));
        };

        var finished = payload();
        finished.put("command", command.text());
        finished.put("backend", plan.backend().name());
        finished.put("exitCode", exitCode);
        finished.put("durationMs", duration.toMillis());
        finished.put("success", result.success());
        finished.put("stdoutLength", out.length());
        finished.put("stderrLength", err.length());
        if (stdout.truncated() || stderr.truncated()) {
            finished.put("truncated", true);
        }
        result.error().ifPresent(e -> finished.put("error", e.code().name()));
        LogLevel level = switch (termination) {
            case EXITED -> result.success() ? LogLevel.INFO : LogLevel.WARN;
            case TIMED_OUT, CANCELLED -> LogLevel.ERROR;
        };
        auditLog.record(level, termination == Termination.EXITED ? "Command completed" : "Command execution failed",
                finished, COMPONENT, correlationId);
        return result;
    }

    private Termination awaitExit(Process process, long timeoutMs, CancellationToken cancellation)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        long pollNanos = settings.pollInterval().toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return Termination.TIMED_OUT;
            }
            if (process.waitFor(Math.min(pollNanos, remaining), TimeUnit.NANOSECONDS)) {
                return Termination.EXITED;
            }
            if (cancellation.isCancelled()) {
                return Termination.CANCELLED;
            }
        }
    }

    /**
     * Grace-kill: destroy the child and the descendants captured beforehand, then
     * force both if the child outlives the grace period.
     */
    private void terminate(Process process) {
        List<ProcessHandle> children = descendantsOf(process);
        process.destroy();
        children.forEach(ProcessHandle::destroy);
        if (waitFor(process, settings.gracePeriod())) {
            children.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
            return;
        }
        log.warn("pid {} still alive after {}ms grace period, forcing", process.pid(),
                settings.gracePeriod().toMillis());
        process.destroyForcibly();
        children.forEach(ProcessHandle::destroyForcibly);
        if (!waitFor(process, FORCED_EXIT_WAIT)) {
            log.warn("pid {} did not exit after forced termination", process.pid());
        }
    }

    private static List<ProcessHandle> descendantsOf(Process process) {
        try {
            return process.descendants().toList();
        } catch (UnsupportedOperationException e) {
            log.debug("Descendant listing unsupported: {}", e.getMessage());
            return List.of();
        }
    }

    private static boolean waitFor(Process process, Duration duration) {
        try {
            return process.waitFor(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }

    private static void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of pid {}: {}", process.pid(), e.getMessage());
        }
    }

    private Future<?> drainAsync(InputStream stream, OutputBuffer buffer) {
        return streamReaders.submit(() -> {
            try (stream) {
                buffer.drain(stream);
            }
            return null;
        });
    }

    private static void joinReader(Future<?> reader, String name) {
        try {
            reader.get(STREAM_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("{} still open {}ms after exit (held by a detached descendant?); using captured output",
                    name, STREAM_DRAIN_TIMEOUT.toMillis());
            reader.cancel(true);
        } catch (ExecutionException e) {
            log.warn("Failed reading {}: {}", name, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reader.cancel(true);
        }
    }

    private CommandResult reject(String command, BackendKind backend, ExecutionError error,
                                 long startNanos, String correlationId) {
        CommandResult.Failure failure = CommandResult.rejected(command, backend, error, elapsed(startNanos));
        if (metrics != null) {
            metrics.recordRejection(error.code());
        }

        var details = payload();
        details.put("command", command);
        details.put("backend", backend == null ? null : backend.name());
        details.put("error", error.code().name());
        details.put("category", error.category().name());
        details.put("message", error.message());
        boolean spawnFailure = error.category() == ErrorCategory.SPAWN_FAILURE;
        auditLog.record(spawnFailure ? LogLevel.ERROR : LogLevel.WARN,
                spawnFailure ? "Command execution failed" : "Command rejected",
                details, COMPONENT, correlationId);
        return failure;
    }

    private static Map<String, Object> payload() {
        return new LinkedHashMap<>();
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public PerformanceMetrics metrics() {
        return tracker.snapshot();
    }

    public void resetMetrics() {
        tracker.reset();
    }

    public ProcessPool pool() {
        return pool;
    }

    public ShellClassifier classifier() {
        return classifier;
    }

    public CommandNormalizer normalizer() {
        return normalizer;
    }

    public ExecutionSettings settings() {
        return settings;
    }

    /**
     * Stops the stream reader threads. Running children are not touched; see
     * {@link ProcessPool#killAll()}.
     */
    public void shutdown() {
        streamReaders.shutdownNow();
    }
}
