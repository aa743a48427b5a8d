package com.shellbridge.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shellbridge.core.model.LogEntry;
import com.shellbridge.core.model.LogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only, line-per-entry audit trail of command executions.
 * <p>
 * Entries are formatted when recorded and held in memory until one of:
 * <ul>
 *   <li>the buffered size crosses {@link AuditSettings#bufferBytes()}</li>
 *   <li>an ERROR entry arrives (written immediately)</li>
 *   <li>the periodic timer fires with a non-empty buffer</li>
 *   <li>{@link #flush()} or {@link #dispose()} is called</li>
 * </ul>
 * Before each write the active file is rotated into {@code <path>.1 .. <path>.N}
 * when it has grown past {@link AuditSettings#maxFileBytes()}.
 * <p>
 * Line format: {@code <ISO timestamp> [LEVEL] [component] (correlationId) message {json payload}}.
 */
public class AuditLog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private static final int ENTRY_OVERHEAD_BYTES = 100;
    private static final int CORRELATION_ID_LENGTH = 8;
    /** Unwritable entries kept for retry, as a multiple of the flush threshold. */
    private static final int RETRY_BUFFER_FACTOR = 16;

    /**
     * @param bufferedEntries entries waiting for the next flush
     * @param bufferedBytes   their estimated size
     * @param lastFlush       time of the last flush attempt
     * @param path            active log file
     */
    public record Stats(int bufferedEntries, long bufferedBytes, Instant lastFlush, Path path) {}

    private final AuditSettings settings;
    private final Clock clock;
    private final Object bufferLock = new Object();
    private final Object fileLock = new Object();
    private final List<String> buffer = new ArrayList<>();
    private long bufferedBytes;
    private volatile Instant lastFlush;
    private final AtomicLong correlationCounter = new AtomicLong();
    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final ScheduledExecutorService flushTimer;

    public AuditLog(AuditSettings settings) {
        this(settings, Clock.systemUTC());
    }

    AuditLog(AuditSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.lastFlush = clock.instant();
        if (settings.enabled() && !settings.flushInterval().isZero()) {
            this.flushTimer = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "audit-log-flush");
                t.setDaemon(true);
                return t;
            });
            long periodMs = settings.flushInterval().toMillis();
            flushTimer.scheduleAtFixedRate(this::periodicFlush, periodMs, periodMs, TimeUnit.MILLISECONDS);
        } else {
            this.flushTimer = null;
        }
    }

    public static AuditLog discarding() {
        return new AuditLog(AuditSettings.disabled());
    }

    public void record(LogLevel level, String message, Map<String, Object> payload, String component) {
        record(level, message, payload, component, null);
    }

    public void record(LogLevel level, String message, Map<String, Object> payload,
                       String component, String correlationId) {
        if (!settings.enabled() || !level.isAtLeast(settings.minLevel())) {
            return;
        }
        var entry = new LogEntry(clock.instant(), level, message,
                payload == null || payload.isEmpty() ? null : payload, correlationId, component);
        String line = format(entry);

        boolean flushNow;
        synchronized (bufferLock) {
            buffer.add(line);
            bufferedBytes += line.length() + ENTRY_OVERHEAD_BYTES;
            flushNow = bufferedBytes >= settings.bufferBytes()
                    || level == LogLevel.ERROR
                    || disposed.get();
        }
        if (flushNow) {
            flush();
        }
    }

    public void debug(String message, Map<String, Object> payload, String component) {
        record(LogLevel.DEBUG, message, payload, component);
    }

    public void info(String message, Map<String, Object> payload, String component) {
        record(LogLevel.INFO, message, payload, component);
    }

    public void warn(String message, Map<String, Object> payload, String component) {
        record(LogLevel.WARN, message, payload, component);
    }

    public void error(String message, Map<String, Object> payload, String component) {
        record(LogLevel.ERROR, message, payload, component);
    }

    /**
     * Returns a short, monotonically increasing base-36 id for grouping the
     * entries of one execution.
     */
    public String nextCorrelationId() {
        String id = Long.toString(correlationCounter.incrementAndGet(), 36);
        return id.length() >= CORRELATION_ID_LENGTH ? id : "0".repeat(CORRELATION_ID_LENGTH - id.length()) + id;
    }

    /**
     * Writes all buffered entries, rotating the active file first when it is too large.
     * Write failures are logged and the entries are kept for the next attempt.
     */
    public void flush() {
        if (!settings.enabled()) {
            return;
        }
        synchronized (fileLock) {
            List<String> batch;
            long batchBytes;
            synchronized (bufferLock) {
                if (buffer.isEmpty()) {
                    return;
                }
                batch = new ArrayList<>(buffer);
                batchBytes = bufferedBytes;
                buffer.clear();
                bufferedBytes = 0;
            }
            lastFlush = clock.instant();
            try {
                Path path = settings.path();
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                rotateIfNeeded(path);
                // getBytes substitutes unmappable characters such as lone surrogates
                Files.write(path, String.join("", batch).getBytes(StandardCharsets.UTF_8),
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                log.warn("Failed to write {} audit entries to {}: {}", batch.size(), settings.path(), e.getMessage());
                requeue(batch, batchBytes);
            }
        }
    }

    private void requeue(List<String> batch, long batchBytes) {
        synchronized (bufferLock) {
            long limit = Math.max(settings.bufferBytes(), 1) * RETRY_BUFFER_FACTOR;
            if (bufferedBytes + batchBytes > limit) {
                log.warn("Dropping {} audit entries after failed write; retry buffer full", batch.size());
                return;
            }
            buffer.addAll(0, batch);
            bufferedBytes += batchBytes;
        }
    }

    /**
     * Shifts {@code path.i} to {@code path.(i+1)} for every retained backlog file,
     * discarding the oldest, then moves the active file to {@code path.1}.
     */
    void rotateIfNeeded(Path path) throws IOException {
        if (!Files.exists(path) || Files.size(path) <= settings.maxFileBytes()) {
            return;
        }
        int retention = settings.retention();
        Files.deleteIfExists(backlog(path, retention));
        for (int i = retention - 1; i >= 1; i--) {
            Path older = backlog(path, i);
            if (Files.exists(older)) {
                Files.move(older, backlog(path, i + 1), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        Files.move(path, backlog(path, 1), StandardCopyOption.REPLACE_EXISTING);
        log.info("Rotated audit log {} (retention {})", path, retention);
    }

    static Path backlog(Path path, int index) {
        return path.resolveSibling(path.getFileName() + "." + index);
    }

    private void periodicFlush() {
        try {
            boolean pending;
            synchronized (bufferLock) {
                pending = !buffer.isEmpty();
            }
            if (pending) {
                flush();
            }
        } catch (RuntimeException e) {
            log.warn("Periodic audit flush failed: {}", e.getMessage(), e);
        }
    }

    static String format(LogEntry entry) {
        var sb = new StringBuilder(128);
        sb.append(entry.timestamp()).append(" [").append(entry.level()).append(']');
        if (entry.component() != null) {
            sb.append(" [").append(entry.component()).append(']');
        }
        if (entry.correlationId() != null) {
            sb.append(" (").append(entry.correlationId()).append(')');
        }
        sb.append(' ').append(entry.message());
        if (entry.payload() != null) {
            sb.append(' ').append(renderPayload(entry.payload()));
        }
        return sb.append('\n').toString();
    }

    private static String renderPayload(Map<String, Object> payload) {
        try {
            return JSON.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.debug("Payload not JSON-serializable, using toString: {}", e.getMessage());
            return String.valueOf(payload);
        }
    }

    /**
     * Stops the periodic timer and writes whatever is buffered. Idempotent;
     * entries recorded afterwards are written immediately.
     */
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        if (flushTimer != null) {
            flushTimer.shutdownNow();
        }
        flush();
    }

    @Override
    public void close() {
        dispose();
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    public Stats stats() {
        synchronized (bufferLock) {
            return new Stats(buffer.size(), bufferedBytes, lastFlush, settings.path());
        }
    }

    public AuditSettings settings() {
        return settings;
    }
}
