package com.shellbridge.core.audit;

import com.shellbridge.core.model.LogLevel;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for {@link AuditLog}.
 *
 * @param enabled        when false every record call is dropped and nothing touches disk
 * @param path           active log file; rotated files get {@code .1}, {@code .2}, ... suffixes
 * @param bufferBytes    estimated buffer size that triggers a flush
 * @param flushInterval  period of the background flush; zero disables the timer
 * @param maxFileBytes   size above which the active file is rotated before the next flush
 * @param retention      number of rotated files kept
 * @param minLevel       entries below this level are dropped
 */
public record AuditSettings(
    boolean enabled,
    Path path,
    long bufferBytes,
    Duration flushInterval,
    long maxFileBytes,
    int retention,
    LogLevel minLevel
) {

    public static final long DEFAULT_BUFFER_BYTES = 64 * 1024;
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(5);
    public static final long DEFAULT_MAX_FILE_BYTES = 50L * 1024 * 1024;
    public static final int DEFAULT_RETENTION = 5;

    public AuditSettings {
        Objects.requireNonNull(flushInterval, "flushInterval");
        Objects.requireNonNull(minLevel, "minLevel");
        if (enabled) {
            Objects.requireNonNull(path, "path");
        }
        if (bufferBytes < 0 || maxFileBytes < 1 || retention < 1) {
            throw new IllegalArgumentException("bufferBytes >= 0, maxFileBytes >= 1 and retention >= 1 required");
        }
    }

    public static AuditSettings defaults(Path path) {
        return new AuditSettings(true, path, DEFAULT_BUFFER_BYTES, DEFAULT_FLUSH_INTERVAL,
                DEFAULT_MAX_FILE_BYTES, DEFAULT_RETENTION, LogLevel.INFO);
    }

    public static AuditSettings disabled() {
        return new AuditSettings(false, null, DEFAULT_BUFFER_BYTES, Duration.ZERO,
                DEFAULT_MAX_FILE_BYTES, DEFAULT_RETENTION, LogLevel.INFO);
    }
}
