package com.shellbridge.core.audit;

import com.shellbridge.core.model.LogEntry;
import com.shellbridge.core.model.LogLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class AuditLogTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:30:00Z");

    @TempDir
    Path tempDir;

    private AuditLog auditLog;

    @AfterEach
    void tearDown() {
        if (auditLog != null) {
            auditLog.dispose();
        }
    }

    private Path logFile() {
        return tempDir.resolve("logs").resolve("audit.log");
    }

    private AuditSettings settings(long bufferBytes, long maxFileBytes, int retention) {
        return new AuditSettings(true, logFile(), bufferBytes, Duration.ZERO, maxFileBytes, retention, LogLevel.INFO);
    }

    private AuditLog open(AuditSettings settings) {
        auditLog = new AuditLog(settings, Clock.fixed(NOW, ZoneOffset.UTC));
        return auditLog;
    }

    private long backlogCount() throws IOException {
        try (Stream<Path> files = Files.list(logFile().getParent())) {
            return files.filter(p -> p.getFileName().toString().matches("audit\\.log\\.\\d+")).count();
        }
    }

    @Nested
    @DisplayName("Buffering and flush triggers")
    class BufferingTests {

        @Test
        @DisplayName("entries stay buffered until flush")
        void bufferedUntilFlush() throws IOException {
            var log = open(settings(1 << 20, 1 << 20, 5));

            log.info("Executing command", Map.of("command", "ls"), "CommandExecutor");

            assertFalse(Files.exists(logFile()));
            assertEquals(1, log.stats().bufferedEntries());

            log.flush();

            String content = Files.readString(logFile());
            assertEquals("2025-01-15T10:30:00Z [INFO] [CommandExecutor] Executing command {\"command\":\"ls\"}\n",
                    content);
            assertEquals(0, log.stats().bufferedEntries());
        }

        @Test
        @DisplayName("error entries are written immediately")
        void errorsFlushImmediately() throws IOException {
            var log = open(settings(1 << 20, 1 << 20, 5));

            log.info("first", null, null);
            log.error("Command execution failed", Map.of("error", "TIMEOUT"), "CommandExecutor");

            String content = Files.readString(logFile());
            assertTrue(content.contains("[INFO] first"));
            assertTrue(content.contains("[ERROR] [CommandExecutor] Command execution failed"));
        }

        @Test
        @DisplayName("crossing the byte threshold flushes")
        void thresholdFlush() {
            var log = open(settings(200, 1 << 20, 5));

            log.info("x".repeat(150), null, "test");

            assertTrue(Files.exists(logFile()));
            assertEquals(0, log.stats().bufferedEntries());
        }

        @Test
        @DisplayName("entries below the minimum level are dropped")
        void minLevel() {
            var log = open(settings(1 << 20, 1 << 20, 5));

            log.debug("noise", null, null);

            assertEquals(0, log.stats().bufferedEntries());
        }

        @Test
        @DisplayName("periodic timer flushes a non-empty buffer")
        void periodicFlush() throws InterruptedException {
            auditLog = new AuditLog(new AuditSettings(true, logFile(), 1 << 20, Duration.ofMillis(50),
                    1 << 20, 5, LogLevel.INFO));

            auditLog.info("tick", null, null);

            long deadline = System.currentTimeMillis() + 5_000;
            while (!Files.exists(logFile()) && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertTrue(Files.exists(logFile()));
        }

        @Test
        @DisplayName("failed writes keep the entries for the next flush")
        void failedWriteRequeues() throws IOException {
            Files.createDirectories(logFile());
            var log = open(settings(1 << 20, Long.MAX_VALUE, 5));

            log.info("kept", null, null);
            log.flush();

            assertEquals(1, log.stats().bufferedEntries());
        }

        @Test
        @DisplayName("text UTF-8 cannot encode is replaced and does not block later entries")
        void unencodableTextIsWritten() throws IOException {
            var log = open(settings(1 << 20, 1 << 20, 5));

            log.info("Executing command", Map.of("original", "echo \uD800"), "CommandExecutor");
            log.flush();
            log.info("later entry", null, null);
            log.flush();

            String content = Files.readString(logFile());
            assertTrue(content.contains("Executing command"));
            assertTrue(content.contains("later entry"));
            assertFalse(content.contains("\uD800"));
            assertEquals(0, log.stats().bufferedEntries());
        }
    }

    @Nested
    @DisplayName("Rotation")
    class RotationTests {

        @Test
        @DisplayName("an oversized file is rotated into exactly one new backlog before the flush")
        void rotatesOnce() throws IOException {
            var log = open(settings(1 << 20, 100, 5));
            log.info("a".repeat(120), null, null);
            log.flush();
            assertEquals(0, backlogCount());

            log.info("fresh", null, null);
            log.flush();

            assertEquals(1, backlogCount());
            assertTrue(Files.readString(AuditLog.backlog(logFile(), 1)).contains("a".repeat(120)));
            String active = Files.readString(logFile());
            assertTrue(active.contains("fresh"));
            assertFalse(active.contains("aaaa"));
        }

        @Test
        @DisplayName("backlogs shift up and the oldest beyond retention is discarded")
        void retention() throws IOException {
            var log = open(settings(1 << 20, 10, 2));
            Files.createDirectories(logFile().getParent());
            Files.writeString(logFile(), "current-generation-content\n");
            Files.writeString(AuditLog.backlog(logFile(), 1), "previous\n");
            Files.writeString(AuditLog.backlog(logFile(), 2), "oldest\n");

            log.info("new", null, null);
            log.flush();

            assertEquals("current-generation-content\n", Files.readString(AuditLog.backlog(logFile(), 1)));
            assertEquals("previous\n", Files.readString(AuditLog.backlog(logFile(), 2)));
            assertFalse(Files.exists(AuditLog.backlog(logFile(), 3)));
            assertTrue(Files.readString(logFile()).contains("new"));
        }
    }

    @Nested
    @DisplayName("Lifecycle and format")
    class LifecycleTests {

        @Test
        @DisplayName("dispose flushes and is safe to call twice")
        void disposeTwice() throws IOException {
            var log = open(settings(1 << 20, 1 << 20, 5));
            log.info("pending", null, null);

            log.dispose();
            log.dispose();

            assertTrue(log.isDisposed());
            assertTrue(Files.readString(logFile()).contains("pending"));
        }

        @Test
        @DisplayName("entries recorded after dispose are written immediately")
        void recordAfterDispose() throws IOException {
            var log = open(settings(1 << 20, 1 << 20, 5));
            log.dispose();

            log.info("late", null, null);

            assertTrue(Files.readString(logFile()).contains("late"));
        }

        @Test
        @DisplayName("correlation ids are padded base-36 and increasing")
        void correlationIds() {
            var log = open(settings(1 << 20, 1 << 20, 5));

            assertEquals("00000001", log.nextCorrelationId());
            assertEquals("00000002", log.nextCorrelationId());
        }

        @Test
        @DisplayName("format includes component, correlation id and payload")
        void format() {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("exitCode", 0);
            payload.put("description", null);
            var entry = new LogEntry(NOW, LogLevel.WARN, "Command completed", payload, "0000000a", "CommandExecutor");

            assertEquals("2025-01-15T10:30:00Z [WARN] [CommandExecutor] (0000000a) Command completed "
                    + "{\"exitCode\":0,\"description\":null}\n", AuditLog.format(entry));
        }

        @Test
        @DisplayName("a disabled log never touches disk")
        void disabled() {
            auditLog = AuditLog.discarding();

            auditLog.error("boom", null, null);
            auditLog.flush();

            assertEquals(0, auditLog.stats().bufferedEntries());
            assertNull(auditLog.stats().path());
        }
    }
}
