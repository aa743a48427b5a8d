package com.shellbridge.core.scheduler;

import com.shellbridge.core.audit.AuditLog;
import com.shellbridge.core.engine.CancellationToken;
import com.shellbridge.core.engine.CommandExecutor;
import com.shellbridge.core.engine.ExecutionSettings;
import com.shellbridge.core.metrics.ShellbridgeMetrics;
import com.shellbridge.core.model.BackendKind;
import com.shellbridge.core.model.CommandResult;
import com.shellbridge.core.model.ErrorCategory;
import com.shellbridge.core.model.ErrorCode;
import com.shellbridge.core.model.ExecutionError;
import com.shellbridge.core.model.ExecutionOptions;
import com.shellbridge.core.pool.ProcessPool;
import com.shellbridge.core.security.CommandSafetyPolicy;
import com.shellbridge.core.shell.CommandNormalizer;
import com.shellbridge.core.shell.ShellCatalog;
import com.shellbridge.core.shell.ShellClassifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BatchRunnerTest {

    private BatchRunner runner;

    @AfterEach
    void tearDown() {
        if (runner != null) {
            runner.shutdown();
        }
    }

    private static CommandResult ok(String command) {
        return new CommandResult.Success(command, BackendKind.CONSOLE, command + "\n", "",
                Duration.ofMillis(1), Instant.now());
    }

    @Nested
    @DisplayName("With a mocked executor")
    class MockedTests {

        private CommandExecutor executor;

        @BeforeEach
        void setUp() {
            executor = mock(CommandExecutor.class);
        }

        @Test
        @DisplayName("results keep input order even when completion order differs")
        void preservesOrder() {
            when(executor.run(any(), any(), any())).thenAnswer(inv -> {
                String command = inv.getArgument(0);
                Thread.sleep(command.equals("slow") ? 150 : 5);
                return ok(command);
            });
            runner = new BatchRunner(executor, 3);

            var results = runner.runBatch(List.of("slow", "fast-1", "fast-2", "fast-3"));

            assertEquals(List.of("slow", "fast-1", "fast-2", "fast-3"),
                    results.stream().map(CommandResult::command).toList());
        }

        @Test
        @DisplayName("an exception from one item becomes an INTERNAL_ERROR failure in its slot")
        void isolatesFaults() {
            when(executor.run(any(), any(), any())).thenAnswer(inv -> {
                String command = inv.getArgument(0);
                if (command.equals("boom")) {
                    throw new IllegalStateException("executor exploded");
                }
                return ok(command);
            });
            runner = new BatchRunner(executor, 2);

            var results = runner.runBatch(List.of("a", "boom", "c"));

            assertEquals(3, results.size());
            assertTrue(results.get(0).success());
            var error = results.get(1).error().orElseThrow();
            assertEquals(ErrorCode.INTERNAL_ERROR, error.code());
            assertEquals(ErrorCategory.INTERNAL, error.category());
            assertTrue(error.message().contains("executor exploded"));
            assertTrue(results.get(2).success());
        }

        @Test
        @DisplayName("no more than the wave size runs at once")
        void boundedFanOut() {
            var inFlight = new AtomicInteger();
            var maxInFlight = new AtomicInteger();
            when(executor.run(any(), any(), any())).thenAnswer(inv -> {
                int now = inFlight.incrementAndGet();
                maxInFlight.accumulateAndGet(now, Math::max);
                Thread.sleep(30);
                inFlight.decrementAndGet();
                return ok(inv.getArgument(0));
            });
            runner = new BatchRunner(executor, 2);

            var results = runner.runBatch(List.of("1", "2", "3", "4", "5"));

            assertEquals(5, results.size());
            assertTrue(maxInFlight.get() <= 2, "max in flight " + maxInFlight.get());
        }

        @Test
        @DisplayName("options and cancellation token are passed to every item")
        void passesOptions() {
            when(executor.run(any(), any(), any())).thenAnswer(inv -> ok(inv.getArgument(0)));
            runner = new BatchRunner(executor, 2);
            var options = ExecutionOptions.builder().timeoutMillis(750L).build();
            var token = new CancellationToken();

            runner.runBatch(List.of("x", "y"), options, token);

            verify(executor).run("x", options, token);
            verify(executor).run("y", options, token);
        }

        @Test
        @DisplayName("each wave is recorded in metrics")
        void waveMetrics() {
            when(executor.run(any(), any(), any())).thenAnswer(inv -> ok(inv.getArgument(0)));
            var registry = new SimpleMeterRegistry();
            runner = new BatchRunner(executor, 2, new ShellbridgeMetrics(registry));

            runner.runBatch(List.of("1", "2", "3", "4", "5"));

            assertEquals(3.0, registry.find("shellbridge.batch.waves").counter().count());
        }

        @Test
        @DisplayName("wave size defaults to the pool bound")
        void waveSizeFromPool() {
            when(executor.pool()).thenReturn(new ProcessPool(7));
            runner = new BatchRunner(executor, (ShellbridgeMetrics) null);
            assertEquals(7, runner.waveSize());
        }

        @Test
        @DisplayName("an empty batch returns an empty list")
        void emptyBatch() {
            runner = new BatchRunner(executor, 2);
            assertTrue(runner.runBatch(List.of()).isEmpty());
            verifyNoInteractions(executor);
        }
    }

    @Test
    @DisplayName("partition splits into consecutive groups")
    void partition() {
        var waves = BatchRunner.partition(List.of("a", "b", "c", "d", "e"), 2);
        assertEquals(List.of(List.of("a", "b"), List.of("c", "d"), List.of("e")), waves);
    }

    @Test
    @DisplayName("validation failures from the executor stay in place")
    void validationInPlace() {
        var executor = mock(CommandExecutor.class);
        when(executor.run(any(), any(), any())).thenAnswer(inv -> {
            String command = inv.getArgument(0);
            if (command.isBlank()) {
                return CommandResult.rejected(command, null, ExecutionError.invalidCommand("blank"), Duration.ZERO);
            }
            return ok(command);
        });
        runner = new BatchRunner(executor, 2);

        var results = runner.runBatch(List.of("echo a", "", "echo b"));

        assertEquals(3, results.size());
        assertTrue(results.get(0).success());
        assertEquals(ErrorCategory.VALIDATION, results.get(1).error().orElseThrow().category());
        assertTrue(results.get(2).success());
    }

    @Test
    @DisplayName("real processes: [echo a, '', echo b] with pool size 2")
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void realBatch() {
        var catalog = ShellCatalog.posix();
        var pool = new ProcessPool(2);
        var executor = new CommandExecutor(
                new CommandNormalizer(catalog.powershellInvocation(), false),
                new ShellClassifier(catalog), pool, AuditLog.discarding(),
                CommandSafetyPolicy.defaults(), null, ExecutionSettings.defaults());
        try {
            runner = new BatchRunner(executor, null);

            var results = runner.runBatch(new ArrayList<>(List.of("echo a", "", "echo b")));

            assertEquals(3, results.size());
            assertTrue(results.get(0).success());
            assertEquals("a\n", results.get(0).stdout());
            assertEquals(ErrorCode.INVALID_COMMAND, results.get(1).error().orElseThrow().code());
            assertTrue(results.get(2).success());
            assertEquals("b\n", results.get(2).stdout());
        } finally {
            executor.shutdown();
        }
    }
}
