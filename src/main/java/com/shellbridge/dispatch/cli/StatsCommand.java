package com.shellbridge.dispatch.cli;

import com.shellbridge.core.audit.AuditLog;
import com.shellbridge.core.engine.CommandExecutor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI command: shellbridge stats [--warmup &lt;command&gt;]...
 * <p>
 * Optionally runs warm-up commands, then prints engine statistics: pool counters,
 * performance metrics, cache sizes and audit buffer state.
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show engine statistics")
@Component
public class StatsCommand implements Runnable {

    @Option(names = {"--warmup", "-w"}, description = "Command to run before collecting stats (repeatable)")
    private List<String> warmup = new ArrayList<>();

    @Option(names = "--json", description = "Print one JSON line instead of a table")
    private boolean json;

    private final CommandExecutor executor;
    private final AuditLog auditLog;

    public StatsCommand(CommandExecutor executor, AuditLog auditLog) {
        this.executor = executor;
        this.auditLog = auditLog;
    }

    @Override
    public void run() {
        for (String command : warmup) {
            executor.run(command);
        }

        var pool = executor.pool().stats();
        var metrics = executor.metrics();
        var audit = auditLog.stats();

        if (json) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("pool", Map.of("active", pool.active(), "max", pool.max(), "peak", pool.peak()));
            out.put("performance", Map.of(
                    "commandsExecuted", metrics.commandsExecuted(),
                    "totalDurationMs", metrics.totalDuration().toMillis(),
                    "averageDurationMs", metrics.averageDuration().toMillis(),
                    "successRate", metrics.successRate(),
                    "lastReset", metrics.lastReset().toString()));
            out.put("cache", Map.of(
                    "classifier", executor.classifier().cacheSize(),
                    "normalizer", executor.normalizer().cacheSize()));
            var auditOut = new LinkedHashMap<String, Object>();
            auditOut.put("bufferedEntries", audit.bufferedEntries());
            auditOut.put("bufferedBytes", audit.bufferedBytes());
            auditOut.put("lastFlush", audit.lastFlush().toString());
            auditOut.put("path", audit.path() == null ? null : audit.path().toString());
            out.put("audit", auditOut);
            ConsoleOutput.json(ResultJson.write(out));
            return;
        }

        ConsoleOutput.printBanner();
        ConsoleOutput.info(String.format("Pool: %d active / %d max (peak %d)", pool.active(), pool.max(), pool.peak()));
        ConsoleOutput.info(String.format("Caches: classifier %d/%d, normalizer %d",
                executor.classifier().cacheSize(), executor.classifier().cacheCapacity(),
                executor.normalizer().cacheSize()));
        ConsoleOutput.info(String.format("Audit: %d buffered entries (%d bytes) -> %s",
                audit.bufferedEntries(), audit.bufferedBytes(), audit.path() == null ? "disabled" : audit.path()));
        ConsoleOutput.metrics(metrics);
    }
}
