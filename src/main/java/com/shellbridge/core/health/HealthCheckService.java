package com.shellbridge.core.health;

import com.shellbridge.core.engine.CommandExecutor;
import com.shellbridge.core.health.BackendHealth.Availability;
import com.shellbridge.core.model.BackendKind;
import com.shellbridge.core.model.CommandResult;
import com.shellbridge.core.model.ErrorCategory;
import com.shellbridge.core.model.ExecutionError;
import com.shellbridge.core.model.ExecutionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Probes each shell backend by running a trivial command through the executor
 * with the backend forced.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    static final long PROBE_TIMEOUT_MS = 10_000;

    private static final Map<BackendKind, String> PROBES = Map.of(
            BackendKind.CONSOLE, "echo ok",
            BackendKind.POWERSHELL, "$PSVersionTable.PSVersion.ToString()",
            BackendKind.POSIX_SUBSYSTEM, "uname -sr"
    );

    private final CommandExecutor executor;

    public HealthCheckService(CommandExecutor executor) {
        this.executor = executor;
    }

    public List<BackendHealth> checkAll() {
        var results = new ArrayList<BackendHealth>();
        for (BackendKind backend : BackendKind.values()) {
            results.add(check(backend));
        }
        return results;
    }

    public BackendHealth check(BackendKind backend) {
        String executable = executor.classifier().catalog().shellFor(backend).executable();
        var options = ExecutionOptions.builder()
                .shellOverride(backend)
                .timeoutMillis(PROBE_TIMEOUT_MS)
                .description("health probe: " + backend.name().toLowerCase())
                .build();

        CommandResult result = executor.run(PROBES.get(backend), options);

        if (result.success()) {
            return new BackendHealth(backend, executable, Availability.UP, result.stdout().trim(),
                    result.duration(), null);
        }
        ExecutionError error = result.error().orElseThrow();
        log.warn("Health probe for {} ({}) failed: {}", backend, executable, error.message());
        if (error.category() == ErrorCategory.SPAWN_FAILURE) {
            return new BackendHealth(backend, executable, Availability.DOWN, error.message(),
                    result.duration(), error.code());
        }
        String detail = result.stderr().isBlank() ? error.message() : result.stderr().trim();
        return new BackendHealth(backend, executable, Availability.DEGRADED, detail, result.duration(), error.code());
    }
}
