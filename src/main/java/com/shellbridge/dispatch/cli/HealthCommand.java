package com.shellbridge.dispatch.cli;

import com.shellbridge.core.health.BackendHealth;
import com.shellbridge.core.health.HealthCheckService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: shellbridge health
 * <p>
 * Runs one probe per backend. Exits 0 only when every backend is up.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Probe each shell backend")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = "--json", description = "Print one JSON line per backend")
    private boolean json;

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        List<BackendHealth> probes = healthCheckService.checkAll();
        if (json) {
            probes.forEach(probe -> ConsoleOutput.json(ResultJson.write(toMap(probe))));
        } else {
            ConsoleOutput.printBanner();
            probes.forEach(HealthCommand::print);
        }
        long up = probes.stream().filter(BackendHealth::isUp).count();
        if (!json) {
            ConsoleOutput.info(up + "/" + probes.size() + " backends up");
        }
        return up == probes.size() ? 0 : 1;
    }

    private static void print(BackendHealth probe) {
        String line = String.format("%-16s %-22s %6s  %s", probe.name(), probe.executable(),
                ConsoleOutput.formatDuration(probe.probeTime().toMillis()), probe.detail());
        switch (probe.availability()) {
            case UP -> ConsoleOutput.success(line);
            case DEGRADED -> ConsoleOutput.warn(line);
            case DOWN -> ConsoleOutput.error(line);
        }
    }

    static LinkedHashMap<String, Object> toMap(BackendHealth probe) {
        var map = new LinkedHashMap<String, Object>();
        map.put("backend", probe.backend().name());
        map.put("executable", probe.executable());
        map.put("availability", probe.availability().name());
        map.put("detail", probe.detail());
        map.put("probeMs", probe.probeTime().toMillis());
        map.put("error", probe.error() == null ? null : probe.error().name());
        return map;
    }
}
