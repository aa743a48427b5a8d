package com.shellbridge.core.config;

import com.shellbridge.core.audit.AuditLog;
import com.shellbridge.core.engine.CommandExecutor;
import com.shellbridge.core.metrics.ShellbridgeMetrics;
import com.shellbridge.core.pool.ProcessPool;
import com.shellbridge.core.scheduler.BatchRunner;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide shutdown: kills every tracked child and disposes the audit log,
 * exactly once. Runs on context close, which Spring's JVM shutdown hook also
 * triggers on SIGTERM / SIGINT.
 */
@Component
public class EngineLifecycle {

    private static final Logger log = LoggerFactory.getLogger(EngineLifecycle.class);

    private final ProcessPool pool;
    private final AuditLog auditLog;
    private final CommandExecutor executor;
    private final BatchRunner batchRunner;
    private final ShellbridgeMetrics metrics;
    private final AtomicBoolean shutDown = new AtomicBoolean(false);

    public EngineLifecycle(ProcessPool pool, AuditLog auditLog, CommandExecutor executor,
                           BatchRunner batchRunner,
                           @Autowired(required = false) ShellbridgeMetrics metrics) {
        this.pool = pool;
        this.auditLog = auditLog;
        this.executor = executor;
        this.batchRunner = batchRunner;
        this.metrics = metrics;
    }

    @PreDestroy
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        int killed = pool.killAll();
        if (metrics != null && killed > 0) {
            metrics.recordKillAll(killed);
        }
        batchRunner.shutdown();
        executor.shutdown();
        auditLog.dispose();
        log.info("Engine shut down ({} process(es) signalled)", killed);
    }

    public boolean isShutDown() {
        return shutDown.get();
    }
}
