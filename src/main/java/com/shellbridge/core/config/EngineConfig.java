package com.shellbridge.core.config;

import com.shellbridge.core.audit.AuditLog;
import com.shellbridge.core.audit.AuditSettings;
import com.shellbridge.core.engine.CommandExecutor;
import com.shellbridge.core.engine.ExecutionSettings;
import com.shellbridge.core.metrics.ShellbridgeMetrics;
import com.shellbridge.core.pool.ProcessPool;
import com.shellbridge.core.scheduler.BatchRunner;
import com.shellbridge.core.security.CommandSafetyPolicy;
import com.shellbridge.core.shell.CommandNormalizer;
import com.shellbridge.core.shell.ShellCatalog;
import com.shellbridge.core.shell.ShellClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires the execution engine from {@link ShellbridgeProperties}. Shutdown of the
 * pool and audit log is owned by {@link EngineLifecycle}, so beans here declare no
 * destroy methods.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public ShellCatalog shellCatalog(ShellbridgeProperties properties) {
        ShellCatalog catalog = resolveCatalog(properties.getShells(), System.getProperty("os.name"));
        log.info("Shell catalog: console={}, powershell={}, subsystem={}",
                catalog.console().executable(), catalog.powershell().executable(),
                catalog.subsystem().executable());
        return catalog;
    }

    @Bean
    public ShellClassifier shellClassifier(ShellCatalog catalog, ShellbridgeProperties properties) {
        return new ShellClassifier(catalog, properties.getCache().getClassifierCapacity());
    }

    @Bean
    public CommandNormalizer commandNormalizer(ShellCatalog catalog, ShellbridgeProperties properties) {
        boolean rewrite = rewriteDrivePaths(properties.getShells(), System.getProperty("os.name"));
        return new CommandNormalizer(catalog.powershellInvocation(), rewrite,
                properties.getCache().getNormalizerCapacity());
    }

    @Bean(destroyMethod = "")
    public ProcessPool processPool(ShellbridgeProperties properties) {
        return new ProcessPool(properties.getPool().getMaxConcurrent());
    }

    @Bean(destroyMethod = "")
    public AuditLog auditLog(ShellbridgeProperties properties) {
        return new AuditLog(auditSettings(properties.getAudit()));
    }

    @Bean
    public ExecutionSettings executionSettings(ShellbridgeProperties properties) {
        var execution = properties.getExecution();
        return new ExecutionSettings(
                Duration.ofMillis(execution.getDefaultTimeoutMs()),
                Duration.ofMillis(execution.getGracePeriodMs()),
                Duration.ofMillis(execution.getPollIntervalMs()),
                execution.getMaxOutputBytes());
    }

    @Bean(destroyMethod = "")
    public CommandExecutor commandExecutor(CommandNormalizer normalizer, ShellClassifier classifier,
                                           ProcessPool pool, AuditLog auditLog,
                                           CommandSafetyPolicy safetyPolicy, ExecutionSettings settings,
                                           @Autowired(required = false) ShellbridgeMetrics metrics) {
        if (metrics != null) {
            metrics.bindPool(pool);
        }
        return new CommandExecutor(normalizer, classifier, pool, auditLog, safetyPolicy, metrics, settings);
    }

    @Bean(destroyMethod = "")
    public BatchRunner batchRunner(CommandExecutor executor,
                                   @Autowired(required = false) ShellbridgeMetrics metrics) {
        return new BatchRunner(executor, metrics);
    }

    static ShellCatalog resolveCatalog(ShellbridgeProperties.Shells shells, String osName) {
        ShellCatalog base = switch (profile(shells)) {
            case "windows" -> ShellCatalog.windows();
            case "posix" -> ShellCatalog.posix();
            case "auto" -> ShellCatalog.forOs(osName);
            default -> throw new IllegalArgumentException(
                    "shellbridge.shells.profile must be auto, windows or posix: " + shells.getProfile());
        };
        return base.withOverrides(shells.getConsole(), shells.getPowershell(), shells.getSubsystem());
    }

    /**
     * Drive-path rewriting defaults to on for the windows profile and off for posix.
     */
    static boolean rewriteDrivePaths(ShellbridgeProperties.Shells shells, String osName) {
        if (shells.getRewriteDrivePaths() != null) {
            return shells.getRewriteDrivePaths();
        }
        return switch (profile(shells)) {
            case "windows" -> true;
            case "posix" -> false;
            default -> ShellCatalog.isWindows(osName);
        };
    }

    static AuditSettings auditSettings(ShellbridgeProperties.Audit audit) {
        if (!audit.isEnabled()) {
            return AuditSettings.disabled();
        }
        return new AuditSettings(true, Path.of(audit.getPath()), audit.getBufferBytes(),
                Duration.ofMillis(audit.getFlushIntervalMs()), audit.getMaxFileBytes(),
                audit.getRetention(), audit.getMinLevel());
    }

    private static String profile(ShellbridgeProperties.Shells shells) {
        return shells.getProfile() == null ? "auto" : shells.getProfile().trim().toLowerCase();
    }
}
