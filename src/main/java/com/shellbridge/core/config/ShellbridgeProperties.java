package com.shellbridge.core.config;

import com.shellbridge.core.model.LogLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "shellbridge")
public class ShellbridgeProperties {

    private Pool pool = new Pool();
    private Execution execution = new Execution();
    private Cache cache = new Cache();
    private Audit audit = new Audit();
    private Shells shells = new Shells();

    public Pool getPool() {
        return pool;
    }

    public void setPool(Pool pool) {
        this.pool = pool;
    }

    public Execution getExecution() {
        return execution;
    }

    public void setExecution(Execution execution) {
        this.execution = execution;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Audit getAudit() {
        return audit;
    }

    public void setAudit(Audit audit) {
        this.audit = audit;
    }

    public Shells getShells() {
        return shells;
    }

    public void setShells(Shells shells) {
        this.shells = shells;
    }

    public static class Pool {
        private int maxConcurrent = 10;

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }
    }

    public static class Execution {
        private long defaultTimeoutMs = 120_000;
        private long gracePeriodMs = 5_000;
        private long pollIntervalMs = 50;
        private long maxOutputBytes = 10L * 1024 * 1024;

        public long getDefaultTimeoutMs() {
            return defaultTimeoutMs;
        }

        public void setDefaultTimeoutMs(long defaultTimeoutMs) {
            this.defaultTimeoutMs = defaultTimeoutMs;
        }

        public long getGracePeriodMs() {
            return gracePeriodMs;
        }

        public void setGracePeriodMs(long gracePeriodMs) {
            this.gracePeriodMs = gracePeriodMs;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getMaxOutputBytes() {
            return maxOutputBytes;
        }

        public void setMaxOutputBytes(long maxOutputBytes) {
            this.maxOutputBytes = maxOutputBytes;
        }
    }

    public static class Cache {
        private int classifierCapacity = 500;
        private int normalizerCapacity = 1000;

        public int getClassifierCapacity() {
            return classifierCapacity;
        }

        public void setClassifierCapacity(int classifierCapacity) {
            this.classifierCapacity = classifierCapacity;
        }

        public int getNormalizerCapacity() {
            return normalizerCapacity;
        }

        public void setNormalizerCapacity(int normalizerCapacity) {
            this.normalizerCapacity = normalizerCapacity;
        }
    }

    public static class Audit {
        private boolean enabled = true;
        private String path = System.getProperty("user.home") + "/.shellbridge/logs/shellbridge.log";
        private long bufferBytes = 64 * 1024;
        private long flushIntervalMs = 5_000;
        private long maxFileBytes = 50L * 1024 * 1024;
        private int retention = 5;
        private LogLevel minLevel = LogLevel.INFO;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public long getBufferBytes() {
            return bufferBytes;
        }

        public void setBufferBytes(long bufferBytes) {
            this.bufferBytes = bufferBytes;
        }

        public long getFlushIntervalMs() {
            return flushIntervalMs;
        }

        public void setFlushIntervalMs(long flushIntervalMs) {
            this.flushIntervalMs = flushIntervalMs;
        }

        public long getMaxFileBytes() {
            return maxFileBytes;
        }

        public void setMaxFileBytes(long maxFileBytes) {
            this.maxFileBytes = maxFileBytes;
        }

        public int getRetention() {
            return retention;
        }

        public void setRetention(int retention) {
            this.retention = retention;
        }

        public LogLevel getMinLevel() {
            return minLevel;
        }

        public void setMinLevel(LogLevel minLevel) {
            this.minLevel = minLevel;
        }
    }

    /**
     * Backend executables. {@code profile} picks the base catalog ({@code auto}
     * follows {@code os.name}); the per-backend entries override single executables.
     */
    public static class Shells {
        private String profile = "auto";
        private String console;
        private String powershell;
        private String subsystem;
        private Boolean rewriteDrivePaths;

        public String getProfile() {
            return profile;
        }

        public void setProfile(String profile) {
            this.profile = profile;
        }

        public String getConsole() {
            return console;
        }

        public void setConsole(String console) {
            this.console = console;
        }

        public String getPowershell() {
            return powershell;
        }

        public void setPowershell(String powershell) {
            this.powershell = powershell;
        }

        public String getSubsystem() {
            return subsystem;
        }

        public void setSubsystem(String subsystem) {
            this.subsystem = subsystem;
        }

        public Boolean getRewriteDrivePaths() {
            return rewriteDrivePaths;
        }

        public void setRewriteDrivePaths(Boolean rewriteDrivePaths) {
            this.rewriteDrivePaths = rewriteDrivePaths;
        }
    }
}
