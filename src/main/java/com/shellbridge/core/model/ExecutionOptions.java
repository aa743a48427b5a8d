package com.shellbridge.core.model;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call execution settings.
 *
 * @param timeoutMillis    timeout in milliseconds; null means the engine default
 * @param workingDirectory directory the child starts in; null means the current directory
 * @param extraEnvironment variables merged over the ambient environment
 * @param description      human description recorded in the audit log, nullable
 * @param shellOverride    forces the backend when non-null
 * @param outputEncoding   charset used to decode captured stdout/stderr
 */
public record ExecutionOptions(
    Long timeoutMillis,
    Path workingDirectory,
    Map<String, String> extraEnvironment,
    String description,
    BackendKind shellOverride,
    Charset outputEncoding
) {

    public ExecutionOptions {
        if (timeoutMillis != null && timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis must be positive: " + timeoutMillis);
        }
        extraEnvironment = extraEnvironment == null ? Map.of() : Map.copyOf(extraEnvironment);
        extraEnvironment.forEach(ExecutionOptions::checkVariable);
        outputEncoding = outputEncoding == null ? StandardCharsets.UTF_8 : outputEncoding;
    }

    /**
     * Names must be non-empty without '=' or NUL; values must not contain NUL.
     */
    private static void checkVariable(String name, String value) {
        if (name.isEmpty() || name.indexOf('=') >= 0 || name.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Invalid environment variable name: \"" + name + "\"");
        }
        if (value.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Environment variable " + name + " must not contain NUL");
        }
    }

    public static ExecutionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public long effectiveTimeoutMillis(long defaultTimeoutMillis) {
        return timeoutMillis != null ? timeoutMillis : defaultTimeoutMillis;
    }

    public Builder toBuilder() {
        var b = new Builder()
                .timeoutMillis(timeoutMillis)
                .workingDirectory(workingDirectory)
                .description(description)
                .shellOverride(shellOverride)
                .outputEncoding(outputEncoding);
        b.env.putAll(extraEnvironment);
        return b;
    }

    public static final class Builder {
        private Long timeoutMillis;
        private Path workingDirectory;
        private final Map<String, String> env = new LinkedHashMap<>();
        private String description;
        private BackendKind shellOverride;
        private Charset outputEncoding;

        private Builder() {}

        public Builder timeoutMillis(Long timeoutMillis) { this.timeoutMillis = timeoutMillis; return this; }
        public Builder workingDirectory(Path workingDirectory) { this.workingDirectory = workingDirectory; return this; }
        public Builder env(String name, String value) { this.env.put(name, value); return this; }
        public Builder env(Map<String, String> variables) { this.env.putAll(variables); return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder shellOverride(BackendKind shellOverride) { this.shellOverride = shellOverride; return this; }
        public Builder outputEncoding(Charset outputEncoding) { this.outputEncoding = outputEncoding; return this; }

        public ExecutionOptions build() {
            return new ExecutionOptions(timeoutMillis, workingDirectory, env, description, shellOverride, outputEncoding);
        }
    }
}
