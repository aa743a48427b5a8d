package com.shellbridge.core.model;

import java.util.Objects;

/**
 * Tagged error carried by a {@link CommandResult.Failure}.
 *
 * @param code    machine-readable code; determines the category
 * @param message human-readable description
 * @param cause   underlying exception (e.g. the OS error behind a spawn failure), nullable
 */
public record ExecutionError(ErrorCode code, String message, Throwable cause) {

    public ExecutionError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    public ExecutionError(ErrorCode code, String message) {
        this(code, message, null);
    }

    public ErrorCategory category() {
        return code.category();
    }

    public static ExecutionError invalidCommand(String problem) {
        return new ExecutionError(ErrorCode.INVALID_COMMAND, problem);
    }

    public static ExecutionError dangerousCommand(String pattern) {
        return new ExecutionError(ErrorCode.DANGEROUS_COMMAND, "Dangerous command pattern detected: " + pattern);
    }

    public static ExecutionError spawnFailed(Throwable cause) {
        return new ExecutionError(ErrorCode.SPAWN_FAILED, "Failed to spawn process: " + cause.getMessage(), cause);
    }

    public static ExecutionError timeout(long timeoutMillis) {
        return new ExecutionError(ErrorCode.TIMEOUT, "Command timed out after " + timeoutMillis + "ms");
    }

    public static ExecutionError cancelled() {
        return new ExecutionError(ErrorCode.CANCELLED, "Command was cancelled");
    }

    public static ExecutionError poolExhausted(int maxConcurrent) {
        return new ExecutionError(ErrorCode.POOL_EXHAUSTED,
                "Too many concurrent processes (max " + maxConcurrent + ")");
    }

    public static ExecutionError nonZeroExit(int exitCode) {
        return new ExecutionError(ErrorCode.NON_ZERO_EXIT, "Process exited with code " + exitCode);
    }

    public static ExecutionError internal(Throwable cause) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ExecutionError(ErrorCode.INTERNAL_ERROR, "Unexpected execution fault: " + detail, cause);
    }
}
