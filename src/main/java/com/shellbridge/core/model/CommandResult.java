package com.shellbridge.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one execution. Exactly one of {@link Success} or {@link Failure};
 * only a failure carries an {@link ExecutionError}.
 */
public sealed interface CommandResult permits CommandResult.Success, CommandResult.Failure {

    /** Command text as executed (normalized), or the raw input when it never got that far. */
    String command();

    /** Backend that ran the command; null when no plan was resolved. */
    BackendKind backend();

    String stdout();

    String stderr();

    int exitCode();

    Duration duration();

    Instant timestamp();

    boolean success();

    default Optional<ExecutionError> error() {
        return Optional.empty();
    }

    record Success(
        String command,
        BackendKind backend,
        String stdout,
        String stderr,
        Duration duration,
        Instant timestamp
    ) implements CommandResult {

        @Override
        public int exitCode() {
            return 0;
        }

        @Override
        public boolean success() {
            return true;
        }
    }

    record Failure(
        String command,
        BackendKind backend,
        String stdout,
        String stderr,
        int exitCode,
        Duration duration,
        Instant timestamp,
        ExecutionError executionError
    ) implements CommandResult {

        public Failure {
            Objects.requireNonNull(executionError, "executionError");
        }

        @Override
        public boolean success() {
            return false;
        }

        @Override
        public Optional<ExecutionError> error() {
            return Optional.of(executionError);
        }
    }

    /**
     * Failure raised before any process existed (validation, admission, spawn).
     */
    static Failure rejected(String command, BackendKind backend, ExecutionError error, Duration duration) {
        return new Failure(command, backend, "", error.message(), -1, duration, Instant.now(), error);
    }
}
