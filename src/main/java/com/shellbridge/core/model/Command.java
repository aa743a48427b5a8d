package com.shellbridge.core.model;

import java.util.Optional;

/**
 * The exact text to run. Never empty or blank, never contains NUL.
 *
 * @param text the command text
 */
public record Command(String text) {

    public Command {
        problem(text).ifPresent(p -> {
            throw new IllegalArgumentException(p);
        });
    }

    /**
     * Checks a raw string against the command invariants without throwing.
     *
     * @return a description of the first violated invariant, or empty when valid
     */
    public static Optional<String> problem(String raw) {
        if (raw == null) {
            return Optional.of("Command must not be null");
        }
        if (raw.isBlank()) {
            return Optional.of("Command must not be empty or blank");
        }
        if (raw.indexOf('\0') >= 0) {
            return Optional.of("Command must not contain NUL bytes");
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return text;
    }
}
