package com.shellbridge.core.model;

/**
 * Shell families a command can be routed to.
 * <p>
 * CONSOLE: the platform's native command interpreter (cmd.exe, sh).
 * POWERSHELL: a PowerShell-family shell, always started without the user profile.
 * POSIX_SUBSYSTEM: a POSIX shell reached through a subsystem bridge (WSL on Windows).
 */
public enum BackendKind {
    CONSOLE,
    POWERSHELL,
    POSIX_SUBSYSTEM;

    /**
     * Parses a user-supplied backend token. Accepts enum names and the short
     * aliases used on the command line ({@code cmd}, {@code sh}, {@code pwsh},
     * {@code powershell}, {@code wsl}, {@code bash}).
     *
     * @throws IllegalArgumentException for unknown tokens
     */
    public static BackendKind fromToken(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Backend token must not be blank");
        }
        return switch (token.trim().toLowerCase()) {
            case "console", "cmd", "sh" -> CONSOLE;
            case "powershell", "pwsh" -> POWERSHELL;
            case "posix_subsystem", "posix-subsystem", "wsl", "bash" -> POSIX_SUBSYSTEM;
            default -> throw new IllegalArgumentException("Unknown backend: " + token);
        };
    }
}
