package com.shellbridge.core.shell;

import com.shellbridge.core.model.BackendKind;

import java.util.List;
import java.util.Objects;

/**
 * Executable and fixed arguments for each backend.
 * <p>
 * The classifier only decides <em>which</em> backend; the catalog decides
 * <em>what</em> that backend is on the current host.
 */
public record ShellCatalog(Shell console, Shell powershell, Shell subsystem) {

    /**
     * One backend's executable and the arguments that precede the command text.
     */
    public record Shell(String executable, List<String> prefixArgs) {
        public Shell {
            Objects.requireNonNull(executable, "executable");
            prefixArgs = List.copyOf(prefixArgs);
        }

        public Shell withExecutable(String replacement) {
            return replacement == null || replacement.isBlank() ? this : new Shell(replacement, prefixArgs);
        }
    }

    public ShellCatalog {
        Objects.requireNonNull(console, "console");
        Objects.requireNonNull(powershell, "powershell");
        Objects.requireNonNull(subsystem, "subsystem");
    }

    public static ShellCatalog windows() {
        return new ShellCatalog(
                new Shell("cmd.exe", List.of("/c")),
                new Shell("powershell.exe", List.of("-NoProfile", "-Command")),
                new Shell("wsl.exe", List.of("--", "bash", "-c")));
    }

    public static ShellCatalog posix() {
        return new ShellCatalog(
                new Shell("sh", List.of("-c")),
                new Shell("pwsh", List.of("-NoProfile", "-Command")),
                new Shell("bash", List.of("-c")));
    }

    public static ShellCatalog forOs(String osName) {
        return isWindows(osName) ? windows() : posix();
    }

    public static boolean isWindows(String osName) {
        return osName != null && osName.toLowerCase().startsWith("windows");
    }

    public Shell shellFor(BackendKind backend) {
        return switch (backend) {
            case CONSOLE -> console;
            case POWERSHELL -> powershell;
            case POSIX_SUBSYSTEM -> subsystem;
        };
    }

    /**
     * Text that launches the PowerShell backend with the command flag, ready to
     * be followed by a script. Used when rewriting bare {@code pwsh} invocations.
     */
    public String powershellInvocation() {
        return powershell.executable() + " " + String.join(" ", powershell.prefixArgs()) + " ";
    }

    public ShellCatalog withOverrides(String consoleExe, String powershellExe, String subsystemExe) {
        return new ShellCatalog(
                console.withExecutable(consoleExe),
                powershell.withExecutable(powershellExe),
                subsystem.withExecutable(subsystemExe));
    }
}
