package com.shellbridge.dispatch.cli;

import com.shellbridge.core.model.BackendKind;
import com.shellbridge.core.model.ExecutionOptions;
import picocli.CommandLine.Option;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options shared by {@code exec} and {@code batch}.
 */
public class ExecutionOptionsMixin {

    @Option(names = {"--timeout", "-t"}, description = "Timeout in milliseconds (default: engine default)")
    Long timeoutMillis;

    @Option(names = "--cwd", description = "Working directory")
    Path workingDirectory;

    @Option(names = {"--env", "-e"}, description = "Extra environment variable, K=V (repeatable)")
    Map<String, String> environment = new LinkedHashMap<>();

    @Option(names = "--shell", description = "Force backend: console|cmd|sh, powershell|pwsh, wsl|bash")
    String shell;

    @Option(names = {"--description", "-d"}, description = "Description recorded in the audit log")
    String description;

    @Option(names = "--encoding", description = "Output charset (default: ${DEFAULT-VALUE})", defaultValue = "UTF-8")
    String encoding;

    /**
     * @throws IllegalArgumentException for an unknown shell token, charset or non-positive timeout
     */
    ExecutionOptions toOptions() {
        return ExecutionOptions.builder()
                .timeoutMillis(timeoutMillis)
                .workingDirectory(workingDirectory)
                .env(environment)
                .shellOverride(shell == null ? null : BackendKind.fromToken(shell))
                .description(description)
                .outputEncoding(Charset.forName(encoding))
                .build();
    }
}
