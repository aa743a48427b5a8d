package com.shellbridge.dispatch.cli;

import com.shellbridge.core.engine.CommandExecutor;
import com.shellbridge.core.model.CommandResult;
import com.shellbridge.core.model.ErrorCode;
import com.shellbridge.core.model.ExecutionOptions;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: shellbridge exec &lt;command...&gt;
 * <p>
 * Runs one command and prints its result as a JSON line. The exit code is the
 * child's own exit code when it ran and failed, 1 for any other failure.
 */
@Command(name = "exec", mixinStandardHelpOptions = true, description = "Execute one command")
@Component
public class ExecCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Command text (joined with spaces)")
    private List<String> commandParts;

    @Mixin
    private ExecutionOptionsMixin execution;

    private final CommandExecutor executor;

    public ExecCommand(CommandExecutor executor) {
        this.executor = executor;
    }

    @Override
    public Integer call() {
        ExecutionOptions options;
        try {
            options = execution.toOptions();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        CommandResult result = executor.run(String.join(" ", commandParts), options);
        ConsoleOutput.json(ResultJson.toJson(result));
        return exitCodeFor(result);
    }

    static int exitCodeFor(CommandResult result) {
        if (result.success()) {
            return 0;
        }
        boolean childExit = result.error().map(e -> e.code() == ErrorCode.NON_ZERO_EXIT).orElse(false);
        return childExit && result.exitCode() > 0 && result.exitCode() < 256 ? result.exitCode() : 1;
    }
}
