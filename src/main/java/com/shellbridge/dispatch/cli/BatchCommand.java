package com.shellbridge.dispatch.cli;

import com.shellbridge.core.model.CommandResult;
import com.shellbridge.core.model.ExecutionOptions;
import com.shellbridge.core.scheduler.BatchRunner;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: shellbridge batch [--file &lt;path&gt;] [command...]
 * <p>
 * Runs commands in pool-sized waves and prints one JSON line per command, in
 * input order. File input skips blank lines and {@code #} comments; arguments
 * are taken as given.
 */
@Command(name = "batch", mixinStandardHelpOptions = true, description = "Execute commands in bounded waves")
@Component
public class BatchCommand implements Callable<Integer> {

    @Parameters(arity = "0..*", description = "Commands, one per argument")
    private List<String> commands = new ArrayList<>();

    @Option(names = {"--file", "-f"}, description = "Read commands from a file, one per line")
    private Path file;

    @Mixin
    private ExecutionOptionsMixin execution;

    private final BatchRunner batchRunner;

    public BatchCommand(BatchRunner batchRunner) {
        this.batchRunner = batchRunner;
    }

    @Override
    public Integer call() {
        ExecutionOptions options;
        List<String> all;
        try {
            options = execution.toOptions();
            all = collectCommands();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 2;
        }
        if (all.isEmpty()) {
            ConsoleOutput.error("No commands given");
            return 2;
        }

        List<CommandResult> results = batchRunner.runBatch(all, options);
        boolean allPassed = true;
        for (CommandResult result : results) {
            ConsoleOutput.json(ResultJson.toJson(result));
            allPassed &= result.success();
        }
        return allPassed ? 0 : 1;
    }

    private List<String> collectCommands() throws IOException {
        var all = new ArrayList<String>();
        if (file != null) {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.strip();
                if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                    all.add(line);
                }
            }
        }
        all.addAll(commands);
        return all;
    }
}
