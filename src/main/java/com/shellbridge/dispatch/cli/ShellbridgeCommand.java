package com.shellbridge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for shellbridge.
 * Routes to subcommands: exec, batch, health, stats.
 */
@Command(
        name = "shellbridge",
        mixinStandardHelpOptions = true,
        version = "shellbridge 0.1.0",
        description = "Cross-shell command execution engine",
        subcommands = {
                ExecCommand.class,
                BatchCommand.class,
                HealthCommand.class,
                StatsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ShellbridgeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
