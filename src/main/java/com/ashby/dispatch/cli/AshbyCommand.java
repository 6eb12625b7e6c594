package com.ashby.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Ashby.
 * Routes to subcommands: acquire, status, health, serve.
 */
@Command(
        name = "ashby",
        mixinStandardHelpOptions = true,
        version = "Ashby 0.1.0",
        description = "Acquires missing capabilities by installing and supervising MCP server plugins",
        subcommands = {
                AcquireCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AshbyCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
