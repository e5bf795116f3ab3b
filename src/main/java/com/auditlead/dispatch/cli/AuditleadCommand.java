package com.auditlead.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Auditlead.
 * Routes to subcommands: run, agents.
 */
@Command(
        name = "auditlead",
        mixinStandardHelpOptions = true,
        version = "Auditlead 0.1.0",
        description = "Multi-agent website audit orchestrator",
        subcommands = {
                RunCommand.class,
                AgentsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AuditleadCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
