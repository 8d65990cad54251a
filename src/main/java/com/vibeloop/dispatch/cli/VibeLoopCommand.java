package com.vibeloop.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: serve, runs, log.
 */
@Command(
        name = "vibeloop",
        mixinStandardHelpOptions = true,
        version = "Vibe Loop 0.1.0",
        description = "Code/vision iteration loop with live event streaming",
        subcommands = {
                ServeCommand.class,
                RunsCommand.class,
                LogCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class VibeLoopCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
