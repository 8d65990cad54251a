package com.vibeloop.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Runs the {@code vibeloop} command tree once the Spring context is up.
 * <p>
 * Subcommands are created through the Spring-aware {@link IFactory}, so they receive beans such as
 * the event log. The resulting exit code is handed back to {@code SpringApplication.exit}.
 * {@code serve} is left alone: the web server keeps the process alive after this runner returns.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final VibeLoopCommand rootCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(VibeLoopCommand rootCommand, IFactory factory) {
        this.rootCommand = rootCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (Arrays.asList(args).contains("serve")) {
            return;
        }
        exitCode = new CommandLine(rootCommand, factory).execute(args);
        if (exitCode != 0) {
            log.debug("Command {} exited with {}", String.join(" ", args), exitCode);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
