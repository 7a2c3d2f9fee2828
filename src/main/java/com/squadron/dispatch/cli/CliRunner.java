package com.squadron.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree inside the Spring Boot lifecycle and hands its exit code
 * back to {@link com.squadron.SquadronApplication}.
 *
 * <p>Exceptions escaping a command are printed as a single error line and exit with 1;
 * the stack trace goes to the debug log.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_FAILURE = 1;

    private final SquadronCommand squadronCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SquadronCommand squadronCommand, IFactory factory) {
        this.squadronCommand = squadronCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
    }

    CommandLine commandLine() {
        return new CommandLine(squadronCommand, factory)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    log.debug("Command '{}' failed", cmd.getCommandName(), e);
                    ConsoleOutput.error(cmd.getCommandName() + " failed: " + e.getMessage());
                    return EXIT_FAILURE;
                });
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
