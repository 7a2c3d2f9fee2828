package com.squadron.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Squadron.
 * Routes to subcommands: start, validate.
 */
@Command(
        name = "squadron",
        mixinStandardHelpOptions = true,
        version = "Squadron 0.1.0",
        description = "Runs coding agents in isolated git worktrees across repositories",
        subcommands = {
                StartCommand.class,
                ValidateCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SquadronCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
