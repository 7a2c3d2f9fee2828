package com.squadron.dispatch.cli;

import com.squadron.agent.AgentOutput;
import com.squadron.workspace.multirepo.PullRequestOutcome;
import com.squadron.workspace.multirepo.RepoCommitResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Squadron CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SQUADRON v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SQUADRON]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void repo(String name, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) [" + name + "]|@ ") + message);
    }

    /** Worker text is printed verbatim after a styled tag so it is never read as markup. */
    public static void agentOutput(AgentOutput chunk) {
        String tag = switch (chunk.type()) {
            case TOOL_USE -> "@|fg(blue) [TOOL]|@";
            case TOOL_RESULT -> "@|faint [RESULT]|@";
            case ERROR -> "@|fg(red) [ERROR]|@";
            case COST -> "@|fg(yellow) [COST]|@";
            case SYSTEM -> "@|faint [SYSTEM]|@";
            case TEXT -> "@|fg(blue) [AGENT]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(tag) + " " + chunk.content());
    }

    public static void commitResult(RepoCommitResult result) {
        if (result.succeeded()) {
            repo(result.repoName(), "committed " + result.commitHash());
        } else {
            repo(result.repoName(), "not committed: " + result.error().getMessage());
        }
    }

    public static void pullRequest(PullRequestOutcome outcome) {
        if (outcome.succeeded()) {
            repo(outcome.repoName(), "PR #" + outcome.pullRequest().number() + " " + outcome.pullRequest().url());
        } else {
            repo(outcome.repoName(), "PR failed: " + outcome.error());
        }
    }
}
