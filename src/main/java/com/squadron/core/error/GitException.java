package com.squadron.core.error;

/**
 * A git command exited non-zero or could not be run.
 */
public class GitException extends RuntimeException {

    private final String command;
    private final int exitCode;
    private final String stderr;

    public GitException(String command, int exitCode, String stderr) {
        super("Git command failed (exit code %d): %s%s".formatted(
                exitCode, command, stderr == null || stderr.isBlank() ? "" : ": " + stderr));
        this.command = command;
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public GitException(String command, Throwable cause) {
        super("Git command failed: " + command, cause);
        this.command = command;
        this.exitCode = -1;
        this.stderr = "";
    }

    public String getCommand() {
        return command;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }
}
