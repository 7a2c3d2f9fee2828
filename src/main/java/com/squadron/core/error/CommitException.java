package com.squadron.core.error;

/**
 * Thrown when a commit cannot be created: nothing to commit, or git failed.
 */
public class CommitException extends RuntimeException {

    private final String repoName;

    public CommitException(String repoName, String message) {
        super(message);
        this.repoName = repoName;
    }

    public CommitException(String repoName, String message, Throwable cause) {
        super(message, cause);
        this.repoName = repoName;
    }

    public String getRepoName() {
        return repoName;
    }
}
