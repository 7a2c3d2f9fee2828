package com.squadron.core.error;

/**
 * Raised when releasing an allocation during multi-repository rollback itself fails.
 * Always attached as a suppressed exception to the allocation failure that triggered
 * the rollback.
 */
public class RollbackException extends RuntimeException {

    private final String repoName;

    public RollbackException(String repoName, String message, Throwable cause) {
        super(message, cause);
        this.repoName = repoName;
    }

    public String getRepoName() {
        return repoName;
    }
}
