package com.squadron.core.error;

/**
 * Thrown when a pull request cannot be opened on the hosting service.
 */
public class PullRequestException extends RuntimeException {
    public PullRequestException(String message) {
        super(message);
    }

    public PullRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
