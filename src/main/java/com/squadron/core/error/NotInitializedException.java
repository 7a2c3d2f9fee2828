package com.squadron.core.error;

/**
 * Thrown when the multi-repository coordinator is used before a successful
 * {@code initializeWorkspace}.
 */
public class NotInitializedException extends IllegalStateException {
    public NotInitializedException(String message) {
        super(message);
    }
}
