package com.squadron.core.error;

/**
 * Thrown when a worker process cannot be launched: the binary is missing or the
 * working directory is invalid.
 */
public class SpawnException extends RuntimeException {
    public SpawnException(String message) {
        super(message);
    }

    public SpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
