package com.agentide.core.persistence;

/**
 * Thrown when a checkpoint cannot be written, read or decoded.
 */
public class CheckpointException extends RuntimeException {

    public CheckpointException(String message) {
        super(message);
    }

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
