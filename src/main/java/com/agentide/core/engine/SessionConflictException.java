package com.agentide.core.engine;

/**
 * The requested operation does not fit the session's current state, e.g. feedback for a
 * session that is not waiting for review, or a run of a session that is already running.
 */
public class SessionConflictException extends RuntimeException {

    public SessionConflictException(String message) {
        super(message);
    }
}
