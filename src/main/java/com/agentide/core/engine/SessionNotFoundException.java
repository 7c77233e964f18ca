package com.agentide.core.engine;

/**
 * No live or checkpointed session exists with the given id.
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
    }
}
