package com.agentide.core.model;

/**
 * Coarse lifecycle status derived from a session's flags, for display.
 */
public enum SessionStatus {
    PENDING,
    RUNNING,
    AWAITING_REVIEW,
    COMPLETED,
    FAILED;

    public static SessionStatus of(SessionSnapshot snapshot, boolean running, boolean failed) {
        if (running) {
            return RUNNING;
        }
        if (snapshot.done()) {
            return COMPLETED;
        }
        if (failed) {
            return FAILED;
        }
        if (snapshot.suspended() && !snapshot.hasFeedback()) {
            return AWAITING_REVIEW;
        }
        return PENDING;
    }
}
