package com.agentide.core.engine;

/**
 * A session reached the ceiling on component invocations. The session is aborted and left in
 * its last checkpointed state.
 */
public class StepLimitExceededException extends RuntimeException {

    private final String sessionId;
    private final int maxSteps;

    public StepLimitExceededException(String sessionId, int maxSteps) {
        super("Workflow exceeded maximum steps (" + maxSteps + ") for session " + sessionId);
        this.sessionId = sessionId;
        this.maxSteps = maxSteps;
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getMaxSteps() {
        return maxSteps;
    }
}
