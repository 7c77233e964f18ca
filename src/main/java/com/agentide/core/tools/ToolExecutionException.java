package com.agentide.core.tools;

/**
 * A tool invocation failed. The message is fed back to the worker that requested it.
 */
public class ToolExecutionException extends RuntimeException {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
