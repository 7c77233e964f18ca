package com.agentide.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * One turn of a reasoning worker: the tool actions it wants executed and any prose it produced.
 * An empty action list means the worker is finished.
 */
public record WorkerReply(
    List<ToolAction> actions,
    String message
) implements Serializable {

    public WorkerReply {
        actions = actions == null ? List.of() : List.copyOf(actions);
        message = message == null ? "" : message;
    }

    public boolean finished() {
        return actions.isEmpty();
    }

    public static WorkerReply done(String message) {
        return new WorkerReply(List.of(), message);
    }
}
