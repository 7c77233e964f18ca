package com.agentide.core.worker;

import com.agentide.core.model.WorkerKind;
import com.agentide.core.model.WorkerReply;

/**
 * Boundary to the external reasoning service that decides a worker's next tool actions.
 */
public interface ReasoningWorker {

    /**
     * Produces the next reply for a worker given everything that happened so far.
     *
     * @param kind         which worker is asking
     * @param systemPrompt role instructions for the worker
     * @param transcript   task, memory context and prior tool results
     * @return the next batch of tool actions; an empty batch ends the attempt loop
     */
    WorkerReply nextReply(WorkerKind kind, String systemPrompt, WorkerTranscript transcript);
}
