package com.agentide.core.worker;

import com.agentide.core.llm.LlmService;
import com.agentide.core.model.WorkerKind;
import com.agentide.core.model.WorkerReply;
import org.springframework.stereotype.Component;

/**
 * {@link ReasoningWorker} backed by a structured LLM call.
 */
@Component
public class LlmReasoningWorker implements ReasoningWorker {

    private final LlmService llmService;

    public LlmReasoningWorker(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public WorkerReply nextReply(WorkerKind kind, String systemPrompt, WorkerTranscript transcript) {
        return llmService.structuredCall(systemPrompt, transcript.render(), WorkerReply.class);
    }
}
