package com.agentide.core.nodes;

import com.agentide.core.config.AgentIdeProperties;
import com.agentide.core.memory.MemoryStore;
import com.agentide.core.metrics.AgentIdeMetrics;
import com.agentide.core.model.ComponentId;
import com.agentide.core.model.WorkerKind;
import com.agentide.core.model.WorkerResult;
import com.agentide.core.state.SessionState;
import com.agentide.core.tools.WorkspaceTools;
import com.agentide.core.worker.ReasoningWorker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;

/**
 * Read-only worker adapter (the "debug agent"). Its analysis becomes {@code lastDiagnostic}
 * for the next write step. Producing no artifacts is expected, so it always completes.
 */
@Component
public class DiagnosticWorkerNode extends WorkerAdapterNode {

    static final String DIAGNOSIS_HEADER = "=== DEBUG ANALYSIS ===";
    static final String NO_DIAGNOSIS = "Debug analysis failed - no suggestions available";

    static final String SYSTEM_PROMPT = """
            You are the debug agent of a coding assistant. Investigate the problem in the
            current task using read-only tool actions:
            - read_file(path), list_files(path), search_text(query, path glob)
            You cannot change files. When you have found the root cause, reply with an
            empty action list and put your analysis and concrete fix suggestions in the
            message; a code agent will apply them.

            Respond with valid JSON matching the schema provided.
            """;

    @Autowired
    public DiagnosticWorkerNode(ReasoningWorker reasoningWorker, AgentIdeProperties properties,
                                AgentIdeMetrics metrics) {
        this(reasoningWorker, properties, metrics, Clock.systemUTC());
    }

    public DiagnosticWorkerNode(ReasoningWorker reasoningWorker, AgentIdeProperties properties,
                                AgentIdeMetrics metrics, Clock clock) {
        super(reasoningWorker, properties, metrics, clock);
    }

    @Override
    protected WorkerKind kind() {
        return WorkerKind.DIAGNOSTIC;
    }

    @Override
    protected ComponentId component() {
        return ComponentId.DIAGNOSTIC_WORKER;
    }

    @Override
    protected String actor() {
        return "debug_agent";
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected boolean allowsWrites() {
        return false;
    }

    @Override
    protected Map<String, Object> complete(SessionState state, WorkerResult result,
                                           MemoryStore memory, WorkspaceTools tools) {
        String diagnosis = result.producedText().isBlank()
                ? NO_DIAGNOSIS
                : DIAGNOSIS_HEADER + "\n\n" + result.producedText();
        memory.recordTurn("assistant", "Debug agent analysed " + result.artifactsRead().size() + " file(s)",
                result.artifactsRead());
        return Map.of(
                "lastDiagnostic", diagnosis,
                "workerCompleted", true);
    }
}
