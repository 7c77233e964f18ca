package com.agentide.core.nodes;

import com.agentide.core.config.AgentIdeProperties;
import com.agentide.core.memory.MemoryStore;
import com.agentide.core.metrics.AgentIdeMetrics;
import com.agentide.core.model.ComponentId;
import com.agentide.core.model.WorkerKind;
import com.agentide.core.model.WorkerResult;
import com.agentide.core.state.SessionState;
import com.agentide.core.tools.ToolExecutionException;
import com.agentide.core.tools.WorkspaceTools;
import com.agentide.core.worker.ReasoningWorker;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Write-capable worker adapter (the "code agent").
 * <p>
 * Succeeds when at least one artifact was created or modified; the latest content of every
 * touched artifact is captured for review and any carried-over diagnosis is consumed.
 */
@Component
public class WriteWorkerNode extends WorkerAdapterNode {

    static final String SYSTEM_PROMPT = """
            You are the code agent of a coding assistant. Complete the current task by
            requesting tool actions against the project:
            - read_file(path), list_files(path), search_text(query, path glob)
            - write_file(path, content) to create or overwrite a file
            - append_file(path, content)
            - apply_patch(path, originalSnippet, newSnippet) for small, exact edits
            Paths are relative to the project root. Read a file before patching it.
            When the task is done, reply with an empty action list and a one-line summary.

            Respond with valid JSON matching the schema provided.
            """;

    @Autowired
    public WriteWorkerNode(ReasoningWorker reasoningWorker, AgentIdeProperties properties, AgentIdeMetrics metrics) {
        this(reasoningWorker, properties, metrics, Clock.systemUTC());
    }

    public WriteWorkerNode(ReasoningWorker reasoningWorker, AgentIdeProperties properties,
                           AgentIdeMetrics metrics, Clock clock) {
        super(reasoningWorker, properties, metrics, clock);
    }

    @Override
    protected WorkerKind kind() {
        return WorkerKind.WRITE;
    }

    @Override
    protected ComponentId component() {
        return ComponentId.WRITE_WORKER;
    }

    @Override
    protected String actor() {
        return "code_agent";
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected boolean allowsWrites() {
        return true;
    }

    @Override
    protected Map<String, Object> complete(SessionState state, WorkerResult result,
                                           MemoryStore memory, WorkspaceTools tools) {
        var updates = new HashMap<String, Object>();
        if (!result.wroteSomething()) {
            memory.recordTurn("assistant", "Code agent attempted task but no files were created or modified");
            updates.put("workerCompleted", false);
            return updates;
        }

        var touched = new LinkedHashSet<String>(result.artifactsCreated());
        touched.addAll(result.artifactsModified());

        var contents = new LinkedHashMap<>(state.artifactContents());
        for (String id : touched) {
            try {
                contents.put(id, tools.readFully(id));
            } catch (ToolExecutionException e) {
                contents.put(id, "Error reading file: " + e.getMessage());
            }
        }

        List<String> summary = new ArrayList<>();
        if (!result.artifactsCreated().isEmpty()) {
            summary.add("created " + result.artifactsCreated().size() + " file(s)");
        }
        if (!result.artifactsModified().isEmpty()) {
            summary.add("modified " + result.artifactsModified().size() + " file(s)");
        }
        memory.recordTurn("assistant", "Code agent " + String.join(" and ", summary), List.copyOf(touched));

        updates.put("artifactContents", Collections.unmodifiableMap(contents));
        updates.put("lastDiagnostic", "");
        updates.put("workerCompleted", true);
        return updates;
    }
}
