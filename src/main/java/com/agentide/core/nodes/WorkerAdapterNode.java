package com.agentide.core.nodes;

import com.agentide.core.config.AgentIdeProperties;
import com.agentide.core.memory.MemoryStore;
import com.agentide.core.metrics.AgentIdeMetrics;
import com.agentide.core.model.ArtifactOperation;
import com.agentide.core.model.ComponentId;
import com.agentide.core.model.ToolAction;
import com.agentide.core.model.WorkerKind;
import com.agentide.core.model.WorkerReply;
import com.agentide.core.model.WorkerResult;
import com.agentide.core.state.SessionState;
import com.agentide.core.tools.ToolExecutionException;
import com.agentide.core.tools.WorkspaceTools;
import com.agentide.core.worker.ReasoningWorker;
import com.agentide.core.worker.WorkerTranscript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Common attempt loop of the worker adapters.
 * <p>
 * Each attempt asks the {@link ReasoningWorker} for its next reply and executes the tool actions
 * it requests against the session's working root. The loop ends when the worker requests no more
 * actions, when the attempt cap is reached, when the time budget runs out, or when the reasoning
 * service itself fails. Failing tool actions never escape: their error text becomes the tool
 * result the worker sees in the next round.
 * <p>
 * Control always returns to the plan controller with {@code stepFinished} set, so a step that
 * produced nothing is still advanced past.
 */
public abstract class WorkerAdapterNode {

    private static final Logger log = LoggerFactory.getLogger(WorkerAdapterNode.class);

    private final ReasoningWorker reasoningWorker;
    private final AgentIdeProperties properties;
    private final AgentIdeMetrics metrics;
    private final Clock clock;

    protected WorkerAdapterNode(ReasoningWorker reasoningWorker, AgentIdeProperties properties,
                                AgentIdeMetrics metrics, Clock clock) {
        this.reasoningWorker = reasoningWorker;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /** Worker kind passed to the reasoning service. */
    protected abstract WorkerKind kind();

    /** The component this adapter is registered as. */
    protected abstract ComponentId component();

    /** Role name used for memory records, e.g. "code_agent". */
    protected abstract String actor();

    protected abstract String systemPrompt();

    /** Whether write_file, append_file and apply_patch may be executed. */
    protected abstract boolean allowsWrites();

    /**
     * Turns the loop outcome into state updates. Implementations must set {@code workerCompleted}.
     */
    protected abstract Map<String, Object> complete(SessionState state, WorkerResult result,
                                                    MemoryStore memory, WorkspaceTools tools);

    public Map<String, Object> apply(SessionState state) {
        long start = System.currentTimeMillis();
        var tools = new WorkspaceTools(Path.of(state.workingRoot().isEmpty() ? "." : state.workingRoot()));
        var memory = new MemoryStore(state.memory());
        var run = new Run(state.generatedArtifacts());
        var transcript = new WorkerTranscript(buildTask(state, memory));

        int maxAttempts = Math.max(1, properties.getWorker().getMaxAttempts());
        Instant deadline = clock.instant().plus(properties.getWorker().getTimeBudget());
        int attempts = 0;
        String producedText = "";

        while (attempts < maxAttempts) {
            if (!clock.instant().isBefore(deadline)) {
                log.warn("{} ran out of its time budget after {} attempt(s)", actor(), attempts);
                break;
            }
            attempts++;
            WorkerReply reply;
            try {
                reply = reasoningWorker.nextReply(kind(), systemPrompt(), transcript);
            } catch (RuntimeException e) {
                log.warn("{} reasoning call failed on attempt {}: {}", actor(), attempts, e.getMessage());
                break;
            }
            if (reply == null) {
                break;
            }
            if (!reply.message().isBlank()) {
                producedText = reply.message();
            }
            if (reply.finished()) {
                log.debug("{} finished after {} attempt(s)", actor(), attempts);
                break;
            }
            List<String> results = new ArrayList<>();
            for (ToolAction action : reply.actions()) {
                results.add(execute(action, tools, run, memory));
            }
            transcript.addRound(reply, results);
        }

        WorkerResult result = new WorkerResult(
                List.copyOf(run.created), List.copyOf(run.modified), List.copyOf(run.read), producedText, attempts);

        var updates = new HashMap<String, Object>();
        updates.put("generatedArtifacts", List.copyOf(run.known));
        updates.putAll(complete(state, result, memory, tools));
        updates.put("stepFinished", true);
        updates.put("nextComponent", ComponentId.PLAN_CONTROLLER.name());
        updates.put("memory", memory.snapshot());

        boolean completed = Boolean.TRUE.equals(updates.get("workerCompleted"));
        metrics.recordWorkerAttempts(component().nodeId(), attempts);
        metrics.recordWorkerExecution(component().nodeId(), completed, System.currentTimeMillis() - start);
        log.info("{} finished step {}: created={}, modified={}, read={}, completed={}",
                actor(), state.stepIndex(), result.artifactsCreated(), result.artifactsModified(),
                result.artifactsRead(), completed);
        return updates;
    }

    /**
     * Task text handed to the reasoning worker: memory context, instruction, target and any
     * carried-over diagnosis.
     */
    protected String buildTask(SessionState state, MemoryStore memory) {
        var sb = new StringBuilder();
        sb.append(memory.contextBlock()).append('\n');
        sb.append("=== CURRENT TASK ===\n");
        sb.append("Instruction: ").append(state.currentInstruction()).append('\n');
        if (!state.currentTarget().isEmpty()) {
            sb.append("Target file: ").append(state.currentTarget()).append('\n');
        }
        state.lastDiagnostic().ifPresent(diagnostic ->
                sb.append("\nPrevious diagnosis to act on:\n").append(diagnostic).append('\n'));
        return sb.toString();
    }

    private String execute(ToolAction action, WorkspaceTools tools, Run run, MemoryStore memory) {
        String tool = action.tool() == null ? "" : action.tool().trim();
        try {
            return switch (tool) {
                case "read_file" -> {
                    String content = tools.readFile(action.path());
                    String id = tools.artifactId(action.path());
                    run.read.add(id);
                    memory.recordArtifactOperation(id, ArtifactOperation.READ, actor());
                    yield content;
                }
                case "write_file" -> {
                    requireWrites(tool);
                    String id = tools.artifactId(action.path());
                    String result = tools.writeFile(action.path(), action.content());
                    run.recordWrite(id, !run.known.contains(id), memory, actor());
                    yield result;
                }
                case "append_file" -> {
                    requireWrites(tool);
                    String id = tools.artifactId(action.path());
                    String result = tools.appendFile(action.path(), action.content());
                    run.recordWrite(id, false, memory, actor());
                    yield result;
                }
                case "apply_patch" -> {
                    requireWrites(tool);
                    String id = tools.artifactId(action.path());
                    String result = tools.applyPatch(action.path(), action.originalSnippet(), action.newSnippet());
                    run.recordWrite(id, false, memory, actor());
                    yield result;
                }
                case "list_files" -> tools.listFiles(action.path());
                case "search_text" -> tools.searchText(action.query(), action.path());
                default -> "ERROR: unknown tool: " + tool;
            };
        } catch (ToolExecutionException e) {
            log.debug("{} tool {} failed: {}", actor(), tool, e.getMessage());
            return "ERROR: " + e.getMessage();
        } catch (RuntimeException e) {
            log.warn("{} tool {} failed unexpectedly: {}", actor(), tool, e.getMessage(), e);
            return "ERROR in " + tool + ": " + e.getMessage();
        }
    }

    private void requireWrites(String tool) {
        if (!allowsWrites()) {
            throw new ToolExecutionException(tool + " is not available to " + actor() + " (read-only)");
        }
    }

    /**
     * Artifact bookkeeping for one adapter invocation.
     */
    private static final class Run {

        /** Session artifacts in insertion order, including ones created in this run. */
        final Set<String> known;
        final Set<String> created = new LinkedHashSet<>();
        final Set<String> modified = new LinkedHashSet<>();
        final Set<String> read = new LinkedHashSet<>();

        Run(List<String> generatedArtifacts) {
            this.known = new LinkedHashSet<>(generatedArtifacts);
        }

        void recordWrite(String id, boolean isNew, MemoryStore memory, String actor) {
            if (isNew) {
                created.add(id);
                memory.recordArtifactOperation(id, ArtifactOperation.CREATED, actor);
            } else {
                if (!created.contains(id)) {
                    modified.add(id);
                }
                memory.recordArtifactOperation(id, ArtifactOperation.MODIFIED, actor);
            }
            known.add(id);
        }
    }
}
