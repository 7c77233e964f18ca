package com.agentide.core.nodes;

import com.agentide.core.config.AgentIdeProperties;
import com.agentide.core.llm.LlmService;
import com.agentide.core.memory.MemoryStore;
import com.agentide.core.metrics.AgentIdeMetrics;
import com.agentide.core.model.ComponentId;
import com.agentide.core.model.PlanProposal;
import com.agentide.core.model.Step;
import com.agentide.core.model.WorkerKind;
import com.agentide.core.state.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the plan and its cursor.
 * <p>
 * On every invocation, in order:
 * <ol>
 *   <li>creates a plan when there is none (planner call with a single-step fallback)</li>
 *   <li>absorbs a finished worker step by advancing the cursor, whether or not the step succeeded</li>
 *   <li>hands over to the review gate once the plan is exhausted</li>
 *   <li>otherwise dispatches the step under the cursor to the worker of its kind</li>
 * </ol>
 */
@Component
public class PlanControllerNode {

    private static final Logger log = LoggerFactory.getLogger(PlanControllerNode.class);

    static final String SYSTEM_PROMPT = """
            You are the planner of a coding assistant. Break the user's request into an
            ordered list of small steps, each executed by exactly one worker:
            - code_agent: creates or edits files. Use it for every step that produces code.
            - debug_agent: reads files and diagnoses a problem without changing anything.
              Its analysis is handed to the next code_agent step.

            Rules:
            1. Every step names the single file it is about in "targetFile".
            2. Keep instructions concrete and self-contained.
            3. Do not add review steps; the user reviews the result after the last step.
            4. Use the memory context to resolve references such as "it" or "that file".

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final AgentIdeProperties properties;
    private final AgentIdeMetrics metrics;

    public PlanControllerNode(LlmService llmService, AgentIdeProperties properties, AgentIdeMetrics metrics) {
        this.llmService = llmService;
        this.properties = properties;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(SessionState state) {
        var updates = new HashMap<String, Object>();
        var memory = new MemoryStore(state.memory());

        List<Step> plan = state.plan();
        int stepIndex = state.stepIndex();

        if (plan.isEmpty()) {
            plan = createPlan(state, memory, updates);
            stepIndex = 0;
            updates.put("plan", plan);
            updates.put("stepIndex", 0);
        }

        if (state.workerCompleted() || state.stepFinished()) {
            if (state.workerCompleted()) {
                log.info("Step {} completed", stepIndex);
            } else {
                log.warn("Step {} finished without changes; advancing", stepIndex);
            }
            stepIndex++;
            updates.put("stepIndex", stepIndex);
            updates.put("workerCompleted", false);
            updates.put("stepFinished", false);
        }

        if (stepIndex >= plan.size()) {
            List<String> generated = state.generatedArtifacts();
            log.info("All {} steps complete; {} artifact(s) generated, requesting review", plan.size(), generated.size());
            memory.recordTurn("assistant", "Completed all tasks. Generated: " + String.join(", ", generated), generated);
            updates.put("needsReview", true);
            updates.put("currentInstruction", "");
            updates.put("currentTarget", "");
            updates.put("nextComponent", ComponentId.REVIEW_GATE.name());
            updates.put("memory", memory.snapshot());
            return updates;
        }

        Step step = plan.get(stepIndex);
        ComponentId worker = ComponentId.forWorker(step.workerKind());
        log.info("Step {}/{}: dispatching to {} (target: {})", stepIndex + 1, plan.size(),
                worker.nodeId(), step.hasTarget() ? step.targetArtifact() : "none");
        updates.put("currentInstruction", step.instruction());
        updates.put("currentTarget", step.hasTarget() ? step.targetArtifact() : "");
        updates.put("needsReview", false);
        updates.put("nextComponent", worker.name());
        updates.put("memory", memory.snapshot());
        return updates;
    }

    private List<Step> createPlan(SessionState state, MemoryStore memory, Map<String, Object> updates) {
        String request = state.request();
        Optional<String> resolved = memory.resolveReference(request, state.generatedArtifacts());
        if (resolved.isPresent()) {
            String rewritten = rewriteReferences(request, resolved.get());
            if (!rewritten.equals(request)) {
                log.info("Resolved reference in request to {}", resolved.get());
                request = rewritten;
                updates.put("request", request);
            }
        }
        memory.recordTurn("user", request, resolved.map(List::of).orElse(List.of()));

        String userPrompt = memory.contextBlock()
                + "\n=== CURRENT PLANNING TASK ===\n"
                + "User request: " + request + "\n\n"
                + "Create the execution plan.";

        long start = System.currentTimeMillis();
        int maxAttempts = Math.max(1, properties.getPlanner().getMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                PlanProposal proposal = llmService.structuredCall(SYSTEM_PROMPT, userPrompt, PlanProposal.class);
                List<Step> steps = toSteps(proposal);
                if (!steps.isEmpty()) {
                    log.info("Plan created with {} step(s): {}", steps.size(),
                            steps.stream().map(s -> s.workerKind() + "->" + s.targetArtifact()).toList());
                    metrics.recordPlanningDuration(System.currentTimeMillis() - start, false);
                    return steps;
                }
                log.warn("Planner returned no usable steps (attempt {}/{})", attempt, maxAttempts);
            } catch (RuntimeException e) {
                log.warn("Planner call failed (attempt {}/{}): {}", attempt, maxAttempts, e.getMessage());
            }
        }

        String target = resolved.orElse(properties.getPlanner().getFallbackArtifact());
        log.warn("Using single-step fallback plan targeting {}", target);
        metrics.recordPlanningDuration(System.currentTimeMillis() - start, true);
        return List.of(new Step(WorkerKind.WRITE, request, target));
    }

    /**
     * Normalizes a proposal: review steps are dropped (the review gate always follows the plan)
     * and steps without an instruction are ignored.
     */
    static List<Step> toSteps(PlanProposal proposal) {
        if (proposal == null || proposal.steps() == null) {
            return List.of();
        }
        return proposal.steps().stream()
                .filter(Objects::nonNull)
                .map(PlanProposal.ProposedStep::toStep)
                .filter(step -> step.workerKind() != WorkerKind.REVIEW)
                .filter(step -> !step.instruction().isBlank())
                .toList();
    }

    /**
     * Replaces standalone " it " and " that " with the resolved artifact id.
     */
    static String rewriteReferences(String request, String artifactId) {
        String padded = " " + request + " ";
        String rewritten = padded
                .replace(" it ", " " + artifactId + " ")
                .replace(" that ", " " + artifactId + " ");
        return rewritten.substring(1, rewritten.length() - 1);
    }
}
