package com.agentide.core.nodes;

import com.agentide.core.memory.MemoryStore;
import com.agentide.core.metrics.AgentIdeMetrics;
import com.agentide.core.model.ComponentId;
import com.agentide.core.model.Step;
import com.agentide.core.persistence.CheckpointStore;
import com.agentide.core.review.ApprovalPolicy;
import com.agentide.core.state.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Human review point after the plan is exhausted.
 * <p>
 * Without feedback the gate writes a checkpoint and marks the session suspended; the router then
 * ends the run so the host regains control. A later run with feedback attached either finishes
 * the session (approval) or folds the feedback into a new request and sends it back to planning
 * (revision). Feedback is cleared on every path.
 */
@Component
public class ReviewGateNode {

    private static final Logger log = LoggerFactory.getLogger(ReviewGateNode.class);

    private final CheckpointStore checkpointStore;
    private final ApprovalPolicy approvalPolicy;
    private final AgentIdeMetrics metrics;

    public ReviewGateNode(CheckpointStore checkpointStore, ApprovalPolicy approvalPolicy, AgentIdeMetrics metrics) {
        this.checkpointStore = checkpointStore;
        this.approvalPolicy = approvalPolicy;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(SessionState state) {
        if (state.skipReview()) {
            log.info("Review skipped for session {}", state.sessionId());
            var updates = finish(state);
            updates.put("finalSummary", completionSummary(state.generatedArtifacts()));
            return updates;
        }

        var feedback = state.feedback();
        if (feedback.isEmpty()) {
            return suspend(state);
        }

        String text = feedback.get();
        if (approvalPolicy.isApproval(text, state.feedbackAction())) {
            log.info("Session {} approved", state.sessionId());
            metrics.recordReviewDecision(true);
            var updates = finish(state);
            updates.put("finalSummary", completionSummary(state.generatedArtifacts()));
            return updates;
        }

        log.info("Session {} revision requested; re-planning", state.sessionId());
        metrics.recordReviewDecision(false);
        var memory = new MemoryStore(state.memory());
        memory.recordTurn("user", text, List.of());

        var updates = new HashMap<String, Object>();
        updates.put("request", revisedRequest(state.plan(), text, state.request()));
        updates.put("plan", List.of());
        updates.put("stepIndex", 0);
        updates.put("workerCompleted", false);
        updates.put("stepFinished", false);
        updates.put("currentInstruction", "");
        updates.put("currentTarget", "");
        updates.put("needsReview", false);
        updates.put("suspended", false);
        updates.put("done", false);
        updates.put("memory", memory.snapshot());
        updates.put("nextComponent", ComponentId.PLAN_CONTROLLER.name());
        clearFeedback(updates);
        return updates;
    }

    private Map<String, Object> suspend(SessionState state) {
        var updates = new HashMap<String, Object>();
        updates.put("needsReview", true);
        updates.put("suspended", true);
        updates.put("done", false);
        updates.put("nextComponent", ComponentId.REVIEW_GATE.name());
        clearFeedback(updates);

        var merged = new HashMap<>(state.data());
        merged.putAll(updates);
        // must succeed before suspension is reported
        checkpointStore.save(state.sessionId(), new SessionState(merged).toSnapshot());

        log.info("Session {} suspended for review:\n{}", state.sessionId(),
                composeSummary(state.plan(), state.generatedArtifacts()));
        return updates;
    }

    private static HashMap<String, Object> finish(SessionState state) {
        var updates = new HashMap<String, Object>();
        updates.put("done", true);
        updates.put("needsReview", false);
        updates.put("suspended", false);
        updates.put("nextComponent", ComponentId.TERMINAL.name());
        clearFeedback(updates);
        return updates;
    }

    private static void clearFeedback(Map<String, Object> updates) {
        updates.put("feedback", "");
        updates.put("feedbackPending", false);
        updates.put("feedbackAction", "");
    }

    static String completionSummary(List<String> generatedArtifacts) {
        return "Workflow completed successfully. " + generatedArtifacts.size() + " files created/modified.";
    }

    /**
     * Request for the next planning round: the executed steps, then the feedback, then the
     * request that produced them.
     */
    static String revisedRequest(List<Step> executedPlan, String feedback, String currentRequest) {
        var sb = new StringBuilder("Previous work completed:\n");
        for (Step step : executedPlan) {
            sb.append("- ").append(step.instruction())
              .append(" (").append(step.hasTarget() ? step.targetArtifact() : "N/A").append(")\n");
        }
        sb.append("\nUser feedback/changes requested:\n").append(feedback).append('\n');
        sb.append("\nOriginal request: ").append(currentRequest);
        return sb.toString();
    }

    /**
     * Human-readable review summary. Pure; safe to call any number of times.
     */
    public static String composeSummary(List<Step> plan, List<String> generatedArtifacts) {
        var sb = new StringBuilder();
        sb.append("Steps executed: ").append(plan.size()).append('\n');
        for (int i = 0; i < plan.size(); i++) {
            Step step = plan.get(i);
            sb.append("  ").append(i + 1).append(". [").append(step.workerKind()).append("] ")
              .append(step.hasTarget() ? step.targetArtifact() : "N/A").append(": ")
              .append(step.instruction()).append('\n');
        }
        if (!generatedArtifacts.isEmpty()) {
            sb.append("Files created/modified:\n");
            for (String artifact : generatedArtifacts) {
                sb.append("  - ").append(artifact).append('\n');
            }
        }
        return sb.toString();
    }
}
