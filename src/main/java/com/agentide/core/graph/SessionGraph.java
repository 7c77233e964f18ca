package com.agentide.core.graph;

import com.agentide.core.config.AgentIdeProperties;
import com.agentide.core.engine.StepLimitExceededException;
import com.agentide.core.events.EventBus;
import com.agentide.core.events.SessionEvent;
import com.agentide.core.logging.MdcContext;
import com.agentide.core.model.ComponentId;
import com.agentide.core.nodes.DiagnosticWorkerNode;
import com.agentide.core.nodes.PlanControllerNode;
import com.agentide.core.nodes.ReviewGateNode;
import com.agentide.core.nodes.WriteWorkerNode;
import com.agentide.core.state.SessionState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.NodeAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} of the plan-execution state machine.
 * <p>
 * Every transition, including the entry from START, goes through {@link SessionRouter}:
 * <pre>
 *   START -> [route] -> plan_controller -> [route] -> write_worker | diagnostic_worker -> [route]
 *         -> plan_controller ... -> review_gate -> [route] -> END (suspended or done)
 *                                                         -> plan_controller (revision)
 * </pre>
 * Each node is wrapped so that it counts towards the session's step ceiling, carries MDC
 * context and publishes a {@code session.step} event after it returns. The ceiling is
 * cumulative across resumes, except for the review gate taking feedback.
 */
@Component
public class SessionGraph {

    private static final Logger log = LoggerFactory.getLogger(SessionGraph.class);

    private final CompiledGraph<SessionState> compiledGraph;
    private final SessionRouter router;
    private final EventBus eventBus;
    private final int maxSteps;
    private final int maxIterations;

    public SessionGraph(
            PlanControllerNode planController,
            WriteWorkerNode writeWorker,
            DiagnosticWorkerNode diagnosticWorker,
            ReviewGateNode reviewGate,
            SessionRouter router,
            EventBus eventBus,
            AgentIdeProperties properties) throws Exception {
        this.router = router;
        this.eventBus = eventBus;
        this.maxSteps = properties.getEngine().getMaxSteps();
        // LangGraph4j counts edge evaluations as well as nodes; the wrapper's ceiling must fire first
        this.maxIterations = 2 * maxSteps + 4;

        Map<String, String> routes = Map.of(
                ComponentId.PLAN_CONTROLLER.nodeId(), ComponentId.PLAN_CONTROLLER.nodeId(),
                ComponentId.WRITE_WORKER.nodeId(), ComponentId.WRITE_WORKER.nodeId(),
                ComponentId.DIAGNOSTIC_WORKER.nodeId(), ComponentId.DIAGNOSTIC_WORKER.nodeId(),
                ComponentId.REVIEW_GATE.nodeId(), ComponentId.REVIEW_GATE.nodeId(),
                ComponentId.TERMINAL.nodeId(), END);

        var graph = new StateGraph<>(SessionState.SCHEMA, SessionState::new)
                .addNode(ComponentId.PLAN_CONTROLLER.nodeId(),
                        node_async(wrap(ComponentId.PLAN_CONTROLLER, planController::apply)))
                .addNode(ComponentId.WRITE_WORKER.nodeId(),
                        node_async(wrap(ComponentId.WRITE_WORKER, writeWorker::apply)))
                .addNode(ComponentId.DIAGNOSTIC_WORKER.nodeId(),
                        node_async(wrap(ComponentId.DIAGNOSTIC_WORKER, diagnosticWorker::apply)))
                .addNode(ComponentId.REVIEW_GATE.nodeId(),
                        node_async(wrap(ComponentId.REVIEW_GATE, reviewGate::apply)))
                .addConditionalEdges(START, edge_async(this::nextNode), routes)
                .addConditionalEdges(ComponentId.PLAN_CONTROLLER.nodeId(), edge_async(this::nextNode), routes)
                .addConditionalEdges(ComponentId.WRITE_WORKER.nodeId(), edge_async(this::nextNode), routes)
                .addConditionalEdges(ComponentId.DIAGNOSTIC_WORKER.nodeId(), edge_async(this::nextNode), routes)
                .addConditionalEdges(ComponentId.REVIEW_GATE.nodeId(), edge_async(this::nextNode), routes);

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        this.compiledGraph.setMaxIterations(maxIterations);
        log.info("Session graph compiled (max steps per session: {})", maxSteps);
    }

    String nextNode(SessionState state) {
        return router.route(state).nodeId();
    }

    private NodeAction<SessionState> wrap(ComponentId component, NodeAction<SessionState> action) {
        return state -> {
            int count = state.invocationCount();
            if (count >= maxSteps && !isReviewResumption(component, state)) {
                throw new StepLimitExceededException(state.sessionId(), maxSteps);
            }
            var entered = new HashMap<>(state.data());
            entered.put("activeComponent", component.name());
            entered.put("invocationCount", count + 1);
            var current = new SessionState(entered);

            MdcContext.setComponent(state.sessionId(), component.nodeId(), state.stepIndex());
            try {
                var updates = new HashMap<>(action.apply(current));
                updates.put("activeComponent", component.name());
                updates.put("invocationCount", count + 1);
                publishStep(component, current, updates);
                return updates;
            } finally {
                MdcContext.clearComponent();
            }
        };
    }

    /**
     * The gate consuming reviewer feedback is exempt from the ceiling, so that a session parked at
     * exactly {@code maxSteps} invocations can still be approved. A revision still re-enters the
     * plan controller, which is counted.
     */
    static boolean isReviewResumption(ComponentId component, SessionState state) {
        return component == ComponentId.REVIEW_GATE && state.feedback().isPresent();
    }

    private void publishStep(ComponentId component, SessionState before, Map<String, Object> updates) {
        var merged = new HashMap<>(before.data());
        merged.putAll(updates);
        var after = new SessionState(merged);

        var payload = new HashMap<String, Object>();
        payload.put("activeComponent", component.name());
        payload.put("stepIndex", after.stepIndex());
        payload.put("plan", after.plan());
        payload.put("generatedArtifacts", after.generatedArtifacts());
        payload.put("needsReview", after.suspended());
        payload.put("done", after.done());
        payload.put("invocationCount", after.invocationCount());
        eventBus.publish(new SessionEvent(SessionEvent.STEP, after.sessionId(), component.nodeId(),
                payload, Instant.now()));
    }

    public CompiledGraph<SessionState> getCompiledGraph() {
        return compiledGraph;
    }

    public int maxSteps() {
        return maxSteps;
    }

    /** Backstop iteration limit handed to the compiled graph. */
    public int maxIterations() {
        return maxIterations;
    }
}
