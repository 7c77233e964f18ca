package com.agentide.core.engine;

import com.agentide.core.config.AgentIdeProperties;
import com.agentide.core.events.EventBus;
import com.agentide.core.events.SessionEvent;
import com.agentide.core.graph.SessionGraph;
import com.agentide.core.logging.MdcContext;
import com.agentide.core.metrics.AgentIdeMetrics;
import com.agentide.core.model.ComponentId;
import com.agentide.core.model.ReviewAction;
import com.agentide.core.model.SessionMemory;
import com.agentide.core.model.SessionSnapshot;
import com.agentide.core.model.SessionStatus;
import com.agentide.core.nodes.ReviewGateNode;
import com.agentide.core.persistence.CheckpointStore;
import com.agentide.core.state.SessionState;
import jakarta.annotation.PreDestroy;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Session control surface: starts sessions, runs them through the {@link SessionGraph} until
 * they suspend or finish, stages reviewer feedback and resumes from checkpoints.
 * <p>
 * A session never runs twice at the same time; different sessions run concurrently on a
 * bounded pool. The latest state of every session this process has seen is kept in memory;
 * anything else is read from the {@link CheckpointStore}.
 */
@Service
public class SessionEngine {

    private static final Logger log = LoggerFactory.getLogger(SessionEngine.class);
    private static final AtomicInteger SESSION_COUNTER = new AtomicInteger(0);

    private final SessionGraph sessionGraph;
    private final CheckpointStore checkpointStore;
    private final EventBus eventBus;
    private final AgentIdeMetrics metrics;
    private final ExecutorService executor;
    private final int capacity;

    private final ConcurrentHashMap<String, SessionSnapshot> liveSessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> failures = new ConcurrentHashMap<>();
    private final Set<String> running = ConcurrentHashMap.newKeySet();

    public SessionEngine(SessionGraph sessionGraph, CheckpointStore checkpointStore, EventBus eventBus,
                         AgentIdeMetrics metrics, AgentIdeProperties properties) {
        this.sessionGraph = sessionGraph;
        this.checkpointStore = checkpointStore;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.capacity = Math.max(1, properties.getEngine().getMaxConcurrentSessions());
        this.executor = Executors.newFixedThreadPool(capacity);
    }

    /**
     * Registers a new session. Nothing runs until {@link #run(String)} or {@link #submit(String)}.
     *
     * @param request     the task description
     * @param workingRoot directory the workers may touch; blank means the current directory
     * @param skipReview  finish without waiting for review once the plan is exhausted
     * @return the new session id
     */
    public String startSession(String request, String workingRoot, boolean skipReview) {
        if (request == null || request.isBlank()) {
            throw new IllegalArgumentException("request must not be empty");
        }
        String root = workingRoot == null || workingRoot.isBlank()
                ? Path.of(".").toAbsolutePath().normalize().toString()
                : Path.of(workingRoot).toAbsolutePath().normalize().toString();
        String sessionId = generateSessionId();

        var snapshot = new SessionSnapshot(sessionId, request, request, root, List.of(), 0, "", "",
                false, false, List.of(), Map.of(), false, false, null, null, skipReview, false,
                ComponentId.PLAN_CONTROLLER.name(), "", null, "", 0, SessionMemory.empty());
        liveSessions.put(sessionId, snapshot);

        log.info("Session {} created (root={}, skipReview={}): {}", sessionId, root, skipReview, request);
        eventBus.publish(new SessionEvent(SessionEvent.STARTED, sessionId, null,
                Map.of("request", request, "workingRoot", root, "skipReview", skipReview),
                Instant.now()));
        return sessionId;
    }

    /**
     * Runs the session until it suspends for review, finishes or fails.
     * A session that is done, or suspended without feedback, is returned unchanged.
     * <p>
     * The session is claimed before its state is read, so feedback staged concurrently is either
     * seen by this run or rejected.
     *
     * @throws SessionNotFoundException    if the session is unknown
     * @throws SessionConflictException    if the session is already running
     * @throws StepLimitExceededException  if the step ceiling was hit
     */
    public SessionSnapshot run(String sessionId) {
        claim(sessionId, "is already running");
        try {
            SessionSnapshot snapshot = requireSession(sessionId);
            if (snapshot.done() || (snapshot.suspended() && !snapshot.hasFeedback())) {
                return snapshot;
            }
            return execute(sessionId, snapshot);
        } finally {
            running.remove(sessionId);
        }
    }

    private SessionSnapshot execute(String sessionId, SessionSnapshot snapshot) {
        MdcContext.setSession(sessionId);
        try {
            failures.remove(sessionId);
            log.info("Running session {} from {} (step {}/{})", sessionId, snapshot.nextComponent(),
                    snapshot.stepIndex(), snapshot.plan().size());

            var config = RunnableConfig.builder()
                    .threadId(sessionId)
                    .build();
            SessionState result = sessionGraph.getCompiledGraph()
                    .invoke(SessionState.toStateMap(snapshot), config)
                    .orElseThrow(() -> new IllegalStateException(
                            "Graph execution returned empty state for session " + sessionId));

            SessionSnapshot latest = result.toSnapshot();
            liveSessions.put(sessionId, latest);

            if (latest.done()) {
                checkpointStore.save(sessionId, latest);
                log.info("Session {} completed: {}", sessionId, latest.finalSummary());
                metrics.recordSessionRun("completed");
                eventBus.publish(new SessionEvent(SessionEvent.COMPLETED, sessionId, null,
                        Map.of("finalSummary", latest.finalSummary(),
                                "generatedArtifacts", latest.generatedArtifacts()),
                        Instant.now()));
            } else if (latest.suspended()) {
                log.info("Session {} waiting for review", sessionId);
                metrics.recordSessionRun("suspended");
                var payload = new HashMap<String, Object>();
                payload.put("summary", ReviewGateNode.composeSummary(latest.plan(), latest.generatedArtifacts()));
                payload.put("plan", latest.plan());
                payload.put("generatedArtifacts", latest.generatedArtifacts());
                payload.put("artifactContents", latest.artifactContents());
                eventBus.publish(new SessionEvent(SessionEvent.REVIEW_REQUIRED, sessionId,
                        ComponentId.REVIEW_GATE.nodeId(), payload, Instant.now()));
            } else {
                log.warn("Session {} stopped without suspending or finishing (next: {})",
                        sessionId, latest.nextComponent());
                metrics.recordSessionRun("stopped");
            }
            return latest;
        } catch (RuntimeException e) {
            RuntimeException cause = unwrap(e);
            failures.put(sessionId, cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage());
            log.error("Session {} failed: {}", sessionId, cause.getMessage(), cause);
            metrics.recordSessionRun("failed");
            eventBus.publish(new SessionEvent(SessionEvent.FAILED, sessionId, null,
                    Map.of("error", failures.get(sessionId)), Instant.now()));
            throw cause;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs the session on the engine's pool. Failures are logged here as well as surfaced
     * through the returned future.
     */
    public CompletableFuture<SessionSnapshot> submit(String sessionId) {
        requireSession(sessionId);
        return CompletableFuture.supplyAsync(() -> run(sessionId), executor)
                .whenComplete((snapshot, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        log.warn("Background run of session {} ended with {}: {}", sessionId,
                                cause.getClass().getSimpleName(), cause.getMessage());
                    }
                });
    }

    /**
     * Attaches reviewer feedback to a suspended session. The session is not run; call
     * {@link #run(String)}, {@link #submit(String)} or use {@link #resume}.
     *
     * @throws SessionConflictException if the session is running, not waiting for review, or
     *                                  already holds feedback that no run has consumed yet
     */
    public SessionSnapshot submitFeedback(String sessionId, String feedbackText, ReviewAction action) {
        claim(sessionId, "is running");
        SessionSnapshot staged;
        try {
            SessionSnapshot snapshot = requireSession(sessionId);
            if (snapshot.done() || !snapshot.suspended()) {
                throw new SessionConflictException("Session " + sessionId + " is not waiting for review");
            }
            if (snapshot.hasFeedback()) {
                throw new SessionConflictException("Session " + sessionId + " already has feedback pending");
            }
            staged = snapshot.withFeedback(feedbackText, action);
            liveSessions.put(sessionId, staged);
        } finally {
            running.remove(sessionId);
        }
        log.info("Feedback staged for session {} (action={})", sessionId, action);
        eventBus.publish(new SessionEvent(SessionEvent.RESUMED, sessionId, ComponentId.REVIEW_GATE.nodeId(),
                Map.of("feedback", staged.feedback(), "action", action == null ? "" : action.name()),
                Instant.now()));
        return staged;
    }

    /**
     * Stages feedback and runs the session to its next suspension or completion.
     */
    public SessionSnapshot resume(String sessionId, String feedbackText, ReviewAction action) {
        submitFeedback(sessionId, feedbackText, action);
        return run(sessionId);
    }

    /**
     * Latest known state: the in-process copy if there is one, otherwise the checkpoint.
     */
    public Optional<SessionSnapshot> getState(String sessionId) {
        SessionSnapshot live = liveSessions.get(sessionId);
        if (live != null) {
            return Optional.of(live);
        }
        return checkpointStore.load(sessionId);
    }

    /**
     * Display status of a session.
     *
     * @throws SessionNotFoundException if the session is unknown
     */
    public SessionStatus status(String sessionId) {
        SessionSnapshot snapshot = requireSession(sessionId);
        return SessionStatus.of(snapshot, running.contains(sessionId), failures.containsKey(sessionId));
    }

    public boolean isRunning(String sessionId) {
        return running.contains(sessionId);
    }

    public Optional<String> failure(String sessionId) {
        return Optional.ofNullable(failures.get(sessionId));
    }

    /** Number of sessions that can run at once; further submissions queue. */
    public int capacity() {
        return capacity;
    }

    /**
     * Number of known sessions in each status, every status present. Sessions deleted while
     * counting are skipped.
     */
    public Map<SessionStatus, Integer> statusCounts() {
        var counts = new EnumMap<SessionStatus, Integer>(SessionStatus.class);
        for (SessionStatus status : SessionStatus.values()) {
            counts.put(status, 0);
        }
        for (String id : listSessions()) {
            getState(id).ifPresent(snapshot -> counts.merge(
                    SessionStatus.of(snapshot, running.contains(id), failures.containsKey(id)), 1, Integer::sum));
        }
        return counts;
    }

    /**
     * Ids of every session known to this process or to the checkpoint store.
     */
    public List<String> listSessions() {
        var ids = new TreeSet<>(liveSessions.keySet());
        ids.addAll(checkpointStore.listSessionIds());
        return List.copyOf(ids);
    }

    /**
     * Forgets a session and removes its checkpoint.
     *
     * @throws SessionNotFoundException if the session is unknown
     * @throws SessionConflictException if the session is running
     */
    public void deleteSession(String sessionId) {
        claim(sessionId, "is running");
        try {
            boolean removedLive = liveSessions.remove(sessionId) != null;
            boolean removedCheckpoint = checkpointStore.delete(sessionId);
            failures.remove(sessionId);
            if (!removedLive && !removedCheckpoint) {
                throw new SessionNotFoundException(sessionId);
            }
        } finally {
            running.remove(sessionId);
        }
        log.info("Session {} deleted", sessionId);
    }

    /**
     * Generates an id of the form AIDE-YYYY-NNNN, skipping ids already checkpointed.
     */
    public String generateSessionId() {
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        String id;
        do {
            id = String.format("AIDE-%d-%04d", year, SESSION_COUNTER.incrementAndGet());
        } while (liveSessions.containsKey(id) || checkpointStore.exists(id));
        return id;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }

    /**
     * Takes exclusive ownership of a session; every read-modify-write of its state goes through here.
     */
    private void claim(String sessionId, String conflictReason) {
        if (!running.add(sessionId)) {
            throw new SessionConflictException("Session " + sessionId + " " + conflictReason);
        }
    }

    private SessionSnapshot requireSession(String sessionId) {
        return getState(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Graph execution may wrap node exceptions; surface the step ceiling or the innermost
     * runtime exception.
     */
    static RuntimeException unwrap(RuntimeException e) {
        Throwable current = e;
        RuntimeException innermost = e;
        while (current != null) {
            if (current instanceof StepLimitExceededException limit) {
                return limit;
            }
            if (current instanceof RuntimeException re && !(current instanceof CompletionException)) {
                innermost = re;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return innermost;
    }
}
