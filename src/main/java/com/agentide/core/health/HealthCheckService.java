package com.agentide.core.health;

import com.agentide.core.engine.SessionEngine;
import com.agentide.core.graph.SessionGraph;
import com.agentide.core.model.SessionStatus;
import com.agentide.core.persistence.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks the pieces a session depends on: the compiled graph and its step ceiling, the
 * checkpoint store and whether it survives a restart, and the engine's session slots.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    static final String GRAPH = "session_graph";
    static final String CHECKPOINTS = "checkpoints";
    static final String SESSIONS = "sessions";

    private final SessionGraph sessionGraph;
    private final CheckpointStore checkpointStore;
    private final SessionEngine sessionEngine;

    public HealthCheckService(
            @Autowired(required = false) SessionGraph sessionGraph,
            @Autowired(required = false) CheckpointStore checkpointStore,
            @Autowired(required = false) SessionEngine sessionEngine) {
        this.sessionGraph = sessionGraph;
        this.checkpointStore = checkpointStore;
        this.sessionEngine = sessionEngine;
    }

    public HealthReport check() {
        var report = HealthReport.of(List.of(checkGraph(), checkCheckpoints(), checkSessions()));
        if (report.status() != HealthStatus.Status.UP) {
            log.debug("Health is {}: {}", report.status(), report.components());
        }
        return report;
    }

    HealthStatus checkGraph() {
        if (sessionGraph == null) {
            return HealthStatus.down(GRAPH, "Session graph not compiled");
        }
        return HealthStatus.up(GRAPH, "Session graph compiled", Map.of(
                "max_steps", String.valueOf(sessionGraph.maxSteps()),
                "max_iterations", String.valueOf(sessionGraph.maxIterations())));
    }

    HealthStatus checkCheckpoints() {
        if (checkpointStore == null) {
            return HealthStatus.down(CHECKPOINTS, "No checkpoint store configured");
        }
        try {
            var metadata = new LinkedHashMap<String, String>();
            metadata.put("store", checkpointStore.getClass().getSimpleName());
            metadata.put("durable", String.valueOf(checkpointStore.isDurable()));
            metadata.put("stored_sessions", String.valueOf(checkpointStore.listSessionIds().size()));
            if (!checkpointStore.isDurable()) {
                return HealthStatus.degraded(CHECKPOINTS,
                        "Checkpoints are in memory; suspended sessions are lost on restart", metadata);
            }
            return HealthStatus.up(CHECKPOINTS, "Checkpoints are durable", metadata);
        } catch (RuntimeException e) {
            log.warn("Checkpoint store health check failed: {}", e.getMessage());
            return HealthStatus.down(CHECKPOINTS, "Checkpoint store error: " + e.getMessage());
        }
    }

    HealthStatus checkSessions() {
        if (sessionEngine == null) {
            return HealthStatus.down(SESSIONS, "Session engine not available");
        }
        try {
            Map<SessionStatus, Integer> counts = sessionEngine.statusCounts();
            int running = counts.getOrDefault(SessionStatus.RUNNING, 0);
            int awaiting = counts.getOrDefault(SessionStatus.AWAITING_REVIEW, 0);
            int capacity = sessionEngine.capacity();

            var metadata = new LinkedHashMap<String, String>();
            metadata.put("capacity", String.valueOf(capacity));
            counts.forEach((status, count) -> metadata.put(status.name().toLowerCase(Locale.ROOT), String.valueOf(count)));

            String detail = running + " running, " + awaiting + " awaiting review";
            if (running >= capacity) {
                return HealthStatus.degraded(SESSIONS,
                        detail + "; all " + capacity + " slots busy, new runs queue", metadata);
            }
            return HealthStatus.up(SESSIONS, detail, metadata);
        } catch (RuntimeException e) {
            log.warn("Session health check failed: {}", e.getMessage());
            return HealthStatus.down(SESSIONS, "Cannot enumerate sessions: " + e.getMessage());
        }
    }
}
