package com.agentide.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Components the router can hand control to. {@link #TERMINAL} ends the run.
 */
public enum ComponentId {
    PLAN_CONTROLLER("plan_controller"),
    WRITE_WORKER("write_worker"),
    DIAGNOSTIC_WORKER("diagnostic_worker"),
    REVIEW_GATE("review_gate"),
    TERMINAL("terminal");

    private final String nodeId;

    ComponentId(String nodeId) {
        this.nodeId = nodeId;
    }

    /** Graph node id for this component. */
    public String nodeId() {
        return nodeId;
    }

    /**
     * Parses either the enum name or the node id. Returns empty for anything else.
     */
    public static Optional<ComponentId> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (ComponentId id : values()) {
            if (id.name().equalsIgnoreCase(value) || id.nodeId.equals(value.toLowerCase(Locale.ROOT))) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    /**
     * The worker adapter that executes steps of the given kind.
     */
    public static ComponentId forWorker(WorkerKind kind) {
        return kind == WorkerKind.DIAGNOSTIC ? DIAGNOSTIC_WORKER : WRITE_WORKER;
    }
}
