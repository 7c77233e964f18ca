package com.agentide.core.model;

import java.util.Locale;

/**
 * Kind of worker a plan step is addressed to.
 * <p>
 * Planners name workers with free-form labels ({@code code_agent}, {@code debug_agent},
 * {@code reviewer_agent}); {@link #fromLabel(String)} maps them onto this closed set.
 */
public enum WorkerKind {
    WRITE,
    DIAGNOSTIC,
    REVIEW;

    /**
     * Maps a planner label to a worker kind. Unknown or missing labels map to {@link #WRITE}.
     */
    public static WorkerKind fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return WRITE;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("debug") || normalized.startsWith("diagnos")) {
            return DIAGNOSTIC;
        }
        if (normalized.startsWith("review")) {
            return REVIEW;
        }
        return WRITE;
    }
}
