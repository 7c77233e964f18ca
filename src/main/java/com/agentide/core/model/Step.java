package com.agentide.core.model;

import java.io.Serializable;

/**
 * One immutable unit of a plan.
 *
 * @param workerKind     which worker executes the step
 * @param instruction    what the worker should do
 * @param targetArtifact the file the step is about, or {@code null} when none was named
 */
public record Step(
    WorkerKind workerKind,
    String instruction,
    String targetArtifact
) implements Serializable {

    public Step {
        if (workerKind == null) {
            workerKind = WorkerKind.WRITE;
        }
        if (instruction == null) {
            instruction = "";
        }
        if (targetArtifact != null && targetArtifact.isBlank()) {
            targetArtifact = null;
        }
    }

    public boolean hasTarget() {
        return targetArtifact != null;
    }
}
