package com.agentide.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Structured output from the planner.
 *
 * @param steps ordered list of proposed steps
 */
public record PlanProposal(
    List<ProposedStep> steps
) implements Serializable {

    /**
     * A step as the planner proposes it, before worker labels are normalized.
     *
     * @param agent       worker label, e.g. "code_agent" or "debug_agent"
     * @param instruction what the worker should do
     * @param targetFile  the file the step is about, may be empty
     */
    public record ProposedStep(
        String agent,
        String instruction,
        String targetFile
    ) implements Serializable {

        public Step toStep() {
            return new Step(WorkerKind.fromLabel(agent), instruction, targetFile);
        }
    }
}
