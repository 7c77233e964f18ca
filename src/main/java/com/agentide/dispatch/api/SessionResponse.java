package com.agentide.dispatch.api;

import com.agentide.core.model.SessionSnapshot;
import com.agentide.core.model.SessionStatus;
import com.agentide.core.model.Step;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON view of a session.
 */
public record SessionResponse(
    @JsonProperty("session_id") String sessionId,
    String status,
    String request,
    @JsonProperty("original_request") String originalRequest,
    @JsonProperty("working_root") String workingRoot,
    List<StepResponse> plan,
    @JsonProperty("step_index") int stepIndex,
    @JsonProperty("active_component") String activeComponent,
    @JsonProperty("generated_artifacts") List<String> generatedArtifacts,
    @JsonProperty("artifact_contents") Map<String, String> artifactContents,
    @JsonProperty("needs_review") boolean needsReview,
    boolean done,
    @JsonProperty("final_summary") String finalSummary,
    @JsonProperty("invocation_count") int invocationCount,
    String error
) {

    public record StepResponse(
        String worker,
        String instruction,
        @JsonProperty("target_artifact") String targetArtifact
    ) {}

    static SessionResponse from(SessionSnapshot snapshot, SessionStatus status, String error) {
        List<StepResponse> steps = snapshot.plan().stream()
                .map(SessionResponse::toStep)
                .toList();
        return new SessionResponse(
                snapshot.sessionId(),
                status.name(),
                snapshot.request(),
                snapshot.originalRequest(),
                snapshot.workingRoot(),
                steps,
                snapshot.stepIndex(),
                snapshot.activeComponent(),
                snapshot.generatedArtifacts(),
                snapshot.artifactContents(),
                snapshot.suspended() && !snapshot.done(),
                snapshot.done(),
                snapshot.finalSummary(),
                snapshot.invocationCount(),
                error);
    }

    private static StepResponse toStep(Step step) {
        return new StepResponse(step.workerKind().name(), step.instruction(), step.targetArtifact());
    }
}
