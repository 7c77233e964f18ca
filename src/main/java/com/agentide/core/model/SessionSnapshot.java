package com.agentide.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Self-contained copy of every session field, as written to the checkpoint store.
 * <p>
 * {@code feedback}, {@code feedbackAction} and {@code lastDiagnostic} are {@code null} when absent.
 * {@code nextComponent} is kept as the raw routing value so that an unrecognized value survives
 * a round trip and is handled by the router rather than by deserialization.
 */
public record SessionSnapshot(
    String sessionId,
    String request,
    String originalRequest,
    String workingRoot,
    List<Step> plan,
    int stepIndex,
    String currentInstruction,
    String currentTarget,
    boolean workerCompleted,
    boolean stepFinished,
    List<String> generatedArtifacts,
    Map<String, String> artifactContents,
    boolean needsReview,
    boolean suspended,
    String feedback,
    ReviewAction feedbackAction,
    boolean skipReview,
    boolean done,
    String nextComponent,
    String activeComponent,
    String lastDiagnostic,
    String finalSummary,
    int invocationCount,
    SessionMemory memory
) implements Serializable {

    public SessionSnapshot {
        plan = plan == null ? List.of() : List.copyOf(plan);
        generatedArtifacts = generatedArtifacts == null ? List.of() : List.copyOf(generatedArtifacts);
        artifactContents = artifactContents == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(artifactContents));
        memory = memory == null ? SessionMemory.empty() : memory;
    }

    public boolean hasFeedback() {
        return feedback != null;
    }

    /**
     * Returns a copy staged for resumption: the given feedback attached, routing pointed back
     * at the review gate.
     */
    public SessionSnapshot withFeedback(String text, ReviewAction action) {
        return new SessionSnapshot(sessionId, request, originalRequest, workingRoot, plan, stepIndex,
                currentInstruction, currentTarget, workerCompleted, stepFinished, generatedArtifacts,
                artifactContents, needsReview, suspended, text == null ? "" : text, action, skipReview, done,
                ComponentId.REVIEW_GATE.name(), activeComponent, lastDiagnostic, finalSummary,
                invocationCount, memory);
    }
}
