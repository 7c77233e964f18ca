package com.agentide.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of one worker adapter execution.
 *
 * @param artifactsCreated  artifacts written for the first time in this session
 * @param artifactsModified artifacts written, appended or patched that already existed in the session
 * @param artifactsRead     artifacts read
 * @param producedText      the worker's final prose (a diagnosis for the diagnostic worker)
 * @param attempts          number of reasoning turns used
 */
public record WorkerResult(
    List<String> artifactsCreated,
    List<String> artifactsModified,
    List<String> artifactsRead,
    String producedText,
    int attempts
) implements Serializable {

    public WorkerResult {
        artifactsCreated = artifactsCreated == null ? List.of() : List.copyOf(artifactsCreated);
        artifactsModified = artifactsModified == null ? List.of() : List.copyOf(artifactsModified);
        artifactsRead = artifactsRead == null ? List.of() : List.copyOf(artifactsRead);
        producedText = producedText == null ? "" : producedText;
    }

    public boolean wroteSomething() {
        return !artifactsCreated.isEmpty() || !artifactsModified.isEmpty();
    }
}
