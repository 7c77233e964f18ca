package com.agentide.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * An entry of the recent-artifacts log.
 *
 * @param artifactId the artifact (file path relative to the working root)
 * @param operation  what was done to it
 * @param actor      the component that did it
 * @param timestamp  when it happened
 */
public record ArtifactRecord(
    String artifactId,
    ArtifactOperation operation,
    String actor,
    Instant timestamp
) implements Serializable {}
