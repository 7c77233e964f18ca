package com.agentide.core.model;

/**
 * What a worker did to an artifact.
 */
public enum ArtifactOperation {
    CREATED,
    MODIFIED,
    READ;

    /** Created and modified artifacts become the current focus; reads do not. */
    public boolean isWrite() {
        return this != READ;
    }
}
