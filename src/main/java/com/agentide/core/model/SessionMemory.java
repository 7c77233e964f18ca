package com.agentide.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Immutable snapshot of a session's short-term memory.
 * <p>
 * {@code conversationHistory} is oldest first; {@code recentArtifacts} is most recent first.
 * An empty {@code currentFocus} means no focus has been set yet.
 */
public record SessionMemory(
    List<ConversationTurn> conversationHistory,
    List<ArtifactRecord> recentArtifacts,
    String currentFocus
) implements Serializable {

    public SessionMemory {
        conversationHistory = conversationHistory == null ? List.of() : List.copyOf(conversationHistory);
        recentArtifacts = recentArtifacts == null ? List.of() : List.copyOf(recentArtifacts);
        currentFocus = currentFocus == null ? "" : currentFocus;
    }

    public static SessionMemory empty() {
        return new SessionMemory(List.of(), List.of(), "");
    }
}
