package com.agentide.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A single entry of the conversation log.
 *
 * @param role               "user", "assistant" or a worker role such as "code_agent"
 * @param content            the turn text
 * @param artifactsMentioned artifact ids the turn refers to
 * @param timestamp          when the turn was recorded
 */
public record ConversationTurn(
    String role,
    String content,
    List<String> artifactsMentioned,
    Instant timestamp
) implements Serializable {

    public ConversationTurn {
        artifactsMentioned = artifactsMentioned == null ? List.of() : List.copyOf(artifactsMentioned);
    }
}
