package com.agentide.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a session runs, consumed by SSE streams and the CLI.
 *
 * @param eventType  e.g. "session.started", "session.step", "session.review_required"
 * @param sessionId  the session this event belongs to
 * @param component  the component that produced it (nullable for session-level events)
 * @param payload    event data
 * @param timestamp  when the event occurred
 */
public record SessionEvent(
    String eventType,
    String sessionId,
    String component,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String STARTED = "session.started";
    public static final String STEP = "session.step";
    public static final String REVIEW_REQUIRED = "session.review_required";
    public static final String RESUMED = "session.resumed";
    public static final String COMPLETED = "session.completed";
    public static final String FAILED = "session.failed";

    /** Whether no further events follow for this session run. */
    public boolean isTerminal() {
        return REVIEW_REQUIRED.equals(eventType) || COMPLETED.equals(eventType) || FAILED.equals(eventType);
    }
}
