package com.agentide.core.persistence;

import com.agentide.core.model.SessionSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Durable store of session snapshots, one per session id.
 * <p>
 * Implementations must isolate sessions from each other by key and must never hand out
 * an object that aliases a live session state.
 */
public interface CheckpointStore {

    /**
     * Writes the snapshot, replacing any previous one for the same session.
     *
     * @throws CheckpointException if the snapshot could not be persisted
     */
    void save(String sessionId, SessionSnapshot snapshot);

    Optional<SessionSnapshot> load(String sessionId);

    boolean exists(String sessionId);

    List<String> listSessionIds();

    /**
     * @return {@code true} if a checkpoint was removed
     */
    boolean delete(String sessionId);

    /** Whether checkpoints survive a process restart. */
    boolean isDurable();
}
