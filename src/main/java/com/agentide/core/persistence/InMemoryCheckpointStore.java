package com.agentide.core.persistence;

import com.agentide.core.model.SessionSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local checkpoint store. Snapshots are kept as JSON text so that every load
 * yields a fresh copy. Not durable across restarts.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final ConcurrentHashMap<String, String> checkpoints = new ConcurrentHashMap<>();

    @Override
    public void save(String sessionId, SessionSnapshot snapshot) {
        checkpoints.put(sessionId, CheckpointSerializer.toJson(snapshot));
    }

    @Override
    public Optional<SessionSnapshot> load(String sessionId) {
        return Optional.ofNullable(checkpoints.get(sessionId)).map(CheckpointSerializer::fromJson);
    }

    @Override
    public boolean exists(String sessionId) {
        return checkpoints.containsKey(sessionId);
    }

    @Override
    public List<String> listSessionIds() {
        return checkpoints.keySet().stream().sorted().toList();
    }

    @Override
    public boolean delete(String sessionId) {
        return checkpoints.remove(sessionId) != null;
    }

    @Override
    public boolean isDurable() {
        return false;
    }
}
