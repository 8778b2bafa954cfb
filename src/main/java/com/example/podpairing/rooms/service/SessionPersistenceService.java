package com.example.podpairing.rooms.service;

import com.example.podpairing.rooms.model.StoredSession;

import java.util.List;
import java.util.Optional;

/**
 * Persistence facade for session snapshots. Implementations may back this with any storage.
 * Failures never surface to callers.
 */
public interface SessionPersistenceService {

    /**
     * Save a snapshot taken from the live session under its lock.
     */
    void save(StoredSession snapshot, String requestedBy);

    /** Sessions to bring back into memory on startup. */
    default List<StoredSession> loadOpen() {
        return List.of();
    }

    default Optional<StoredSession> load(String code) {
        return Optional.empty();
    }
}
