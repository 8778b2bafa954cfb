package com.example.podpairing.rooms.service;

import com.example.podpairing.rooms.model.StoredSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when {@code pods.persistence.enabled=false}: sessions live in memory only.
 */
public class NoOpSessionPersistenceService implements SessionPersistenceService {

    private static final Logger log = LoggerFactory.getLogger(NoOpSessionPersistenceService.class);

    @Override
    public void save(StoredSession snapshot, String requestedBy) {
        if (snapshot != null) {
            log.debug("NoOp save: roomCode={}, requestedBy={}", snapshot.getCode(), requestedBy);
        }
    }
}
