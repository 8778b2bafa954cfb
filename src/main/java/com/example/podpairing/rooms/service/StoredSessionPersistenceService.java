package com.example.podpairing.rooms.service;

import com.example.podpairing.rooms.model.StoredSession;
import com.example.podpairing.rooms.repo.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

public class StoredSessionPersistenceService implements SessionPersistenceService {

  private static final Logger log = LoggerFactory.getLogger(StoredSessionPersistenceService.class);

  private final SessionStore store;

  public StoredSessionPersistenceService(SessionStore store) {
    this.store = store;
  }

  @Override
  public void save(StoredSession snapshot, String requestedBy) {
    if (snapshot == null) return;

    try {
      // Keep the original creation time of an already stored session
      StoredSession existing = store.load(snapshot.getCode()).orElse(null);
      if (existing != null && existing.getCreatedAt() != null) {
        snapshot.setCreatedAt(existing.getCreatedAt());
      }
      snapshot.touchCreatedIfNull();
      snapshot.touchUpdated();

      if (log.isDebugEnabled()) {
        log.debug("save: {} snapshot for roomCode={} by={} (round={}, archived rounds={})",
            existing == null ? "creating" : "replacing", snapshot.getCode(), requestedBy,
            snapshot.getCurrentRound(), snapshot.getArchive().size());
      }
      store.save(snapshot);

    } catch (Exception e) {
      // Best-effort: log and swallow so the app keeps running
      if (log.isDebugEnabled()) {
        log.debug("save failed for room {}: {}", snapshot.getCode(), e.toString(), e);
      } else {
        log.warn("save failed for room {}: {}", snapshot.getCode(), e.toString());
      }
    }
  }

  @Override
  public List<StoredSession> loadOpen() {
    try {
      return store.loadOpen();
    } catch (Exception e) {
      log.warn("loadOpen failed: {}", e.toString());
      return List.of();
    }
  }

  @Override
  public Optional<StoredSession> load(String code) {
    try {
      return store.load(code);
    } catch (Exception e) {
      log.warn("load failed for room {}: {}", code, e.toString());
      return Optional.empty();
    }
  }
}
