package com.example.podpairing.rooms.repo;

import com.example.podpairing.rooms.model.StoredSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stores session snapshots as JSON documents in the {@code persistent_sessions} table.
 */
@Component
public class JpaSessionStore implements SessionStore {

  private final PersistentSessionRepository repo;
  private final ObjectMapper mapper;

  public JpaSessionStore(PersistentSessionRepository repo, ObjectMapper mapper) {
    this.repo = repo;
    this.mapper = mapper;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<StoredSession> load(String code) throws Exception {
    if (code == null || code.isBlank()) return Optional.empty();
    Optional<PersistentSession> row = repo.findById(code.trim().toUpperCase());
    if (row.isEmpty()) return Optional.empty();
    return Optional.of(mapper.readValue(row.get().getPayload(), StoredSession.class));
  }

  @Override
  @Transactional(readOnly = true)
  public List<StoredSession> loadOpen() throws Exception {
    List<StoredSession> out = new ArrayList<>();
    for (PersistentSession row : repo.findByEndedFalse()) {
      StoredSession s = mapper.readValue(row.getPayload(), StoredSession.class);
      if (!s.isArchived()) out.add(s);
    }
    return out;
  }

  @Override
  @Transactional
  public void save(StoredSession session) throws Exception {
    String code = session.getCode().trim().toUpperCase();
    PersistentSession row = repo.findById(code)
        .orElseGet(() -> new PersistentSession(code, session.getHostId()));
    row.setHostId(session.getHostId());
    if (session.getCreatedAt() != null) row.setCreatedAt(session.getCreatedAt());
    row.setUpdatedAt(session.getUpdatedAt());
    row.setExpiresAt(session.getExpiresAt());
    row.setEnded(session.isEnded() || session.isArchived());
    row.setPayload(mapper.writeValueAsString(session));
    repo.save(row);
  }
}
