package com.example.podpairing.rooms.repo;

import com.example.podpairing.rooms.model.StoredSession;

import java.util.List;
import java.util.Optional;

public interface SessionStore {
  /** Loads a session snapshot; empty when none was stored yet. */
  Optional<StoredSession> load(String code) throws Exception;

  /** Every stored snapshot that is neither ended nor archived. */
  List<StoredSession> loadOpen() throws Exception;

  /** Saves/overwrites the snapshot. */
  void save(StoredSession session) throws Exception;
}
