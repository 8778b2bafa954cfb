package com.example.podpairing.rooms.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** One archived round inside a {@link StoredSession}. */
public class StoredRound {
  private int roundNumber;
  private Instant archivedAt;
  private List<StoredTable> tables = new ArrayList<>();

  public StoredRound() {}

  public int getRoundNumber() { return roundNumber; }
  public void setRoundNumber(int roundNumber) { this.roundNumber = roundNumber; }
  public Instant getArchivedAt() { return archivedAt; }
  public void setArchivedAt(Instant archivedAt) { this.archivedAt = archivedAt; }
  public List<StoredTable> getTables() { return tables; }
  public void setTables(List<StoredTable> tables) { this.tables = (tables == null) ? new ArrayList<>() : tables; }
}
