package com.example.podpairing.rooms.model;

import com.example.podpairing.model.TableResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class StoredTable {
  private int number;
  private int roundNumber;
  private List<StoredParticipant> participants = new ArrayList<>();
  private TableResult result = TableResult.NONE;
  private String winnerId;
  private boolean roundStarted;
  private Instant startedAt;
  private Instant completedAt;
  private Map<String, Object> statistics = new LinkedHashMap<>();
  private boolean custom;
  private boolean autoFill;
  private String customGroupId;

  public StoredTable() {}

  public int getNumber() { return number; }
  public void setNumber(int number) { this.number = number; }
  public int getRoundNumber() { return roundNumber; }
  public void setRoundNumber(int roundNumber) { this.roundNumber = roundNumber; }
  public List<StoredParticipant> getParticipants() { return participants; }
  public void setParticipants(List<StoredParticipant> participants) {
    this.participants = (participants == null) ? new ArrayList<>() : participants;
  }
  public TableResult getResult() { return result; }
  public void setResult(TableResult result) { this.result = (result == null) ? TableResult.NONE : result; }
  public String getWinnerId() { return winnerId; }
  public void setWinnerId(String winnerId) { this.winnerId = winnerId; }
  public boolean isRoundStarted() { return roundStarted; }
  public void setRoundStarted(boolean roundStarted) { this.roundStarted = roundStarted; }
  public Instant getStartedAt() { return startedAt; }
  public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
  public Instant getCompletedAt() { return completedAt; }
  public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
  public Map<String, Object> getStatistics() { return statistics; }
  public void setStatistics(Map<String, Object> statistics) {
    this.statistics = (statistics == null) ? new LinkedHashMap<>() : statistics;
  }
  public boolean isCustom() { return custom; }
  public void setCustom(boolean custom) { this.custom = custom; }
  public boolean isAutoFill() { return autoFill; }
  public void setAutoFill(boolean autoFill) { this.autoFill = autoFill; }
  public String getCustomGroupId() { return customGroupId; }
  public void setCustomGroupId(String customGroupId) { this.customGroupId = customGroupId; }
}
