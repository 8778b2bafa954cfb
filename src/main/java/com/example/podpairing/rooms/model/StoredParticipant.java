package com.example.podpairing.rooms.model;

import java.time.Instant;

public class StoredParticipant {
  private String id;
  private String name;
  private String role;
  private int points;
  private Instant joinedAt;
  private boolean dropped;
  private int seatOrder;
  private String customGroupId;
  private boolean autoFill;

  public StoredParticipant() {}

  public String getId() { return id; }
  public void setId(String id) { this.id = id; }
  public String getName() { return name; }
  public void setName(String name) { this.name = name; }
  public String getRole() { return role; }
  public void setRole(String role) { this.role = role; }
  public int getPoints() { return points; }
  public void setPoints(int points) { this.points = points; }
  public Instant getJoinedAt() { return joinedAt; }
  public void setJoinedAt(Instant joinedAt) { this.joinedAt = joinedAt; }
  public boolean isDropped() { return dropped; }
  public void setDropped(boolean dropped) { this.dropped = dropped; }
  public int getSeatOrder() { return seatOrder; }
  public void setSeatOrder(int seatOrder) { this.seatOrder = seatOrder; }
  public String getCustomGroupId() { return customGroupId; }
  public void setCustomGroupId(String customGroupId) { this.customGroupId = customGroupId; }
  public boolean isAutoFill() { return autoFill; }
  public void setAutoFill(boolean autoFill) { this.autoFill = autoFill; }
}
