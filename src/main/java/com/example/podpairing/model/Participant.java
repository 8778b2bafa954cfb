package com.example.podpairing.model;

import java.time.Instant;
import java.util.Objects;

/** Participant of a pod session. Archived rounds keep value copies made with {@link #copy()}. */
public class Participant {

    private final String id;
    private final String name;
    private final Instant joinedAt;

    private String role = "";            // character / commander label, free text
    private int points = 0;
    private boolean dropped = false;
    private int seatOrder = 0;           // 1..n within the current table, 0 = unassigned
    private String customGroupId;        // null => not in a custom group
    private boolean autoFill = false;    // open custom group: remaining seats filled automatically

    public Participant(String id, String name, Instant joinedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = (name == null || name.isBlank()) ? id : name.trim();
        this.joinedAt = Objects.requireNonNull(joinedAt, "joinedAt");
    }

    // identity
    public String getId() { return id; }
    public String getName() { return name; }
    public Instant getJoinedAt() { return joinedAt; }

    // role label
    public String getRole() { return role; }
    public void setRole(String role) { this.role = (role == null) ? "" : role.trim(); }

    // scoring
    public int getPoints() { return points; }
    public void setPoints(int points) { this.points = points; }
    public void addPoints(int delta) { this.points += delta; }

    public boolean isDropped() { return dropped; }
    public void setDropped(boolean dropped) { this.dropped = dropped; }

    public int getSeatOrder() { return seatOrder; }
    public void setSeatOrder(int seatOrder) { this.seatOrder = seatOrder; }

    // custom groups
    public String getCustomGroupId() { return customGroupId; }
    public void setCustomGroupId(String customGroupId) {
        this.customGroupId = (customGroupId == null || customGroupId.isBlank()) ? null : customGroupId;
    }
    public boolean isInCustomGroup() { return customGroupId != null; }

    public boolean isAutoFill() { return autoFill; }
    public void setAutoFill(boolean autoFill) { this.autoFill = autoFill; }

    /** Puts the participant back into the general pool. */
    public void leaveCustomGroup() {
        this.customGroupId = null;
        this.autoFill = false;
    }

    public Participant copy() {
        Participant c = new Participant(id, name, joinedAt);
        c.role = role;
        c.points = points;
        c.dropped = dropped;
        c.seatOrder = seatOrder;
        c.customGroupId = customGroupId;
        c.autoFill = autoFill;
        return c;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Participant)) return false;
        return id.equals(((Participant) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Participant{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", points=" + points +
                ", dropped=" + dropped +
                ", customGroupId=" + customGroupId +
                ", autoFill=" + autoFill +
                '}';
    }
}
