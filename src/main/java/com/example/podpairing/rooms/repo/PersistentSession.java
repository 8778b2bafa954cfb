package com.example.podpairing.rooms.repo;

import jakarta.persistence.*;
import java.time.Instant;

/** One row per room code; the full snapshot lives in {@code payload} as JSON. */
@Entity
@Table(
    name = "persistent_sessions",
    indexes = {
        @Index(name = "idx_persistent_sessions_expires_at", columnList = "expiresAt"),
        @Index(name = "idx_persistent_sessions_ended", columnList = "ended")
    }
)
public class PersistentSession {

    @Id
    @Column(length = 16, nullable = false, updatable = false)
    private String code;

    @Column(nullable = false, length = 200)
    private String hostId;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Column(nullable = false)
    private Instant expiresAt;

    @Column(nullable = false)
    private boolean ended = false;

    @Lob
    @Column(nullable = false)
    private String payload;

    protected PersistentSession() {}

    public PersistentSession(String code, String hostId) {
        this.code = code;
        this.hostId = hostId;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (this.createdAt == null) this.createdAt = now;
        if (this.updatedAt == null) this.updatedAt = now;
        if (this.expiresAt == null) this.expiresAt = now;
    }

    public String getCode() { return code; }

    public String getHostId() { return hostId; }
    public void setHostId(String hostId) { this.hostId = hostId; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }

    public boolean isEnded() { return ended; }
    public void setEnded(boolean ended) { this.ended = ended; }

    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }

    @Override
    public String toString() {
        return "PersistentSession{" +
                "code='" + code + '\'' +
                ", hostId='" + hostId + '\'' +
                ", updatedAt=" + updatedAt +
                ", expiresAt=" + expiresAt +
                ", ended=" + ended +
                '}';
    }
}
