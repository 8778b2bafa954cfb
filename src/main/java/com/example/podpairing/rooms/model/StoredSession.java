package com.example.podpairing.rooms.model;

import com.example.podpairing.model.SelectorVariant;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * StoredSession is the serializable snapshot of a pod session: participants, current tables and the
 * full archive. It is storage-agnostic and produced/consumed by SessionCodec.
 */
public class StoredSession {

    // --- Identity & basic metadata -----------------------------------------

    private String code;
    private String hostId;
    private String eventName;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant expiresAt;

    // --- Game state -------------------------------------------------------------

    private int currentRound;
    private boolean started;
    private boolean ended;
    private boolean archived;

    private Settings settings = new Settings();
    private List<StoredParticipant> participants = new ArrayList<>();
    private List<StoredTable> currentTables;          // null until the first generation
    private List<StoredRound> archive = new ArrayList<>();

    public static StoredSession newWithCode(String code) {
        StoredSession s = new StoredSession();
        s.code = Objects.requireNonNull(code, "code");
        Instant now = Instant.now();
        s.createdAt = now;
        s.updatedAt = now;
        return s;
    }

    // --- Getters / Setters --------------------------------------------------

    public String getCode() { return code; }
    public void setCode(String code) { this.code = Objects.requireNonNull(code, "code"); }

    public String getHostId() { return hostId; }
    public void setHostId(String hostId) { this.hostId = hostId; }

    public String getEventName() { return eventName; }
    public void setEventName(String eventName) { this.eventName = eventName; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }

    public int getCurrentRound() { return currentRound; }
    public void setCurrentRound(int currentRound) { this.currentRound = currentRound; }

    public boolean isStarted() { return started; }
    public void setStarted(boolean started) { this.started = started; }

    public boolean isEnded() { return ended; }
    public void setEnded(boolean ended) { this.ended = ended; }

    public boolean isArchived() { return archived; }
    public void setArchived(boolean archived) { this.archived = archived; }

    public Settings getSettings() { return settings; }
    public void setSettings(Settings settings) { this.settings = (settings == null) ? new Settings() : settings; }

    public List<StoredParticipant> getParticipants() { return participants; }
    public void setParticipants(List<StoredParticipant> participants) {
        this.participants = (participants == null) ? new ArrayList<>() : participants;
    }

    public List<StoredTable> getCurrentTables() { return currentTables; }
    public void setCurrentTables(List<StoredTable> currentTables) { this.currentTables = currentTables; }

    public List<StoredRound> getArchive() { return archive; }
    public void setArchive(List<StoredRound> archive) { this.archive = (archive == null) ? new ArrayList<>() : archive; }

    // --- Helpers ------------------------------------------------------------

    public void touchUpdated() {
        this.updatedAt = Instant.now();
    }

    public void touchCreatedIfNull() {
        if (this.createdAt == null) this.createdAt = Instant.now();
    }

    // --- Nested types -------------------------------------------------------

    /** Flat copy of RoomSettings; round length kept in minutes. */
    public static class Settings {
        private boolean allowJoinAfterStart = true;
        private boolean prioritizeWinners = true;
        private boolean allowThreeSeatTables = true;
        private boolean extraThreeSeatPenalty = false;
        private boolean allowCustomGroups = true;
        private long roundLengthMinutes = 90;
        private boolean usePoints = false;
        private int pointsForWin = 3;
        private int pointsForDraw = 1;
        private int pointsForLoss = 0;
        private int pointsForBye = 1;
        private int maxRounds = 0;
        private int maxTableSize = 4;
        private SelectorVariant selectorVariant = SelectorVariant.PROGRESSIVE;

        public boolean isAllowJoinAfterStart() { return allowJoinAfterStart; }
        public void setAllowJoinAfterStart(boolean v) { this.allowJoinAfterStart = v; }
        public boolean isPrioritizeWinners() { return prioritizeWinners; }
        public void setPrioritizeWinners(boolean v) { this.prioritizeWinners = v; }
        public boolean isAllowThreeSeatTables() { return allowThreeSeatTables; }
        public void setAllowThreeSeatTables(boolean v) { this.allowThreeSeatTables = v; }
        public boolean isExtraThreeSeatPenalty() { return extraThreeSeatPenalty; }
        public void setExtraThreeSeatPenalty(boolean v) { this.extraThreeSeatPenalty = v; }
        public boolean isAllowCustomGroups() { return allowCustomGroups; }
        public void setAllowCustomGroups(boolean v) { this.allowCustomGroups = v; }
        public long getRoundLengthMinutes() { return roundLengthMinutes; }
        public void setRoundLengthMinutes(long v) { this.roundLengthMinutes = v; }
        public boolean isUsePoints() { return usePoints; }
        public void setUsePoints(boolean v) { this.usePoints = v; }
        public int getPointsForWin() { return pointsForWin; }
        public void setPointsForWin(int v) { this.pointsForWin = v; }
        public int getPointsForDraw() { return pointsForDraw; }
        public void setPointsForDraw(int v) { this.pointsForDraw = v; }
        public int getPointsForLoss() { return pointsForLoss; }
        public void setPointsForLoss(int v) { this.pointsForLoss = v; }
        public int getPointsForBye() { return pointsForBye; }
        public void setPointsForBye(int v) { this.pointsForBye = v; }
        public int getMaxRounds() { return maxRounds; }
        public void setMaxRounds(int v) { this.maxRounds = v; }
        public int getMaxTableSize() { return maxTableSize; }
        public void setMaxTableSize(int v) { this.maxTableSize = v; }
        public SelectorVariant getSelectorVariant() { return selectorVariant; }
        public void setSelectorVariant(SelectorVariant v) { this.selectorVariant = v; }
    }
}
