package com.example.podpairing.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Live state of one pod session.
 *
 * Not thread-safe: every read-modify-write goes through the per-code lock owned by
 * {@link com.example.podpairing.service.RoomSessionRegistry}.
 */
public class RoomSession {

    private final String code;
    private final String hostId;
    private final Instant createdAt;
    private Instant expiresAt;
    private String eventName;

    private RoomSettings settings = new RoomSettings();

    private int currentRound = 0;
    private final Map<String, Participant> participants = new LinkedHashMap<>();
    private List<GameTable> currentTables;     // null until the first generation
    private final List<ArchivedRound> archive = new ArrayList<>();

    private boolean started = false;
    private boolean ended = false;
    private boolean archived = false;

    public RoomSession(String code, String hostId, Instant createdAt, Instant expiresAt) {
        this.code = Objects.requireNonNull(code, "code");
        this.hostId = Objects.requireNonNull(hostId, "hostId");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    }

    // --- identity -------------------------------------------------------------

    public String getCode() { return code; }
    public String getHostId() { return hostId; }
    public boolean isHost(String actorId) { return actorId != null && hostId.equals(actorId); }

    public Instant getCreatedAt() { return createdAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = Objects.requireNonNull(expiresAt); }
    public boolean isExpired(Instant now) { return !now.isBefore(expiresAt); }

    public String getEventName() { return eventName; }
    public void setEventName(String eventName) {
        this.eventName = (eventName == null || eventName.isBlank()) ? null : eventName.trim();
    }

    public RoomSettings getSettings() { return settings; }
    public void setSettings(RoomSettings settings) { this.settings = Objects.requireNonNull(settings); }

    // --- participants ---------------------------------------------------------

    public Participant getParticipant(String id) { return (id == null) ? null : participants.get(id); }
    public boolean hasParticipant(String id) { return id != null && participants.containsKey(id); }

    public void addParticipant(Participant p) {
        if (participants.putIfAbsent(p.getId(), p) != null) {
            throw new IllegalArgumentException("duplicate participant " + p.getId());
        }
    }

    public Participant removeParticipant(String id) { return participants.remove(id); }

    public Collection<Participant> getParticipants() {
        return Collections.unmodifiableCollection(participants.values());
    }

    /** Participants eligible for seating, in join order. */
    public List<Participant> getActiveParticipants() {
        return participants.values().stream().filter(p -> !p.isDropped()).collect(Collectors.toList());
    }

    public List<Participant> getCustomGroupMembers(String groupId) {
        return participants.values().stream()
                .filter(p -> groupId.equals(p.getCustomGroupId()))
                .collect(Collectors.toList());
    }

    // --- rounds ---------------------------------------------------------------

    public int getCurrentRound() { return currentRound; }

    /** Round numbers never go backwards. */
    public void setCurrentRound(int round) {
        if (round < currentRound) {
            throw new IllegalStateException("round number must not decrease (" + currentRound + " -> " + round + ")");
        }
        this.currentRound = round;
    }

    public List<GameTable> getCurrentTables() {
        return (currentTables == null) ? null : Collections.unmodifiableList(currentTables);
    }

    public boolean hasCurrentTables() { return currentTables != null && !currentTables.isEmpty(); }

    public void setCurrentTables(List<GameTable> tables) {
        this.currentTables = (tables == null) ? null : new ArrayList<>(tables);
    }

    public void clearCurrentTables() { this.currentTables = null; }

    public Optional<GameTable> findCurrentTable(int number) {
        if (currentTables == null) return Optional.empty();
        return currentTables.stream().filter(t -> t.getNumber() == number).findFirst();
    }

    public Optional<GameTable> findCurrentTableOf(String participantId) {
        if (currentTables == null) return Optional.empty();
        return currentTables.stream().filter(t -> t.contains(participantId)).findFirst();
    }

    public boolean anyCurrentTableStarted() {
        return currentTables != null && currentTables.stream().anyMatch(GameTable::isRoundStarted);
    }

    public List<ArchivedRound> getArchive() { return Collections.unmodifiableList(archive); }

    public void appendArchive(ArchivedRound round) { archive.add(Objects.requireNonNull(round)); }

    public Optional<ArchivedRound> latestArchivedRound() {
        return archive.isEmpty() ? Optional.empty() : Optional.of(archive.get(archive.size() - 1));
    }

    // --- flags ----------------------------------------------------------------

    public boolean isStarted() { return started; }
    public void setStarted(boolean started) { this.started = started; }

    public boolean isEnded() { return ended; }
    public void setEnded(boolean ended) { this.ended = ended; }

    public boolean isArchived() { return archived; }
    public void setArchived(boolean archived) { this.archived = archived; }

    @Override
    public String toString() {
        return "RoomSession{" +
                "code='" + code + '\'' +
                ", hostId='" + hostId + '\'' +
                ", round=" + currentRound +
                ", participants=" + participants.size() +
                ", archived rounds=" + archive.size() +
                ", started=" + started +
                ", ended=" + ended +
                '}';
    }
}
