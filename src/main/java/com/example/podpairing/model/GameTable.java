package com.example.podpairing.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One table (pod) of a round.
 *
 * Live tables hold the session's own {@link Participant} instances. Snapshots produced by
 * {@link #snapshot(Instant)} hold participant copies and reject every mutation.
 */
public class GameTable {

    /** Sentinel number of the table collecting participants left unseated by the plan. */
    public static final int BYE_TABLE_NUMBER = 99;

    private int number;
    private final int roundNumber;
    private final Map<String, Participant> seats = new LinkedHashMap<>();

    private TableResult result = TableResult.NONE;
    private String winnerId;

    private boolean roundStarted = false;
    private Instant startedAt;
    private Instant completedAt;

    private final Map<String, Object> statistics = new LinkedHashMap<>();

    private boolean custom = false;
    private boolean autoFill = false;
    private String customGroupId;

    private final boolean frozen;

    public GameTable(int number, int roundNumber) {
        this(number, roundNumber, false);
    }

    private GameTable(int number, int roundNumber, boolean frozen) {
        this.number = number;
        this.roundNumber = roundNumber;
        this.frozen = frozen;
    }

    public static GameTable bye(int roundNumber) {
        return new GameTable(BYE_TABLE_NUMBER, roundNumber);
    }

    // --- seats ----------------------------------------------------------------

    /** Adds the participant; returns false when already seated here. */
    public boolean seat(Participant p) {
        ensureMutable();
        return seats.putIfAbsent(p.getId(), p) == null;
    }

    public Participant unseat(String participantId) {
        ensureMutable();
        return seats.remove(participantId);
    }

    public boolean contains(String participantId) {
        return participantId != null && seats.containsKey(participantId);
    }

    public Participant getParticipant(String participantId) {
        return seats.get(participantId);
    }

    public List<Participant> getParticipants() {
        return Collections.unmodifiableList(new ArrayList<>(seats.values()));
    }

    public List<String> getParticipantIds() {
        return List.copyOf(seats.keySet());
    }

    public int size() { return seats.size(); }
    public boolean isBye() { return number == BYE_TABLE_NUMBER; }

    // --- result ---------------------------------------------------------------

    public TableResult getResult() { return result; }
    public String getWinnerId() { return winnerId; }
    public boolean hasResult() { return result != TableResult.NONE; }

    public void declareWinner(String participantId, Instant at) {
        ensureMutable();
        this.result = TableResult.WIN;
        this.winnerId = participantId;
        if (completedAt == null) this.completedAt = at;
    }

    public void declareDraw(Instant at) {
        ensureMutable();
        this.result = TableResult.DRAW;
        this.winnerId = null;
        if (completedAt == null) this.completedAt = at;
    }

    public void clearResult() {
        ensureMutable();
        this.result = TableResult.NONE;
        this.winnerId = null;
        this.completedAt = null;
    }

    // --- lifecycle ------------------------------------------------------------

    public boolean isRoundStarted() { return roundStarted; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }

    /** Starting an already started table keeps its original start time. */
    public void start(Instant at) {
        ensureMutable();
        if (roundStarted) return;
        this.roundStarted = true;
        this.startedAt = at;
    }

    /** Back to forming: started flag and timestamps cleared. */
    public void reset() {
        ensureMutable();
        this.roundStarted = false;
        this.startedAt = null;
        this.completedAt = null;
    }

    // --- statistics -----------------------------------------------------------

    public Map<String, Object> getStatistics() {
        return Collections.unmodifiableMap(statistics);
    }

    public void mergeStatistics(Map<String, ?> values) {
        ensureMutable();
        if (values == null) return;
        values.forEach((k, v) -> {
            if (k != null && !k.isBlank()) statistics.put(k, v);
        });
    }

    // --- numbering / custom flags ---------------------------------------------

    public int getNumber() { return number; }
    public void setNumber(int number) {
        ensureMutable();
        this.number = number;
    }

    public int getRoundNumber() { return roundNumber; }

    public boolean isCustom() { return custom; }
    public boolean isAutoFill() { return autoFill; }
    public String getCustomGroupId() { return customGroupId; }

    public void markCustom(String groupId, boolean autoFill) {
        ensureMutable();
        this.custom = true;
        this.customGroupId = groupId;
        this.autoFill = autoFill;
    }

    public boolean isFrozen() { return frozen; }

    /**
     * Frozen value copy for the archive. A missing completion time is stamped with {@code at}.
     */
    public GameTable snapshot(Instant at) {
        GameTable s = new GameTable(number, roundNumber, true);
        seats.values().forEach(p -> s.seats.put(p.getId(), p.copy()));
        s.result = result;
        s.winnerId = winnerId;
        s.roundStarted = roundStarted;
        s.startedAt = startedAt;
        s.completedAt = (completedAt != null) ? completedAt : at;
        s.statistics.putAll(statistics);
        s.custom = custom;
        s.autoFill = autoFill;
        s.customGroupId = customGroupId;
        return s;
    }

    /** Restores the result fields of a live table from stored values. */
    public void restoreState(TableResult result, String winnerId, boolean roundStarted,
                             Instant startedAt, Instant completedAt) {
        ensureMutable();
        this.result = (result == null) ? TableResult.NONE : result;
        this.winnerId = winnerId;
        this.roundStarted = roundStarted;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("Archived table " + number + " of round " + roundNumber + " is immutable");
        }
    }

    @Override
    public String toString() {
        return "GameTable{" +
                "number=" + number +
                ", round=" + roundNumber +
                ", seats=" + seats.keySet() +
                ", result=" + result +
                ", winnerId=" + winnerId +
                ", custom=" + custom +
                '}';
    }
}
