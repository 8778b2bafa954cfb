package com.example.podpairing.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Frozen tables of one superseded round. */
public final class ArchivedRound {

    private final int roundNumber;
    private final Instant archivedAt;
    private final List<GameTable> tables;

    private ArchivedRound(int roundNumber, Instant archivedAt, List<GameTable> tables) {
        this.roundNumber = roundNumber;
        this.archivedAt = archivedAt;
        this.tables = List.copyOf(tables);
    }

    /** Snapshots live tables; tables without a completion time are stamped with {@code at}. */
    public static ArchivedRound of(int roundNumber, List<GameTable> live, Instant at) {
        return new ArchivedRound(roundNumber, at, live.stream().map(t -> t.snapshot(at)).toList());
    }

    /** Wraps tables that are already frozen (restore path). */
    public static ArchivedRound ofFrozen(int roundNumber, Instant archivedAt, List<GameTable> frozen) {
        for (GameTable t : frozen) {
            if (!t.isFrozen()) throw new IllegalArgumentException("table " + t.getNumber() + " is not frozen");
        }
        return new ArchivedRound(roundNumber, archivedAt, frozen);
    }

    public int getRoundNumber() { return roundNumber; }
    public Instant getArchivedAt() { return archivedAt; }
    public List<GameTable> getTables() { return tables; }

    public Optional<GameTable> findTable(int number) {
        return tables.stream().filter(t -> t.getNumber() == number).findFirst();
    }
}
