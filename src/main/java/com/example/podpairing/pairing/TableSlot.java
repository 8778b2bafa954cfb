package com.example.podpairing.pairing;

import com.example.podpairing.model.GameTable;
import com.example.podpairing.model.Participant;

import java.util.List;

/** A table under construction together with the seat count it must reach. */
final class TableSlot {

    private final GameTable table;
    private final int targetSize;
    private boolean hostsWinners = false;

    TableSlot(GameTable table, int targetSize) {
        this.table = table;
        this.targetSize = targetSize;
    }

    GameTable table() { return table; }
    int targetSize() { return targetSize; }
    int free() { return targetSize - table.size(); }
    boolean isEmpty() { return table.size() == 0; }
    boolean isCustom() { return table.isCustom(); }

    boolean hostsWinners() { return hostsWinners; }
    void markWinners() { this.hostsWinners = true; }

    List<Participant> members() { return table.getParticipants(); }

    void seatAll(List<Participant> participants) {
        participants.forEach(table::seat);
    }

    @Override
    public String toString() {
        return "TableSlot{" + table.getParticipantIds() + " -> " + targetSize + (hostsWinners ? ", winners" : "") + "}";
    }
}
