package com.example.podpairing.service;

import com.example.podpairing.rooms.model.StoredTable;

import java.util.List;

/**
 * Outcome of a host command. Tables are a snapshot taken under the session lock.
 */
public record CommandResult(boolean success, CommandError error, String message, int roundNumber,
                            List<StoredTable> tables, String customGroupId, Move move) {

    /** Details of a successful participant move. */
    public record Move(String participantId, int fromTable, int toTable) { }

    public static CommandResult ok(int roundNumber, List<StoredTable> tables) {
        return new CommandResult(true, null, null, roundNumber, tables, null, null);
    }

    public static CommandResult customGroup(int roundNumber, String customGroupId) {
        return new CommandResult(true, null, null, roundNumber, List.of(), customGroupId, null);
    }

    public static CommandResult moved(int roundNumber, List<StoredTable> tables, Move move) {
        return new CommandResult(true, null, null, roundNumber, tables, null, move);
    }

    public static CommandResult fail(CommandError error, String message) {
        return new CommandResult(false, error, message, 0, List.of(), null, null);
    }
}
