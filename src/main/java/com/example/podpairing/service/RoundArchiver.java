package com.example.podpairing.service;

import com.example.podpairing.model.ArchivedRound;
import com.example.podpairing.model.GameTable;
import com.example.podpairing.model.Participant;
import com.example.podpairing.model.RoomSession;
import com.example.podpairing.model.RoomSettings;

import java.time.Instant;
import java.util.List;

/** Moves the current tables of a session into its archive. Callers hold the session lock. */
final class RoundArchiver {

    private RoundArchiver() {}

    /**
     * Awards points (when enabled), snapshots the current tables and clears them.
     *
     * @return the appended round, or null when there was nothing to archive
     */
    static ArchivedRound archiveCurrent(RoomSession session, Instant now) {
        List<GameTable> tables = session.getCurrentTables();
        if (tables == null || tables.isEmpty()) return null;

        if (session.getSettings().isUsePoints()) {
            tables.forEach(t -> awardPoints(session, t));
        }
        ArchivedRound round = ArchivedRound.of(session.getCurrentRound(), tables, now);
        session.appendArchive(round);
        session.clearCurrentTables();
        return round;
    }

    private static void awardPoints(RoomSession session, GameTable table) {
        RoomSettings s = session.getSettings();
        for (Participant seated : table.getParticipants()) {
            Participant p = session.getParticipant(seated.getId());
            if (p == null) continue;   // dropped out after seating

            if (table.isBye()) {
                p.addPoints(s.getPointsForBye());
                continue;
            }
            switch (table.getResult()) {
                case WIN:
                    p.addPoints(p.getId().equals(table.getWinnerId()) ? s.getPointsForWin() : s.getPointsForLoss());
                    break;
                case DRAW:
                    p.addPoints(s.getPointsForDraw());
                    break;
                default:
                    break;
            }
        }
    }
}
