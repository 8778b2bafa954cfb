package com.example.podpairing.rooms.codec;

import com.example.podpairing.model.ArchivedRound;
import com.example.podpairing.model.GameTable;
import com.example.podpairing.model.RoomSession;
import com.example.podpairing.model.SelectorVariant;
import com.example.podpairing.model.TableResult;
import com.example.podpairing.rooms.model.StoredSession;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.example.podpairing.TestFixtures.T0;
import static com.example.podpairing.TestFixtures.archived;
import static com.example.podpairing.TestFixtures.session;
import static com.example.podpairing.TestFixtures.table;
import static org.junit.jupiter.api.Assertions.*;

class SessionCodecTest {

    private RoomSession played() {
        RoomSession s = session(8);
        s.setEventName("Friday Night Pods");
        s.getSettings().setUsePoints(true);
        s.getSettings().setRoundLength(Duration.ofMinutes(75));
        s.getSettings().setSelectorVariant(SelectorVariant.BASIC);

        GameTable won = table(s, 1, 1, "p1", "p2", "p3", "p4");
        won.declareWinner("p2", T0);
        s.appendArchive(archived(1, won, table(s, 2, 1, "p5", "p6", "p7", "p8")));

        s.setCurrentRound(2);
        GameTable current = table(s, 1, 2, "p1", "p5", "p3", "p7");
        current.start(T0.plusSeconds(60));
        current.mergeStatistics(Map.of("turns", 9));
        s.setCurrentTables(List.of(current, table(s, 2, 2, "p2", "p6", "p4", "p8")));
        s.setStarted(true);
        return s;
    }

    @Test
    void restoredSession_keepsStateAndSettings() {
        StoredSession stored = SessionCodec.toStored(played());

        RoomSession live = SessionCodec.toLive(stored);

        assertEquals("ROOM01", live.getCode());
        assertEquals("Friday Night Pods", live.getEventName());
        assertEquals(2, live.getCurrentRound());
        assertTrue(live.isStarted());
        assertEquals(8, live.getParticipants().size());
        assertTrue(live.getSettings().isUsePoints());
        assertEquals(Duration.ofMinutes(75), live.getSettings().getRoundLength());
        assertEquals(SelectorVariant.BASIC, live.getSettings().getSelectorVariant());

        GameTable current = live.findCurrentTable(1).orElseThrow();
        assertTrue(current.isRoundStarted());
        assertEquals(T0.plusSeconds(60), current.getStartedAt());
        assertEquals(9, current.getStatistics().get("turns"));
    }

    @Test
    void restoredArchive_isFrozen() {
        RoomSession live = SessionCodec.toLive(SessionCodec.toStored(played()));

        ArchivedRound round = live.latestArchivedRound().orElseThrow();
        GameTable won = round.findTable(1).orElseThrow();
        assertTrue(won.isFrozen());
        assertEquals(TableResult.WIN, won.getResult());
        assertEquals("p2", won.getWinnerId());
        assertThrows(IllegalStateException.class, () -> won.declareDraw(T0));
    }

    @Test
    void restoredCurrentTables_shareSessionParticipants() {
        RoomSession live = SessionCodec.toLive(SessionCodec.toStored(played()));

        GameTable current = live.findCurrentTable(2).orElseThrow();
        assertSame(live.getParticipant("p2"), current.getParticipant("p2"));

        live.getParticipant("p2").addPoints(3);
        assertEquals(3, current.getParticipant("p2").getPoints());
    }

    @Test
    void storedSettings_outOfRange_areRejected() {
        StoredSession stored = SessionCodec.toStored(played());
        stored.getSettings().setMaxTableSize(6);

        assertThrows(IllegalArgumentException.class, () -> SessionCodec.toLive(stored));
    }
}
