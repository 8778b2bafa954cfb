package com.example.podpairing.service;

import com.example.podpairing.TestFixtures.MutableClock;
import com.example.podpairing.config.PodProperties;
import com.example.podpairing.events.RoomEvent;
import com.example.podpairing.events.RoomEventListener;
import com.example.podpairing.events.RoomEventPublisher;
import com.example.podpairing.events.RoomEventType;
import com.example.podpairing.model.TableResult;
import com.example.podpairing.pairing.RandomSource;
import com.example.podpairing.pairing.RoundGenerator;
import com.example.podpairing.rooms.model.StoredParticipant;
import com.example.podpairing.rooms.model.StoredSession;
import com.example.podpairing.rooms.model.StoredTable;
import com.example.podpairing.rooms.service.SessionPersistenceService;
import com.example.podpairing.rooms.service.SessionSnapshotter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.example.podpairing.TestFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class RoundServiceTest {

    private MutableClock clock;
    private final List<RoomEvent> events = new ArrayList<>();
    private RoomEventPublisher publisher;
    private RoomSessionRegistry registry;
    private RoundService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        RoomEventListener recorder = events::add;
        publisher = new RoomEventPublisher(List.of(recorder));
        PodProperties props = new PodProperties(Duration.ofHours(24), 6, 300_000, 500,
                new PodProperties.Persistence(false));
        registry = new RoomSessionRegistry(RandomSource.secure(), clock, props, publisher,
                mock(SessionSnapshotter.class), mock(SessionPersistenceService.class));
        service = new RoundService(registry, new RoundGenerator(RandomSource.secure()), publisher, clock);
    }

    /** Creates a room with participants p1..pn and clears the join events. */
    private String room(int participants) {
        String code = registry.createSession("host").getCode();
        for (int i = 1; i <= participants; i++) {
            assertEquals(JoinOutcome.SUCCESS, registry.join(code, "p" + i, "Player " + i, null));
        }
        events.clear();
        return code;
    }

    private StoredSession snapshot(String code) {
        return registry.getSession(code).orElseThrow();
    }

    private static StoredTable tableOf(List<StoredTable> tables, String participantId) {
        return tables.stream()
                .filter(t -> t.getParticipants().stream().anyMatch(p -> p.getId().equals(participantId)))
                .findFirst().orElseThrow();
    }

    private static List<String> ids(StoredTable t) {
        return t.getParticipants().stream().map(StoredParticipant::getId).collect(Collectors.toList());
    }

    private static int points(StoredSession s, String id) {
        return s.getParticipants().stream().filter(p -> p.getId().equals(id)).findFirst().orElseThrow().getPoints();
    }

    private List<RoomEventType> eventTypes() {
        return events.stream().map(RoomEvent::type).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("round commands")
    class Commands {

        @Test
        void generateFirst_needsSixParticipants() {
            String code = room(5);

            CommandResult r = service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND);

            assertFalse(r.success());
            assertEquals(CommandError.INSUFFICIENT_PARTICIPANTS, r.error());
            assertEquals("At least 6 participants are required", r.message());
            assertEquals(0, snapshot(code).getCurrentRound());
            assertTrue(events.isEmpty());
        }

        @Test
        void generateFirst_seatsEveryone_andEmitsRoundGenerated() {
            String code = room(8);

            CommandResult r = service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND);

            assertTrue(r.success());
            assertEquals(1, r.roundNumber());
            assertEquals(2, r.tables().size());
            assertEquals(8, r.tables().stream().mapToInt(t -> t.getParticipants().size()).sum());
            StoredSession s = snapshot(code);
            assertTrue(s.isStarted());
            assertEquals(1, s.getCurrentRound());
            assertEquals(List.of(RoomEventType.ROUND_GENERATED), eventTypes());
            assertEquals(1, events.get(0).payload().get("roundNumber"));
        }

        @Test
        void generateFirst_twice_isRejected() {
            String code = room(6);
            service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND);

            CommandResult r = service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND);

            assertEquals(CommandError.INVALID_REQUEST, r.error());
        }

        @Test
        void regenerate_keepsRoundNumber_untilStarted() {
            String code = room(8);
            assertEquals(CommandError.NO_TABLES, service.handleRound(code, RoundCommand.REGENERATE_ROUND).error());

            service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND);
            CommandResult again = service.handleRound(code, RoundCommand.REGENERATE_ROUND);
            assertTrue(again.success());
            assertEquals(1, again.roundNumber());
            assertTrue(snapshot(code).getArchive().isEmpty());

            service.handleRound(code, RoundCommand.START_ROUND);
            assertEquals(CommandError.ROUND_ALREADY_STARTED,
                    service.handleRound(code, RoundCommand.REGENERATE_ROUND).error());
        }

        @Test
        void start_and_reset() {
            String code = room(7);
            assertEquals(CommandError.NO_TABLES, service.handleRound(code, RoundCommand.START_ROUND).error());

            service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND);
            clock.advance(Duration.ofMinutes(5));
            CommandResult started = service.handleRound(code, RoundCommand.START_ROUND);
            assertTrue(started.tables().stream().allMatch(StoredTable::isRoundStarted));
            assertTrue(started.tables().stream().allMatch(t -> T0.plus(Duration.ofMinutes(5)).equals(t.getStartedAt())));
            assertTrue(eventTypes().contains(RoomEventType.ROUND_STARTED));

            clock.advance(Duration.ofMinutes(10));
            CommandResult again = service.handleRound(code, RoundCommand.START_ROUND);
            assertTrue(again.tables().stream().allMatch(t -> T0.plus(Duration.ofMinutes(5)).equals(t.getStartedAt())),
                    "a repeated start keeps the round clock");

            CommandResult reset = service.handleRound(code, RoundCommand.RESET_ROUND);
            assertTrue(reset.tables().stream().noneMatch(StoredTable::isRoundStarted));
            assertTrue(reset.tables().stream().allMatch(t -> t.getStartedAt() == null));
        }

        @Test
        void generateNext_archivesPreviousRound() {
            String code = room(9);
            service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND);

            CommandResult next = service.handleRound(code, RoundCommand.GENERATE_NEXT_ROUND);

            assertTrue(next.success());
            assertEquals(2, next.roundNumber());
            StoredSession s = snapshot(code);
            assertEquals(1, s.getArchive().size());
            assertEquals(1, s.getArchive().get(0).getRoundNumber());
            assertTrue(s.getArchive().get(0).getTables().stream().allMatch(t -> t.getCompletedAt() != null));
        }

        @Test
        void maxRounds_blocksFurtherRounds_withoutTouchingState() {
            String code = room(8);
            service.updateSettings(code, "host", settings -> settings.setMaxRounds(1));
            service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND);

            CommandResult r = service.handleRound(code, RoundCommand.GENERATE_NEXT_ROUND);

            assertEquals(CommandError.MAX_ROUNDS_REACHED, r.error());
            StoredSession s = snapshot(code);
            assertEquals(1, s.getCurrentRound());
            assertTrue(s.getArchive().isEmpty());
            assertNotNull(s.getCurrentTables());
        }

        @Test
        void endRound_archives_thenHasNothingToEnd() {
            String code = room(6);
            service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND);
            events.clear();

            assertTrue(service.handleRound(code, RoundCommand.END_ROUND).success());
            assertEquals(List.of(RoomEventType.GAME_ENDED), eventTypes());
            assertEquals(Boolean.FALSE, events.get(0).payload().get("gameEnded"));
            assertNull(snapshot(code).getCurrentTables());
            assertEquals(1, snapshot(code).getArchive().size());

            assertEquals(CommandError.NO_TABLES, service.handleRound(code, RoundCommand.END_ROUND).error());
        }

        @Test
        void endGame_closesSession() {
            String code = room(6);
            service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND);

            assertTrue(service.handleRound(code, RoundCommand.END_GAME).success());

            assertTrue(snapshot(code).isEnded());
            assertEquals(CommandError.GAME_ENDED, service.handleRound(code, RoundCommand.GENERATE_NEXT_ROUND).error());
            assertEquals(JoinOutcome.GAME_ENDED, registry.join(code, "late", "Late", null));
        }

        @Test
        void expiredOrUnknownSession_isRejected() {
            String code = room(6);
            clock.advance(Duration.ofHours(24));

            assertEquals(CommandError.SESSION_EXPIRED, service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND).error());
            assertEquals(CommandError.SESSION_NOT_FOUND, service.handleRound("ZZZZZZ", RoundCommand.START_ROUND).error());
        }

        @Test
        void failingListener_doesNotFailCommand() {
            String code = room(6);
            publisher.addListener(e -> {
                throw new IllegalStateException("broadcast down");
            });

            CommandResult r = service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND);

            assertTrue(r.success());
            assertEquals(List.of(RoomEventType.ROUND_GENERATED), eventTypes());
        }
    }

    @Nested
    @DisplayName("reportOutcome")
    class Reports {

        private String code;
        private List<StoredTable> tables;

        @BeforeEach
        void generate() {
            code = room(8);
            tables = service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND).tables();
            events.clear();
        }

        @Test
        void win_recordsWinner_once() {
            ReportResponse r = service.reportOutcome(code, "p1", ReportOutcome.WIN, null, null);

            assertTrue(r.isSuccess());
            assertEquals("p1", r.winnerId());
            assertEquals(tableOf(tables, "p1").getNumber(), r.tableNumber());
            assertEquals(List.of(RoomEventType.GAME_ENDED), eventTypes());

            StoredTable stored = tableOf(snapshot(code).getCurrentTables(), "p1");
            assertEquals(TableResult.WIN, stored.getResult());
            assertEquals("p1", stored.getWinnerId());
            assertEquals(T0, stored.getCompletedAt());

            String tableMate = ids(stored).stream().filter(id -> !id.equals("p1")).findFirst().orElseThrow();
            ReportResponse second = service.reportOutcome(code, tableMate, ReportOutcome.DRAW, null, null);
            assertEquals(ReportOutcomeResult.ALREADY_ENDED, second.result());
            assertEquals("p1", second.winnerId());
        }

        @Test
        void dataOnly_updatesRoleAndStatistics_withoutResult() {
            ReportResponse r = service.reportOutcome(code, "p2", ReportOutcome.DATA_ONLY, "Necromancer",
                    Map.of("turns", 12));

            assertTrue(r.isSuccess());
            assertTrue(events.isEmpty());
            StoredSession s = snapshot(code);
            StoredTable t = tableOf(s.getCurrentTables(), "p2");
            assertEquals(TableResult.NONE, t.getResult());
            assertEquals(12, t.getStatistics().get("turns"));
            assertEquals("Necromancer", s.getParticipants().stream()
                    .filter(p -> p.getId().equals("p2")).findFirst().orElseThrow().getRole());
        }

        @Test
        void rejections() {
            assertEquals(ReportOutcomeResult.INVALID,
                    service.reportOutcome(code, " ", ReportOutcome.WIN, null, null).result());
            assertEquals(ReportOutcomeResult.PARTICIPANT_NOT_FOUND,
                    service.reportOutcome(code, "ghost", ReportOutcome.WIN, null, null).result());
            assertEquals(ReportOutcomeResult.ROOM_NOT_FOUND,
                    service.reportOutcome("ZZZZZZ", "p1", ReportOutcome.WIN, null, null).result());
        }

        @Test
        void beforeFirstRound_isNotStarted() {
            String fresh = room(6);
            assertEquals(ReportOutcomeResult.NOT_STARTED,
                    service.reportOutcome(fresh, "p1", ReportOutcome.WIN, null, null).result());
        }

        @Test
        void dropOut_beforeStart_removesParticipant() {
            ReportResponse r = service.reportOutcome(code, "p3", ReportOutcome.DROP_OUT, null, null);

            assertTrue(r.isSuccess());
            assertEquals("p3", r.removedParticipantId());
            assertEquals(List.of(RoomEventType.PARTICIPANT_DROPPED), eventTypes());
            assertTrue(snapshot(code).getParticipants().stream().noneMatch(p -> p.getId().equals("p3")));
        }

        @Test
        void dropOut_afterStart_isRejected() {
            service.handleRound(code, RoundCommand.START_ROUND);

            ReportResponse r = service.reportOutcome(code, "p3", ReportOutcome.DROP_OUT, null, null);

            assertEquals(ReportOutcomeResult.ROUND_ALREADY_STARTED, r.result());
            assertEquals(8, snapshot(code).getParticipants().size());
        }

        @Test
        void dropOut_dissolvesGroupLeftWithOneMember() {
            String groupCode = room(8);
            String groupId = service.createCustomGroup(groupCode, List.of("p1", "p2"), true).customGroupId();

            service.reportOutcome(groupCode, "p1", ReportOutcome.DROP_OUT, null, null);

            StoredParticipant p2 = snapshot(groupCode).getParticipants().stream()
                    .filter(p -> p.getId().equals("p2")).findFirst().orElseThrow();
            assertNotEquals(groupId, p2.getCustomGroupId());
            assertNull(p2.getCustomGroupId());
        }
    }

    @Test
    void points_areAwardedWhenRoundIsArchived() {
        String code = room(8);
        service.updateSettings(code, "host", s -> s.setUsePoints(true));
        List<StoredTable> tables = service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND).tables();
        StoredTable won = tableOf(tables, "p1");
        StoredTable drawn = tables.stream().filter(t -> t != won).findFirst().orElseThrow();

        service.reportOutcome(code, "p1", ReportOutcome.WIN, null, null);
        service.reportOutcome(code, ids(drawn).get(0), ReportOutcome.DRAW, null, null);
        service.handleRound(code, RoundCommand.END_ROUND);

        StoredSession s = snapshot(code);
        assertEquals(3, points(s, "p1"));
        ids(won).stream().filter(id -> !id.equals("p1")).forEach(id -> assertEquals(0, points(s, id)));
        ids(drawn).forEach(id -> assertEquals(1, points(s, id)));
    }

    @Nested
    @DisplayName("host corrections")
    class Corrections {

        private String code;
        private List<StoredTable> tables;

        @BeforeEach
        void generate() {
            code = room(8);
            tables = service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND).tables();
        }

        @Test
        void setTableResult_winDrawAndClear() {
            StoredTable t = tables.get(0);
            String seated = ids(t).get(0);
            String elsewhere = ids(tables.get(1)).get(0);

            assertEquals(CommandError.PARTICIPANT_NOT_FOUND,
                    service.setTableResult(code, t.getNumber(), 1, TableResult.WIN, elsewhere).error());

            CommandResult win = service.setTableResult(code, t.getNumber(), 1, TableResult.WIN, seated);
            assertTrue(win.success());
            assertEquals(seated, win.tables().get(0).getWinnerId());

            CommandResult draw = service.setTableResult(code, t.getNumber(), 1, TableResult.DRAW, null);
            assertEquals(TableResult.DRAW, draw.tables().get(0).getResult());
            assertNull(draw.tables().get(0).getWinnerId());

            CommandResult cleared = service.setTableResult(code, t.getNumber(), 1, TableResult.NONE, null);
            assertEquals(TableResult.NONE, cleared.tables().get(0).getResult());
        }

        @Test
        void setTableResult_unknownTableOrRound() {
            assertEquals(CommandError.TABLE_NOT_FOUND,
                    service.setTableResult(code, 42, 1, TableResult.DRAW, null).error());
            assertEquals(CommandError.TABLE_NOT_FOUND,
                    service.setTableResult(code, 1, 5, TableResult.DRAW, null).error());
            assertEquals(CommandError.INVALID_REQUEST,
                    service.setTableResult(code, 1, 1, null, null).error());
        }

        @Test
        void archivedRound_cannotChange() {
            service.handleRound(code, RoundCommand.GENERATE_NEXT_ROUND);

            assertEquals(CommandError.ROUND_ARCHIVED,
                    service.setTableResult(code, 1, 1, TableResult.DRAW, null).error());
            assertEquals(CommandError.ROUND_ARCHIVED,
                    service.moveParticipant(code, 1, 2, 1, "p1").error());
        }

        @Test
        void move_betweenFullTables_isRejected() {
            StoredTable from = tableOf(tables, "p1");
            StoredTable to = tables.stream().filter(t -> t != from).findFirst().orElseThrow();

            CommandResult r = service.moveParticipant(code, from.getNumber(), to.getNumber(), 1, "p1");

            assertEquals(CommandError.INVALID_REQUEST, r.error());
            assertEquals(4, tableOf(snapshot(code).getCurrentTables(), "p1").getParticipants().size());
            assertEquals(from.getNumber(), tableOf(snapshot(code).getCurrentTables(), "p1").getNumber());
        }

        @Test
        void move_rejections() {
            StoredTable from = tableOf(tables, "p1");
            StoredTable other = tables.stream().filter(t -> t != from).findFirst().orElseThrow();

            assertEquals(CommandError.INVALID_REQUEST,
                    service.moveParticipant(code, 1, 1, 1, "p1").error());
            assertEquals(CommandError.PARTICIPANT_NOT_FOUND,
                    service.moveParticipant(code, other.getNumber(), from.getNumber(), 1, "p1").error());
            assertEquals(CommandError.TABLE_NOT_FOUND,
                    service.moveParticipant(code, from.getNumber(), 7, 1, "p1").error());
        }
    }

    @Nested
    @DisplayName("moveParticipant")
    class Moves {

        private String code;
        private StoredTable four;
        private StoredTable three;

        @BeforeEach
        void generate() {
            code = room(7);
            List<StoredTable> tables = service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND).tables();
            four = tables.stream().filter(t -> t.getParticipants().size() == 4).findFirst().orElseThrow();
            three = tables.stream().filter(t -> t.getParticipants().size() == 3).findFirst().orElseThrow();
        }

        @Test
        void move_fromFourToThree() {
            String mover = ids(four).get(0);

            CommandResult r = service.moveParticipant(code, four.getNumber(), three.getNumber(), 1, mover);

            assertTrue(r.success());
            assertEquals(new CommandResult.Move(mover, four.getNumber(), three.getNumber()), r.move());
            StoredTable after = tableOf(snapshot(code).getCurrentTables(), mover);
            assertEquals(three.getNumber(), after.getNumber());
            assertEquals(4, after.getParticipants().size());
        }

        @Test
        void move_outOfThreeSeatTable_isRejected() {
            String mover = ids(three).get(0);

            CommandResult r = service.moveParticipant(code, three.getNumber(), four.getNumber(), 1, mover);

            assertEquals(CommandError.INVALID_REQUEST, r.error());
            assertEquals(three.getNumber(), tableOf(snapshot(code).getCurrentTables(), mover).getNumber());
        }

        @Test
        void movingTheWinner_clearsTheSourceResult() {
            String winner = ids(four).get(0);
            assertEquals(ReportOutcomeResult.SUCCESS,
                    service.reportOutcome(code, winner, ReportOutcome.WIN, null, null).result());

            assertTrue(service.moveParticipant(code, four.getNumber(), three.getNumber(), 1, winner).success());

            StoredTable source = snapshot(code).getCurrentTables().stream()
                    .filter(t -> t.getNumber() == four.getNumber()).findFirst().orElseThrow();
            assertEquals(TableResult.NONE, source.getResult());
            assertNull(source.getWinnerId());
            assertFalse(ids(source).contains(winner));
        }

        @Test
        void movingAnotherSeat_keepsTheSourceResult() {
            String winner = ids(four).get(0);
            String mover = ids(four).get(1);
            service.reportOutcome(code, winner, ReportOutcome.WIN, null, null);

            assertTrue(service.moveParticipant(code, four.getNumber(), three.getNumber(), 1, mover).success());

            StoredTable source = tableOf(snapshot(code).getCurrentTables(), winner);
            assertEquals(TableResult.WIN, source.getResult());
            assertEquals(winner, source.getWinnerId());
        }
    }

    @Nested
    @DisplayName("custom groups")
    class CustomGroups {

        @Test
        void createdGroup_isSeatedTogether() {
            String code = room(10);

            CommandResult created = service.createCustomGroup(code, List.of("p1", "p2"), true);
            assertTrue(created.success());
            assertNotNull(created.customGroupId());

            List<StoredTable> tables = service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND).tables();
            StoredTable t = tableOf(tables, "p1");
            assertTrue(ids(t).contains("p2"));
            assertTrue(t.isCustom());
            assertEquals(created.customGroupId(), t.getCustomGroupId());
        }

        @Test
        void create_rejections() {
            String code = room(8);

            assertEquals(CommandError.INVALID_REQUEST,
                    service.createCustomGroup(code, List.of(), true).error());
            assertEquals(CommandError.INVALID_REQUEST,
                    service.createCustomGroup(code, List.of("p1", "p2", "p3", "p4", "p5"), true).error());
            assertEquals(CommandError.PARTICIPANT_NOT_FOUND,
                    service.createCustomGroup(code, List.of("p1", "ghost"), true).error());

            assertEquals(CommandError.INVALID_REQUEST,
                    service.createCustomGroup(code, List.of("p1", "p2"), false).error());
            assertTrue(snapshot(code).getParticipants().stream().allMatch(p -> p.getCustomGroupId() == null));

            service.updateSettings(code, "host", s -> s.setAllowCustomGroups(false));
            assertEquals(CommandError.CUSTOM_GROUPS_DISABLED,
                    service.createCustomGroup(code, List.of("p1", "p2"), true).error());
        }

        @Test
        void closedGroup_isSeatedAlone() {
            String code = room(7);
            String groupId = service.createCustomGroup(code, List.of("p1", "p2", "p3"), false).customGroupId();

            List<StoredTable> tables = service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND).tables();

            StoredTable t = tableOf(tables, "p1");
            assertEquals(3, ids(t).size());
            assertTrue(ids(t).containsAll(List.of("p1", "p2", "p3")));
            assertEquals(groupId, t.getCustomGroupId());
            assertFalse(t.isAutoFill());
        }

        @Test
        void closedGroup_losingAMember_isDissolved() {
            String code = room(8);
            service.createCustomGroup(code, List.of("p1", "p2", "p3"), false);

            service.createCustomGroup(code, List.of("p3", "p4"), true);

            StoredSession s = snapshot(code);
            for (String id : List.of("p1", "p2")) {
                assertNull(s.getParticipants().stream().filter(p -> p.getId().equals(id))
                        .findFirst().orElseThrow().getCustomGroupId());
            }
        }

        @Test
        void delete_returnsMembersToPool() {
            String code = room(8);
            String groupId = service.createCustomGroup(code, List.of("p1", "p2", "p3"), false).customGroupId();

            assertTrue(service.deleteCustomGroup(code, groupId).success());
            assertTrue(snapshot(code).getParticipants().stream().allMatch(p -> p.getCustomGroupId() == null));
            assertEquals(CommandError.CUSTOM_GROUP_NOT_FOUND, service.deleteCustomGroup(code, groupId).error());
        }

        @Test
        void regrouping_dissolvesPreviousGroupLeftWithOneMember() {
            String code = room(8);
            service.createCustomGroup(code, List.of("p1", "p2"), true);

            service.createCustomGroup(code, List.of("p1", "p3"), true);

            StoredParticipant p2 = snapshot(code).getParticipants().stream()
                    .filter(p -> p.getId().equals("p2")).findFirst().orElseThrow();
            assertNull(p2.getCustomGroupId());
        }
    }

    @Nested
    @DisplayName("updateSettings")
    class Settings {

        @Test
        void onlyHost_beforeStart_withValidValues() {
            String code = room(6);

            assertEquals(CommandError.NOT_HOST,
                    service.updateSettings(code, "p1", s -> s.setUsePoints(true)).error());

            CommandResult bad = service.updateSettings(code, "host", s -> {
                s.setUsePoints(true);
                s.setMaxTableSize(5);
            });
            assertEquals(CommandError.INVALID_REQUEST, bad.error());
            assertFalse(snapshot(code).getSettings().isUsePoints(), "failed update leaves settings untouched");

            assertTrue(service.updateSettings(code, "host", s -> s.setPointsForWin(5)).success());
            assertEquals(5, snapshot(code).getSettings().getPointsForWin());

            service.handleRound(code, RoundCommand.GENERATE_FIRST_ROUND);
            assertEquals(CommandError.GAME_STARTED,
                    service.updateSettings(code, "host", s -> s.setPointsForWin(7)).error());
        }
    }
}
