package com.example.podpairing.service;

import com.example.podpairing.events.RoomEvent;
import com.example.podpairing.events.RoomEventPublisher;
import com.example.podpairing.events.RoomEventType;
import com.example.podpairing.model.ArchivedRound;
import com.example.podpairing.model.GameTable;
import com.example.podpairing.model.Participant;
import com.example.podpairing.model.RoomSession;
import com.example.podpairing.model.RoomSettings;
import com.example.podpairing.model.TableResult;
import com.example.podpairing.pairing.RoundGenerator;
import com.example.podpairing.pairing.TableSizePlanner;
import com.example.podpairing.rooms.model.StoredSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Round lifecycle commands: generation, start/reset, end, results, custom groups and seat moves.
 *
 * Every command runs entirely under the session lock. Business failures come back as
 * {@link CommandResult} / {@link ReportResponse} values and leave the session untouched.
 */
@Service
public class RoundService {

    private static final Logger log = LoggerFactory.getLogger(RoundService.class);

    private final RoomSessionRegistry registry;
    private final RoundGenerator generator;
    private final RoomEventPublisher publisher;
    private final Clock clock;

    public RoundService(RoomSessionRegistry registry, RoundGenerator generator,
                        RoomEventPublisher publisher, Clock clock) {
        this.registry = registry;
        this.generator = generator;
        this.publisher = publisher;
        this.clock = clock;
    }

    // =====================================================================
    // Round commands
    // =====================================================================

    public CommandResult handleRound(String code, RoundCommand command) {
        Objects.requireNonNull(command, "command");
        List<RoomEvent> events = new ArrayList<>();
        CommandResult result = registry.withLock(code, session -> {
            CommandResult denied = checkOpen(session);
            if (denied != null) return denied;

            switch (command) {
                case GENERATE_FIRST_ROUND:
                case GENERATE_NEXT_ROUND:
                case REGENERATE_ROUND:
                    return generate(session, command, events);
                case START_ROUND:
                    return start(session, events);
                case RESET_ROUND:
                    return reset(session);
                case END_ROUND:
                    return end(session, false, events);
                case END_GAME:
                    return end(session, true, events);
                default:
                    return CommandResult.fail(CommandError.INVALID_REQUEST, "Unsupported command " + command);
            }
        }).orElseGet(RoundService::sessionNotFound);

        logOutcome(code, command.name(), result);
        publisher.publishAll(events);
        return result;
    }

    private CommandResult generate(RoomSession session, RoundCommand command, List<RoomEvent> events) {
        int current = session.getCurrentRound();
        int next;
        switch (command) {
            case GENERATE_FIRST_ROUND:
                if (current > 0) {
                    return CommandResult.fail(CommandError.INVALID_REQUEST,
                            "Round " + current + " already exists; regenerate or advance instead");
                }
                next = 1;
                break;
            case REGENERATE_ROUND:
                if (current == 0 || !session.hasCurrentTables()) {
                    return CommandResult.fail(CommandError.NO_TABLES, "There is no current round to regenerate");
                }
                if (session.anyCurrentTableStarted()) {
                    return CommandResult.fail(CommandError.ROUND_ALREADY_STARTED, "Round " + current + " has already started");
                }
                next = current;
                break;
            default:
                next = current + 1;
                break;
        }

        if (session.getActiveParticipants().size() < TableSizePlanner.MIN_POOL_SIZE) {
            return CommandResult.fail(CommandError.INSUFFICIENT_PARTICIPANTS,
                    "At least " + TableSizePlanner.MIN_POOL_SIZE + " participants are required");
        }
        int maxRounds = session.getSettings().getMaxRounds();
        if (next > current && maxRounds > 0 && next > maxRounds) {
            return CommandResult.fail(CommandError.MAX_ROUNDS_REACHED, "Maximum of " + maxRounds + " rounds reached");
        }

        Instant now = clock.instant();
        if (command == RoundCommand.GENERATE_NEXT_ROUND) {
            RoundArchiver.archiveCurrent(session, now);
        }

        List<GameTable> tables = generator.generate(session, next, command == RoundCommand.GENERATE_FIRST_ROUND);
        session.setCurrentRound(next);
        session.setCurrentTables(tables);
        session.setStarted(true);

        StoredSession snap = registry.persist(session, session.getHostId());
        Map<String, Object> payload = new HashMap<>();
        payload.put("roundNumber", next);
        payload.put("regenerated", command == RoundCommand.REGENERATE_ROUND);
        payload.put("tables", snap.getCurrentTables());
        events.add(event(RoomEventType.ROUND_GENERATED, session, now, snap, payload));
        return CommandResult.ok(next, snap.getCurrentTables());
    }

    private CommandResult start(RoomSession session, List<RoomEvent> events) {
        if (!session.hasCurrentTables()) {
            return CommandResult.fail(CommandError.NO_TABLES, "No tables to start");
        }
        Instant now = clock.instant();
        session.getCurrentTables().forEach(t -> t.start(now));

        StoredSession snap = registry.persist(session, session.getHostId());
        events.add(event(RoomEventType.ROUND_STARTED, session, now, snap,
                Map.of("roundNumber", session.getCurrentRound(), "startedAt", now)));
        return CommandResult.ok(session.getCurrentRound(), snap.getCurrentTables());
    }

    private CommandResult reset(RoomSession session) {
        if (!session.hasCurrentTables()) {
            return CommandResult.fail(CommandError.NO_TABLES, "No tables to reset");
        }
        for (GameTable t : session.getCurrentTables()) {
            t.clearResult();
            t.reset();
        }
        StoredSession snap = registry.persist(session, session.getHostId());
        return CommandResult.ok(session.getCurrentRound(), snap.getCurrentTables());
    }

    private CommandResult end(RoomSession session, boolean endGame, List<RoomEvent> events) {
        if (!endGame && !session.hasCurrentTables()) {
            return CommandResult.fail(CommandError.NO_TABLES, "No round in progress");
        }
        Instant now = clock.instant();
        ArchivedRound archived = RoundArchiver.archiveCurrent(session, now);
        if (endGame) session.setEnded(true);

        StoredSession snap = registry.persist(session, session.getHostId());
        Map<String, Object> payload = new HashMap<>();
        payload.put("roundNumber", session.getCurrentRound());
        payload.put("gameEnded", endGame);
        payload.put("archivedRound", archived == null ? null : archived.getRoundNumber());
        events.add(event(RoomEventType.GAME_ENDED, session, now, snap, payload));
        return CommandResult.ok(session.getCurrentRound(), List.of());
    }

    // =====================================================================
    // Outcome reporting
    // =====================================================================

    /**
     * @param role       non-blank value replaces the participant's role label
     * @param statistics merged into the participant's table; may be null
     */
    public ReportResponse reportOutcome(String code, String participantId, ReportOutcome outcome,
                                        String role, Map<String, ?> statistics) {
        if (code == null || code.isBlank() || participantId == null || participantId.isBlank() || outcome == null) {
            return ReportResponse.of(ReportOutcomeResult.INVALID, "Room code, participant id and outcome are required");
        }
        String id = participantId.trim();
        List<RoomEvent> events = new ArrayList<>();
        ReportResponse response = registry.withLock(code, session -> {
            Instant now = clock.instant();
            if (session.isExpired(now)) {
                return ReportResponse.of(ReportOutcomeResult.ROOM_NOT_FOUND, "Session has expired");
            }
            if (outcome == ReportOutcome.DROP_OUT) {
                return dropOut(session, id, now, events);
            }

            Participant participant = session.getParticipant(id);
            if (participant == null) {
                return ReportResponse.of(ReportOutcomeResult.PARTICIPANT_NOT_FOUND, "Participant not found");
            }
            if (!session.hasCurrentTables()) {
                return ReportResponse.of(ReportOutcomeResult.NOT_STARTED, "No round in progress");
            }
            GameTable table = session.findCurrentTableOf(id).orElse(null);
            boolean decisive = outcome != ReportOutcome.DATA_ONLY;
            if (table == null || (decisive && table.isBye())) {
                return ReportResponse.of(ReportOutcomeResult.PARTICIPANT_NOT_FOUND,
                        "Participant is not seated in round " + session.getCurrentRound());
            }
            if (decisive && table.hasResult()) {
                return new ReportResponse(ReportOutcomeResult.ALREADY_ENDED, table.getWinnerId(), null,
                        table.getNumber(), "Table " + table.getNumber() + " already has a result");
            }

            if (role != null && !role.isBlank()) participant.setRole(role);
            table.mergeStatistics(statistics);

            String winnerId = null;
            if (outcome == ReportOutcome.WIN) {
                table.declareWinner(id, now);
                winnerId = id;
            } else if (outcome == ReportOutcome.DRAW) {
                table.declareDraw(now);
            }

            StoredSession snap = registry.persist(session, id);
            if (decisive) {
                Map<String, Object> payload = new HashMap<>();
                payload.put("roundNumber", session.getCurrentRound());
                payload.put("tableNumber", table.getNumber());
                payload.put("result", table.getResult().name());
                payload.put("winnerId", winnerId);
                events.add(event(RoomEventType.GAME_ENDED, session, now, snap, payload));
            }
            return new ReportResponse(ReportOutcomeResult.SUCCESS, winnerId, null, table.getNumber(), null);
        }).orElseGet(() -> ReportResponse.of(ReportOutcomeResult.ROOM_NOT_FOUND, "Session not found"));

        log.debug("Report {} by {} in room {} -> {}", outcome, id, code, response.result());
        publisher.publishAll(events);
        return response;
    }

    private ReportResponse dropOut(RoomSession session, String id, Instant now, List<RoomEvent> events) {
        if (session.anyCurrentTableStarted()) {
            return ReportResponse.of(ReportOutcomeResult.ROUND_ALREADY_STARTED,
                    "Cannot drop out after round " + session.getCurrentRound() + " has started");
        }
        Participant removed = session.removeParticipant(id);
        if (removed == null) {
            return ReportResponse.of(ReportOutcomeResult.PARTICIPANT_NOT_FOUND, "Participant not found");
        }
        removed.setDropped(true);
        String groupId = removed.getCustomGroupId();
        removed.leaveCustomGroup();
        if (groupId != null) dissolveIfUnseatable(session, groupId);

        StoredSession snap = registry.persist(session, id);
        events.add(event(RoomEventType.PARTICIPANT_DROPPED, session, now, snap,
                Map.of("participantId", id, "name", removed.getName())));
        log.info("Participant {} dropped out of room {}", id, session.getCode());
        return new ReportResponse(ReportOutcomeResult.SUCCESS, null, id,
                session.findCurrentTableOf(id).map(GameTable::getNumber).orElse(null), null);
    }

    // =====================================================================
    // Host corrections
    // =====================================================================

    /** Records or clears the result of a table of the current round. */
    public CommandResult setTableResult(String code, int tableNumber, int roundNumber,
                                        TableResult result, String winnerId) {
        if (result == null) return CommandResult.fail(CommandError.INVALID_REQUEST, "result is required");

        List<RoomEvent> events = new ArrayList<>();
        CommandResult outcome = registry.withLock(code, session -> {
            CommandResult denied = checkCurrentRound(session, roundNumber);
            if (denied != null) return denied;

            GameTable table = session.findCurrentTable(tableNumber).orElse(null);
            if (table == null || table.isBye()) {
                return CommandResult.fail(CommandError.TABLE_NOT_FOUND, "Table " + tableNumber + " not found");
            }

            Instant now = clock.instant();
            switch (result) {
                case WIN:
                    if (!table.contains(winnerId)) {
                        return CommandResult.fail(CommandError.PARTICIPANT_NOT_FOUND,
                                "Winner must be seated at table " + tableNumber);
                    }
                    table.clearResult();
                    table.declareWinner(winnerId, now);
                    break;
                case DRAW:
                    table.clearResult();
                    table.declareDraw(now);
                    break;
                default:
                    table.clearResult();
                    break;
            }

            StoredSession snap = registry.persist(session, session.getHostId());
            if (result != TableResult.NONE) {
                Map<String, Object> payload = new HashMap<>();
                payload.put("roundNumber", roundNumber);
                payload.put("tableNumber", tableNumber);
                payload.put("result", result.name());
                payload.put("winnerId", table.getWinnerId());
                events.add(event(RoomEventType.GAME_ENDED, session, now, snap, payload));
            }
            return CommandResult.ok(roundNumber, snap.getCurrentTables());
        }).orElseGet(RoundService::sessionNotFound);

        logOutcome(code, "SET_TABLE_RESULT", outcome);
        publisher.publishAll(events);
        return outcome;
    }

    public CommandResult moveParticipant(String code, int fromTable, int toTable, int roundNumber, String participantId) {
        if (participantId == null || participantId.isBlank() || fromTable == toTable) {
            return CommandResult.fail(CommandError.INVALID_REQUEST, "A participant and two different tables are required");
        }
        String id = participantId.trim();
        CommandResult outcome = registry.withLock(code, session -> {
            CommandResult denied = checkCurrentRound(session, roundNumber);
            if (denied != null) return denied;

            GameTable source = session.findCurrentTable(fromTable).orElse(null);
            GameTable target = session.findCurrentTable(toTable).orElse(null);
            if (source == null || target == null) {
                return CommandResult.fail(CommandError.TABLE_NOT_FOUND,
                        "Table " + (source == null ? fromTable : toTable) + " not found in round " + roundNumber);
            }
            if (!source.contains(id)) {
                return CommandResult.fail(CommandError.PARTICIPANT_NOT_FOUND,
                        "Participant is not seated at table " + fromTable);
            }

            if (!source.isBye() && source.size() - 1 < TableSizePlanner.MIN_TABLE_SIZE) {
                return CommandResult.fail(CommandError.INVALID_REQUEST,
                        "Table " + fromTable + " would drop below " + TableSizePlanner.MIN_TABLE_SIZE + " seats");
            }
            if (!target.isBye() && target.size() + 1 > TableSizePlanner.MAX_TABLE_SIZE) {
                return CommandResult.fail(CommandError.INVALID_REQUEST,
                        "Table " + toTable + " already seats " + TableSizePlanner.MAX_TABLE_SIZE);
            }

            if (id.equals(source.getWinnerId())) {
                source.clearResult();
                log.info("Result of table {} in room {} cleared: winner {} moved to table {}",
                        fromTable, session.getCode(), id, toTable);
            }
            Participant p = source.unseat(id);
            target.seat(p);
            p.setSeatOrder(target.size());

            StoredSession snap = registry.persist(session, session.getHostId());
            return CommandResult.moved(roundNumber, snap.getCurrentTables(), new CommandResult.Move(id, fromTable, toTable));
        }).orElseGet(RoundService::sessionNotFound);

        logOutcome(code, "MOVE", outcome);
        return outcome;
    }

    // =====================================================================
    // Custom groups
    // =====================================================================

    public CommandResult createCustomGroup(String code, List<String> participantIds, boolean autoFill) {
        if (participantIds == null || participantIds.isEmpty()) {
            return CommandResult.fail(CommandError.INVALID_REQUEST, "At least one participant is required");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (String raw : participantIds) {
            if (raw == null || raw.isBlank()) {
                return CommandResult.fail(CommandError.INVALID_REQUEST, "Participant ids must not be blank");
            }
            ids.add(raw.trim());
        }
        if (ids.size() > TableSizePlanner.MAX_TABLE_SIZE) {
            return CommandResult.fail(CommandError.INVALID_REQUEST, "A custom group seats at most 4 participants");
        }
        if (!autoFill && ids.size() < TableSizePlanner.MIN_TABLE_SIZE) {
            return CommandResult.fail(CommandError.INVALID_REQUEST, "A custom group without auto-fill needs at least 3 participants");
        }

        CommandResult outcome = registry.withLock(code, session -> {
            CommandResult denied = checkOpen(session);
            if (denied != null) return denied;
            if (!session.getSettings().isAllowCustomGroups()) {
                return CommandResult.fail(CommandError.CUSTOM_GROUPS_DISABLED, "Custom groups are disabled for this room");
            }
            if (session.anyCurrentTableStarted()) {
                return CommandResult.fail(CommandError.ROUND_ALREADY_STARTED, "Round " + session.getCurrentRound() + " has already started");
            }

            List<Participant> members = new ArrayList<>();
            for (String id : ids) {
                Participant p = session.getParticipant(id);
                if (p == null || p.isDropped()) {
                    return CommandResult.fail(CommandError.PARTICIPANT_NOT_FOUND, "Participant " + id + " not found");
                }
                members.add(p);
            }

            String groupId = UUID.randomUUID().toString();
            Set<String> previousGroups = new LinkedHashSet<>();
            for (Participant p : members) {
                if (p.getCustomGroupId() != null) previousGroups.add(p.getCustomGroupId());
                p.setCustomGroupId(groupId);
                p.setAutoFill(autoFill);
            }
            previousGroups.forEach(g -> dissolveIfUnseatable(session, g));

            registry.persist(session, session.getHostId());
            log.info("Custom group {} created in room {} ({} members, autoFill={})",
                    groupId, session.getCode(), members.size(), autoFill);
            return CommandResult.customGroup(session.getCurrentRound(), groupId);
        }).orElseGet(RoundService::sessionNotFound);

        logOutcome(code, "CREATE_CUSTOM_GROUP", outcome);
        return outcome;
    }

    public CommandResult deleteCustomGroup(String code, String groupId) {
        if (groupId == null || groupId.isBlank()) {
            return CommandResult.fail(CommandError.INVALID_REQUEST, "Group id is required");
        }
        CommandResult outcome = registry.withLock(code, session -> {
            CommandResult denied = checkOpen(session);
            if (denied != null) return denied;
            if (session.anyCurrentTableStarted()) {
                return CommandResult.fail(CommandError.ROUND_ALREADY_STARTED, "Round " + session.getCurrentRound() + " has already started");
            }
            List<Participant> members = session.getCustomGroupMembers(groupId.trim());
            if (members.isEmpty()) {
                return CommandResult.fail(CommandError.CUSTOM_GROUP_NOT_FOUND, "Custom group not found");
            }
            members.forEach(Participant::leaveCustomGroup);
            registry.persist(session, session.getHostId());
            return CommandResult.customGroup(session.getCurrentRound(), groupId.trim());
        }).orElseGet(RoundService::sessionNotFound);

        logOutcome(code, "DELETE_CUSTOM_GROUP", outcome);
        return outcome;
    }

    // =====================================================================
    // Settings
    // =====================================================================

    /**
     * Applies {@code changes} to a copy of the settings; only before the first round and only by the host.
     */
    public CommandResult updateSettings(String code, String actorId, Consumer<RoomSettings> changes) {
        Objects.requireNonNull(changes, "changes");
        CommandResult outcome = registry.withLock(code, session -> {
            if (!session.isHost(actorId)) {
                return CommandResult.fail(CommandError.NOT_HOST, "Only the host can change settings");
            }
            CommandResult denied = checkOpen(session);
            if (denied != null) return denied;
            if (session.isStarted()) {
                return CommandResult.fail(CommandError.GAME_STARTED, "Settings are locked once the game has started");
            }

            RoomSettings updated = session.getSettings().copy();
            try {
                changes.accept(updated);
            } catch (IllegalArgumentException e) {
                return CommandResult.fail(CommandError.INVALID_REQUEST, e.getMessage());
            }
            session.setSettings(updated);
            registry.persist(session, actorId);
            return CommandResult.ok(session.getCurrentRound(), List.of());
        }).orElseGet(RoundService::sessionNotFound);

        logOutcome(code, "UPDATE_SETTINGS", outcome);
        return outcome;
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private CommandResult checkOpen(RoomSession session) {
        if (session.isExpired(clock.instant())) {
            return CommandResult.fail(CommandError.SESSION_EXPIRED, "Session has expired");
        }
        if (session.isEnded() || session.isArchived()) {
            return CommandResult.fail(CommandError.GAME_ENDED, "Game has ended");
        }
        return null;
    }

    private CommandResult checkCurrentRound(RoomSession session, int roundNumber) {
        CommandResult denied = checkOpen(session);
        if (denied != null) return denied;
        if (!session.hasCurrentTables()) {
            return CommandResult.fail(CommandError.NO_TABLES, "No round in progress");
        }
        if (roundNumber != session.getCurrentRound()) {
            boolean archived = session.getArchive().stream().anyMatch(r -> r.getRoundNumber() == roundNumber);
            return archived
                    ? CommandResult.fail(CommandError.ROUND_ARCHIVED, "Round " + roundNumber + " is archived and can no longer change")
                    : CommandResult.fail(CommandError.TABLE_NOT_FOUND, "Round " + roundNumber + " not found");
        }
        return null;
    }

    /** A custom group left with a single member returns that member to the general pool. */
    /** A single leftover, or a closed group that no longer fills a table, rejoins the pool. */
    private static void dissolveIfUnseatable(RoomSession session, String groupId) {
        List<Participant> left = session.getCustomGroupMembers(groupId);
        boolean autoFill = left.stream().anyMatch(Participant::isAutoFill);
        if (left.size() == 1 || (!autoFill && left.size() < TableSizePlanner.MIN_TABLE_SIZE)) {
            left.forEach(Participant::leaveCustomGroup);
        }
    }

    private static RoomEvent event(RoomEventType type, RoomSession session, Instant at,
                                   StoredSession snap, Map<String, Object> payload) {
        return new RoomEvent(type, session.getCode(), at, snap, new LinkedHashMap<>(payload));
    }

    private static CommandResult sessionNotFound() {
        return CommandResult.fail(CommandError.SESSION_NOT_FOUND, "Session not found");
    }

    private static void logOutcome(String code, String command, CommandResult result) {
        if (result.success()) {
            log.debug("{} in room {} succeeded (round={})", command, code, result.roundNumber());
        } else {
            log.debug("{} in room {} rejected: {} ({})", command, code, result.error(), result.message());
        }
    }
}
