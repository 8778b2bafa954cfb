package com.example.podpairing.rooms.web;

import com.example.podpairing.model.RoomSession;
import com.example.podpairing.model.SelectorVariant;
import com.example.podpairing.model.TableResult;
import com.example.podpairing.rooms.model.StoredParticipant;
import com.example.podpairing.rooms.model.StoredSession;
import com.example.podpairing.rooms.model.StoredTable;
import com.example.podpairing.service.CommandError;
import com.example.podpairing.service.CommandResult;
import com.example.podpairing.service.JoinOutcome;
import com.example.podpairing.service.ReportOutcome;
import com.example.podpairing.service.ReportResponse;
import com.example.podpairing.service.RoomSessionRegistry;
import com.example.podpairing.service.RoundCommand;
import com.example.podpairing.service.RoundService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/rooms")
public class RoomsController {

  private final RoomSessionRegistry registry;
  private final RoundService rounds;

  public RoomsController(RoomSessionRegistry registry, RoundService rounds) {
    this.registry = registry;
    this.rounds = rounds;
  }

  // --- Create / Join / Get --------------------------------------------------

  @PostMapping
  public ResponseEntity<?> create(@Valid @RequestBody CreateRequest body) {
    try {
      Duration ttl = (body.ttlMinutes == null) ? null : Duration.ofMinutes(body.ttlMinutes);
      RoomSession created = registry.createSession(body.hostId, body.codeLength, ttl);
      if (body.eventName != null) {
        registry.withLock(created.getCode(), s -> {
          s.setEventName(body.eventName);
          return registry.persist(s, body.hostId);
        });
      }
      return registry.getSession(created.getCode())
          .<ResponseEntity<?>>map(s -> ResponseEntity.status(HttpStatus.CREATED).body(SessionView.from(s)))
          .orElseGet(() -> ResponseEntity.status(500).body(new ErrorView("Room vanished after creation")));
    } catch (IllegalArgumentException e) {
      return ResponseEntity.badRequest().body(new ErrorView(e.getMessage()));
    } catch (IllegalStateException e) {
      return ResponseEntity.status(503).body(new ErrorView(e.getMessage()));
    }
  }

  @PostMapping("/{code}/join")
  public ResponseEntity<?> join(@PathVariable String code, @RequestBody JoinRequest body) {
    JoinOutcome outcome = registry.join(code, body.participantId, body.name, body.role);
    JoinView view = new JoinView(outcome);
    switch (outcome) {
      case SUCCESS:
        return ResponseEntity.ok(view);
      case INVALID_CODE:
      case INVALID_PARTICIPANT:
        return ResponseEntity.badRequest().body(view);
      case SESSION_NOT_FOUND:
        return ResponseEntity.status(404).body(view);
      default:
        return ResponseEntity.status(409).body(view);
    }
  }

  @GetMapping("/{code}")
  public ResponseEntity<?> get(@PathVariable String code) {
    Optional<StoredSession> s = registry.getSession(code);
    if (s.isEmpty()) return ResponseEntity.status(404).body(new ErrorView("Session not found"));
    return ResponseEntity.ok(SessionView.from(s.get()));
  }

  // --- Rounds / results -----------------------------------------------------

  @PostMapping("/{code}/rounds")
  public ResponseEntity<?> round(@PathVariable String code, @Valid @RequestBody RoundRequest body) {
    ResponseEntity<?> denied = requireHost(code, body.hostId);
    if (denied != null) return denied;
    return toResponse(rounds.handleRound(code, body.command));
  }

  @PostMapping("/{code}/report")
  public ResponseEntity<?> report(@PathVariable String code, @Valid @RequestBody ReportRequest body) {
    ReportResponse r = rounds.reportOutcome(code, body.participantId, body.outcome, body.role, body.statistics);
    ReportView view = ReportView.from(r);
    switch (r.result()) {
      case SUCCESS:
        return ResponseEntity.ok(view);
      case INVALID:
        return ResponseEntity.badRequest().body(view);
      case ROOM_NOT_FOUND:
      case PARTICIPANT_NOT_FOUND:
        return ResponseEntity.status(404).body(view);
      default:
        return ResponseEntity.status(409).body(view);
    }
  }

  @PutMapping("/{code}/tables/{number}/result")
  public ResponseEntity<?> tableResult(@PathVariable String code, @PathVariable int number,
                                       @Valid @RequestBody TableResultRequest body) {
    ResponseEntity<?> denied = requireHost(code, body.hostId);
    if (denied != null) return denied;
    return toResponse(rounds.setTableResult(code, number, body.roundNumber, body.result, body.winnerId));
  }

  @PostMapping("/{code}/move")
  public ResponseEntity<?> move(@PathVariable String code, @Valid @RequestBody MoveRequest body) {
    ResponseEntity<?> denied = requireHost(code, body.hostId);
    if (denied != null) return denied;
    return toResponse(rounds.moveParticipant(code, body.fromTable, body.toTable, body.roundNumber, body.participantId));
  }

  // --- Custom groups --------------------------------------------------------

  @PostMapping("/{code}/custom-groups")
  public ResponseEntity<?> createGroup(@PathVariable String code, @Valid @RequestBody CustomGroupRequest body) {
    ResponseEntity<?> denied = requireHost(code, body.hostId);
    if (denied != null) return denied;
    return toResponse(rounds.createCustomGroup(code, body.participantIds, body.autoFill));
  }

  @DeleteMapping("/{code}/custom-groups/{groupId}")
  public ResponseEntity<?> deleteGroup(@PathVariable String code, @PathVariable String groupId,
                                       @RequestParam String hostId) {
    ResponseEntity<?> denied = requireHost(code, hostId);
    if (denied != null) return denied;
    return toResponse(rounds.deleteCustomGroup(code, groupId));
  }

  // --- Settings (host only, before the first round) ----------------------------

  @PutMapping("/{code}/settings")
  public ResponseEntity<?> settings(@PathVariable String code, @Valid @RequestBody SettingsRequest body) {
    CommandResult r = rounds.updateSettings(code, body.hostId, s -> {
      if (body.allowJoinAfterStart != null)   s.setAllowJoinAfterStart(body.allowJoinAfterStart);
      if (body.prioritizeWinners != null)     s.setPrioritizeWinners(body.prioritizeWinners);
      if (body.allowThreeSeatTables != null)  s.setAllowThreeSeatTables(body.allowThreeSeatTables);
      if (body.extraThreeSeatPenalty != null) s.setExtraThreeSeatPenalty(body.extraThreeSeatPenalty);
      if (body.allowCustomGroups != null)     s.setAllowCustomGroups(body.allowCustomGroups);
      if (body.roundLengthMinutes != null)    s.setRoundLength(Duration.ofMinutes(body.roundLengthMinutes));
      if (body.usePoints != null)             s.setUsePoints(body.usePoints);
      if (body.pointsForWin != null)          s.setPointsForWin(body.pointsForWin);
      if (body.pointsForDraw != null)         s.setPointsForDraw(body.pointsForDraw);
      if (body.pointsForLoss != null)         s.setPointsForLoss(body.pointsForLoss);
      if (body.pointsForBye != null)          s.setPointsForBye(body.pointsForBye);
      if (body.maxRounds != null)             s.setMaxRounds(body.maxRounds);
      if (body.maxTableSize != null)          s.setMaxTableSize(body.maxTableSize);
      if (body.selectorVariant != null)       s.setSelectorVariant(body.selectorVariant);
    });
    if (!r.success()) return error(r);
    return get(code);
  }

  // --- Helpers ----------------------------------------------------------------

  private ResponseEntity<?> requireHost(String code, String actorId) {
    Optional<Boolean> host = registry.withLock(code, s -> s.isHost(actorId));
    if (host.isEmpty()) return ResponseEntity.status(404).body(new ErrorView("Session not found"));
    if (!host.get()) return ResponseEntity.status(403).body(new ErrorView("Only the host can do this"));
    return null;
  }

  private static ResponseEntity<?> toResponse(CommandResult r) {
    return r.success() ? ResponseEntity.ok(CommandView.from(r)) : error(r);
  }

  private static ResponseEntity<?> error(CommandResult r) {
    return ResponseEntity.status(statusOf(r.error())).body(new ErrorView(r.error(), r.message()));
  }

  static int statusOf(CommandError error) {
    switch (error) {
      case INVALID_REQUEST:
        return 400;
      case NOT_HOST:
        return 403;
      case SESSION_NOT_FOUND:
      case TABLE_NOT_FOUND:
      case PARTICIPANT_NOT_FOUND:
      case CUSTOM_GROUP_NOT_FOUND:
        return 404;
      default:
        return 409;
    }
  }

  // ===== DTOs (Views/Requests) ============================================

  /** POST body */
  public static final class CreateRequest {
    @NotBlank public String hostId;
    @Min(4) @Max(12) public Integer codeLength;
    @Min(1) public Long ttlMinutes;
    public String eventName;
  }

  /** POST join body */
  public static final class JoinRequest {
    public String participantId;
    public String name;
    public String role;
  }

  public static final class RoundRequest {
    @NotBlank public String hostId;
    @NotNull public RoundCommand command;
  }

  public static final class ReportRequest {
    @NotBlank public String participantId;
    @NotNull public ReportOutcome outcome;
    public String role;
    public Map<String, Object> statistics;
  }

  public static final class TableResultRequest {
    @NotBlank public String hostId;
    @Min(1) public int roundNumber;
    @NotNull public TableResult result;
    public String winnerId;
  }

  public static final class MoveRequest {
    @NotBlank public String hostId;
    @NotBlank public String participantId;
    @Min(1) public int fromTable;
    @Min(1) public int toTable;
    @Min(1) public int roundNumber;
  }

  public static final class CustomGroupRequest {
    @NotBlank public String hostId;
    @NotEmpty public List<String> participantIds;
    public boolean autoFill;
  }

  /** PUT settings body; only supplied fields change */
  public static final class SettingsRequest {
    @NotBlank public String hostId;
    public Boolean allowJoinAfterStart;
    public Boolean prioritizeWinners;
    public Boolean allowThreeSeatTables;
    public Boolean extraThreeSeatPenalty;
    public Boolean allowCustomGroups;
    @Min(1) public Long roundLengthMinutes;
    public Boolean usePoints;
    public Integer pointsForWin;
    public Integer pointsForDraw;
    public Integer pointsForLoss;
    public Integer pointsForBye;
    @Min(0) public Integer maxRounds;
    @Min(3) @Max(4) public Integer maxTableSize;
    public SelectorVariant selectorVariant;
  }

  /** Session snapshot as returned to clients */
  public static final class SessionView {
    public String code;
    public String hostId;
    public String eventName;
    public Instant createdAt;
    public Instant expiresAt;
    public int currentRound;
    public boolean started;
    public boolean ended;
    public StoredSession.Settings settings;
    public List<StoredParticipant> participants;
    public List<StoredTable> currentTables;
    public int archivedRounds;

    public static SessionView from(StoredSession s) {
      SessionView v = new SessionView();
      v.code = s.getCode();
      v.hostId = s.getHostId();
      v.eventName = s.getEventName();
      v.createdAt = s.getCreatedAt();
      v.expiresAt = s.getExpiresAt();
      v.currentRound = s.getCurrentRound();
      v.started = s.isStarted();
      v.ended = s.isEnded() || s.isArchived();
      v.settings = s.getSettings();
      v.participants = s.getParticipants();
      v.currentTables = s.getCurrentTables();
      v.archivedRounds = s.getArchive().size();
      return v;
    }
  }

  public static final class JoinView {
    public boolean ok;
    public JoinOutcome outcome;
    public String message;
    public JoinView(JoinOutcome outcome) {
      this.ok = outcome.isSuccess();
      this.outcome = outcome;
      this.message = outcome.message();
    }
  }

  public static final class ReportView {
    public boolean ok;
    public String result;
    public String winnerId;
    public String removedParticipantId;
    public Integer tableNumber;
    public String message;

    public static ReportView from(ReportResponse r) {
      ReportView v = new ReportView();
      v.ok = r.isSuccess();
      v.result = r.result().name();
      v.winnerId = r.winnerId();
      v.removedParticipantId = r.removedParticipantId();
      v.tableNumber = r.tableNumber();
      v.message = r.message();
      return v;
    }
  }

  public static final class CommandView {
    public boolean ok = true;
    public int roundNumber;
    public List<StoredTable> tables;
    public String customGroupId;
    public CommandResult.Move move;

    public static CommandView from(CommandResult r) {
      CommandView v = new CommandView();
      v.roundNumber = r.roundNumber();
      v.tables = r.tables();
      v.customGroupId = r.customGroupId();
      v.move = r.move();
      return v;
    }
  }

  /** Compact error body */
  public static final class ErrorView {
    public boolean ok = false;
    public String error;
    public String message;
    public ErrorView(String message) {
      this.message = (message == null ? "Internal error" : message);
    }
    public ErrorView(CommandError error, String message) {
      this(message);
      this.error = (error == null ? null : error.name());
    }
  }
}
