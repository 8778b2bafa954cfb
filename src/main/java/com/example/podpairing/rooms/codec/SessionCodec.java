package com.example.podpairing.rooms.codec;

import com.example.podpairing.model.ArchivedRound;
import com.example.podpairing.model.GameTable;
import com.example.podpairing.model.Participant;
import com.example.podpairing.model.RoomSession;
import com.example.podpairing.model.RoomSettings;
import com.example.podpairing.rooms.model.StoredParticipant;
import com.example.podpairing.rooms.model.StoredRound;
import com.example.podpairing.rooms.model.StoredSession;
import com.example.podpairing.rooms.model.StoredTable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class SessionCodec {
  private SessionCodec() {}

  /** Live -> Stored snapshot. Call with the session lock held. */
  public static StoredSession toStored(RoomSession session) {
    if (session == null) return null;

    StoredSession s = new StoredSession();
    s.setCode(session.getCode());
    s.setHostId(session.getHostId());
    s.setEventName(session.getEventName());
    s.setCreatedAt(session.getCreatedAt());
    s.setExpiresAt(session.getExpiresAt());

    s.setCurrentRound(session.getCurrentRound());
    s.setStarted(session.isStarted());
    s.setEnded(session.isEnded());
    s.setArchived(session.isArchived());

    s.setSettings(toStoredSettings(session.getSettings()));

    List<StoredParticipant> participants = new ArrayList<>();
    for (Participant p : session.getParticipants()) participants.add(toStored(p));
    s.setParticipants(participants);

    if (session.getCurrentTables() != null) s.setCurrentTables(toStoredTables(session.getCurrentTables()));

    List<StoredRound> archive = new ArrayList<>();
    for (ArchivedRound r : session.getArchive()) {
      StoredRound sr = new StoredRound();
      sr.setRoundNumber(r.getRoundNumber());
      sr.setArchivedAt(r.getArchivedAt());
      sr.setTables(toStoredTables(r.getTables()));
      archive.add(sr);
    }
    s.setArchive(archive);

    s.touchUpdated();
    return s;
  }

  public static List<StoredTable> toStoredTables(List<GameTable> tables) {
    List<StoredTable> out = new ArrayList<>();
    if (tables == null) return out;
    for (GameTable t : tables) out.add(toStored(t));
    return out;
  }

  public static StoredTable toStored(GameTable t) {
    StoredTable st = new StoredTable();
    st.setNumber(t.getNumber());
    st.setRoundNumber(t.getRoundNumber());
    List<StoredParticipant> seated = new ArrayList<>();
    for (Participant p : t.getParticipants()) seated.add(toStored(p));
    st.setParticipants(seated);
    st.setResult(t.getResult());
    st.setWinnerId(t.getWinnerId());
    st.setRoundStarted(t.isRoundStarted());
    st.setStartedAt(t.getStartedAt());
    st.setCompletedAt(t.getCompletedAt());
    st.getStatistics().putAll(t.getStatistics());
    st.setCustom(t.isCustom());
    st.setAutoFill(t.isAutoFill());
    st.setCustomGroupId(t.getCustomGroupId());
    return st;
  }

  public static StoredParticipant toStored(Participant p) {
    StoredParticipant sp = new StoredParticipant();
    sp.setId(p.getId());
    sp.setName(p.getName());
    sp.setRole(p.getRole());
    sp.setPoints(p.getPoints());
    sp.setJoinedAt(p.getJoinedAt());
    sp.setDropped(p.isDropped());
    sp.setSeatOrder(p.getSeatOrder());
    sp.setCustomGroupId(p.getCustomGroupId());
    sp.setAutoFill(p.isAutoFill());
    return sp;
  }

  public static StoredSession.Settings toStoredSettings(RoomSettings rs) {
    StoredSession.Settings s = new StoredSession.Settings();
    s.setAllowJoinAfterStart(rs.isAllowJoinAfterStart());
    s.setPrioritizeWinners(rs.isPrioritizeWinners());
    s.setAllowThreeSeatTables(rs.isAllowThreeSeatTables());
    s.setExtraThreeSeatPenalty(rs.isExtraThreeSeatPenalty());
    s.setAllowCustomGroups(rs.isAllowCustomGroups());
    s.setRoundLengthMinutes(rs.getRoundLength().toMinutes());
    s.setUsePoints(rs.isUsePoints());
    s.setPointsForWin(rs.getPointsForWin());
    s.setPointsForDraw(rs.getPointsForDraw());
    s.setPointsForLoss(rs.getPointsForLoss());
    s.setPointsForBye(rs.getPointsForBye());
    s.setMaxRounds(rs.getMaxRounds());
    s.setMaxTableSize(rs.getMaxTableSize());
    s.setSelectorVariant(rs.getSelectorVariant());
    return s;
  }

  /** Stored settings -> live settings; throws IllegalArgumentException on out-of-range values. */
  public static RoomSettings toLiveSettings(StoredSession.Settings s) {
    RoomSettings rs = new RoomSettings();
    if (s == null) return rs;
    rs.setAllowJoinAfterStart(s.isAllowJoinAfterStart());
    rs.setPrioritizeWinners(s.isPrioritizeWinners());
    rs.setAllowThreeSeatTables(s.isAllowThreeSeatTables());
    rs.setExtraThreeSeatPenalty(s.isExtraThreeSeatPenalty());
    rs.setAllowCustomGroups(s.isAllowCustomGroups());
    if (s.getRoundLengthMinutes() > 0) rs.setRoundLength(Duration.ofMinutes(s.getRoundLengthMinutes()));
    rs.setUsePoints(s.isUsePoints());
    rs.setPointsForWin(s.getPointsForWin());
    rs.setPointsForDraw(s.getPointsForDraw());
    rs.setPointsForLoss(s.getPointsForLoss());
    rs.setPointsForBye(s.getPointsForBye());
    rs.setMaxRounds(s.getMaxRounds());
    rs.setMaxTableSize(s.getMaxTableSize());
    rs.setSelectorVariant(s.getSelectorVariant());
    return rs;
  }

  /** Stored snapshot -> new live instance */
  public static RoomSession toLive(StoredSession s) {
    if (s == null) return null;

    Instant created = (s.getCreatedAt() != null) ? s.getCreatedAt() : Instant.now();
    Instant expires = (s.getExpiresAt() != null) ? s.getExpiresAt() : created;
    RoomSession live = new RoomSession(s.getCode(), s.getHostId(), created, expires);
    live.setEventName(s.getEventName());
    live.setSettings(toLiveSettings(s.getSettings()));

    for (StoredParticipant sp : s.getParticipants()) {
      live.addParticipant(toLive(sp));
    }

    for (StoredRound sr : s.getArchive()) {
      List<GameTable> frozen = new ArrayList<>();
      for (StoredTable st : sr.getTables()) {
        GameTable t = toLiveTable(st, null);
        frozen.add(t.snapshot(t.getCompletedAt()));
      }
      live.appendArchive(ArchivedRound.ofFrozen(sr.getRoundNumber(), sr.getArchivedAt(), frozen));
    }

    if (s.getCurrentTables() != null) {
      List<GameTable> current = new ArrayList<>();
      for (StoredTable st : s.getCurrentTables()) current.add(toLiveTable(st, live));
      live.setCurrentTables(current);
    }

    live.setCurrentRound(s.getCurrentRound());
    live.setStarted(s.isStarted());
    live.setEnded(s.isEnded());
    live.setArchived(s.isArchived());
    return live;
  }

  /** Seats the session's own participants when {@code owner} is given, stand-alone copies otherwise. */
  private static GameTable toLiveTable(StoredTable st, RoomSession owner) {
    GameTable t = new GameTable(st.getNumber(), st.getRoundNumber());
    if (st.isCustom()) t.markCustom(st.getCustomGroupId(), st.isAutoFill());
    for (StoredParticipant sp : st.getParticipants()) {
      Participant p = (owner != null) ? owner.getParticipant(sp.getId()) : null;
      t.seat(p != null ? p : toLive(sp));
    }
    t.restoreState(st.getResult(), st.getWinnerId(), st.isRoundStarted(), st.getStartedAt(), st.getCompletedAt());
    t.mergeStatistics(st.getStatistics());
    return t;
  }

  private static Participant toLive(StoredParticipant sp) {
    Instant joined = (sp.getJoinedAt() != null) ? sp.getJoinedAt() : Instant.EPOCH;
    Participant p = new Participant(sp.getId(), sp.getName(), joined);
    p.setRole(sp.getRole());
    p.setPoints(sp.getPoints());
    p.setDropped(sp.isDropped());
    p.setSeatOrder(sp.getSeatOrder());
    p.setCustomGroupId(sp.getCustomGroupId());
    p.setAutoFill(sp.isAutoFill());
    return p;
  }
}
