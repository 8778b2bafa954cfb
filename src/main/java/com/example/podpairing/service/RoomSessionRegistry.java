package com.example.podpairing.service;

import com.example.podpairing.config.PodProperties;
import com.example.podpairing.events.RoomEvent;
import com.example.podpairing.events.RoomEventPublisher;
import com.example.podpairing.events.RoomEventType;
import com.example.podpairing.model.ArchivedRound;
import com.example.podpairing.model.Participant;
import com.example.podpairing.model.RoomSession;
import com.example.podpairing.pairing.RandomSource;
import com.example.podpairing.rooms.codec.SessionCodec;
import com.example.podpairing.rooms.model.StoredSession;
import com.example.podpairing.rooms.service.SessionPersistenceService;
import com.example.podpairing.rooms.service.SessionSnapshotter;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owns every live session, keyed by upper-cased room code, and the exclusive lock of each code.
 *
 * Mutations run inside {@link #withLock}; events and snapshots produced there are handed on only
 * after the lock is released. Sessions of different codes never block each other.
 */
@Component
public class RoomSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomSessionRegistry.class);

    /** No 0/O, 1/I/L: codes are read aloud at the table. */
    static final String ALLOWED_CHARS = "ABCDEFGHJKMNPQRSTUVWXYZ23456789";
    static final int MAX_CODE_ATTEMPTS = 1000;
    static final int MIN_CODE_LENGTH = 4;
    static final int MAX_CODE_LENGTH = 12;

    private final ConcurrentHashMap<String, RoomSession> sessions = new ConcurrentHashMap<>();
    // kept for the registry's lifetime: a code always maps to the same lock
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    private final RandomSource random;
    private final Clock clock;
    private final PodProperties props;
    private final RoomEventPublisher publisher;
    private final SessionSnapshotter snapshotter;
    private final SessionPersistenceService persistence;

    public RoomSessionRegistry(RandomSource random,
                               Clock clock,
                               PodProperties props,
                               RoomEventPublisher publisher,
                               SessionSnapshotter snapshotter,
                               SessionPersistenceService persistence) {
        this.random = random;
        this.clock = clock;
        this.props = props;
        this.publisher = publisher;
        this.snapshotter = snapshotter;
        this.persistence = persistence;
    }

    /** Brings stored, still open sessions back into memory. */
    @PostConstruct
    public void restore() {
        int restored = 0;
        for (StoredSession s : persistence.loadOpen()) {
            try {
                RoomSession live = SessionCodec.toLive(s);
                if (sessions.putIfAbsent(normalize(live.getCode()), live) == null) restored++;
            } catch (RuntimeException e) {
                log.warn("Skipping unreadable stored session {}: {}", s.getCode(), e.toString());
            }
        }
        if (restored > 0) log.info("Restored {} open session(s) from storage", restored);
    }

    // ---- creation ----------------------------------------------------------------

    public RoomSession createSession(String hostId) {
        return createSession(hostId, null, null);
    }

    /**
     * @param codeLength null for the configured default
     * @param ttl        null for the configured default
     * @throws IllegalArgumentException on a blank host id, bad code length or non-positive ttl
     * @throws IllegalStateException    when no free code was found
     */
    public RoomSession createSession(String hostId, Integer codeLength, Duration ttl) {
        if (hostId == null || hostId.isBlank()) {
            throw new IllegalArgumentException("hostId is required");
        }
        int length = (codeLength == null) ? props.defaultCodeLength() : codeLength;
        if (length < MIN_CODE_LENGTH || length > MAX_CODE_LENGTH) {
            throw new IllegalArgumentException("codeLength must be between " + MIN_CODE_LENGTH + " and " + MAX_CODE_LENGTH);
        }
        Duration lifetime = (ttl == null) ? props.defaultTtl() : ttl;
        if (lifetime.isNegative() || lifetime.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }

        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            String code = generateCode(length);
            Instant now = clock.instant();
            RoomSession session = new RoomSession(code, hostId.trim(), now, now.plus(lifetime));
            if (sessions.putIfAbsent(normalize(code), session) == null) {
                log.info("Room {} created by host {} (expires {})", code, session.getHostId(), session.getExpiresAt());
                withLock(code, s -> {
                    persist(s, hostId);
                    return s;
                });
                return session;
            }
        }
        throw new IllegalStateException("Unable to generate a unique room code. Try increasing code length.");
    }

    String generateCode(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALLOWED_CHARS.charAt(random.nextInt(ALLOWED_CHARS.length())));
        }
        return sb.toString();
    }

    // ---- join --------------------------------------------------------------------

    public JoinOutcome join(String code, String participantId, String name, String role) {
        if (code == null || code.isBlank()) return JoinOutcome.INVALID_CODE;
        if (participantId == null || participantId.isBlank()) return JoinOutcome.INVALID_PARTICIPANT;

        String id = participantId.trim();
        List<RoomEvent> events = new ArrayList<>();
        JoinOutcome outcome = withLock(code, session -> {
            Instant now = clock.instant();
            if (session.isExpired(now)) return JoinOutcome.SESSION_EXPIRED;
            if (session.isEnded() || session.isArchived()) return JoinOutcome.GAME_ENDED;
            if (session.isStarted() && !session.getSettings().isAllowJoinAfterStart()) return JoinOutcome.GAME_STARTED;
            if (session.hasParticipant(id)) return JoinOutcome.DUPLICATE_PARTICIPANT;

            Participant p = new Participant(id, name, now);
            p.setRole(role);
            session.addParticipant(p);

            StoredSession snap = persist(session, id);
            events.add(new RoomEvent(RoomEventType.PARTICIPANT_JOINED, session.getCode(), now, snap,
                    Map.of("participantId", p.getId(), "name", p.getName())));
            return JoinOutcome.SUCCESS;
        }).orElse(JoinOutcome.SESSION_NOT_FOUND);

        if (outcome.isSuccess()) {
            log.debug("Participant {} joined room {}", id, code);
        } else {
            log.debug("Join rejected (room={}, participant={}): {}", code, id, outcome);
        }
        publisher.publishAll(events);
        return outcome;
    }

    // ---- lookup / locking -----------------------------------------------------------

    /** Snapshot of the session, taken under its lock. */
    public Optional<StoredSession> getSession(String code) {
        return withLock(code, SessionCodec::toStored);
    }

    /**
     * Runs {@code action} while holding the exclusive lock of the session.
     *
     * @return empty when no such session exists (in memory or in storage)
     */
    public <T> Optional<T> withLock(String code, Function<RoomSession, T> action) {
        if (code == null || code.isBlank()) return Optional.empty();
        String key = normalize(code);

        RoomSession session = lookup(key);
        if (session == null) return Optional.empty();

        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            // evicted between lookup and lock
            if (sessions.get(key) != session) return Optional.empty();
            return Optional.ofNullable(action.apply(session));
        } finally {
            lock.unlock();
        }
    }

    private RoomSession lookup(String key) {
        RoomSession live = sessions.get(key);
        if (live != null) return live;

        Optional<StoredSession> stored = persistence.load(key);
        if (stored.isEmpty()) return null;
        StoredSession row = stored.get();
        if (row.isArchived() || row.getExpiresAt() == null || !clock.instant().isBefore(row.getExpiresAt())) {
            log.debug("Stored session {} is archived or expired; not restoring", key);
            return null;
        }
        try {
            RoomSession restored = SessionCodec.toLive(row);
            RoomSession prev = sessions.putIfAbsent(key, restored);
            return (prev != null) ? prev : restored;
        } catch (RuntimeException e) {
            log.warn("Stored session {} could not be restored: {}", key, e.toString());
            return null;
        }
    }

    /**
     * Hands a snapshot to the debounced snapshotter. Call with the lock held; no I/O happens here.
     */
    public StoredSession persist(RoomSession session, String actor) {
        StoredSession snap = SessionCodec.toStored(session);
        snapshotter.onChange(snap, actor);
        return snap;
    }

    public boolean contains(String code) {
        return code != null && sessions.containsKey(normalize(code));
    }

    public int size() {
        return sessions.size();
    }

    static String normalize(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }

    // ---- expiry ---------------------------------------------------------------------

    /**
     * Archives and evicts expired sessions, one lock at a time.
     *
     * @return number of evicted sessions
     */
    @Scheduled(fixedDelayString = "${pods.sweep-interval-ms:300000}",
               initialDelayString = "${pods.sweep-interval-ms:300000}")
    public int sweepExpired() {
        Instant now = clock.instant();
        int evicted = 0;
        for (Map.Entry<String, RoomSession> e : sessions.entrySet()) {
            if (!e.getValue().isExpired(now)) continue;
            if (expire(e.getKey())) evicted++;
        }
        if (evicted > 0) {
            log.info("Expiry sweep evicted {} session(s); {} remain", evicted, sessions.size());
        } else {
            log.debug("Expiry sweep: nothing to evict ({} live)", sessions.size());
        }
        return evicted;
    }

    /**
     * Archives current tables, marks the session ended and archived, then drops it from memory.
     * The stored row stays but is never restored into memory again.
     */
    public boolean expire(String code) {
        String key = normalize(code);
        List<RoomEvent> events = new ArrayList<>();
        boolean expired = withLock(key, session -> {
            Instant now = clock.instant();
            if (!session.isExpired(now)) return false;

            ArchivedRound last = RoundArchiver.archiveCurrent(session, now);
            session.setEnded(true);
            session.setArchived(true);
            StoredSession snap = persist(session, "expiry-sweep");
            events.add(new RoomEvent(RoomEventType.SESSION_EXPIRED, session.getCode(), now, snap,
                    Map.of("archivedRounds", session.getArchive().size(),
                           "lastRound", last == null ? 0 : last.getRoundNumber())));
            sessions.remove(key, session);
            return true;
        }).orElse(false);

        if (expired) {
            log.info("Room {} expired and was archived", key);
            publisher.publishAll(events);
        }
        return expired;
    }
}
