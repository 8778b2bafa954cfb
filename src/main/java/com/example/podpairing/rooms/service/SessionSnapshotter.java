package com.example.podpairing.rooms.service;

import com.example.podpairing.rooms.model.StoredSession;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Debounces rapid session mutations and persists the latest snapshot via SessionPersistenceService.
 */
public class SessionSnapshotter {

    private static final Logger log = LoggerFactory.getLogger(SessionSnapshotter.class);

    private final SessionPersistenceService service;
    private final long debounceMs;

    private final ScheduledExecutorService scheduler;
    private final ConcurrentMap<String, ScheduledFuture<?>> inflight = new ConcurrentHashMap<>();

    public SessionSnapshotter(SessionPersistenceService service, long debounceMs) {
        this.service = service;
        this.debounceMs = Math.max(0, debounceMs);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactory() {
            private final AtomicInteger c = new AtomicInteger();
            @Override public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "session-snapshotter-" + c.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
        log.info("SessionSnapshotter initialized (debounceMs={})", this.debounceMs);
    }

    /**
     * Signal that a session changed. After the debounce window the latest snapshot is persisted;
     * a newer snapshot for the same code replaces a pending one.
     */
    public void onChange(StoredSession snapshot, String actor) {
        if (snapshot == null) return;
        String code = snapshot.getCode();
        if (code == null || code.isBlank()) return;

        Runnable task = () -> {
            try {
                service.save(snapshot, actor);
                log.debug("Snapshot persisted (room={}, actor={})", code, actor);
            } catch (RuntimeException e) {
                log.warn("Snapshot failed (room={}, actor={}): {}", code, actor, e.toString());
            } finally {
                inflight.remove(code);
            }
        };

        ScheduledFuture<?> fut = scheduler.schedule(task, debounceMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> prev = inflight.put(code, fut);
        if (prev != null && !prev.isDone()) {
            prev.cancel(false);
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
