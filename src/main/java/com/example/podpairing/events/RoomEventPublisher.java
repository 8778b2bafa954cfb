package com.example.podpairing.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Best-effort fan-out of room events. A failing listener is logged and skipped; the remaining
 * listeners still receive the event.
 */
@Component
public class RoomEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RoomEventPublisher.class);

    private final List<RoomEventListener> listeners = new CopyOnWriteArrayList<>();

    public RoomEventPublisher(List<RoomEventListener> listeners) {
        if (listeners != null) this.listeners.addAll(listeners);
    }

    public void addListener(RoomEventListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void removeListener(RoomEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(RoomEvent event) {
        if (event == null) return;
        for (RoomEventListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {} for room {}: {}",
                        l.getClass().getSimpleName(), event.type(), event.roomCode(), e.toString());
            }
        }
    }

    public void publishAll(Collection<RoomEvent> events) {
        if (events == null) return;
        events.forEach(this::publish);
    }
}
