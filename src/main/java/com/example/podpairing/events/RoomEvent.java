package com.example.podpairing.events;

import com.example.podpairing.rooms.model.StoredSession;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Notification about a session change.
 *
 * @param session snapshot taken under the session lock when the event was raised
 * @param payload event specific values (tables, participant id, winner id, ...)
 */
public record RoomEvent(RoomEventType type, String roomCode, Instant at,
                        StoredSession session, Map<String, Object> payload) {

    public RoomEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(roomCode, "roomCode");
        payload = (payload == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
