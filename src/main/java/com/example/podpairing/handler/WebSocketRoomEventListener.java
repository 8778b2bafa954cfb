package com.example.podpairing.handler;

import com.example.podpairing.events.RoomEvent;
import com.example.podpairing.events.RoomEventListener;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/** Pushes room events to WebSocket subscribers as {@code {type, roomCode, at, payload}}. */
@Component
public class WebSocketRoomEventListener implements RoomEventListener {

    private static final Logger log = LoggerFactory.getLogger(WebSocketRoomEventListener.class);

    private final RoomEventsWebSocketHandler handler;
    private final ObjectMapper mapper;

    public WebSocketRoomEventListener(RoomEventsWebSocketHandler handler, ObjectMapper mapper) {
        this.handler = handler;
        this.mapper = mapper;
    }

    @Override
    public void onEvent(RoomEvent event) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", event.type().name());
        msg.put("roomCode", event.roomCode());
        msg.put("at", event.at());
        msg.put("payload", event.payload());
        try {
            int sent = handler.broadcast(event.roomCode(), mapper.writeValueAsString(msg));
            log.debug("Event {} for room {} sent to {} subscriber(s)", event.type(), event.roomCode(), sent);
        } catch (JsonProcessingException e) {
            log.warn("Event {} for room {} could not be serialized: {}", event.type(), event.roomCode(), e.getOriginalMessage());
        }
    }
}
