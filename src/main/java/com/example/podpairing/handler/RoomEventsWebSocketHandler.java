package com.example.podpairing.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint for room event subscribers.
 * - Subscribes by {@code ?roomCode=XYZ} on connect
 * - Heartbeat: replies "pong" to "ping"
 * - Room events are pushed through {@link #broadcast(String, String)}
 */
@Component
public class RoomEventsWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RoomEventsWebSocketHandler.class);

    /** Room code (upper case) → subscribed sockets */
    private final Map<String, Set<WebSocketSession>> byRoom = new ConcurrentHashMap<>();

    /** Socket id → room code */
    private final Map<String, String> roomBySession = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        String roomCode = parseQuery(session.getUri()).getOrDefault("roomCode", "").trim().toUpperCase(Locale.ROOT);
        if (roomCode.isEmpty()) {
            log.debug("WS REJECT id={} without roomCode", session.getId());
            session.close(new CloseStatus(4000, "roomCode is required"));
            return;
        }
        byRoom.computeIfAbsent(roomCode, k -> ConcurrentHashMap.newKeySet()).add(session);
        roomBySession.put(session.getId(), roomCode);
        log.info("WS OPEN room={} id={}", roomCode, session.getId());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        String payload = message.getPayload();
        if ("ping".equalsIgnoreCase(payload.trim())) {
            send(session, "pong");
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        String roomCode = roomBySession.remove(session.getId());
        if (roomCode == null) return;
        Set<WebSocketSession> subs = byRoom.get(roomCode);
        if (subs != null) {
            subs.remove(session);
            if (subs.isEmpty()) byRoom.remove(roomCode, subs);
        }
        log.info("WS CLOSE room={} id={} status={}", roomCode, session.getId(), status);
    }

    /** Sends {@code json} to every open subscriber of the room; send failures are logged. */
    public int broadcast(String roomCode, String json) {
        if (roomCode == null) return 0;
        Set<WebSocketSession> subs = byRoom.get(roomCode.toUpperCase(Locale.ROOT));
        if (subs == null || subs.isEmpty()) return 0;
        int sent = 0;
        for (WebSocketSession s : subs) {
            if (send(s, json)) sent++;
        }
        return sent;
    }

    public int subscriberCount(String roomCode) {
        Set<WebSocketSession> subs = (roomCode == null) ? null : byRoom.get(roomCode.toUpperCase(Locale.ROOT));
        return (subs == null) ? 0 : subs.size();
    }

    private boolean send(WebSocketSession session, String text) {
        if (!session.isOpen()) return false;
        try {
            // WebSocketSession is not safe for concurrent sends
            synchronized (session) {
                session.sendMessage(new TextMessage(text));
            }
            return true;
        } catch (IOException | IllegalStateException e) {
            log.warn("WS send failed id={}: {}", session.getId(), e.toString());
            return false;
        }
    }

    private static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new HashMap<>();
        if (uri == null || uri.getRawQuery() == null) return out;
        for (String pair : uri.getRawQuery().split("&")) {
            int i = pair.indexOf('=');
            if (i <= 0) continue;
            String k = URLDecoder.decode(pair.substring(0, i), StandardCharsets.UTF_8);
            String v = URLDecoder.decode(pair.substring(i + 1), StandardCharsets.UTF_8);
            out.put(k, v);
        }
        return out;
    }
}
