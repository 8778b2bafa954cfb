package com.example.podpairing.handler;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RoomEventsWebSocketHandlerTest {

    private final RoomEventsWebSocketHandler handler = new RoomEventsWebSocketHandler();

    private static WebSocketSession socket(String id, String query) {
        WebSocketSession s = mock(WebSocketSession.class);
        when(s.getId()).thenReturn(id);
        when(s.getUri()).thenReturn(URI.create("ws://localhost:8080/ws/rooms" + (query == null ? "" : "?" + query)));
        when(s.isOpen()).thenReturn(true);
        return s;
    }

    @Test
    void subscribe_broadcast_andClose() throws Exception {
        WebSocketSession a = socket("a", "roomCode=abc123");
        WebSocketSession b = socket("b", "roomCode=ABC123");
        WebSocketSession other = socket("c", "roomCode=ZZZ999");
        handler.afterConnectionEstablished(a);
        handler.afterConnectionEstablished(b);
        handler.afterConnectionEstablished(other);

        assertEquals(2, handler.subscriberCount("abc123"));
        assertEquals(2, handler.broadcast("ABC123", "{\"type\":\"ROUND_STARTED\"}"));
        verify(a).sendMessage(new TextMessage("{\"type\":\"ROUND_STARTED\"}"));
        verify(other, never()).sendMessage(any());

        handler.afterConnectionClosed(a, CloseStatus.NORMAL);
        assertEquals(1, handler.subscriberCount("ABC123"));
    }

    @Test
    void missingRoomCode_closesWith4000() throws Exception {
        WebSocketSession s = socket("x", null);

        handler.afterConnectionEstablished(s);

        ArgumentCaptor<CloseStatus> cap = ArgumentCaptor.forClass(CloseStatus.class);
        verify(s).close(cap.capture());
        assertEquals(4000, cap.getValue().getCode());
    }

    @Test
    void ping_getsPong() throws Exception {
        WebSocketSession s = socket("p", "roomCode=ROOM01");
        handler.afterConnectionEstablished(s);

        handler.handleTextMessage(s, new TextMessage(" ping "));

        verify(s).sendMessage(new TextMessage("pong"));
    }

    @Test
    void failingSocket_doesNotStopBroadcast() throws Exception {
        WebSocketSession broken = socket("broken", "roomCode=ROOM01");
        WebSocketSession fine = socket("fine", "roomCode=ROOM01");
        doThrow(new IOException("reset by peer")).when(broken).sendMessage(any());
        handler.afterConnectionEstablished(broken);
        handler.afterConnectionEstablished(fine);

        assertEquals(1, handler.broadcast("ROOM01", "{}"));
        verify(fine).sendMessage(new TextMessage("{}"));
    }
}
