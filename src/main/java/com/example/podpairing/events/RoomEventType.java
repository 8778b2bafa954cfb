package com.example.podpairing.events;

public enum RoomEventType {
    PARTICIPANT_JOINED,
    ROUND_GENERATED,
    ROUND_STARTED,
    GAME_ENDED,
    PARTICIPANT_DROPPED,
    SESSION_EXPIRED
}
