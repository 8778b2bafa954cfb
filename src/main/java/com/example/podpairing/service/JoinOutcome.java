package com.example.podpairing.service;

/** Result of a join attempt, with the message shown to the joining client. */
public enum JoinOutcome {
    SUCCESS("Joined"),
    INVALID_CODE("Room code is required"),
    INVALID_PARTICIPANT("Participant id is required"),
    SESSION_NOT_FOUND("Session not found"),
    SESSION_EXPIRED("Session has expired"),
    GAME_ENDED("Game has ended"),
    GAME_STARTED("Game has started"),
    DUPLICATE_PARTICIPANT("Participant already joined");

    private final String message;

    JoinOutcome(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
