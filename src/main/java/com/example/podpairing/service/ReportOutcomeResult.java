package com.example.podpairing.service;

public enum ReportOutcomeResult {
    SUCCESS,
    ROOM_NOT_FOUND,
    NOT_STARTED,
    ALREADY_ENDED,
    PARTICIPANT_NOT_FOUND,
    ROUND_ALREADY_STARTED,
    INVALID
}
