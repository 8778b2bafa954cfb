package com.example.podpairing.service;

/** Stable reasons for a rejected command. No state was changed when one of these is returned. */
public enum CommandError {
    INVALID_REQUEST,
    NOT_HOST,
    SESSION_NOT_FOUND,
    SESSION_EXPIRED,
    GAME_ENDED,
    GAME_STARTED,
    INSUFFICIENT_PARTICIPANTS,
    MAX_ROUNDS_REACHED,
    NO_TABLES,
    ROUND_ALREADY_STARTED,
    ROUND_ARCHIVED,
    TABLE_NOT_FOUND,
    PARTICIPANT_NOT_FOUND,
    CUSTOM_GROUPS_DISABLED,
    CUSTOM_GROUP_NOT_FOUND
}
