package com.example.podpairing.service;

public enum RoundCommand {
    GENERATE_FIRST_ROUND,
    GENERATE_NEXT_ROUND,
    REGENERATE_ROUND,
    START_ROUND,
    RESET_ROUND,
    END_ROUND,
    END_GAME
}
