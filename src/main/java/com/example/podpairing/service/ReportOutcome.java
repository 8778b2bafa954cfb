package com.example.podpairing.service;

/** What a participant reports about the current round. */
public enum ReportOutcome {
    WIN,
    DRAW,
    DROP_OUT,
    /** Statistics / role update only; never touches the table result. */
    DATA_ONLY
}
