package com.example.podpairing.model;

/** Declared outcome of a table. WIN carries the winner id on the table itself. */
public enum TableResult {
    NONE,
    WIN,
    DRAW
}
