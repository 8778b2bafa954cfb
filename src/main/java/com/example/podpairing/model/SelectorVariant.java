package com.example.podpairing.model;

/**
 * Scoring flavour of the minimal-repeat selector.
 */
public enum SelectorVariant {
    /** Scores against committed seats and the rest of the pool; fairness multiplier doubles per undersized seat. */
    PROGRESSIVE,
    /** Scores against committed seats only; flat 3x boost for last round's undersized tables. */
    BASIC
}
