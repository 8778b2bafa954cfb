package com.example.podpairing.pairing;

/** Number of 4-seat and 3-seat tables for one round. */
public record TablePlan(int fours, int threes) {

    public int tables() {
        return fours + threes;
    }

    public int seats() {
        return fours * 4 + threes * 3;
    }

    /** Both counts non-negative. */
    public boolean isFeasible() {
        return fours >= 0 && threes >= 0;
    }
}
