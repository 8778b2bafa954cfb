package com.example.podpairing.pairing;

/**
 * Splits a pool of n participants into tables of four, topping up with tables of three.
 * Callers enforce the minimum pool size; below six the result may not be feasible.
 */
public final class TableSizePlanner {

    public static final int MIN_POOL_SIZE = 6;
    public static final int MIN_TABLE_SIZE = 3;
    public static final int MAX_TABLE_SIZE = 4;

    private TableSizePlanner() {}

    public static TablePlan plan(int n, boolean allowThreeSeatTables) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0");

        int k = n / 4;
        if (!allowThreeSeatTables) {
            return new TablePlan(k, 0);   // remainder is left unseated
        }
        switch (n % 4) {
            case 0:  return new TablePlan(k, 0);
            case 1:  return new TablePlan(k - 2, 3);
            case 2:  return new TablePlan(k - 1, 2);
            default: return new TablePlan(k, 1);
        }
    }
}
