package com.example.podpairing.pairing;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TableSizePlannerTest {

    @Test
    void plan_coversEveryParticipant_whenThreeSeatTablesAllowed() {
        for (int n = 6; n <= 200; n++) {
            TablePlan p = TableSizePlanner.plan(n, true);
            assertEquals(n, p.fours() * 4 + p.threes() * 3, "n=" + n);
            assertTrue(p.threes() >= 0 && p.threes() <= 3, "n=" + n);
            assertTrue(p.fours() >= 0, "n=" + n);
        }
    }

    @Test
    void plan_sixParticipants_isTwoTablesOfThree() {
        assertEquals(new TablePlan(0, 2), TableSizePlanner.plan(6, true));
    }

    @Test
    void plan_remainders() {
        assertEquals(new TablePlan(3, 0), TableSizePlanner.plan(12, true));
        assertEquals(new TablePlan(1, 3), TableSizePlanner.plan(13, true));
        assertEquals(new TablePlan(2, 2), TableSizePlanner.plan(14, true));
        assertEquals(new TablePlan(3, 1), TableSizePlanner.plan(15, true));
    }

    @Test
    void plan_withoutThreeSeatTables_leavesRemainderOut() {
        assertEquals(new TablePlan(3, 0), TableSizePlanner.plan(12, false));
        assertEquals(new TablePlan(3, 0), TableSizePlanner.plan(15, false));
        assertEquals(12, TableSizePlanner.plan(14, false).seats());
    }

    @Test
    void plan_belowMinimum_mayBeInfeasible() {
        assertFalse(TableSizePlanner.plan(5, true).isFeasible());
        assertTrue(TableSizePlanner.plan(5, false).isFeasible());
    }
}
