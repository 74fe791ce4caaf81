package com.largomodo.photocollage.core.domain;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class SquareGridPlannerTest {

    // jqwik properties do not run JUnit lifecycle methods, so the planner is built inline
    private final SquareGridPlanner planner = new SquareGridPlanner();

    @ParameterizedTest
    @CsvSource({
            "1, 1, 1",
            "2, 1, 2",
            "3, 2, 2",
            "4, 2, 2",
            "5, 2, 3",
            "7, 3, 3",
            "10, 3, 4",
            "50, 7, 8",
            "100, 10, 10"
    })
    void testKnownCounts(int count, int expectedRows, int expectedCols) {
        GridPlan plan = planner.plan(count);

        assertEquals(expectedRows, plan.rows(), "rows for n=" + count);
        assertEquals(expectedCols, plan.cols(), "cols for n=" + count);
    }

    @Test
    void testSevenImagesLeaveTwoSpareCells() {
        GridPlan plan = planner.plan(7);

        assertEquals(9, plan.capacity());
        assertEquals(2, plan.capacity() - 7, "Search accepts 3x3 even though 2x4 wastes less");
    }

    @Test
    void testZeroAndNegativeCountsYieldEmptyGrid() {
        assertEquals(GridPlan.EMPTY, planner.plan(0));
        assertEquals(GridPlan.EMPTY, planner.plan(-3));
        assertTrue(planner.plan(0).isEmpty());
    }

    @Property
    void gridAlwaysHoldsEveryImage(@ForAll @IntRange(min = 1, max = 5000) int count) {
        GridPlan plan = planner.plan(count);

        assertTrue(plan.capacity() >= count, "capacity must cover n=" + count);
        assertTrue(plan.rows() >= 1 && plan.cols() >= 1);
    }

    @Property
    void gridIsNearSquare(@ForAll @IntRange(min = 1, max = 5000) int count) {
        GridPlan plan = planner.plan(count);

        assertTrue(plan.cols() >= plan.rows(), "never taller than wide");
        assertTrue(plan.cols() - plan.rows() <= 1, "cols and rows differ by at most one for n=" + count);
        assertTrue((long) (plan.rows() - 1) * plan.cols() < count, "no fully empty trailing row for n=" + count);
    }
}
