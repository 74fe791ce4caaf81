package com.largomodo.photocollage.core.domain;

/**
 * Near-square grid planner.
 * <p>
 * Starts from {@code cols = ceil(sqrt(n))}, derives {@code rows = ceil(n / cols)} and widens
 * the grid one column at a time until {@code rows * cols >= n}. The column count is the first
 * value this deterministic search accepts, not a global optimum over all shapes (e.g. n=7
 * yields 3x3 with two spare cells rather than 2x4 with one).
 */
public class SquareGridPlanner implements GridPlanner {

    @Override
    public GridPlan plan(int count) {
        if (count <= 0) {
            return GridPlan.EMPTY;
        }

        int cols = (int) Math.ceil(Math.sqrt(count));
        int rows = ceilDiv(count, cols);

        // ceil(n / ceil(sqrt(n))) always satisfies the bound; kept to guard floating-point sqrt
        while ((long) rows * cols < count) {
            cols++;
        }

        return new GridPlan(rows, cols);
    }

    private static int ceilDiv(int dividend, int divisor) {
        return -Math.floorDiv(-dividend, divisor);
    }
}
