package com.largomodo.photocollage.core.domain;

/**
 * Rows and columns chosen for one collage.
 * <p>
 * Derived only from the number of successfully decoded images of a group.
 * Capacity ({@code rows * cols}) is always at least that number; trailing cells
 * beyond it stay background.
 *
 * @param rows number of grid rows (0 only for an empty plan)
 * @param cols number of grid columns (0 only for an empty plan)
 */
public record GridPlan(int rows, int cols) {

    public static final GridPlan EMPTY = new GridPlan(0, 0);

    public GridPlan {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Grid dimensions cannot be negative: " + rows + "x" + cols);
        }
    }

    public int capacity() {
        return rows * cols;
    }

    public boolean isEmpty() {
        return rows == 0 || cols == 0;
    }
}
