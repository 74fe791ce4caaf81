package com.largomodo.photocollage.core.domain;

/**
 * Origin and size of one grid cell on the canvas, before shadow growth.
 *
 * @param x      left edge in canvas pixels
 * @param y      top edge in canvas pixels
 * @param width  cell width
 * @param height cell height
 */
public record CellGeometry(int x, int y, int width, int height) {

    /**
     * Computes the slot for a row-major index.
     * <p>
     * Usable space is the canvas minus the outer frame on both sides and the spacing between
     * neighbouring cells; it is split evenly with floor division, so any remainder is left
     * at the right and bottom edges.
     *
     * @param index         0-based position in the group
     * @param plan          grid plan of the group
     * @param canvasWidth   canvas width in pixels
     * @param canvasHeight  canvas height in pixels
     * @param frame         outer frame thickness
     * @param spacing       gap between neighbouring cells
     * @return geometry of the cell at {@code index}
     */
    public static CellGeometry forIndex(int index, GridPlan plan, int canvasWidth, int canvasHeight,
                                        int frame, int spacing) {
        if (plan.isEmpty()) {
            throw new IllegalArgumentException("Cannot place a cell on an empty grid");
        }
        if (index < 0 || index >= plan.capacity()) {
            throw new IndexOutOfBoundsException("Cell index " + index + " outside grid of " + plan.capacity());
        }

        int cellWidth = cellSize(canvasWidth, frame, spacing, plan.cols());
        int cellHeight = cellSize(canvasHeight, frame, spacing, plan.rows());

        int row = index / plan.cols();
        int col = index % plan.cols();

        return new CellGeometry(
                frame + col * (cellWidth + spacing),
                frame + row * (cellHeight + spacing),
                cellWidth,
                cellHeight);
    }

    /**
     * Size of one cell along an axis: {@code (extent - 2*frame - (n-1)*spacing) div n}.
     * May be zero or negative when frame and spacing consume the canvas.
     */
    public static int cellSize(int extent, int frame, int spacing, int cellsOnAxis) {
        int usable = extent - 2 * frame - (cellsOnAxis - 1) * spacing;
        return Math.floorDiv(usable, cellsOnAxis);
    }
}
