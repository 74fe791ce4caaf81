package com.largomodo.photocollage.core.domain;

/**
 * Strategy interface for choosing the grid that holds a collage's photos.
 */
public interface GridPlanner {
    /**
     * Plans a grid for the given number of photos.
     *
     * @param count number of photos to place
     * @return grid whose capacity is at least {@code count}; {@link GridPlan#EMPTY} when count &lt;= 0
     */
    GridPlan plan(int count);
}
