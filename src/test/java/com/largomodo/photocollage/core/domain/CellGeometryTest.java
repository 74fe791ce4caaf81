package com.largomodo.photocollage.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellGeometryTest {

    @Test
    void testCellSizeSubtractsFrameAndSpacing() {
        // 3000 - 2*20 - 6*5 = 2930, / 7 = 418 remainder 4
        assertEquals(418, CellGeometry.cellSize(3000, 20, 5, 7));
        // 3000 - 40 - 35 = 2925, / 8 = 365 remainder 5
        assertEquals(365, CellGeometry.cellSize(3000, 20, 5, 8));
    }

    @Test
    void testCellSizeCanCollapse() {
        assertTrue(CellGeometry.cellSize(40, 20, 5, 1) <= 0);
        assertEquals(-1, CellGeometry.cellSize(100, 50, 1, 2), "floor division of a negative extent");
    }

    @Test
    void testRowMajorPlacement() {
        GridPlan plan = new GridPlan(3, 3);

        CellGeometry first = CellGeometry.forIndex(0, plan, 310, 310, 10, 5);
        CellGeometry fifth = CellGeometry.forIndex(4, plan, 310, 310, 10, 5);
        CellGeometry last = CellGeometry.forIndex(8, plan, 310, 310, 10, 5);

        // (310 - 20 - 10) / 3 = 93
        assertEquals(new CellGeometry(10, 10, 93, 93), first);
        assertEquals(new CellGeometry(10 + 98, 10 + 98, 93, 93), fifth);
        assertEquals(new CellGeometry(10 + 2 * 98, 10 + 2 * 98, 93, 93), last);
    }

    @Test
    void testIndexOutsideGridRejected() {
        GridPlan plan = new GridPlan(2, 2);

        assertThrows(IndexOutOfBoundsException.class, () -> CellGeometry.forIndex(4, plan, 100, 100, 0, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> CellGeometry.forIndex(-1, plan, 100, 100, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> CellGeometry.forIndex(0, GridPlan.EMPTY, 100, 100, 0, 0));
    }

    @Test
    void testCellsNeverOverlapFrame() {
        GridPlan plan = new GridPlan(8, 7);
        for (int i = 0; i < plan.capacity(); i++) {
            CellGeometry cell = CellGeometry.forIndex(i, plan, 3000, 3000, 20, 5);
            assertTrue(cell.x() >= 20 && cell.y() >= 20);
            assertTrue(cell.x() + cell.width() <= 3000 - 20);
            assertTrue(cell.y() + cell.height() <= 3000 - 20);
        }
    }
}
