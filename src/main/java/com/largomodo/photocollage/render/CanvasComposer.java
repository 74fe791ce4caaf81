package com.largomodo.photocollage.render;

import com.largomodo.photocollage.core.CollageSettings;
import com.largomodo.photocollage.core.domain.CellGeometry;
import com.largomodo.photocollage.core.domain.DecodedImage;
import com.largomodo.photocollage.core.domain.GridPlan;
import com.largomodo.photocollage.core.domain.GridPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.AlphaComposite;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;

/**
 * Assembles one group's decoded photos into a collage canvas.
 * <p>
 * Steps: plan the grid from the photo count, derive cell size from canvas, frame and spacing,
 * reserve the shadow margin, fill the canvas with the background colour, render and centre each
 * photo in its cell row-major (left to right, top to bottom), then apply the silhouette once.
 * Trailing cells of an incomplete last row keep the background.
 * <p>
 * Deterministic: the same images and settings produce identical pixels.
 */
public class CanvasComposer {

    private static final Logger log = LoggerFactory.getLogger(CanvasComposer.class);

    private final GridPlanner gridPlanner;
    private final CellRenderer cellRenderer;
    private final ShapeMask shapeMask;

    public CanvasComposer(GridPlanner gridPlanner, CellRenderer cellRenderer, ShapeMask shapeMask) {
        if (gridPlanner == null || cellRenderer == null || shapeMask == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.gridPlanner = gridPlanner;
        this.cellRenderer = cellRenderer;
        this.shapeMask = shapeMask;
    }

    /**
     * Composes a canvas from decoded photos.
     *
     * @param images   decoded photos in placement order
     * @param settings run configuration
     * @return the composed canvas, or empty when there is nothing to place
     */
    public Optional<ComposedCanvas> compose(List<DecodedImage> images, CollageSettings settings) {
        if (images.isEmpty()) {
            return Optional.empty();
        }

        GridPlan grid = gridPlanner.plan(images.size());
        int canvasWidth = settings.canvasWidth();
        int canvasHeight = settings.canvasHeight();

        int cellWidth = CellGeometry.cellSize(canvasWidth, settings.frameThickness(), settings.spacing(), grid.cols());
        int cellHeight = CellGeometry.cellSize(canvasHeight, settings.frameThickness(), settings.spacing(), grid.rows());
        Dimension content = CellRenderer.contentSize(cellWidth, cellHeight, settings.shadowMargin());

        log.debug("Grid {}x{}, cell {}x{}, content {}x{}", grid.rows(), grid.cols(),
                cellWidth, cellHeight, content.width, content.height);

        BufferedImage canvas = new BufferedImage(canvasWidth, canvasHeight, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.setColor(settings.backgroundColor());
            g.fillRect(0, 0, canvasWidth, canvasHeight);

            g.setComposite(AlphaComposite.SrcOver);
            for (int i = 0; i < images.size(); i++) {
                CellGeometry cell = CellGeometry.forIndex(i, grid, canvasWidth, canvasHeight,
                        settings.frameThickness(), settings.spacing());
                BufferedImage rendered = cellRenderer.render(images.get(i), content, settings);

                int x = cell.x() + Math.floorDiv(cell.width() - rendered.getWidth(), 2);
                int y = cell.y() + Math.floorDiv(cell.height() - rendered.getHeight(), 2);
                g.drawImage(rendered, x, y, null);
            }
        } finally {
            g.dispose();
        }

        if (!settings.shape().isFullCanvas()) {
            shapeMask.apply(canvas, settings.shape());
        }

        return Optional.of(new ComposedCanvas(canvas, grid, images.size()));
    }
}
