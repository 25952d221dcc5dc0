package com.panelforge.imaging;

import com.panelforge.plan.model.GridPosition;
import com.panelforge.plan.model.GridSpecification;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Computes panel pixel bounds from a grid address and copies panels out of the master grid.
 * <p>
 * Panel size is {@code imageWidth / cols} by {@code imageHeight / rows} with integer division:
 * remainder pixels on the right and bottom edges belong to no panel.
 */
public final class GridSlicer {

    /**
     * @param position    panel address {@code [row, col]}
     * @param grid        grid shape ({@code cols} x {@code rows})
     * @param imageWidth  master grid width in pixels
     * @param imageHeight master grid height in pixels
     * @throws IllegalArgumentException when the position is outside the grid or the image is
     *                                  too small to give every panel at least one pixel
     */
    public PanelBounds computePanelBounds(GridPosition position, GridSpecification grid, int imageWidth, int imageHeight) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(grid, "grid");
        if (!grid.contains(position)) {
            throw new IllegalArgumentException("grid_position " + position + " is outside grid " + grid);
        }
        int panelWidth = imageWidth / grid.getCols();
        int panelHeight = imageHeight / grid.getRows();
        if (panelWidth < 1 || panelHeight < 1) {
            throw new IllegalArgumentException("image " + imageWidth + "x" + imageHeight
                    + " is too small for grid " + grid + " (" + grid.getCols() + " columns, " + grid.getRows() + " rows)");
        }
        int left = position.getCol() * panelWidth;
        int top = position.getRow() * panelHeight;
        return new PanelBounds(left, top, left + panelWidth, top + panelHeight);
    }

    /** Convenience overload taking the raw {@code "CxR"} text. */
    public PanelBounds computePanelBounds(GridPosition position, String gridSpecification, int imageWidth, int imageHeight) {
        return computePanelBounds(position, GridSpecification.parse(gridSpecification), imageWidth, imageHeight);
    }

    /**
     * Copies {@code bounds} out of {@code source} into a new RGB image that does not share the
     * source raster, so panels can be processed on separate threads.
     */
    public BufferedImage extract(BufferedImage source, PanelBounds bounds) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(bounds, "bounds");
        if (bounds.right() > source.getWidth() || bounds.bottom() > source.getHeight() || bounds.width() == 0 || bounds.height() == 0) {
            throw new IllegalArgumentException("bounds " + bounds + " do not fit image " + source.getWidth() + "x" + source.getHeight());
        }
        return Rasters.copy(source, bounds.left(), bounds.top(), bounds.width(), bounds.height());
    }
}
