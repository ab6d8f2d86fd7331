package org.spritegrid.atlas.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The fixed 3x3 partition of an atlas raster.
 * <p>
 * Cell boundaries are {@code floor(i * size / 3)} on each axis, which for a 1024 pixel atlas
 * yields cell extents of 341, 341 and 342 pixels. Output rasters are compared byte for byte,
 * so this rounding must not be changed.
 */
public final class GridLayout {

    public static final int CELLS_PER_AXIS = 3;
    public static final int CELL_COUNT = CELLS_PER_AXIS * CELLS_PER_AXIS;

    private final int width;
    private final int height;
    private final int[] xLines;
    private final int[] yLines;
    private final List<GridCell> cells;

    public GridLayout(int width, int height) {
        this.width = width;
        this.height = height;
        this.xLines = gridLines(width);
        this.yLines = gridLines(height);

        final List<GridCell> list = new ArrayList<>(CELL_COUNT);
        for (int cy = 0; cy < CELLS_PER_AXIS; cy++) {
            for (int cx = 0; cx < CELLS_PER_AXIS; cx++) {
                list.add(new GridCell(cx, cy, xLines[cx], xLines[cx + 1], yLines[cy], yLines[cy + 1]));
            }
        }
        this.cells = Collections.unmodifiableList(list);
    }

    public static GridLayout of(Raster raster) {
        return new GridLayout(raster.getWidth(), raster.getHeight());
    }

    private static int[] gridLines(int size) {
        final int[] lines = new int[CELLS_PER_AXIS + 1];
        for (int i = 0; i <= CELLS_PER_AXIS; i++) {
            lines[i] = i * size / CELLS_PER_AXIS;
        }
        return lines;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * All cells in row-major scan order: (0,0), (1,0), (2,0), (0,1), ...
     */
    public List<GridCell> cells() {
        return cells;
    }

    public GridCell cell(int cx, int cy) {
        return cells.get(cy * CELLS_PER_AXIS + cx);
    }

    public GridCell cell(int index) {
        return cells.get(index);
    }

    /**
     * Vertical grid line positions including both raster edges (4 values).
     */
    public int[] xLines() {
        return xLines.clone();
    }

    /**
     * Horizontal grid line positions including both raster edges (4 values).
     */
    public int[] yLines() {
        return yLines.clone();
    }

    /**
     * Nominal (fractional) cell width, {@code width / 3}.
     */
    public double nominalCellWidth() {
        return width / (double) CELLS_PER_AXIS;
    }

    /**
     * Nominal (fractional) cell height, {@code height / 3}.
     */
    public double nominalCellHeight() {
        return height / (double) CELLS_PER_AXIS;
    }

    /**
     * Column index of the cell containing pixel column {@code x}.
     */
    public int columnOf(int x) {
        return bandOf(xLines, x);
    }

    /**
     * Row index of the cell containing pixel row {@code y}.
     */
    public int rowOf(int y) {
        return bandOf(yLines, y);
    }

    /**
     * Scan index of the cell containing pixel (x, y). Equivalent to testing the pixel against
     * every cell rectangle, without the nine comparisons.
     */
    public int cellIndexAt(int x, int y) {
        return rowOf(y) * CELLS_PER_AXIS + columnOf(x);
    }

    private static int bandOf(int[] lines, int coordinate) {
        if (coordinate < lines[0] || coordinate >= lines[CELLS_PER_AXIS]) {
            throw new IllegalArgumentException("Coordinate " + coordinate + " is outside the grid");
        }
        int band = 0;
        while (coordinate >= lines[band + 1]) {
            band++;
        }
        return band;
    }

    /**
     * Distance from {@code coordinate} to the closest of the given grid lines.
     */
    public static int distanceToNearestLine(int[] lines, int coordinate) {
        int best = Integer.MAX_VALUE;
        for (int line : lines) {
            best = Math.min(best, Math.abs(coordinate - line));
        }
        return best;
    }
}
