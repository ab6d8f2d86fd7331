package org.spritegrid.atlas.model;

/**
 * One cell of the 3x3 atlas grid. Start coordinates are inclusive, end coordinates exclusive.
 *
 * @param cx     Column index (0..2).
 * @param cy     Row index (0..2).
 * @param startX First pixel column of the cell.
 * @param endX   One past the last pixel column of the cell.
 * @param startY First pixel row of the cell.
 * @param endY   One past the last pixel row of the cell.
 */
public record GridCell(int cx, int cy, int startX, int endX, int startY, int endY) {

    /**
     * Row-major scan index of the cell: {@code cy * 3 + cx}.
     */
    public int index() {
        return cy * GridLayout.CELLS_PER_AXIS + cx;
    }

    public int width() {
        return endX - startX;
    }

    public int height() {
        return endY - startY;
    }

    public boolean contains(int x, int y) {
        return x >= startX && x < endX && y >= startY && y < endY;
    }

    @Override
    public String toString() {
        return "(" + cx + "," + cy + ")";
    }
}
