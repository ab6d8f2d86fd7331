package org.spritegrid.atlas.model;

/**
 * Per-cell pixel counts of one part.
 * <p>
 * The owner is the cell holding the most pixels. Ties go to the cell the part's member pixels
 * entered first in flood-fill visitation order, an arbitrary but deterministic choice.
 */
public final class OwnershipRecord {

    private final Part part;
    private final int[] counts;
    private final int span;
    private final int ownerIndex;

    private OwnershipRecord(Part part, int[] counts, int[] touchOrder, int span) {
        this.part = part;
        this.counts = counts;
        this.span = span;

        int owner = -1;
        int best = 0;
        for (int i = 0; i < span; i++) {
            final int cell = touchOrder[i];
            if (counts[cell] > best) {
                best = counts[cell];
                owner = cell;
            }
        }
        this.ownerIndex = owner;
    }

    /**
     * Counts the part's pixels per grid cell.
     */
    public static OwnershipRecord of(Part part, GridLayout grid) {
        final int[] counts = new int[GridLayout.CELL_COUNT];
        final int[] touchOrder = new int[GridLayout.CELL_COUNT];
        int span = 0;
        for (int i = 0; i < part.size(); i++) {
            final int cell = grid.cellIndexAt(part.x(i), part.y(i));
            if (counts[cell]++ == 0) {
                touchOrder[span++] = cell;
            }
        }
        return new OwnershipRecord(part, counts, touchOrder, span);
    }

    public Part part() {
        return part;
    }

    public int countIn(int cellIndex) {
        return counts[cellIndex];
    }

    /**
     * Number of distinct cells touched by the part.
     */
    public int span() {
        return span;
    }

    /**
     * Scan index of the owning cell.
     */
    public int ownerIndex() {
        return ownerIndex;
    }
}
