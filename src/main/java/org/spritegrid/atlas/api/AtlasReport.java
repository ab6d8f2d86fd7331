package org.spritegrid.atlas.api;

import java.util.List;

/**
 * Summary of one atlas run.
 *
 * @param mode                Mode the atlas was processed in.
 * @param partsFound          Parts extracted after bridge separation.
 * @param approvedPerCell     Approved part count per cell, in row-major scan order.
 * @param rejectedBySpan      Parts dropped for touching too many cells.
 * @param rejectedBySize      Parts dropped for an out-of-range bounding box.
 * @param rejectedByAlignment Parts dropped for not lining up with the grid.
 * @param bridgeCuts          Number of bridges severed.
 * @param erasedPixels        Pixels erased by bridge cuts.
 */
public record AtlasReport(
    AlignmentMode mode,
    int partsFound,
    List<Integer> approvedPerCell,
    int rejectedBySpan,
    int rejectedBySize,
    int rejectedByAlignment,
    int bridgeCuts,
    int erasedPixels
) {

    public AtlasReport {
        approvedPerCell = List.copyOf(approvedPerCell);
    }

    /**
     * Number of cells that received at least one part.
     */
    public int filledCells() {
        int filled = 0;
        for (int count : approvedPerCell) {
            if (count > 0) {
                filled++;
            }
        }
        return filled;
    }

    public int rejectedTotal() {
        return rejectedBySpan + rejectedBySize + rejectedByAlignment;
    }
}
