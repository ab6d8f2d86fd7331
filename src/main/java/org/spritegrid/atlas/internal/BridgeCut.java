package org.spritegrid.atlas.internal;

import org.spritegrid.atlas.model.PixelBounds;

/**
 * One severed bridge.
 *
 * @param axis          Pass that made the cut.
 * @param band          Band index (0..2) the fused part was found in.
 * @param position      Erased column (row pass) or row (column pass).
 * @param erasedPixels  Number of pixels set to transparent.
 * @param partBounds    Bounds of the fused part before the cut.
 */
public record BridgeCut(CutAxis axis, int band, int position, int erasedPixels, PixelBounds partBounds) {

    /**
     * Direction of a separation pass.
     */
    public enum CutAxis {
        /** Row bands; severs horizontal fusion by erasing a column. */
        ROWS,
        /** Column bands; severs vertical fusion by erasing a row. */
        COLUMNS
    }
}
