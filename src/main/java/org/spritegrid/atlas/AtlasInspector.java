package org.spritegrid.atlas;

import org.spritegrid.atlas.internal.ComponentExtractor;
import org.spritegrid.atlas.model.GridLayout;
import org.spritegrid.atlas.model.OwnershipRecord;
import org.spritegrid.atlas.model.Part;
import org.spritegrid.atlas.model.Raster;

import java.util.ArrayList;
import java.util.List;

/**
 * Describes an atlas without processing it.
 */
public final class AtlasInspector {

    private AtlasInspector() {
    }

    /**
     * Basic structure of a raster. Never fails on size or channel count, so it can be used to
     * explain why {@link AtlasProcessor} rejected an input.
     */
    public static AtlasStructure inspect(Raster raster) {
        return new AtlasStructure(
            raster.getWidth(),
            raster.getHeight(),
            raster.getChannels(),
            raster.hasAlpha(),
            raster.getWidth() / (double) GridLayout.CELLS_PER_AXIS);
    }

    /**
     * Number of parts whose majority of pixels lies in each cell, before any mode filter.
     * Rasters without alpha are treated as fully opaque.
     *
     * @return Counts in row-major scan order.
     */
    public static List<Integer> partsPerCell(Raster raster) {
        final GridLayout grid = GridLayout.of(raster);
        final int[] counts = new int[GridLayout.CELL_COUNT];
        for (Part part : ComponentExtractor.extract(raster)) {
            counts[OwnershipRecord.of(part, grid).ownerIndex()]++;
        }
        final List<Integer> result = new ArrayList<>(counts.length);
        for (int count : counts) {
            result.add(count);
        }
        return result;
    }

    /**
     * @param width    Raster width.
     * @param height   Raster height.
     * @param channels Channel count.
     * @param hasAlpha True with four or more channels.
     * @param tileSize Nominal cell size, {@code width / 3}.
     */
    public record AtlasStructure(int width, int height, int channels, boolean hasAlpha, double tileSize) {

        public boolean isProcessable() {
            return width == AtlasProcessor.ATLAS_SIZE
                && height == AtlasProcessor.ATLAS_SIZE
                && channels >= AtlasProcessor.MIN_CHANNELS;
        }
    }
}
