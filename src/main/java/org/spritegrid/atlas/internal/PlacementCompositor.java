package org.spritegrid.atlas.internal;

import org.spritegrid.atlas.api.AlignmentMode.Placement;
import org.spritegrid.atlas.model.GridCell;
import org.spritegrid.atlas.model.GridLayout;
import org.spritegrid.atlas.model.Part;
import org.spritegrid.atlas.model.PixelBounds;
import org.spritegrid.atlas.model.Raster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes every cell's approved parts, as one group, into a fresh transparent raster.
 * <p>
 * The parts of a cell keep their arrangement relative to each other (a hat stays on its head);
 * the group as a whole is moved to the target position. Pixels are copied verbatim, without
 * blending or resampling. Cells are written in scan order, so where groups overflow into a
 * neighbour the later cell wins. Pixels moved outside the raster are dropped.
 */
public final class PlacementCompositor {

    private static final Logger log = LoggerFactory.getLogger(PlacementCompositor.class);

    /**
     * Composes the output raster.
     *
     * @param source     Raster the parts were extracted from.
     * @param grid       The atlas grid.
     * @param assignment Approved parts per cell.
     * @param placement  Placement policy.
     * @return A new raster with the dimensions and channel count of {@code source}.
     */
    public Raster compose(Raster source, GridLayout grid, CellAssignment assignment, Placement placement) {
        final Raster output = Raster.blank(source.getWidth(), source.getHeight(), source.getChannels());
        for (GridCell cell : grid.cells()) {
            final List<Part> parts = assignment.partsOf(cell.index());
            if (parts.isEmpty()) {
                continue;
            }
            final PixelBounds group = groupBounds(parts);
            final int[] target = targetOrigin(cell, group, placement);
            final int dropped = copyGroup(source, output, parts, group, target[0], target[1]);
            log.debug("Cell {}: {} part(s), group {}x{} placed at ({}, {}), {} pixel(s) dropped",
                cell, parts.size(), group.width(), group.height(), target[0], target[1], dropped);
        }
        return output;
    }

    /**
     * Union of the bounding boxes of all parts.
     */
    static PixelBounds groupBounds(List<Part> parts) {
        PixelBounds bounds = parts.get(0).bounds();
        for (int i = 1; i < parts.size(); i++) {
            bounds = bounds.union(parts.get(i).bounds());
        }
        return bounds;
    }

    /**
     * Top-left target position of a group.
     * <p>
     * Both policies centre horizontally. {@link Placement#BOTTOM} puts the group's bottom row on
     * the cell's bottom row; a group taller than the cell then starts above the cell's top edge.
     *
     * @return {@code {targetX, targetY}}
     */
    static int[] targetOrigin(GridCell cell, PixelBounds group, Placement placement) {
        final int targetX = cell.startX() + Math.floorDiv(cell.width() - group.width(), 2);
        final int targetY = switch (placement) {
            case CENTER -> cell.startY() + Math.floorDiv(cell.height() - group.height(), 2);
            case BOTTOM -> cell.endY() - group.height();
        };
        return new int[]{targetX, targetY};
    }

    private static int copyGroup(Raster source, Raster output, List<Part> parts, PixelBounds group,
                                 int targetX, int targetY) {
        int dropped = 0;
        for (Part part : parts) {
            for (int i = 0; i < part.size(); i++) {
                final int x = part.x(i);
                final int y = part.y(i);
                final int newX = targetX + (x - group.minX());
                final int newY = targetY + (y - group.minY());
                if (output.contains(newX, newY)) {
                    output.copyPixelFrom(source, x, y, newX, newY);
                } else {
                    dropped++;
                }
            }
        }
        return dropped;
    }
}
