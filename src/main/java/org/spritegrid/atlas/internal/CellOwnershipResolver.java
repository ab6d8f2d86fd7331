package org.spritegrid.atlas.internal;

import org.spritegrid.atlas.api.AlignmentMode;
import org.spritegrid.atlas.internal.CellAssignment.Rejection;
import org.spritegrid.atlas.model.GridLayout;
import org.spritegrid.atlas.model.OwnershipRecord;
import org.spritegrid.atlas.model.Part;
import org.spritegrid.atlas.model.PixelBounds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Decides which grid cell owns each part.
 * <p>
 * A mode-dependent filter runs first and drops parts that look like background or stray
 * shapes. Every surviving part belongs to the cell holding most of its pixels and is approved
 * for that cell only.
 */
public final class CellOwnershipResolver {

    private static final Logger log = LoggerFactory.getLogger(CellOwnershipResolver.class);

    /** Icon mode drops parts touching this many cells or more. */
    static final int ICON_MAX_SPAN_EXCLUSIVE = 3;

    /** Generic mode drops parts touching more than this many cells. */
    static final int GENERIC_MAX_SPAN = 5;

    /** Silhouette mode drops parts touching this many cells or more. */
    static final int SILHOUETTE_MAX_SPAN_EXCLUSIVE = 5;

    static final int SILHOUETTE_MIN_SIZE = 200;
    static final int SILHOUETTE_MAX_SIZE = 400;

    /** Allowed distance of a silhouette edge from a grid line, as a share of the cell size. */
    static final double SILHOUETTE_EDGE_TOLERANCE = 0.20;

    /**
     * Assigns parts to cells.
     *
     * @param parts Parts in discovery order.
     * @param grid  The atlas grid.
     * @param mode  Filter to apply.
     * @return Approved parts per cell plus rejections.
     */
    public CellAssignment resolve(List<Part> parts, GridLayout grid, AlignmentMode mode) {
        final CellAssignment assignment = new CellAssignment();
        for (Part part : parts) {
            final OwnershipRecord record = OwnershipRecord.of(part, grid);
            final Rejection rejection = check(record, grid, mode);
            if (rejection != null) {
                log.debug("Rejected {} ({}, span {})", part, rejection, record.span());
                assignment.reject(rejection, part);
                continue;
            }
            assignment.approve(record.ownerIndex(), part);
        }
        log.debug("Ownership in {} mode: {} approved, {} rejected",
            mode, assignment.approvedCount(), assignment.rejectedCount());
        return assignment;
    }

    /**
     * Applies the acceptance filter of the mode.
     *
     * @return The reason to drop the part, or {@code null} to keep it.
     */
    static Rejection check(OwnershipRecord record, GridLayout grid, AlignmentMode mode) {
        final int span = record.span();
        return switch (mode) {
            case ICON -> span >= ICON_MAX_SPAN_EXCLUSIVE ? Rejection.SPAN : null;
            case GENERIC -> span > GENERIC_MAX_SPAN ? Rejection.SPAN : null;
            case SILHOUETTE -> checkSilhouette(record, grid);
        };
    }

    private static Rejection checkSilhouette(OwnershipRecord record, GridLayout grid) {
        if (record.span() >= SILHOUETTE_MAX_SPAN_EXCLUSIVE) {
            return Rejection.SPAN;
        }

        final PixelBounds bounds = record.part().bounds();
        if (!withinSize(bounds.width()) || !withinSize(bounds.height())) {
            return Rejection.SIZE;
        }

        final double toleranceX = grid.nominalCellWidth() * SILHOUETTE_EDGE_TOLERANCE;
        final double toleranceY = grid.nominalCellHeight() * SILHOUETTE_EDGE_TOLERANCE;
        final int[] xLines = grid.xLines();
        final int[] yLines = grid.yLines();
        if (GridLayout.distanceToNearestLine(xLines, bounds.minX()) > toleranceX
            || GridLayout.distanceToNearestLine(xLines, bounds.maxX()) > toleranceX
            || GridLayout.distanceToNearestLine(yLines, bounds.minY()) > toleranceY
            || GridLayout.distanceToNearestLine(yLines, bounds.maxY()) > toleranceY) {
            return Rejection.ALIGNMENT;
        }
        return null;
    }

    private static boolean withinSize(int extent) {
        return extent >= SILHOUETTE_MIN_SIZE && extent <= SILHOUETTE_MAX_SIZE;
    }
}
