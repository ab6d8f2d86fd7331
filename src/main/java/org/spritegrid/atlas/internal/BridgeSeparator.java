package org.spritegrid.atlas.internal;

import org.spritegrid.atlas.internal.BridgeCut.CutAxis;
import org.spritegrid.atlas.model.GridLayout;
import org.spritegrid.atlas.model.Part;
import org.spritegrid.atlas.model.Raster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Severs narrow necks between silhouettes that the generator drew touching across cell borders.
 * <p>
 * Two one-dimensional passes run on the same raster, rows first, then columns, and both always
 * run. The row pass walks the three row bands; in each band it looks for parts that are much
 * wider than a single cell and erases, near each expected split position, the column where the
 * part is thinnest. The column pass does the same with rows inside the three column bands.
 * <p>
 * Parts are re-extracted for every band so that cuts made for an earlier band are seen by later
 * ones. A part fused diagonally cannot be separated by either pass; it stays fused.
 * <p>
 * The raster is modified in place. Callers must hand in a private copy.
 */
public final class BridgeSeparator {

    private static final Logger log = LoggerFactory.getLogger(BridgeSeparator.class);

    /** Minimum extent across the band for a part to be considered. */
    static final int MIN_CROSS_EXTENT = 50;

    /** Minimum share of a part's pixels that must fall inside the band. */
    static final double MIN_BAND_SHARE = 0.30;

    /** Half width of the window searched around an expected split position. */
    static final int SEARCH_RADIUS = 20;

    /** Below this width-to-cell ratio a part is a single silhouette. */
    static final double ONE_SPLIT_RATIO = 1.5;

    /** Below this ratio a part is two silhouettes, at or above it three. */
    static final double TWO_SPLIT_RATIO = 2.5;

    private static final double[] NO_SPLIT = {};
    private static final double[] HALVES = {1.0 / 2};
    private static final double[] THIRDS = {1.0 / 3, 2.0 / 3};

    /**
     * Runs the row pass followed by the column pass.
     *
     * @param raster Raster to cut in place.
     * @param grid   Grid of the raster.
     * @return All cuts made, in the order they were made.
     */
    public List<BridgeCut> separate(Raster raster, GridLayout grid) {
        final List<BridgeCut> cuts = new ArrayList<>();
        cuts.addAll(separateAlong(raster, grid, CutAxis.ROWS));
        cuts.addAll(separateAlong(raster, grid, CutAxis.COLUMNS));
        log.debug("Bridge separation made {} cut(s)", cuts.size());
        return cuts;
    }

    /**
     * Runs a single pass over the three bands of one axis.
     */
    List<BridgeCut> separateAlong(Raster raster, GridLayout grid, CutAxis axis) {
        final List<BridgeCut> cuts = new ArrayList<>();
        final int[] bandLines = axis == CutAxis.ROWS ? grid.yLines() : grid.xLines();
        final double expectedExtent = axis == CutAxis.ROWS ? grid.nominalCellWidth() : grid.nominalCellHeight();

        for (int band = 0; band < GridLayout.CELLS_PER_AXIS; band++) {
            final int bandStart = bandLines[band];
            final int bandEnd = bandLines[band + 1];

            for (Part part : ComponentExtractor.extract(raster)) {
                if (!qualifies(part, axis, bandStart, bandEnd)) {
                    continue;
                }

                final double[] fractions = splitFractions(extentAlong(part, axis), expectedExtent);
                for (double fraction : fractions) {
                    final BridgeCut cut = cutNarrowest(raster, part, axis, band, fraction);
                    if (cut != null) {
                        cuts.add(cut);
                    }
                }
            }
        }
        return cuts;
    }

    /**
     * True when the part is tall (row pass) or wide (column pass) enough and enough of its mass
     * lies inside the band. This leaves out parts that only graze the band and thin slivers.
     */
    static boolean qualifies(Part part, CutAxis axis, int bandStart, int bandEnd) {
        final int crossExtent = axis == CutAxis.ROWS ? part.bounds().height() : part.bounds().width();
        if (crossExtent <= MIN_CROSS_EXTENT) {
            return false;
        }

        int inside = 0;
        for (int i = 0; i < part.size(); i++) {
            final int coordinate = axis == CutAxis.ROWS ? part.y(i) : part.x(i);
            if (coordinate >= bandStart && coordinate < bandEnd) {
                inside++;
            }
        }
        return inside >= MIN_BAND_SHARE * part.size();
    }

    /**
     * Relative split positions for a part of the given extent, estimated from how many cells it
     * covers.
     */
    static double[] splitFractions(int extent, double expectedExtent) {
        final double ratio = extent / expectedExtent;
        if (ratio < ONE_SPLIT_RATIO) {
            return NO_SPLIT;
        }
        if (ratio < TWO_SPLIT_RATIO) {
            return HALVES;
        }
        return THIRDS;
    }

    private static int extentAlong(Part part, CutAxis axis) {
        return axis == CutAxis.ROWS ? part.bounds().width() : part.bounds().height();
    }

    /**
     * Finds the thinnest cross-section of the part inside the search window around
     * {@code fraction} of its extent and erases it.
     *
     * @return The cut, or {@code null} when no cross-section in the window holds part pixels.
     */
    BridgeCut cutNarrowest(Raster raster, Part part, CutAxis axis, int band, double fraction) {
        final boolean rows = axis == CutAxis.ROWS;
        final int min = rows ? part.bounds().minX() : part.bounds().minY();
        final int max = rows ? part.bounds().maxX() : part.bounds().maxY();
        final int[] histogram = rows ? part.columnHistogram() : part.rowHistogram();

        final int expected = min + (int) Math.floor(extentAlong(part, axis) * fraction);
        final int from = Math.max(min, expected - SEARCH_RADIUS);
        final int to = Math.min(max, expected + SEARCH_RADIUS);

        int best = -1;
        int bestCount = Integer.MAX_VALUE;
        int bestDistance = Integer.MAX_VALUE;
        for (int position = from; position <= to; position++) {
            final int count = histogram[position - min];
            if (count == 0) {
                continue;
            }
            final int distance = Math.abs(position - expected);
            if (count < bestCount || (count == bestCount && distance < bestDistance)) {
                best = position;
                bestCount = count;
                bestDistance = distance;
            }
        }

        if (best < 0) {
            log.debug("No bridge candidate for {} in window [{}..{}], part stays fused", part, from, to);
            return null;
        }

        int erased = 0;
        for (int i = 0; i < part.size(); i++) {
            if ((rows ? part.x(i) : part.y(i)) == best) {
                raster.clearPixel(part.x(i), part.y(i));
                erased++;
            }
        }
        log.debug("Cut {} at {} {} ({} pixels) in band {}", part, rows ? "column" : "row", best, erased, band);
        return new BridgeCut(axis, band, best, erased, part.bounds());
    }
}
