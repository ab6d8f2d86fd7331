package org.spritegrid.atlas;

import org.spritegrid.atlas.api.AlignmentMode;
import org.spritegrid.atlas.api.AtlasReport;
import org.spritegrid.atlas.api.AtlasResult;
import org.spritegrid.atlas.api.AtlasValidationException;
import org.spritegrid.atlas.api.InvalidAlignmentModeException;
import org.spritegrid.atlas.api.InvalidRasterShapeException;
import org.spritegrid.atlas.internal.BridgeCut;
import org.spritegrid.atlas.internal.BridgeSeparator;
import org.spritegrid.atlas.internal.CellAssignment;
import org.spritegrid.atlas.internal.CellAssignment.Rejection;
import org.spritegrid.atlas.internal.CellOwnershipResolver;
import org.spritegrid.atlas.internal.ComponentExtractor;
import org.spritegrid.atlas.internal.PlacementCompositor;
import org.spritegrid.atlas.model.GridLayout;
import org.spritegrid.atlas.model.Part;
import org.spritegrid.atlas.model.Raster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Post-processes a generated 3x3 atlas so that every cell holds exactly its own content,
 * re-placed inside the cell.
 * <p>
 * Pipeline: validate, copy the input, optionally sever bridges between fused silhouettes,
 * extract parts, resolve cell ownership, compose the output. The input raster is never modified
 * and no state survives a call, so one instance may serve concurrent callers as long as each
 * passes its own raster.
 * <p>
 * A cell without approved content, a fusion that could not be severed and pixels moved outside
 * the raster are normal outcomes, not errors.
 */
public class AtlasProcessor {

    private static final Logger log = LoggerFactory.getLogger(AtlasProcessor.class);

    /** Required width and height of an atlas. */
    public static final int ATLAS_SIZE = 1024;

    /** Minimum channel count (RGBA). */
    public static final int MIN_CHANNELS = 4;

    private final BridgeSeparator bridgeSeparator;
    private final CellOwnershipResolver ownershipResolver;
    private final PlacementCompositor compositor;

    public AtlasProcessor() {
        this(new BridgeSeparator(), new CellOwnershipResolver(), new PlacementCompositor());
    }

    AtlasProcessor(BridgeSeparator bridgeSeparator, CellOwnershipResolver ownershipResolver,
                   PlacementCompositor compositor) {
        this.bridgeSeparator = bridgeSeparator;
        this.ownershipResolver = ownershipResolver;
        this.compositor = compositor;
    }

    /**
     * Processes an atlas.
     *
     * @param raster A 1024x1024 raster with at least four channels.
     * @param mode   Alignment mode.
     * @return A new raster of the same dimensions and channel count.
     * @throws InvalidRasterShapeException if the raster has the wrong size or no alpha channel.
     */
    public Raster processAtlas(Raster raster, AlignmentMode mode) throws AtlasValidationException {
        return processAtlasWithReport(raster, mode).raster();
    }

    /**
     * Processes an atlas, resolving the mode by name.
     *
     * @throws InvalidAlignmentModeException if the mode name is not recognised.
     * @throws InvalidRasterShapeException   if the raster has the wrong size or no alpha channel.
     * @see AlignmentMode#fromName(String)
     */
    public Raster processAtlas(Raster raster, String modeName) throws AtlasValidationException {
        final AlignmentMode mode = AlignmentMode.fromName(modeName);
        return processAtlas(raster, mode);
    }

    /**
     * Processes an atlas and reports what happened to its parts.
     *
     * @param raster A 1024x1024 raster with at least four channels.
     * @param mode   Alignment mode.
     * @return Output raster and report.
     * @throws InvalidRasterShapeException if the raster has the wrong size or no alpha channel.
     */
    public AtlasResult processAtlasWithReport(Raster raster, AlignmentMode mode) throws AtlasValidationException {
        if (mode == null) {
            throw new InvalidAlignmentModeException(null);
        }
        validate(raster);

        final GridLayout grid = GridLayout.of(raster);
        final Raster working = raster.copy();

        List<BridgeCut> cuts = List.of();
        if (mode.separatesBridges()) {
            cuts = bridgeSeparator.separate(working, grid);
        }

        final List<Part> parts = ComponentExtractor.extract(working);
        log.debug("Extracted {} part(s) in {} mode", parts.size(), mode);

        final CellAssignment assignment = ownershipResolver.resolve(parts, grid, mode);
        final Raster output = compositor.compose(working, grid, assignment, mode.placement());

        return new AtlasResult(output, buildReport(mode, parts, assignment, cuts));
    }

    /**
     * Checks the input shape.
     *
     * @throws InvalidRasterShapeException if the raster is not 1024x1024 or has fewer than four channels.
     */
    public static void validate(Raster raster) throws InvalidRasterShapeException {
        if (raster == null) {
            throw new InvalidRasterShapeException("Input raster is missing", 0, 0, 0);
        }
        if (raster.getWidth() != ATLAS_SIZE || raster.getHeight() != ATLAS_SIZE) {
            throw new InvalidRasterShapeException(
                String.format("Input image must be %dx%d pixels, got %dx%d",
                    ATLAS_SIZE, ATLAS_SIZE, raster.getWidth(), raster.getHeight()),
                raster.getWidth(), raster.getHeight(), raster.getChannels());
        }
        if (raster.getChannels() < MIN_CHANNELS) {
            throw new InvalidRasterShapeException(
                String.format("Input image must have an alpha channel, got %d channel(s)", raster.getChannels()),
                raster.getWidth(), raster.getHeight(), raster.getChannels());
        }
    }

    private static AtlasReport buildReport(AlignmentMode mode, List<Part> parts, CellAssignment assignment,
                                           List<BridgeCut> cuts) {
        final List<Integer> perCell = new ArrayList<>(GridLayout.CELL_COUNT);
        for (int i = 0; i < GridLayout.CELL_COUNT; i++) {
            perCell.add(assignment.partsOf(i).size());
        }
        int erased = 0;
        for (BridgeCut cut : cuts) {
            erased += cut.erasedPixels();
        }
        return new AtlasReport(
            mode,
            parts.size(),
            perCell,
            assignment.rejected(Rejection.SPAN).size(),
            assignment.rejected(Rejection.SIZE).size(),
            assignment.rejected(Rejection.ALIGNMENT).size(),
            cuts.size(),
            erased);
    }
}
