package org.spritegrid.atlas.api;

import org.spritegrid.atlas.model.Raster;

/**
 * Output raster of an atlas run together with its report.
 */
public record AtlasResult(Raster raster, AtlasReport report) {
}
