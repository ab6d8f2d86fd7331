package org.spritegrid.atlas.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Policy controlling which parts are kept and where a cell's content is placed.
 */
public enum AlignmentMode {

    /**
     * Compact icons. Parts touching three or more cells are dropped; content is centred.
     */
    ICON("icon", Placement.CENTER, false, "icons"),

    /**
     * Character poses and faces. Fused neighbours are separated first, only roughly cell-sized,
     * grid-aligned parts are kept, and content stands on the bottom edge of its cell.
     */
    SILHOUETTE("silhouette", Placement.BOTTOM, true, "faces", "center-bottom"),

    /**
     * Background tolerant centring. Only parts spreading over more than five cells are dropped.
     */
    GENERIC("generic", Placement.CENTER, false, "center");

    /**
     * Where a cell's content group is placed inside the cell.
     */
    public enum Placement {
        /** Centred on both axes. */
        CENTER,
        /** Centred horizontally, bottom edge on the cell's bottom edge. */
        BOTTOM
    }

    private final String modeName;
    private final Placement placement;
    private final boolean separatesBridges;
    private final String[] aliases;

    AlignmentMode(String modeName, Placement placement, boolean separatesBridges, String... aliases) {
        this.modeName = modeName;
        this.placement = placement;
        this.separatesBridges = separatesBridges;
        this.aliases = aliases;
    }

    public String modeName() {
        return modeName;
    }

    public Placement placement() {
        return placement;
    }

    /**
     * True when the bridge separator runs before extraction.
     */
    public boolean separatesBridges() {
        return separatesBridges;
    }

    /**
     * Resolves a mode by name or alias, ignoring case and surrounding whitespace.
     *
     * @param name The mode name, e.g. {@code "icon"} or {@code "silhouette"}.
     * @return The matching mode.
     * @throws InvalidAlignmentModeException if the name is {@code null} or not recognised.
     */
    public static AlignmentMode fromName(String name) throws InvalidAlignmentModeException {
        if (name == null) {
            throw new InvalidAlignmentModeException(null);
        }
        final String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (AlignmentMode mode : values()) {
            if (mode.modeName.equals(normalized)) {
                return mode;
            }
            for (String alias : mode.aliases) {
                if (alias.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new InvalidAlignmentModeException(name);
    }

    /**
     * All names and aliases {@link #fromName(String)} accepts.
     */
    public static List<String> acceptedNames() {
        final List<String> names = new ArrayList<>();
        for (AlignmentMode mode : values()) {
            names.add(mode.modeName);
            names.addAll(List.of(mode.aliases));
        }
        return names;
    }

    @Override
    public String toString() {
        return modeName;
    }
}
