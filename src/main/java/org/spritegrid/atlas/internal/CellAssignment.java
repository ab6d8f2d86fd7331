package org.spritegrid.atlas.internal;

import org.spritegrid.atlas.model.GridLayout;
import org.spritegrid.atlas.model.Part;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of ownership resolution: the approved parts of every cell plus the rejected parts.
 */
public final class CellAssignment {

    /**
     * Why a part was left out of every cell.
     */
    public enum Rejection {
        /** Touches too many cells for the mode. */
        SPAN,
        /** Bounding box outside the accepted silhouette size range. */
        SIZE,
        /** Bounding box edge too far from the grid lines. */
        ALIGNMENT
    }

    private final List<List<Part>> approved;
    private final Map<Rejection, List<Part>> rejected = new EnumMap<>(Rejection.class);

    CellAssignment() {
        this.approved = new ArrayList<>(GridLayout.CELL_COUNT);
        for (int i = 0; i < GridLayout.CELL_COUNT; i++) {
            approved.add(new ArrayList<>());
        }
        for (Rejection reason : Rejection.values()) {
            rejected.put(reason, new ArrayList<>());
        }
    }

    void approve(int cellIndex, Part part) {
        approved.get(cellIndex).add(part);
    }

    void reject(Rejection reason, Part part) {
        rejected.get(reason).add(part);
    }

    /**
     * Approved parts of a cell in discovery order, possibly empty.
     */
    public List<Part> partsOf(int cellIndex) {
        return Collections.unmodifiableList(approved.get(cellIndex));
    }

    public List<Part> rejected(Rejection reason) {
        return Collections.unmodifiableList(rejected.get(reason));
    }

    public int approvedCount() {
        int count = 0;
        for (List<Part> parts : approved) {
            count += parts.size();
        }
        return count;
    }

    public int rejectedCount() {
        int count = 0;
        for (List<Part> parts : rejected.values()) {
            count += parts.size();
        }
        return count;
    }
}
