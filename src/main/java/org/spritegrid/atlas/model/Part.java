package org.spritegrid.atlas.model;

import java.util.Arrays;

/**
 * A maximal 4-connected region of opaque pixels found by flood fill.
 * <p>
 * Member coordinates are kept in flood-fill visitation order. Parts carry no identity beyond
 * their discovery index within a single extraction and are recomputed on every run.
 */
public final class Part {

    private final int index;
    private final int[] xs;
    private final int[] ys;
    private final PixelBounds bounds;

    /**
     * @param index  Discovery index within the extraction that produced this part.
     * @param xs     Member x coordinates; must have the same length as {@code ys}.
     * @param ys     Member y coordinates.
     * @param bounds Bounding box of all members.
     */
    public Part(int index, int[] xs, int[] ys, PixelBounds bounds) {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("Coordinate arrays differ in length: " + xs.length + " vs " + ys.length);
        }
        if (xs.length == 0) {
            throw new IllegalArgumentException("A part needs at least one pixel");
        }
        this.index = index;
        this.xs = xs;
        this.ys = ys;
        this.bounds = bounds;
    }

    public int index() {
        return index;
    }

    public int size() {
        return xs.length;
    }

    public int x(int i) {
        return xs[i];
    }

    public int y(int i) {
        return ys[i];
    }

    public PixelBounds bounds() {
        return bounds;
    }

    /**
     * Histogram of member pixels per x coordinate, indexed from {@code bounds().minX()}.
     */
    public int[] columnHistogram() {
        final int[] histogram = new int[bounds.width()];
        for (int x : xs) {
            histogram[x - bounds.minX()]++;
        }
        return histogram;
    }

    /**
     * Histogram of member pixels per y coordinate, indexed from {@code bounds().minY()}.
     */
    public int[] rowHistogram() {
        final int[] histogram = new int[bounds.height()];
        for (int y : ys) {
            histogram[y - bounds.minY()]++;
        }
        return histogram;
    }

    @Override
    public String toString() {
        return "Part{#" + index + ", pixels=" + xs.length + ", bounds=" + bounds + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Part other)) return false;
        return index == other.index && Arrays.equals(xs, other.xs) && Arrays.equals(ys, other.ys);
    }

    @Override
    public int hashCode() {
        return 31 * index + Arrays.hashCode(xs);
    }
}
