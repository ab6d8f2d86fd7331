package org.spritegrid.atlas.model;

/**
 * Inclusive axis-aligned pixel rectangle.
 */
public record PixelBounds(int minX, int maxX, int minY, int maxY) {

    public PixelBounds {
        if (maxX < minX || maxY < minY) {
            throw new IllegalArgumentException(
                String.format("Empty bounds [%d..%d]x[%d..%d]", minX, maxX, minY, maxY));
        }
    }

    public static PixelBounds of(int x, int y) {
        return new PixelBounds(x, x, y, y);
    }

    public int width() {
        return maxX - minX + 1;
    }

    public int height() {
        return maxY - minY + 1;
    }

    public PixelBounds include(int x, int y) {
        if (x >= minX && x <= maxX && y >= minY && y <= maxY) {
            return this;
        }
        return new PixelBounds(Math.min(minX, x), Math.max(maxX, x), Math.min(minY, y), Math.max(maxY, y));
    }

    public PixelBounds union(PixelBounds other) {
        return new PixelBounds(
            Math.min(minX, other.minX),
            Math.max(maxX, other.maxX),
            Math.min(minY, other.minY),
            Math.max(maxY, other.maxY));
    }
}
