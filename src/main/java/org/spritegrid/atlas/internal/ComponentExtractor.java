package org.spritegrid.atlas.internal;

import org.spritegrid.atlas.model.Part;
import org.spritegrid.atlas.model.PixelBounds;
import org.spritegrid.atlas.model.Raster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits the opaque area of a raster into 4-connected parts.
 * <p>
 * Pixels count as opaque when their alpha exceeds {@link #ALPHA_THRESHOLD}, which keeps faint
 * anti-aliasing fringes out of the parts. Parts of {@value #MAX_NOISE_PIXELS} pixels or fewer are
 * dropped as rendering noise.
 * <p>
 * The fill uses an explicit stack: a fully opaque 1024x1024 raster is a single part of a
 * million pixels, far beyond what recursion could handle. Seeds are taken in row-major order and
 * neighbours are pushed as right, left, down, up, so parts, member order and bounding boxes are
 * identical for identical input.
 */
public final class ComponentExtractor {

    /** Alpha values at or below this are transparent. */
    public static final int ALPHA_THRESHOLD = 10;

    /** Parts with this many pixels or fewer are noise. */
    public static final int MAX_NOISE_PIXELS = 3;

    private ComponentExtractor() {
    }

    /**
     * Extracts all parts of the raster.
     *
     * @param raster A raster with an alpha channel.
     * @return Parts in discovery order; empty when nothing is opaque.
     */
    public static List<Part> extract(Raster raster) {
        final int width = raster.getWidth();
        final int height = raster.getHeight();
        final boolean[] visited = new boolean[width * height];
        final IntStack stack = new IntStack(1024);
        final IntStack members = new IntStack(1024);
        final List<Part> parts = new ArrayList<>();
        int discovered = 0;

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final int seed = y * width + x;
                if (visited[seed] || !isOpaque(raster, x, y)) {
                    continue;
                }

                members.clear();
                stack.clear();
                stack.push(seed);
                int minX = x, maxX = x, minY = y, maxY = y;

                while (!stack.isEmpty()) {
                    final int p = stack.pop();
                    if (visited[p]) {
                        continue;
                    }
                    final int px = p % width;
                    final int py = p / width;
                    if (!isOpaque(raster, px, py)) {
                        continue;
                    }

                    visited[p] = true;
                    members.push(p);
                    if (px < minX) minX = px;
                    if (px > maxX) maxX = px;
                    if (py < minY) minY = py;
                    if (py > maxY) maxY = py;

                    if (px + 1 < width) stack.push(p + 1);
                    if (px > 0) stack.push(p - 1);
                    if (py + 1 < height) stack.push(p + width);
                    if (py > 0) stack.push(p - width);
                }

                if (members.size() > MAX_NOISE_PIXELS) {
                    final int n = members.size();
                    final int[] xs = new int[n];
                    final int[] ys = new int[n];
                    for (int i = 0; i < n; i++) {
                        final int p = members.get(i);
                        xs[i] = p % width;
                        ys[i] = p / width;
                    }
                    parts.add(new Part(discovered++, xs, ys, new PixelBounds(minX, maxX, minY, maxY)));
                }
            }
        }
        return parts;
    }

    public static boolean isOpaque(Raster raster, int x, int y) {
        return raster.alpha(x, y) > ALPHA_THRESHOLD;
    }

    /**
     * Growable stack of packed pixel indices.
     */
    static final class IntStack {
        private int[] elements;
        private int size;

        IntStack(int initialCapacity) {
            this.elements = new int[initialCapacity];
        }

        void push(int value) {
            if (size == elements.length) {
                elements = Arrays.copyOf(elements, elements.length * 2);
            }
            elements[size++] = value;
        }

        int pop() {
            return elements[--size];
        }

        int get(int i) {
            return elements[i];
        }

        int size() {
            return size;
        }

        boolean isEmpty() {
            return size == 0;
        }

        void clear() {
            size = 0;
        }
    }
}
