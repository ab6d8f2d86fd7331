package org.spritegrid.atlas.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * An interleaved, row-major 8-bit raster.
 * <p>
 * Channel order is R, G, B[, A, ...]. A raster with four or more channels treats channel
 * index 3 as alpha. The backing buffer is owned by the raster; {@link #copy()} is the only
 * supported way to obtain an independent instance.
 */
public final class Raster {

    /** Channel index of the alpha component. */
    public static final int ALPHA_CHANNEL = 3;

    private final int width;
    private final int height;
    private final int channels;
    private final byte[] data;

    /**
     * Wraps an existing pixel buffer without copying it.
     *
     * @param width    Raster width in pixels.
     * @param height   Raster height in pixels.
     * @param channels Bytes per pixel.
     * @param data     Row-major interleaved pixel data of length {@code width * height * channels}.
     */
    public Raster(int width, int height, int channels, byte[] data) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster dimensions must be positive, got " + width + "x" + height);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("Channel count must be positive, got " + channels);
        }
        Objects.requireNonNull(data, "data");
        if ((long) width * height * channels != data.length) {
            throw new IllegalArgumentException(String.format(
                "Buffer length %d does not match %dx%d with %d channels", data.length, width, height, channels));
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data;
    }

    /**
     * Creates a fully transparent (all bytes zero) raster.
     */
    public static Raster blank(int width, int height, int channels) {
        return new Raster(width, height, channels, new byte[width * height * channels]);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    public boolean hasAlpha() {
        return channels > ALPHA_CHANNEL;
    }

    /**
     * Returns the backing buffer. Mutations are visible to this raster.
     */
    public byte[] getData() {
        return data;
    }

    /**
     * Byte offset of the first channel of pixel (x, y).
     */
    public int offsetOf(int x, int y) {
        return (y * width + x) * channels;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * Unsigned value of one channel of pixel (x, y).
     */
    public int sample(int x, int y, int channel) {
        return data[offsetOf(x, y) + channel] & 0xFF;
    }

    /**
     * Alpha of pixel (x, y), or 255 for rasters without an alpha channel.
     */
    public int alpha(int x, int y) {
        return hasAlpha() ? data[offsetOf(x, y) + ALPHA_CHANNEL] & 0xFF : 0xFF;
    }

    /**
     * Writes all channels of pixel (x, y). Missing trailing values are left untouched.
     */
    public void setPixel(int x, int y, int... values) {
        final int offset = offsetOf(x, y);
        final int n = Math.min(values.length, channels);
        for (int c = 0; c < n; c++) {
            data[offset + c] = (byte) values[c];
        }
    }

    /**
     * Sets every channel of pixel (x, y) to zero.
     */
    public void clearPixel(int x, int y) {
        final int offset = offsetOf(x, y);
        Arrays.fill(data, offset, offset + channels, (byte) 0);
    }

    /**
     * Copies all channels of a pixel from {@code source} into this raster.
     * Both rasters must have the same channel count.
     */
    public void copyPixelFrom(Raster source, int sourceX, int sourceY, int targetX, int targetY) {
        System.arraycopy(source.data, source.offsetOf(sourceX, sourceY), data, offsetOf(targetX, targetY), channels);
    }

    public Raster copy() {
        return new Raster(width, height, channels, data.clone());
    }

    /**
     * Returns this raster if it already carries alpha, otherwise an RGBA copy with every pixel opaque.
     */
    public Raster ensureAlpha() {
        if (hasAlpha()) {
            return this;
        }
        final byte[] rgba = new byte[width * height * 4];
        final int pixels = width * height;
        for (int i = 0; i < pixels; i++) {
            final int src = i * channels;
            final int dst = i * 4;
            for (int c = 0; c < 3; c++) {
                // Grey images are widened to RGB.
                rgba[dst + c] = data[src + Math.min(c, channels - 1)];
            }
            rgba[dst + 3] = (byte) 0xFF;
        }
        return new Raster(width, height, 4, rgba);
    }

    /**
     * Counts pixels whose alpha exceeds {@code threshold}.
     */
    public int countOpaque(int threshold) {
        int count = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (alpha(x, y) > threshold) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Bounding box of all pixels with alpha above {@code threshold} inside the given
     * half-open rectangle, or {@code null} when there are none.
     */
    public PixelBounds opaqueBounds(int startX, int startY, int endX, int endY, int threshold) {
        PixelBounds bounds = null;
        for (int y = Math.max(0, startY); y < Math.min(height, endY); y++) {
            for (int x = Math.max(0, startX); x < Math.min(width, endX); x++) {
                if (alpha(x, y) > threshold) {
                    bounds = bounds == null ? PixelBounds.of(x, y) : bounds.include(x, y);
                }
            }
        }
        return bounds;
    }

    public boolean contentEquals(Raster other) {
        return other != null
            && width == other.width
            && height == other.height
            && channels == other.channels
            && Arrays.equals(data, other.data);
    }

    @Override
    public String toString() {
        return "Raster{" + width + "x" + height + ", channels=" + channels + "}";
    }
}
