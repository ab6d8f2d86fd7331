package org.spritegrid.texture;

import org.spritegrid.atlas.model.Raster;

/**
 * Converts an RGBA raster into the pixel layout of a {@link StexImageFormat}.
 * <p>
 * Luminance uses integer Rec.709 weights. The 16-bit packed formats are written little-endian
 * with the first named component in the most significant bits.
 */
public final class StexPixelConverter {

    private StexPixelConverter() {
    }

    /**
     * @param raster RGB or RGBA raster; RGB is treated as fully opaque.
     * @param format Target format.
     * @return Pixel data of length {@code width * height * format.bytesPerPixel()}.
     */
    public static byte[] convert(Raster raster, StexImageFormat format) {
        final Raster rgba = raster.ensureAlpha();
        final byte[] src = rgba.getData();
        final int pixels = rgba.getWidth() * rgba.getHeight();
        final int stride = rgba.getChannels();
        final byte[] out = new byte[pixels * format.bytesPerPixel()];

        int o = 0;
        for (int i = 0; i < pixels; i++) {
            final int s = i * stride;
            final int r = src[s] & 0xFF;
            final int g = src[s + 1] & 0xFF;
            final int b = src[s + 2] & 0xFF;
            final int a = src[s + 3] & 0xFF;

            switch (format) {
                case L8 -> out[o++] = (byte) luminance(r, g, b);
                case LA8 -> {
                    out[o++] = (byte) luminance(r, g, b);
                    out[o++] = (byte) a;
                }
                case R8 -> out[o++] = (byte) r;
                case RG8 -> {
                    out[o++] = (byte) r;
                    out[o++] = (byte) g;
                }
                case RGB8 -> {
                    out[o++] = (byte) r;
                    out[o++] = (byte) g;
                    out[o++] = (byte) b;
                }
                case RGBA8 -> {
                    out[o++] = (byte) r;
                    out[o++] = (byte) g;
                    out[o++] = (byte) b;
                    out[o++] = (byte) a;
                }
                case RGB565 -> o = putShort(out, o, (r >> 3) << 11 | (g >> 2) << 5 | (b >> 3));
                case RGBA4444 -> o = putShort(out, o, (r >> 4) << 12 | (g >> 4) << 8 | (b >> 4) << 4 | (a >> 4));
                case RGBA5551 -> o = putShort(out, o, (r >> 3) << 11 | (g >> 3) << 6 | (b >> 3) << 1 | (a >> 7));
            }
        }
        return out;
    }

    static int luminance(int r, int g, int b) {
        return (2126 * r + 7152 * g + 722 * b + 5000) / 10000;
    }

    private static int putShort(byte[] out, int offset, int value) {
        out[offset] = (byte) value;
        out[offset + 1] = (byte) (value >> 8);
        return offset + 2;
    }
}
