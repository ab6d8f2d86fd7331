package org.spritegrid.texture;

import java.util.Optional;

/**
 * Pixel formats of uncompressed STEX textures. Ids match the engine's image format enumeration.
 */
public enum StexImageFormat {
    L8(0x00, 1),
    LA8(0x01, 2),
    R8(0x02, 1),
    RG8(0x03, 2),
    RGB8(0x04, 3),
    RGBA8(0x05, 4),
    RGB565(0x06, 2),
    RGBA4444(0x07, 2),
    RGBA5551(0x08, 2);

    /** Bytes per pixel assumed for ids this enumeration does not know. */
    public static final int UNKNOWN_BYTES_PER_PIXEL = 4;

    private final int id;
    private final int bytesPerPixel;

    StexImageFormat(int id, int bytesPerPixel) {
        this.id = id;
        this.bytesPerPixel = bytesPerPixel;
    }

    public int id() {
        return id;
    }

    public int bytesPerPixel() {
        return bytesPerPixel;
    }

    public static Optional<StexImageFormat> fromId(int id) {
        for (StexImageFormat format : values()) {
            if (format.id == id) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    public static int bytesPerPixelOf(int id) {
        return fromId(id).map(StexImageFormat::bytesPerPixel).orElse(UNKNOWN_BYTES_PER_PIXEL);
    }
}
