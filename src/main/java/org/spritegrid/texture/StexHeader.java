package org.spritegrid.texture;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * The fixed 20 byte header of an uncompressed STEX texture.
 * <p>
 * Layout, all little-endian:
 * <pre>
 *  0  magic "GDST"
 *  4  u16 widthA     6  u16 widthB (0 when uncompressed)
 *  8  u16 heightA   10  u16 heightB (0 when uncompressed)
 * 12  u32 texture flags
 * 16  u32 format = image format id | feature flags
 * </pre>
 */
public record StexHeader(int widthA, int widthB, int heightA, int heightB, int textureFlags, int format) {

    public static final String MAGIC = "GDST";
    public static final int SIZE = 20;

    public static final int MAX_DIMENSION = 0xFFFF;

    /**
     * Creates the header of an uncompressed texture.
     *
     * @throws IllegalArgumentException if a dimension does not fit into 16 bits.
     */
    public static StexHeader create(int width, int height, StexImageFormat imageFormat, int textureFlags,
                                    int featureFlags) {
        if (width <= 0 || width > MAX_DIMENSION || height <= 0 || height > MAX_DIMENSION) {
            throw new IllegalArgumentException("Texture dimensions out of range: " + width + "x" + height);
        }
        return new StexHeader(width, 0, height, 0, textureFlags,
            imageFormat.id() | (featureFlags & StexFlags.FEATURE_MASK));
    }

    /**
     * Reads the header at the start of {@code bytes}.
     *
     * @throws StexFormatException if there are fewer than 20 bytes or the magic does not match.
     */
    public static StexHeader parse(byte[] bytes) throws StexFormatException {
        if (bytes.length < SIZE) {
            throw new StexFormatException("Invalid STEX file: too small (" + bytes.length + " bytes)");
        }
        final String magic = new String(bytes, 0, 4, StandardCharsets.US_ASCII);
        if (!MAGIC.equals(magic)) {
            throw new StexFormatException("Invalid STEX magic: expected '" + MAGIC + "', got '" + magic + "'");
        }
        final ByteBuffer buffer = ByteBuffer.wrap(bytes, 0, SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buffer.position(4);
        return new StexHeader(
            Short.toUnsignedInt(buffer.getShort()),
            Short.toUnsignedInt(buffer.getShort()),
            Short.toUnsignedInt(buffer.getShort()),
            Short.toUnsignedInt(buffer.getShort()),
            buffer.getInt(),
            buffer.getInt());
    }

    public byte[] toBytes() {
        final ByteBuffer buffer = ByteBuffer.allocate(SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(MAGIC.getBytes(StandardCharsets.US_ASCII));
        buffer.putShort((short) widthA);
        buffer.putShort((short) widthB);
        buffer.putShort((short) heightA);
        buffer.putShort((short) heightB);
        buffer.putInt(textureFlags);
        buffer.putInt(format);
        return buffer.array();
    }

    public int imageFormatId() {
        return format & StexFlags.IMAGE_FORMAT_MASK;
    }

    public int featureFlags() {
        return format & StexFlags.FEATURE_MASK;
    }

    public boolean hasMipmaps() {
        return (featureFlags() & StexFlags.HAS_MIPMAPS) != 0;
    }

    public int bytesPerPixel() {
        return StexImageFormat.bytesPerPixelOf(imageFormatId());
    }

    /**
     * Size of the top mip level's pixel data, {@code widthA * heightA * bytesPerPixel}.
     */
    public long expectedPixelDataSize() {
        return (long) widthA * heightA * bytesPerPixel();
    }

    /**
     * Format name, or {@code UNKNOWN} for ids outside {@link StexImageFormat}.
     */
    public String formatName() {
        return StexImageFormat.fromId(imageFormatId()).map(Enum::name).orElse("UNKNOWN");
    }
}
