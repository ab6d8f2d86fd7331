package org.spritegrid.texture;

import org.spritegrid.atlas.model.Raster;
import org.spritegrid.io.PngRasterCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and rewrites uncompressed STEX textures.
 * <p>
 * Replacing a texture keeps the original's texture flags and feature flags unless told
 * otherwise, but always clears {@link StexFlags#HAS_MIPMAPS}: only the top level is written.
 */
public class StexCodec {

    private static final Logger log = LoggerFactory.getLogger(StexCodec.class);

    private final PngRasterCodec imageCodec;

    public StexCodec() {
        this(new PngRasterCodec());
    }

    public StexCodec(PngRasterCodec imageCodec) {
        this.imageCodec = imageCodec;
    }

    /**
     * Options for {@link #replace}. {@code null} fields fall back to the defaults described on
     * each accessor.
     *
     * @param format       Target format; defaults to {@link StexImageFormat#RGBA8}.
     * @param textureFlags Texture flags; defaults to those of the existing file.
     * @param featureFlags Feature flags; defaults to those of the existing file minus mipmaps.
     * @param outputPath   Destination; defaults to overwriting the existing file.
     */
    public record ReplaceOptions(StexImageFormat format, Integer textureFlags, Integer featureFlags, Path outputPath) {

        public static ReplaceOptions defaults() {
            return new ReplaceOptions(null, null, null, null);
        }

        public ReplaceOptions withFormat(StexImageFormat newFormat) {
            return new ReplaceOptions(newFormat, textureFlags, featureFlags, outputPath);
        }

        public ReplaceOptions withOutputPath(Path newOutputPath) {
            return new ReplaceOptions(format, textureFlags, featureFlags, newOutputPath);
        }

        public ReplaceOptions withTextureFlags(int flags) {
            return new ReplaceOptions(format, flags, featureFlags, outputPath);
        }

        public ReplaceOptions withFeatureFlags(int flags) {
            return new ReplaceOptions(format, textureFlags, flags, outputPath);
        }
    }

    /**
     * Outcome of a replacement.
     */
    public record StexReplacement(
        long originalSize,
        long newSize,
        int originalWidth,
        int originalHeight,
        int newWidth,
        int newHeight,
        StexImageFormat format,
        int bytesPerPixel,
        int pixelDataSize,
        Path outputPath
    ) {
    }

    /**
     * Description of an existing texture file.
     */
    public record StexInfo(long fileSize, StexHeader header, long pixelDataSize, String formatName) {

        public List<String> featureFlagNames() {
            return StexFlags.describeFeatures(header.featureFlags());
        }

        public List<String> textureFlagNames() {
            return StexFlags.describeTexture(header.textureFlags());
        }
    }

    /**
     * Builds a complete texture file (header followed by pixel data).
     */
    public static byte[] encode(Raster raster, StexImageFormat format, int textureFlags, int featureFlags) {
        final StexHeader header = StexHeader.create(raster.getWidth(), raster.getHeight(), format,
            textureFlags, featureFlags);
        final byte[] pixels = StexPixelConverter.convert(raster, format);
        final byte[] file = new byte[StexHeader.SIZE + pixels.length];
        System.arraycopy(header.toBytes(), 0, file, 0, StexHeader.SIZE);
        System.arraycopy(pixels, 0, file, StexHeader.SIZE, pixels.length);
        return file;
    }

    /**
     * Replaces the pixels of an existing texture with an image file.
     *
     * @throws NoSuchFileException if either file is missing.
     */
    public StexReplacement replace(Path stexPath, Path imagePath, ReplaceOptions options)
        throws IOException, StexFormatException {
        if (!Files.exists(imagePath)) {
            throw new NoSuchFileException(imagePath.toString(), null, "Image file not found");
        }
        return replace(stexPath, imageCodec.decode(imagePath), options);
    }

    /**
     * Replaces the pixels of an existing texture with a raster.
     *
     * @throws NoSuchFileException  if the texture is missing.
     * @throws StexFormatException  if the existing file is not a STEX texture or the raster is too
     *                              large for its 16-bit header fields.
     */
    public StexReplacement replace(Path stexPath, Raster raster, ReplaceOptions options)
        throws IOException, StexFormatException {
        if (raster.getWidth() > StexHeader.MAX_DIMENSION || raster.getHeight() > StexHeader.MAX_DIMENSION) {
            throw new StexFormatException(String.format("Image is %dx%d, textures are limited to %dx%d",
                raster.getWidth(), raster.getHeight(), StexHeader.MAX_DIMENSION, StexHeader.MAX_DIMENSION));
        }
        final byte[] existing = readExisting(stexPath);
        final StexHeader existingHeader = StexHeader.parse(existing);

        final StexImageFormat format = options.format() != null ? options.format() : StexImageFormat.RGBA8;
        final int textureFlags = options.textureFlags() != null
            ? options.textureFlags()
            : existingHeader.textureFlags();
        final int featureFlags = options.featureFlags() != null
            ? options.featureFlags()
            : existingHeader.featureFlags() & ~StexFlags.HAS_MIPMAPS;
        final Path outputPath = options.outputPath() != null ? options.outputPath() : stexPath;

        final byte[] replacement = encode(raster, format, textureFlags, featureFlags);
        Files.write(outputPath, replacement);
        log.info("Wrote {} texture {}x{} ({} bytes) to {}",
            format, raster.getWidth(), raster.getHeight(), replacement.length, outputPath);

        return new StexReplacement(
            existing.length,
            replacement.length,
            existingHeader.widthA(),
            existingHeader.heightA(),
            raster.getWidth(),
            raster.getHeight(),
            format,
            format.bytesPerPixel(),
            replacement.length - StexHeader.SIZE,
            outputPath);
    }

    /**
     * Describes an existing texture file.
     *
     * @throws NoSuchFileException if the file is missing.
     * @throws StexFormatException if the file is not a STEX texture.
     */
    public StexInfo info(Path stexPath) throws IOException, StexFormatException {
        final byte[] bytes = readExisting(stexPath);
        final StexHeader header = StexHeader.parse(bytes);
        return new StexInfo(bytes.length, header, bytes.length - StexHeader.SIZE, header.formatName());
    }

    private static byte[] readExisting(Path stexPath) throws IOException {
        if (!Files.exists(stexPath)) {
            throw new NoSuchFileException(stexPath.toString(), null, "STEX file not found");
        }
        return Files.readAllBytes(stexPath);
    }
}
