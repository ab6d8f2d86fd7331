package org.spritegrid.io;

import org.spritegrid.atlas.model.Raster;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Converts between encoded images and {@link Raster}s.
 * <p>
 * Decoding yields RGBA (non-premultiplied) for images with an alpha channel and RGB for images
 * without one. Encoding always writes PNG; rasters with fewer than three channels are written as
 * grey, extra channels beyond RGBA are not representable and are dropped.
 */
public class PngRasterCodec {

    private static final String FORMAT = "png";

    public Raster decode(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return decode(in, path.toString());
        }
    }

    public Raster decode(byte[] encoded) throws IOException {
        return decode(new ByteArrayInputStream(encoded), "<memory>");
    }

    private Raster decode(InputStream in, String source) throws IOException {
        final BufferedImage image = ImageIO.read(in);
        if (image == null) {
            throw new IOException("Unsupported or corrupt image: " + source);
        }
        return fromImage(image);
    }

    /**
     * Copies a {@link BufferedImage} into a raster.
     */
    public static Raster fromImage(BufferedImage image) {
        final int width = image.getWidth();
        final int height = image.getHeight();
        final boolean alpha = image.getColorModel().hasAlpha();
        final int channels = alpha ? 4 : 3;
        final byte[] data = new byte[width * height * channels];
        final int[] row = new int[width];

        int offset = 0;
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                final int argb = row[x];
                data[offset++] = (byte) (argb >> 16);
                data[offset++] = (byte) (argb >> 8);
                data[offset++] = (byte) argb;
                if (alpha) {
                    data[offset++] = (byte) (argb >>> 24);
                }
            }
        }
        return new Raster(width, height, channels, data);
    }

    /**
     * Copies a raster into a new {@link BufferedImage} ({@code TYPE_INT_ARGB} when the raster has
     * alpha, {@code TYPE_INT_RGB} otherwise).
     */
    public static BufferedImage toImage(Raster raster) {
        final int width = raster.getWidth();
        final int height = raster.getHeight();
        final int channels = raster.getChannels();
        final boolean alpha = raster.hasAlpha();
        final BufferedImage image = new BufferedImage(width, height,
            alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
        final byte[] data = raster.getData();
        final int[] row = new int[width];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                final int o = raster.offsetOf(x, y);
                final int r = data[o] & 0xFF;
                final int g = channels > 1 ? data[o + 1] & 0xFF : r;
                final int b = channels > 2 ? data[o + 2] & 0xFF : r;
                final int a = alpha ? data[o + Raster.ALPHA_CHANNEL] & 0xFF : 0xFF;
                row[x] = (a << 24) | (r << 16) | (g << 8) | b;
            }
            image.setRGB(0, y, width, 1, row, 0, width);
        }
        return image;
    }

    public byte[] encode(Raster raster) throws IOException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(raster, out);
        return out.toByteArray();
    }

    public void write(Raster raster, Path path) throws IOException {
        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            write(raster, out);
        }
    }

    private void write(Raster raster, OutputStream out) throws IOException {
        if (!ImageIO.write(toImage(raster), FORMAT, out)) {
            throw new IOException("No PNG writer available");
        }
    }
}
