package org.spritegrid.atlas.api;

/**
 * The raster is not 1024x1024 or has no alpha channel.
 */
public class InvalidRasterShapeException extends AtlasValidationException {

    private final int width;
    private final int height;
    private final int channels;

    public InvalidRasterShapeException(String message, int width, int height, int channels) {
        super(message);
        this.width = width;
        this.height = height;
        this.channels = channels;
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
}
