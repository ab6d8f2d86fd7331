package org.spritegrid.texture;

/**
 * Thrown when a file is not a readable uncompressed STEX texture.
 */
public class StexFormatException extends Exception {

    public StexFormatException(String message) {
        super(message);
    }

    public StexFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
