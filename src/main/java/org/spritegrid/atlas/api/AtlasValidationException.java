package org.spritegrid.atlas.api;

/**
 * Thrown when an atlas cannot be processed because its input is invalid.
 * <p>
 * Validation happens before any pixel is touched, so a caller receiving this exception can rely
 * on neither the input nor any output having been modified or produced.
 */
public class AtlasValidationException extends Exception {

    /**
     * Constructs a new validation exception with the specified detail message.
     *
     * @param message The detail message.
     */
    public AtlasValidationException(String message) {
        super(message);
    }

    /**
     * Constructs a new validation exception with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The cause.
     */
    public AtlasValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
