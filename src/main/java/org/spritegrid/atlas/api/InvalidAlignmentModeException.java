package org.spritegrid.atlas.api;

/**
 * The requested alignment mode name is not one of the recognised modes.
 */
public class InvalidAlignmentModeException extends AtlasValidationException {

    private final String requestedMode;

    public InvalidAlignmentModeException(String requestedMode) {
        super(String.format("Unknown alignment mode '%s'; expected one of %s",
            requestedMode, AlignmentMode.acceptedNames()));
        this.requestedMode = requestedMode;
    }

    public String getRequestedMode() {
        return requestedMode;
    }
}
