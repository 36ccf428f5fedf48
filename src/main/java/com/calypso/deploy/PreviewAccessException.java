package com.calypso.deploy;

/**
 * A preview status request without a valid token.
 */
public class PreviewAccessException extends RuntimeException {

    private final boolean missing;

    private PreviewAccessException(String message, boolean missing) {
        super(message);
        this.missing = missing;
    }

    public static PreviewAccessException missingToken() {
        return new PreviewAccessException("Missing token", true);
    }

    public static PreviewAccessException invalidToken() {
        return new PreviewAccessException("Invalid token", false);
    }

    /** {@code true} when no token was sent at all, {@code false} when it did not match. */
    public boolean isMissing() {
        return missing;
    }
}
