package com.calypso.deploy;

/**
 * The hosting provider rejected a request. Authentication failures are flagged
 * so callers can report a configuration problem instead of the raw provider text.
 */
public class DeploymentProviderException extends RuntimeException {

    static final String MISCONFIGURED = "Publishing service is misconfigured";

    private final int statusCode;
    private final boolean authFailure;

    public DeploymentProviderException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
        this.authFailure = statusCode == 401 || statusCode == 403;
    }

    public DeploymentProviderException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.authFailure = false;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isAuthFailure() {
        return authFailure;
    }

    /** Message safe to return to a client. */
    public String clientMessage() {
        return authFailure ? MISCONFIGURED : getMessage();
    }
}
