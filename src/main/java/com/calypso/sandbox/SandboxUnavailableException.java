package com.calypso.sandbox;

/**
 * Thrown when a sandbox cannot execute commands at all, as opposed to a command failing.
 */
public class SandboxUnavailableException extends RuntimeException {

    public SandboxUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
