package com.calypso.deploy;

public class DeploymentUnavailableException extends RuntimeException {

    public DeploymentUnavailableException(String message) {
        super(message);
    }
}
