package com.calypso.core.persistence;

public class BuildNotFoundException extends RuntimeException {

    public BuildNotFoundException(String buildId) {
        super("Build not found: " + buildId);
    }
}
