package com.calypso.core.build;

public class NoCompletedBuildException extends RuntimeException {

    public NoCompletedBuildException(String projectId) {
        super("No completed build found for project " + projectId);
    }
}
