package com.calypso.core.build;

/**
 * Thrown when a build is requested for a project that already has one running.
 */
public class BuildInProgressException extends RuntimeException {

    private final String activeBuildId;

    public BuildInProgressException(String projectId, String activeBuildId) {
        super("Project " + projectId + " already has build " + activeBuildId + " running");
        this.activeBuildId = activeBuildId;
    }

    public String getActiveBuildId() {
        return activeBuildId;
    }
}
