package com.calypso.deploy;

public class NotPublishedException extends RuntimeException {

    public NotPublishedException(String projectId) {
        super("Project " + projectId + " is not published");
    }
}
