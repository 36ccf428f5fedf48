package com.calypso.dispatch.api;

import com.calypso.core.build.NoCompletedBuildException;
import com.calypso.deploy.DeploymentProviderException;
import com.calypso.deploy.DeploymentUnavailableException;
import com.calypso.deploy.InvalidSlugException;
import com.calypso.deploy.NotPublishedException;
import com.calypso.deploy.SlugConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Maps publish and preview failures to {@code {"error": …}} responses.
 */
final class DeployErrors {

    private static final Logger log = LoggerFactory.getLogger(DeployErrors.class);

    private DeployErrors() {}

    static ResponseEntity<Map<String, String>> toResponse(RuntimeException e) {
        HttpStatus status;
        String message;
        if (e instanceof NoCompletedBuildException) {
            status = HttpStatus.NOT_FOUND;
            message = "No completed build found. Build your project first.";
        } else if (e instanceof NotPublishedException) {
            status = HttpStatus.NOT_FOUND;
            message = "Not published";
        } else if (e instanceof InvalidSlugException) {
            status = HttpStatus.BAD_REQUEST;
            message = e.getMessage();
        } else if (e instanceof SlugConflictException) {
            status = HttpStatus.CONFLICT;
            message = e.getMessage();
        } else if (e instanceof DeploymentUnavailableException) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
            message = e.getMessage();
        } else if (e instanceof DeploymentProviderException provider) {
            status = HttpStatus.BAD_GATEWAY;
            message = provider.clientMessage();
        } else {
            log.error("Unexpected deployment failure", e);
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            message = "Something went wrong. Please try again.";
        }
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
