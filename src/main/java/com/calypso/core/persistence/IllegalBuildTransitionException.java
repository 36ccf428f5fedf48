package com.calypso.core.persistence;

import com.calypso.core.model.BuildStatus;

/**
 * Thrown when a write would move a build output through a forbidden status transition.
 */
public class IllegalBuildTransitionException extends RuntimeException {

    public IllegalBuildTransitionException(String buildId, BuildStatus from, BuildStatus to) {
        super("Build " + buildId + " cannot move from " + from + " to " + to);
    }

    public IllegalBuildTransitionException(String message) {
        super(message);
    }
}
