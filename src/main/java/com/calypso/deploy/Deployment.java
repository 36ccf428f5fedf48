package com.calypso.deploy;

/**
 * Deployment as reported by the hosting provider.
 *
 * @param readyState provider state, e.g. {@code QUEUED}, {@code BUILDING}, {@code READY}, {@code ERROR}
 */
public record Deployment(String id, String projectId, String url, String readyState) {}
