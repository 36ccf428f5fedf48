package com.calypso.core.model;

import java.time.Instant;

/**
 * Live (or soft-deleted) publication of a project. At most one row per project;
 * republishing updates the row so the slug and hosting project stay stable.
 */
public record PublishedSite(
    String id,
    String projectId,
    String slug,
    String hostingProjectId,
    String deploymentId,
    String url,
    String buildOutputId,
    SiteStatus status,
    Instant publishedAt
) {

    public boolean isLive() {
        return status == SiteStatus.READY;
    }

    /**
     * A site is stale when a newer complete build exists than the one it serves.
     *
     * @param latestCompleteBuildId id of the project's latest complete build, may be null
     */
    public boolean isStale(String latestCompleteBuildId) {
        return latestCompleteBuildId != null && !latestCompleteBuildId.equals(buildOutputId);
    }

    public PublishedSite withStatus(SiteStatus newStatus) {
        return new PublishedSite(id, projectId, slug, hostingProjectId, deploymentId, url,
                buildOutputId, newStatus, publishedAt);
    }
}
