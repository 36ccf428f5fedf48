package com.calypso.deploy;

import com.calypso.core.build.NoCompletedBuildException;
import com.calypso.core.logging.MdcContext;
import com.calypso.core.metrics.CalypsoMetrics;
import com.calypso.core.model.BuildConfiguration;
import com.calypso.core.model.BuildOutput;
import com.calypso.core.model.Framework;
import com.calypso.core.model.PublishedSite;
import com.calypso.core.model.SiteStatus;
import com.calypso.core.persistence.BuildOutputStore;
import com.calypso.core.persistence.DuplicateSlugException;
import com.calypso.core.persistence.PublishedSiteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Publishes a project's latest complete build to {@code <slug>.<publish-domain>}.
 * <p>
 * A project owns at most one {@link PublishedSite}. Republishing redeploys into the
 * same hosting project and keeps the slug; unpublishing detaches the domain and
 * marks the row deleted so the slug stays reserved for the project.
 */
@Service
public class PublishManager {

    private static final Logger log = LoggerFactory.getLogger(PublishManager.class);

    private final BuildOutputStore buildStore;
    private final PublishedSiteStore siteStore;
    private final SiteDeployer deployer;
    private final HostingProviderClient client;
    private final PublishProperties properties;
    private final CalypsoMetrics metrics;
    private final Clock clock;

    public PublishManager(BuildOutputStore buildStore, PublishedSiteStore siteStore, SiteDeployer deployer,
                          HostingProviderClient client, PublishProperties properties, CalypsoMetrics metrics,
                          Clock clock) {
        this.buildStore = buildStore;
        this.siteStore = siteStore;
        this.deployer = deployer;
        this.client = client;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @throws NoCompletedBuildException      if the project has no complete build with files
     * @throws InvalidSlugException           if the requested slug is malformed
     * @throws SlugConflictException          if the requested slug belongs to another project
     * @throws DeploymentUnavailableException if no provider token is configured
     * @throws DeploymentProviderException    if the provider rejects the upload or deployment
     */
    public PublishResult publish(String projectId, PublishRequest request) {
        MdcContext.setProject(projectId);
        try {
            BuildOutput output = buildStore.findLatestComplete(projectId)
                    .filter(BuildOutput::hasFiles)
                    .orElseThrow(() -> new NoCompletedBuildException(projectId));
            if (!properties.isConfigured()) {
                log.error("Publishing requested but calypso.publish.token is not set");
                throw new DeploymentUnavailableException("Publishing is not available right now. Please try again later.");
            }

            Optional<PublishedSite> existing = siteStore.findByProject(projectId);
            String slug = resolveSlug(projectId, existing, request);
            Framework framework = buildStore.findConfiguration(projectId)
                    .map(BuildConfiguration::framework)
                    .orElse(null);

            log.info("Publishing build {} of project {} as '{}'", output.id(), projectId, slug);
            Deployment deployment;
            try {
                deployment = deployer.deploy(Slugs.hostingProjectName(projectId),
                        existing.map(PublishedSite::hostingProjectId).orElse(null),
                        output.files(), framework, slug);
            } catch (RuntimeException e) {
                metrics.recordPublish(false);
                throw e;
            }

            String url = deployer.urlFor(slug);
            PublishedSite site = new PublishedSite(
                    existing.map(PublishedSite::id).orElseGet(() -> UUID.randomUUID().toString()),
                    projectId,
                    slug,
                    deployment.projectId(),
                    deployment.id(),
                    url,
                    output.id(),
                    SiteStatus.READY,
                    clock.instant());
            try {
                siteStore.save(site);
            } catch (DuplicateSlugException e) {
                metrics.recordPublish(false);
                throw new SlugConflictException(slug);
            }

            metrics.recordPublish(true);
            log.info("Published project {} at {}", projectId, url);
            return new PublishResult(url, slug, deployment.id());
        } finally {
            MdcContext.clear();
        }
    }

    public PublishStatus status(String projectId) {
        Optional<PublishedSite> site = siteStore.findByProject(projectId).filter(PublishedSite::isLive);
        if (site.isEmpty()) {
            return PublishStatus.unpublished();
        }
        return PublishStatus.of(site.get(), isStale(projectId, site.get()));
    }

    public SlugAvailability checkSlug(String projectId, String requested) {
        String slug = Slugs.normalize(requested);
        if (!Slugs.isValid(slug)) {
            return SlugAvailability.invalid();
        }
        return takenByOtherProject(projectId, slug) ? SlugAvailability.taken() : SlugAvailability.free();
    }

    /**
     * Detaches the site's domain and marks it deleted. The slug and hosting project are
     * kept for a later republish.
     *
     * @throws NotPublishedException if the project has no live site
     */
    public void unpublish(String projectId) {
        PublishedSite site = siteStore.findByProject(projectId)
                .filter(PublishedSite::isLive)
                .orElseThrow(() -> new NotPublishedException(projectId));

        if (properties.isConfigured() && site.hostingProjectId() != null) {
            try {
                client.removeDomain(site.hostingProjectId(), deployer.domainFor(site.slug()));
            } catch (DeploymentProviderException e) {
                log.error("Could not detach {} from {}: {}", site.slug(), site.hostingProjectId(), e.getMessage());
            }
        } else {
            log.warn("Unpublishing {} without contacting the hosting provider", projectId);
        }

        siteStore.save(site.withStatus(SiteStatus.DELETED));
        log.info("Unpublished project {} ({})", projectId, site.slug());
    }

    boolean isStale(String projectId, PublishedSite site) {
        String latest = buildStore.findLatestComplete(projectId).map(BuildOutput::id).orElse(null);
        return site.isStale(latest);
    }

    /**
     * A requested slug is validated before anything is deployed, even when the project keeps
     * its existing slug.
     */
    private String resolveSlug(String projectId, Optional<PublishedSite> existing, PublishRequest request) {
        String requested = null;
        if (request != null && request.slug() != null && !request.slug().isBlank()) {
            requested = Slugs.normalize(request.slug());
            if (!Slugs.isValid(requested)) {
                throw new InvalidSlugException();
            }
            if (takenByOtherProject(projectId, requested)) {
                throw new SlugConflictException(requested);
            }
        }
        if (existing.isPresent()) {
            return existing.get().slug();
        }
        if (requested != null) {
            return requested;
        }
        String base = Slugs.slugify(request == null ? null : request.projectName());
        return Slugs.uniqueSlug(base, projectId, candidate -> takenByOtherProject(projectId, candidate));
    }

    private boolean takenByOtherProject(String projectId, String slug) {
        return siteStore.findBySlug(slug)
                .map(site -> !site.projectId().equals(projectId))
                .orElse(false);
    }
}
