package com.calypso.deploy;

import com.calypso.core.build.NoCompletedBuildException;
import com.calypso.core.logging.MdcContext;
import com.calypso.core.metrics.CalypsoMetrics;
import com.calypso.core.model.BuildConfiguration;
import com.calypso.core.model.BuildOutput;
import com.calypso.core.model.Framework;
import com.calypso.core.model.GeneratedFile;
import com.calypso.core.model.PublishedSite;
import com.calypso.core.persistence.BuildOutputStore;
import com.calypso.core.persistence.PublishedSiteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Private, token-gated preview deployments of the latest complete build.
 * <p>
 * Each preview lives in its own hosting project under a random {@code pv-} subdomain.
 * Its URL and token are stored on the build output so a reachable preview is reused.
 */
@Service
public class PreviewManager {

    private static final Logger log = LoggerFactory.getLogger(PreviewManager.class);

    private final BuildOutputStore buildStore;
    private final PublishedSiteStore siteStore;
    private final SiteDeployer deployer;
    private final HostingProviderClient client;
    private final PublishProperties properties;
    private final CalypsoMetrics metrics;
    private final SecureRandom random = new SecureRandom();

    public PreviewManager(BuildOutputStore buildStore, PublishedSiteStore siteStore, SiteDeployer deployer,
                          HostingProviderClient client, PublishProperties properties, CalypsoMetrics metrics) {
        this.buildStore = buildStore;
        this.siteStore = siteStore;
        this.deployer = deployer;
        this.client = client;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Returns the stored preview when it still answers, otherwise deploys a new one.
     *
     * @throws NoCompletedBuildException      if the project has no complete build with files
     * @throws DeploymentUnavailableException if no provider token is configured
     * @throws DeploymentProviderException    if the provider rejects the deployment
     */
    public PreviewInfo createPreview(String projectId) {
        MdcContext.setProject(projectId);
        try {
            BuildOutput output = buildStore.findLatestComplete(projectId)
                    .filter(BuildOutput::hasFiles)
                    .orElseThrow(() -> new NoCompletedBuildException(projectId));

            if (output.hasPreview()) {
                if (client.isReachable(output.previewUrl())) {
                    metrics.recordPreview(true);
                    log.info("Reusing preview {} of build {}", output.previewUrl(), output.id());
                    return PreviewInfo.ready(output.previewUrl(), output.previewToken());
                }
                log.info("Preview {} of build {} is gone, recreating", output.previewUrl(), output.id());
                buildStore.updatePreview(output.id(), null, null, null, null);
            }

            if (!properties.isConfigured()) {
                throw new DeploymentUnavailableException("Preview is not available right now.");
            }

            Framework framework = buildStore.findConfiguration(projectId)
                    .map(BuildConfiguration::framework)
                    .orElse(null);
            String token = randomHex(32);
            String subdomain = "pv-" + randomHex(8);
            String hostingProjectName = "calypso-pv-" + Slugs.prefix(projectId, 8) + "-" + randomHex(4);

            List<GeneratedFile> files = PreviewScripts.inject(output.files(), projectId, token,
                    properties.resolvedAppUrl());
            Deployment deployment = deployer.deploy(hostingProjectName, files, framework, subdomain);

            String url = deployer.urlFor(subdomain);
            buildStore.updatePreview(output.id(), url, token, deployment.id(), deployment.projectId());
            metrics.recordPreview(false);
            log.info("Created preview {} for build {}", url, output.id());
            return PreviewInfo.ready(url, token);
        } finally {
            MdcContext.clear();
        }
    }

    public PreviewInfo getPreview(String projectId) {
        return buildStore.findLatestComplete(projectId)
                .filter(BuildOutput::hasPreview)
                .map(output -> PreviewInfo.ready(output.previewUrl(), output.previewToken()))
                .orElseGet(PreviewInfo::notReady);
    }

    /**
     * Publication state for the banner of a preview. The token must belong to the
     * project's latest complete build.
     *
     * @throws PreviewAccessException if the token is missing or does not match
     */
    public PreviewSiteStatus previewStatus(String projectId, String token) {
        if (token == null || token.isBlank()) {
            throw PreviewAccessException.missingToken();
        }
        BuildOutput output = buildStore.findLatestComplete(projectId)
                .filter(o -> o.previewToken() != null && tokensMatch(o.previewToken(), token))
                .orElseThrow(PreviewAccessException::invalidToken);

        Optional<PublishedSite> site = siteStore.findByProject(projectId).filter(PublishedSite::isLive);
        if (site.isEmpty()) {
            return PreviewSiteStatus.unpublished();
        }
        return new PreviewSiteStatus(true, site.get().isStale(output.id()), site.get().url());
    }

    private String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        random.nextBytes(buffer);
        return HexFormat.of().formatHex(buffer);
    }

    private static boolean tokensMatch(String expected, String actual) {
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }
}
