package com.calypso.deploy;

import com.calypso.core.metrics.CalypsoMetrics;
import com.calypso.core.model.Framework;
import com.calypso.core.model.GeneratedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pushes a file tree to the hosting provider and binds it to a subdomain:
 * upload, create deployment, wait for readiness, assign domain.
 */
@Service
public class SiteDeployer {

    private static final Logger log = LoggerFactory.getLogger(SiteDeployer.class);

    private final HostingProviderClient client;
    private final PublishProperties properties;
    private final CalypsoMetrics metrics;

    public SiteDeployer(HostingProviderClient client, PublishProperties properties, CalypsoMetrics metrics) {
        this.client = client;
        this.properties = properties;
        this.metrics = metrics;
    }

    public Deployment deploy(String hostingProjectName, List<GeneratedFile> files, Framework framework,
                             String subdomain) {
        return deploy(hostingProjectName, null, files, framework, subdomain);
    }

    /**
     * @param hostingProjectName provider project the deployment belongs to
     * @param hostingProjectId   provider id of that project when already known, else {@code null}
     * @param subdomain          label placed in front of the publish domain
     * @return the created deployment, its {@code projectId} falling back to {@code hostingProjectName}
     * @throws DeploymentProviderException if an upload or the deployment fails
     */
    public Deployment deploy(String hostingProjectName, String hostingProjectId, List<GeneratedFile> files,
                             Framework framework, String subdomain) {
        if (!properties.isConfigured()) {
            throw new DeploymentUnavailableException("Publishing is not available right now. Please try again later.");
        }

        List<FileRef> refs = upload(client, files);
        Deployment deployment = client.createDeployment(hostingProjectName, hostingProjectId, refs,
                hostingFramework(framework));
        awaitReady(deployment);
        attachDomain(deployment.projectId(), domainFor(subdomain));
        return deployment;
    }

    /**
     * Deploys into the hosting account behind {@code token} rather than the service's own.
     * The deployment is created and returned without waiting for readiness or binding a domain.
     *
     * @throws DeploymentProviderException if an upload or the deployment fails, flagged as an
     *                                     auth failure when the token is rejected
     */
    public Deployment deployToAccount(String token, String hostingProjectName, List<GeneratedFile> files,
                                      Framework framework) {
        HostingProviderClient account = client.withToken(token);
        List<FileRef> refs = upload(account, files);
        return account.createDeployment(hostingProjectName, null, refs, hostingFramework(framework));
    }

    public String domainFor(String subdomain) {
        return subdomain + "." + properties.getDomain();
    }

    public String urlFor(String subdomain) {
        return "https://" + domainFor(subdomain);
    }

    List<FileRef> upload(HostingProviderClient target, List<GeneratedFile> files) {
        Set<String> uploaded = new HashSet<>();
        List<FileRef> refs = new ArrayList<>(files.size());
        for (GeneratedFile file : files) {
            byte[] content = file.content().getBytes(StandardCharsets.UTF_8);
            String sha = Slugs.sha1Hex(content);
            if (uploaded.add(sha)) {
                target.uploadFile(content, sha);
            }
            refs.add(new FileRef(file.path(), sha, content.length));
        }
        log.debug("Uploaded {} distinct bodies for {} files", uploaded.size(), files.size());
        return refs;
    }

    /**
     * Polls until READY. Reaching the ceiling is not an error: the provider keeps
     * building and the site becomes reachable later.
     */
    void awaitReady(Deployment deployment) {
        if (deployment.id() == null) {
            return;
        }
        long start = System.nanoTime();
        long timeoutNanos = properties.pollTimeout().toNanos();
        while (System.nanoTime() - start < timeoutNanos) {
            try {
                Thread.sleep(properties.pollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for deployment {}", deployment.id());
                return;
            }

            String state;
            try {
                state = client.getDeploymentState(deployment.id());
            } catch (DeploymentProviderException e) {
                log.debug("Deployment state poll failed: {}", e.getMessage());
                continue;
            }
            if ("READY".equals(state)) {
                metrics.recordDeploymentReadiness((System.nanoTime() - start) / 1_000_000);
                log.info("Deployment {} is ready", deployment.id());
                return;
            }
            if ("ERROR".equals(state) || "CANCELED".equals(state)) {
                throw new DeploymentProviderException("Deployment failed (" + state + ")", 0);
            }
        }
        log.warn("Deployment {} not ready after {} ms, continuing", deployment.id(), properties.getPollTimeoutMs());
    }

    private static String hostingFramework(Framework framework) {
        return framework == null ? null : framework.hostingFramework();
    }

    private void attachDomain(String hostingProjectId, String domain) {
        try {
            client.assignDomain(hostingProjectId, domain);
        } catch (DeploymentProviderException e) {
            log.error("Domain assignment of {} to {} failed: {}", domain, hostingProjectId, e.getMessage());
        }
    }
}
