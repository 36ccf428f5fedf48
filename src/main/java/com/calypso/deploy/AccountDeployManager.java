package com.calypso.deploy;

import com.calypso.core.build.NoCompletedBuildException;
import com.calypso.core.logging.MdcContext;
import com.calypso.core.metrics.CalypsoMetrics;
import com.calypso.core.model.BuildConfiguration;
import com.calypso.core.model.BuildOutput;
import com.calypso.core.model.Framework;
import com.calypso.core.persistence.BuildOutputStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Deploys a project's latest complete build into the caller's own hosting account.
 * <p>
 * Nothing is recorded: the deployment belongs to the caller's account, has no
 * {@code <slug>.<publish-domain>} address and does not affect the published site.
 */
@Service
public class AccountDeployManager {

    private static final Logger log = LoggerFactory.getLogger(AccountDeployManager.class);

    private final BuildOutputStore buildStore;
    private final SiteDeployer deployer;
    private final CalypsoMetrics metrics;

    public AccountDeployManager(BuildOutputStore buildStore, SiteDeployer deployer, CalypsoMetrics metrics) {
        this.buildStore = buildStore;
        this.deployer = deployer;
        this.metrics = metrics;
    }

    /**
     * @throws IllegalArgumentException    if the request carries no token
     * @throws NoCompletedBuildException   if the project has no complete build with files
     * @throws DeploymentProviderException if the provider rejects the token, an upload or the deployment
     */
    public AccountDeployResult deploy(String projectId, AccountDeployRequest request) {
        if (request == null || request.token() == null || request.token().isBlank()) {
            throw new IllegalArgumentException("Hosting access token is required");
        }
        MdcContext.setProject(projectId);
        try {
            BuildOutput output = buildStore.findLatestComplete(projectId)
                    .filter(BuildOutput::hasFiles)
                    .orElseThrow(() -> new NoCompletedBuildException(projectId));
            Framework framework = buildStore.findConfiguration(projectId)
                    .map(BuildConfiguration::framework)
                    .orElse(null);

            String name = Slugs.slugify(request.projectName());
            if (name.isEmpty()) {
                name = Slugs.hostingProjectName(projectId);
            }

            Deployment deployment;
            try {
                deployment = deployer.deployToAccount(request.token(), name, output.files(), framework);
            } catch (RuntimeException e) {
                metrics.recordAccountDeploy(false);
                throw e;
            }
            metrics.recordAccountDeploy(true);
            log.info("Deployed build {} of project {} to a caller account as {}", output.id(), projectId, name);

            String url = deployment.url() == null ? null : "https://" + deployment.url();
            return new AccountDeployResult(url, deployment.id());
        } finally {
            MdcContext.clear();
        }
    }
}
