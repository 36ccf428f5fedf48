package com.calypso.deploy;

import com.calypso.core.build.NoCompletedBuildException;
import com.calypso.core.metrics.CalypsoMetrics;
import com.calypso.core.model.BuildOutput;
import com.calypso.core.model.Framework;
import com.calypso.core.model.GeneratedFile;
import com.calypso.core.model.StylingApproach;
import com.calypso.core.persistence.InMemoryBuildOutputStore;
import com.calypso.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AccountDeployManagerTest {

    private static final List<GeneratedFile> FILES = List.of(new GeneratedFile("index.html", "<h1>Hi</h1>"));

    private MutableClock clock;
    private InMemoryBuildOutputStore buildStore;
    private SiteDeployer deployer;
    private SimpleMeterRegistry registry;
    private AccountDeployManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T12:00:00Z");
        buildStore = new InMemoryBuildOutputStore(clock);
        deployer = mock(SiteDeployer.class);
        registry = new SimpleMeterRegistry();
        when(deployer.deployToAccount(anyString(), anyString(), any(), any()))
                .thenReturn(new Deployment("dpl_u", "prj_u", "my-site-abc.vercel.app", "QUEUED"));
        manager = new AccountDeployManager(buildStore, deployer, new CalypsoMetrics(registry));
    }

    private void completeBuild(String projectId, String buildId) {
        var config = buildStore.upsertConfiguration(projectId, Framework.VITE_REACT, StylingApproach.CSS, false);
        buildStore.create(BuildOutput.generating(buildId, projectId, config.id(), clock.instant()));
        buildStore.markComplete(buildId, FILES);
    }

    @Test
    @DisplayName("deploys the latest complete build under the slugified project name")
    void deploys() {
        completeBuild("p1", "b1");

        AccountDeployResult result = manager.deploy("p1", new AccountDeployRequest("user-token", "My Site!"));

        assertEquals(new AccountDeployResult("https://my-site-abc.vercel.app", "dpl_u"), result);
        verify(deployer).deployToAccount("user-token", "my-site", FILES, Framework.VITE_REACT);
        verify(deployer, never()).deploy(anyString(), any(), any(), any(), anyString());
        assertEquals(1.0, registry.get("calypso.account.deploy.total").tag("result", "success").counter().count());
    }

    @Test
    @DisplayName("falls back to the hosting project name without a project name")
    void defaultName() {
        completeBuild("p1", "b1");

        manager.deploy("p1", new AccountDeployRequest("user-token", null));

        verify(deployer).deployToAccount("user-token", Slugs.hostingProjectName("p1"), FILES, Framework.VITE_REACT);
    }

    @Test
    @DisplayName("needs a token and a complete build")
    void preconditions() {
        assertThrows(IllegalArgumentException.class, () -> manager.deploy("p1", new AccountDeployRequest(" ", "x")));
        assertThrows(NoCompletedBuildException.class,
                () -> manager.deploy("p1", new AccountDeployRequest("user-token", "x")));
        verifyNoInteractions(deployer);
    }

    @Test
    @DisplayName("a rejected token is counted and rethrown")
    void rejectedToken() {
        completeBuild("p1", "b1");
        when(deployer.deployToAccount(anyString(), anyString(), any(), any()))
                .thenThrow(new DeploymentProviderException("Not authorized", 401));

        var e = assertThrows(DeploymentProviderException.class,
                () -> manager.deploy("p1", new AccountDeployRequest("bad", "x")));
        assertTrue(e.isAuthFailure());
        assertEquals(1.0, registry.get("calypso.account.deploy.total").tag("result", "failure").counter().count());
    }
}
