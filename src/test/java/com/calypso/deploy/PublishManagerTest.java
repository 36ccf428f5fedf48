package com.calypso.deploy;

import com.calypso.core.build.NoCompletedBuildException;
import com.calypso.core.metrics.CalypsoMetrics;
import com.calypso.core.model.BuildOutput;
import com.calypso.core.model.Framework;
import com.calypso.core.model.GeneratedFile;
import com.calypso.core.model.PublishedSite;
import com.calypso.core.model.SiteStatus;
import com.calypso.core.model.StylingApproach;
import com.calypso.core.persistence.InMemoryBuildOutputStore;
import com.calypso.core.persistence.InMemoryPublishedSiteStore;
import com.calypso.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class PublishManagerTest {

    private static final List<GeneratedFile> FILES = List.of(new GeneratedFile("index.html", "<h1>Hi</h1>"));

    private MutableClock clock;
    private InMemoryBuildOutputStore buildStore;
    private InMemoryPublishedSiteStore siteStore;
    private SiteDeployer deployer;
    private HostingProviderClient client;
    private PublishProperties properties;
    private PublishManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T12:00:00Z");
        buildStore = new InMemoryBuildOutputStore(clock);
        siteStore = new InMemoryPublishedSiteStore();
        deployer = mock(SiteDeployer.class);
        client = mock(HostingProviderClient.class);
        properties = new PublishProperties();
        properties.setToken("secret");
        when(deployer.urlFor(anyString())).thenAnswer(inv -> "https://" + inv.getArgument(0) + ".calypso.build");
        when(deployer.domainFor(anyString())).thenAnswer(inv -> inv.getArgument(0) + ".calypso.build");
        when(deployer.deploy(anyString(), any(), any(), any(), anyString())).thenAnswer(inv -> {
            String knownId = inv.getArgument(1);
            return new Deployment("dpl-" + clock.millis(), knownId != null ? knownId : "prj_" + inv.getArgument(0),
                    null, "READY");
        });
        manager = new PublishManager(buildStore, siteStore, deployer, client, properties,
                new CalypsoMetrics(new SimpleMeterRegistry()), clock);
    }

    private String completeBuild(String projectId, String buildId) {
        var config = buildStore.upsertConfiguration(projectId, Framework.NEXTJS, StylingApproach.TAILWIND, true);
        buildStore.create(BuildOutput.generating(buildId, projectId, config.id(), clock.instant()));
        buildStore.markComplete(buildId, FILES);
        return buildId;
    }

    @Nested
    @DisplayName("publish")
    class PublishTests {

        @Test
        @DisplayName("derives the slug from the project name and records the site")
        void firstPublish() {
            completeBuild("p1", "b1");

            PublishResult result = manager.publish("p1", new PublishRequest(null, "My Bakery"));

            assertEquals("my-bakery", result.slug());
            assertEquals("https://my-bakery.calypso.build", result.url());
            verify(deployer).deploy(Slugs.hostingProjectName("p1"), null, FILES, Framework.NEXTJS, "my-bakery");

            PublishedSite site = siteStore.findByProject("p1").orElseThrow();
            assertEquals(SiteStatus.READY, site.status());
            assertEquals("b1", site.buildOutputId());
            assertEquals(result.deploymentId(), site.deploymentId());
        }

        @Test
        @DisplayName("republishing keeps the slug, row and hosting project")
        void idempotentRepublish() {
            completeBuild("p1", "b1");
            PublishResult first = manager.publish("p1", new PublishRequest(null, "Demo"));
            String siteId = siteStore.findByProject("p1").orElseThrow().id();

            clock.advance(Duration.ofMinutes(5));
            completeBuild("p1", "b2");
            PublishResult second = manager.publish("p1", new PublishRequest("something-else", "Renamed"));

            assertEquals(first.slug(), second.slug());
            PublishedSite site = siteStore.findByProject("p1").orElseThrow();
            assertEquals(siteId, site.id());
            assertEquals("b2", site.buildOutputId());
            String hostingProjectId = "prj_" + Slugs.hostingProjectName("p1");
            assertEquals(hostingProjectId, site.hostingProjectId());
            verify(deployer).deploy(eq(Slugs.hostingProjectName("p1")), isNull(), any(), any(), eq("demo"));
            verify(deployer).deploy(eq(Slugs.hostingProjectName("p1")), eq(hostingProjectId), any(), any(), eq("demo"));
        }

        @Test
        @DisplayName("accepts a free requested slug after normalizing it")
        void requestedSlug() {
            completeBuild("p1", "b1");

            assertEquals("my-shop", manager.publish("p1", new PublishRequest("  My-Shop ", null)).slug());
        }

        @Test
        @DisplayName("a second project with the same name gets a disambiguated slug")
        void sameNameOtherProject() {
            completeBuild("p1", "b1");
            completeBuild("p2", "b2");

            String first = manager.publish("p1", new PublishRequest(null, "Demo")).slug();
            String second = manager.publish("p2", new PublishRequest(null, "Demo")).slug();

            assertEquals("demo", first);
            assertNotEquals(first, second);
            assertTrue(second.startsWith("demo-"));
        }

        @Test
        @DisplayName("a requested slug owned by another project is a conflict and changes nothing")
        void conflict() {
            completeBuild("p1", "b1");
            completeBuild("p2", "b2");
            manager.publish("p1", new PublishRequest("taken", null));

            assertThrows(SlugConflictException.class, () -> manager.publish("p2", new PublishRequest("taken", null)));
            assertTrue(siteStore.findByProject("p2").isEmpty());
            assertEquals("p1", siteStore.findBySlug("taken").orElseThrow().projectId());
            verify(deployer, times(1)).deploy(anyString(), any(), any(), any(), anyString());
        }

        @Test
        @DisplayName("projects whose ids share a prefix deploy into different hosting projects")
        void sharedIdPrefix() {
            completeBuild("project-alpha", "b1");
            completeBuild("project-beta", "b2");
            List<String> names = new ArrayList<>();
            when(deployer.deploy(anyString(), any(), any(), any(), anyString())).thenAnswer(inv -> {
                names.add(inv.getArgument(0));
                return new Deployment("dpl-" + names.size(), "prj_" + inv.getArgument(0), null, "READY");
            });

            manager.publish("project-alpha", new PublishRequest(null, "Alpha"));
            manager.publish("project-beta", new PublishRequest(null, "Beta"));

            assertEquals(2, names.size());
            assertNotEquals(names.get(0), names.get(1));
            assertNotEquals(siteStore.findByProject("project-alpha").orElseThrow().hostingProjectId(),
                    siteStore.findByProject("project-beta").orElseThrow().hostingProjectId());
        }

        @Test
        @DisplayName("a live project requesting another project's slug is a conflict and its site is untouched")
        void conflictWithExistingSite() {
            completeBuild("p2", "b1-p2");
            manager.publish("p2", new PublishRequest("taken-slug", null));
            completeBuild("p1", "b1-p1");
            manager.publish("p1", new PublishRequest("mine", null));
            PublishedSite before = siteStore.findByProject("p1").orElseThrow();

            clock.advance(Duration.ofMinutes(5));
            completeBuild("p1", "b2-p1");

            assertThrows(SlugConflictException.class,
                    () -> manager.publish("p1", new PublishRequest("taken-slug", null)));
            assertEquals(before, siteStore.findByProject("p1").orElseThrow());
            verify(deployer, times(2)).deploy(anyString(), any(), any(), any(), anyString());
        }

        @Test
        @DisplayName("a live project requesting a malformed slug is rejected before deploying")
        void invalidSlugWithExistingSite() {
            completeBuild("p1", "b1");
            manager.publish("p1", new PublishRequest("mine", null));

            assertThrows(InvalidSlugException.class, () -> manager.publish("p1", new PublishRequest("-bad_", null)));
            verify(deployer, times(1)).deploy(anyString(), any(), any(), any(), anyString());
        }

        @Test
        @DisplayName("a malformed requested slug is rejected before deploying")
        void invalidSlug() {
            completeBuild("p1", "b1");

            assertThrows(InvalidSlugException.class, () -> manager.publish("p1", new PublishRequest("-bad_", null)));
            verify(deployer, never()).deploy(anyString(), any(), any(), any(), anyString());
        }

        @Test
        @DisplayName("needs a complete build")
        void noBuild() {
            assertThrows(NoCompletedBuildException.class, () -> manager.publish("p1", null));
        }

        @Test
        @DisplayName("is unavailable without a provider token")
        void unconfigured() {
            completeBuild("p1", "b1");
            properties.setToken("");

            assertThrows(DeploymentUnavailableException.class, () -> manager.publish("p1", null));
            verifyNoInteractions(client);
        }

        @Test
        @DisplayName("a provider failure leaves no site behind")
        void providerFailure() {
            completeBuild("p1", "b1");
            when(deployer.deploy(anyString(), any(), any(), any(), anyString()))
                    .thenThrow(new DeploymentProviderException("quota exceeded", 402));

            assertThrows(DeploymentProviderException.class, () -> manager.publish("p1", null));
            assertTrue(siteStore.findByProject("p1").isEmpty());
        }
    }

    @Nested
    @DisplayName("status")
    class StatusTests {

        @Test
        @DisplayName("reports unpublished projects")
        void unpublished() {
            assertFalse(manager.status("p1").published());
        }

        @Test
        @DisplayName("becomes stale once a newer build completes")
        void staleness() {
            completeBuild("p1", "b1");
            manager.publish("p1", new PublishRequest(null, "Demo"));
            assertEquals(Boolean.FALSE, manager.status("p1").isStale());

            completeBuild("p1", "b2");

            PublishStatus status = manager.status("p1");
            assertTrue(status.published());
            assertEquals(Boolean.TRUE, status.isStale());
            assertEquals("ready", status.status());
            assertEquals("demo", status.slug());
        }
    }

    @Nested
    @DisplayName("unpublish")
    class UnpublishTests {

        @Test
        @DisplayName("detaches the domain and soft-deletes the site")
        void softDelete() {
            completeBuild("p1", "b1");
            manager.publish("p1", new PublishRequest(null, "Demo"));

            manager.unpublish("p1");

            verify(client).removeDomain("prj_" + Slugs.hostingProjectName("p1"), "demo.calypso.build");
            assertEquals(SiteStatus.DELETED, siteStore.findByProject("p1").orElseThrow().status());
            assertFalse(manager.status("p1").published());
        }

        @Test
        @DisplayName("a later publish reactivates the same slug")
        void republishAfterUnpublish() {
            completeBuild("p1", "b1");
            manager.publish("p1", new PublishRequest(null, "Demo"));
            manager.unpublish("p1");

            PublishResult result = manager.publish("p1", new PublishRequest(null, "Other"));

            assertEquals("demo", result.slug());
            assertEquals(SiteStatus.READY, siteStore.findByProject("p1").orElseThrow().status());
        }

        @Test
        @DisplayName("a provider error while detaching still unpublishes")
        void detachFailure() {
            completeBuild("p1", "b1");
            manager.publish("p1", new PublishRequest(null, "Demo"));
            doThrow(new DeploymentProviderException("gone", 500)).when(client).removeDomain(anyString(), anyString());

            manager.unpublish("p1");

            assertEquals(SiteStatus.DELETED, siteStore.findByProject("p1").orElseThrow().status());
        }

        @Test
        @DisplayName("fails when nothing is live")
        void notPublished() {
            assertThrows(NotPublishedException.class, () -> manager.unpublish("p1"));
        }
    }

    @Test
    @DisplayName("slug checks report format and ownership")
    void checkSlug() {
        completeBuild("p1", "b1");
        manager.publish("p1", new PublishRequest("taken", null));

        assertEquals(SlugAvailability.invalid(), manager.checkSlug("p2", "-bad"));
        assertFalse(manager.checkSlug("p2", "taken").available());
        assertTrue(manager.checkSlug("p1", "taken").available());
        assertTrue(manager.checkSlug("p2", "Fresh-Name").available());
    }
}
