package com.calypso.core.persistence;

import com.calypso.core.model.PublishedSite;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Heap-backed {@link PublishedSiteStore}.
 */
public class InMemoryPublishedSiteStore implements PublishedSiteStore {

    private final Map<String, PublishedSite> byProject = new HashMap<>();

    @Override
    public synchronized Optional<PublishedSite> findByProject(String projectId) {
        return Optional.ofNullable(byProject.get(projectId));
    }

    @Override
    public synchronized Optional<PublishedSite> findBySlug(String slug) {
        return byProject.values().stream().filter(s -> s.slug().equals(slug)).findFirst();
    }

    @Override
    public synchronized PublishedSite save(PublishedSite site) {
        Optional<PublishedSite> owner = findBySlug(site.slug());
        if (owner.isPresent() && !owner.get().projectId().equals(site.projectId())) {
            throw new DuplicateSlugException(site.slug());
        }
        PublishedSite existing = byProject.get(site.projectId());
        PublishedSite stored = existing == null ? site : new PublishedSite(existing.id(), site.projectId(),
                site.slug(), site.hostingProjectId(), site.deploymentId(), site.url(), site.buildOutputId(),
                site.status(), site.publishedAt());
        byProject.put(site.projectId(), stored);
        return stored;
    }
}
