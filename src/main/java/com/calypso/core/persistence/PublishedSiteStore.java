package com.calypso.core.persistence;

import com.calypso.core.model.PublishedSite;

import java.util.Optional;

/**
 * Storage for published sites: at most one row per project, slugs unique across projects.
 * A soft-deleted row keeps its slug reserved for its project.
 */
public interface PublishedSiteStore {

    Optional<PublishedSite> findByProject(String projectId);

    Optional<PublishedSite> findBySlug(String slug);

    /**
     * Inserts the project's row or updates it in place (keeping its id).
     *
     * @throws DuplicateSlugException if another project holds {@code site.slug()}
     */
    PublishedSite save(PublishedSite site);
}
