package com.calypso.deploy;

import com.calypso.core.model.PublishedSite;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Locale;

/**
 * Publication state of a project as reported to the authoring app.
 * Only {@code published} is serialized for an unpublished project.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PublishStatus(
    boolean published,
    String url,
    String slug,
    String status,
    Instant publishedAt,
    Boolean isStale
) {

    public static PublishStatus unpublished() {
        return new PublishStatus(false, null, null, null, null, null);
    }

    static PublishStatus of(PublishedSite site, boolean stale) {
        return new PublishStatus(true, site.url(), site.slug(), site.status().name().toLowerCase(Locale.ROOT),
                site.publishedAt(), stale);
    }
}
