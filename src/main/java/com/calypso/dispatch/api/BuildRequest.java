package com.calypso.dispatch.api;

import com.calypso.core.model.ProjectSpecification;

/**
 * Inbound JSON body for POST /api/v1/projects/{projectId}/builds.
 *
 * @param framework         {@code nextjs}, {@code vite_react} or {@code html}
 * @param styling           {@code tailwind}, {@code css} or {@code scss}
 * @param includeTypeScript whether the generated project uses TypeScript
 * @param specification     the project brief to build from
 */
public record BuildRequest(
    String framework,
    String styling,
    Boolean includeTypeScript,
    ProjectSpecification specification
) {}
