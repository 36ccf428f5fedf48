package com.calypso.core.model;

import java.time.Instant;

/**
 * Build settings of a project. One row per project, upserted on every build request.
 */
public record BuildConfiguration(
    String id,
    String projectId,
    Framework framework,
    StylingApproach styling,
    boolean typeScriptEnabled,
    Instant updatedAt
) {}
