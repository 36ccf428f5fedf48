package com.calypso.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Result record of one build action.
 * <p>
 * {@code files} is overwritten (never appended) whenever a better file set is
 * known, so an interrupted run still leaves the latest known-good set behind.
 *
 * @param verified {@code true} when the tree built, {@code false} when repair
 *                 rounds were exhausted, {@code null} when verification did not run
 */
public record BuildOutput(
    String id,
    String projectId,
    String buildConfigId,
    BuildStatus status,
    List<GeneratedFile> files,
    String error,
    Boolean verified,
    String previewUrl,
    String previewToken,
    String previewDeploymentId,
    String previewHostingProjectId,
    Instant createdAt
) {

    public BuildOutput {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static BuildOutput generating(String id, String projectId, String buildConfigId, Instant createdAt) {
        return new BuildOutput(id, projectId, buildConfigId, BuildStatus.GENERATING, List.of(),
                null, null, null, null, null, null, createdAt);
    }

    public boolean hasFiles() {
        return !files.isEmpty();
    }

    public boolean hasPreview() {
        return previewUrl != null && previewToken != null;
    }

    public BuildOutput withFiles(List<GeneratedFile> newFiles) {
        return new BuildOutput(id, projectId, buildConfigId, status, newFiles, error, verified,
                previewUrl, previewToken, previewDeploymentId, previewHostingProjectId, createdAt);
    }

    public BuildOutput withStatus(BuildStatus newStatus, String newError) {
        return new BuildOutput(id, projectId, buildConfigId, newStatus, files, newError, verified,
                previewUrl, previewToken, previewDeploymentId, previewHostingProjectId, createdAt);
    }

    public BuildOutput withVerified(Boolean newVerified) {
        return new BuildOutput(id, projectId, buildConfigId, status, files, error, newVerified,
                previewUrl, previewToken, previewDeploymentId, previewHostingProjectId, createdAt);
    }

    public BuildOutput withPreview(String url, String token, String deploymentId, String hostingProjectId) {
        return new BuildOutput(id, projectId, buildConfigId, status, files, error, verified,
                url, token, deploymentId, hostingProjectId, createdAt);
    }
}
