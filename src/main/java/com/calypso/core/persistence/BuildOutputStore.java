package com.calypso.core.persistence;

import com.calypso.core.model.BuildConfiguration;
import com.calypso.core.model.BuildOutput;
import com.calypso.core.model.Framework;
import com.calypso.core.model.GeneratedFile;
import com.calypso.core.model.StylingApproach;

import java.util.List;
import java.util.Optional;

/**
 * Storage for build configurations and build outputs.
 * <p>
 * Implementations enforce the status machine: an output only leaves
 * {@code GENERATING}, to {@code COMPLETE} (with a non-empty file set) or {@code FAILED},
 * and never returns. Violations raise {@link IllegalBuildTransitionException}.
 */
public interface BuildOutputStore {

    /** Inserts or updates the single configuration row of a project. */
    BuildConfiguration upsertConfiguration(String projectId, Framework framework, StylingApproach styling,
                                           boolean typeScriptEnabled);

    Optional<BuildConfiguration> findConfiguration(String projectId);

    BuildOutput create(BuildOutput output);

    Optional<BuildOutput> findById(String buildId);

    /** Newest output of a project, whatever its status. */
    Optional<BuildOutput> findLatest(String projectId);

    /** Newest {@code COMPLETE} output of a project. */
    Optional<BuildOutput> findLatestComplete(String projectId);

    /** Newest {@code GENERATING} output that already has persisted files. */
    Optional<BuildOutput> findLatestGeneratingWithFiles(String projectId);

    /** Overwrites the file set; allowed in any status except {@code FAILED}. */
    void updateFiles(String buildId, List<GeneratedFile> files);

    void markComplete(String buildId, List<GeneratedFile> files);

    void markFailed(String buildId, String error);

    void updateVerified(String buildId, Boolean verified);

    /** Sets the preview fields; all {@code null} clears them. */
    void updatePreview(String buildId, String url, String token, String deploymentId, String hostingProjectId);
}
