package com.calypso.core.persistence;

import com.calypso.core.model.BuildConfiguration;
import com.calypso.core.model.BuildOutput;
import com.calypso.core.model.BuildStatus;
import com.calypso.core.model.Framework;
import com.calypso.core.model.GeneratedFile;
import com.calypso.core.model.StylingApproach;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Heap-backed {@link BuildOutputStore}. Not durable across restarts; used when no
 * datasource is configured and in tests.
 */
public class InMemoryBuildOutputStore implements BuildOutputStore {

    private final Clock clock;
    private final Map<String, BuildConfiguration> configurations = new HashMap<>();
    /** Insertion order doubles as creation order. */
    private final LinkedHashMap<String, BuildOutput> outputs = new LinkedHashMap<>();

    public InMemoryBuildOutputStore() {
        this(Clock.systemUTC());
    }

    public InMemoryBuildOutputStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized BuildConfiguration upsertConfiguration(String projectId, Framework framework,
                                                               StylingApproach styling, boolean typeScriptEnabled) {
        BuildConfiguration existing = configurations.get(projectId);
        String id = existing != null ? existing.id() : UUID.randomUUID().toString();
        var config = new BuildConfiguration(id, projectId, framework, styling, typeScriptEnabled, clock.instant());
        configurations.put(projectId, config);
        return config;
    }

    @Override
    public synchronized Optional<BuildConfiguration> findConfiguration(String projectId) {
        return Optional.ofNullable(configurations.get(projectId));
    }

    @Override
    public synchronized BuildOutput create(BuildOutput output) {
        if (outputs.containsKey(output.id())) {
            throw new IllegalStateException("Build " + output.id() + " already exists");
        }
        outputs.put(output.id(), output);
        return output;
    }

    @Override
    public synchronized Optional<BuildOutput> findById(String buildId) {
        return Optional.ofNullable(outputs.get(buildId));
    }

    @Override
    public synchronized Optional<BuildOutput> findLatest(String projectId) {
        return newest(projectId, o -> true);
    }

    @Override
    public synchronized Optional<BuildOutput> findLatestComplete(String projectId) {
        return newest(projectId, o -> o.status() == BuildStatus.COMPLETE);
    }

    @Override
    public synchronized Optional<BuildOutput> findLatestGeneratingWithFiles(String projectId) {
        return newest(projectId, o -> o.status() == BuildStatus.GENERATING && o.hasFiles());
    }

    @Override
    public synchronized void updateFiles(String buildId, List<GeneratedFile> files) {
        BuildOutput current = require(buildId);
        if (current.status() == BuildStatus.FAILED) {
            throw new IllegalBuildTransitionException("Build " + buildId + " has failed; its files are final");
        }
        if (current.status() == BuildStatus.COMPLETE && files.isEmpty()) {
            throw new IllegalBuildTransitionException("Complete build " + buildId + " cannot have an empty file set");
        }
        outputs.put(buildId, current.withFiles(files));
    }

    @Override
    public synchronized void markComplete(String buildId, List<GeneratedFile> files) {
        if (files == null || files.isEmpty()) {
            throw new IllegalBuildTransitionException("Build " + buildId + " cannot complete without files");
        }
        transition(buildId, BuildStatus.COMPLETE, o -> o.withFiles(files).withStatus(BuildStatus.COMPLETE, null));
    }

    @Override
    public synchronized void markFailed(String buildId, String error) {
        transition(buildId, BuildStatus.FAILED, o -> o.withStatus(BuildStatus.FAILED, error));
    }

    @Override
    public synchronized void updateVerified(String buildId, Boolean verified) {
        outputs.put(buildId, require(buildId).withVerified(verified));
    }

    @Override
    public synchronized void updatePreview(String buildId, String url, String token, String deploymentId,
                                           String hostingProjectId) {
        outputs.put(buildId, require(buildId).withPreview(url, token, deploymentId, hostingProjectId));
    }

    private void transition(String buildId, BuildStatus target, UnaryOperator<BuildOutput> change) {
        BuildOutput current = require(buildId);
        if (!current.status().canTransitionTo(target)) {
            throw new IllegalBuildTransitionException(buildId, current.status(), target);
        }
        outputs.put(buildId, change.apply(current));
    }

    private BuildOutput require(String buildId) {
        BuildOutput output = outputs.get(buildId);
        if (output == null) {
            throw new BuildNotFoundException(buildId);
        }
        return output;
    }

    private Optional<BuildOutput> newest(String projectId, Predicate<BuildOutput> filter) {
        List<BuildOutput> all = new ArrayList<>(outputs.values());
        for (int i = all.size() - 1; i >= 0; i--) {
            BuildOutput o = all.get(i);
            if (o.projectId().equals(projectId) && filter.test(o)) {
                return Optional.of(o);
            }
        }
        return Optional.empty();
    }
}
