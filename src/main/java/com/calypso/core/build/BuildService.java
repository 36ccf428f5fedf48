package com.calypso.core.build;

import com.calypso.core.model.BuildConfiguration;
import com.calypso.core.model.BuildOutput;
import com.calypso.core.model.Framework;
import com.calypso.core.model.ProjectSpecification;
import com.calypso.core.model.StylingApproach;
import com.calypso.core.persistence.BuildOutputStore;
import com.calypso.core.persistence.IllegalBuildTransitionException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for build actions: starts builds on a bounded worker pool, tracks running
 * jobs for cancellation, and serves the latest build for export.
 * <p>
 * With {@code calypso.build.per-project-lock} enabled (the default) a project runs at most
 * one build at a time; a second request is refused with {@link BuildInProgressException}.
 */
@Service
public class BuildService {

    private static final Logger log = LoggerFactory.getLogger(BuildService.class);

    private final BuildPipeline pipeline;
    private final BuildOutputStore store;
    private final BuildProperties properties;
    private final Clock clock;
    private final ExecutorService executor;

    /** Running jobs keyed by build id. */
    private final ConcurrentHashMap<String, BuildJob> activeJobs = new ConcurrentHashMap<>();

    /** Build id currently holding each project's lock. */
    private final ConcurrentHashMap<String, String> projectLocks = new ConcurrentHashMap<>();

    public BuildService(BuildPipeline pipeline, BuildOutputStore store, BuildProperties properties, Clock clock) {
        this.pipeline = pipeline;
        this.store = store;
        this.properties = properties;
        this.clock = clock;
        var counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getExecutorThreads()), r -> {
            Thread t = new Thread(r, "calypso-build-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    void shutdown() {
        activeJobs.values().forEach(BuildJob::cancel);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Upserts the project's build configuration, creates a {@code GENERATING} output and
     * queues the pipeline. Returns immediately.
     *
     * @throws BuildInProgressException if the project already has a running build
     */
    public BuildOutput startBuild(String projectId, Framework framework, StylingApproach styling,
                                  boolean typeScriptEnabled, ProjectSpecification specification) {
        String buildId = UUID.randomUUID().toString();
        if (properties.isPerProjectLock()) {
            String holder = projectLocks.putIfAbsent(projectId, buildId);
            if (holder != null) {
                throw new BuildInProgressException(projectId, holder);
            }
        }

        try {
            BuildConfiguration config = store.upsertConfiguration(projectId, framework, styling, typeScriptEnabled);
            BuildOutput output = store.create(BuildOutput.generating(buildId, projectId, config.id(), clock.instant()));
            var job = new BuildJob(buildId, projectId, config, specification);
            activeJobs.put(buildId, job);
            executor.execute(() -> run(job));
            log.info("Build {} queued for project {} ({}, {})", buildId, projectId,
                    framework.wireName(), styling.wireName());
            return output;
        } catch (RuntimeException e) {
            activeJobs.remove(buildId);
            projectLocks.remove(projectId, buildId);
            if (e instanceof RejectedExecutionException) {
                store.markFailed(buildId, "Build service is shutting down");
            }
            throw e;
        }
    }

    private void run(BuildJob job) {
        try {
            pipeline.execute(job);
        } finally {
            activeJobs.remove(job.buildId());
            projectLocks.remove(job.projectId(), job.buildId());
        }
    }

    /**
     * Requests cooperative cancellation. Already persisted state is kept.
     *
     * @return true if a running build was signalled
     */
    public boolean cancel(String buildId) {
        BuildJob job = activeJobs.get(buildId);
        if (job == null) {
            return false;
        }
        boolean signalled = job.cancel();
        if (signalled) {
            log.info("Cancellation requested for build {}", buildId);
        }
        return signalled;
    }

    public boolean isRunning(String buildId) {
        return activeJobs.containsKey(buildId);
    }

    public Optional<BuildOutput> findBuild(String projectId, String buildId) {
        return store.findById(buildId).filter(b -> b.projectId().equals(projectId));
    }

    public Optional<BuildOutput> latestBuild(String projectId) {
        return store.findLatest(projectId);
    }

    /**
     * Latest complete build for export. When none exists, the newest generating build that
     * already has files (a run killed before it could finish) is promoted to complete.
     *
     * @throws NoCompletedBuildException if neither exists
     */
    public BuildOutput latestExportable(String projectId) {
        Optional<BuildOutput> complete = store.findLatestComplete(projectId).filter(BuildOutput::hasFiles);
        if (complete.isPresent()) {
            return complete.get();
        }
        Optional<BuildOutput> pending = store.findLatestGeneratingWithFiles(projectId)
                .filter(b -> !isRunning(b.id()));
        if (pending.isPresent()) {
            BuildOutput stranded = pending.get();
            try {
                store.markComplete(stranded.id(), stranded.files());
                log.info("Recovered stranded build {} with {} files", stranded.id(), stranded.files().size());
            } catch (IllegalBuildTransitionException e) {
                log.debug("Build {} changed status during recovery: {}", stranded.id(), e.getMessage());
            }
            return store.findById(stranded.id()).filter(BuildOutput::hasFiles).orElse(stranded);
        }
        throw new NoCompletedBuildException(projectId);
    }

    public int activeBuildCount() {
        return activeJobs.size();
    }
}
