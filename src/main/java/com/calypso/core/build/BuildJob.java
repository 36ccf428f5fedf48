package com.calypso.core.build;

import com.calypso.core.model.BuildConfiguration;
import com.calypso.core.model.ProjectSpecification;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One queued or running build, with its cooperative cancellation signal.
 */
public class BuildJob {

    private final String buildId;
    private final String projectId;
    private final BuildConfiguration configuration;
    private final ProjectSpecification specification;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Sinks.One<Boolean> cancelSignal = Sinks.one();

    public BuildJob(String buildId, String projectId, BuildConfiguration configuration,
                    ProjectSpecification specification) {
        this.buildId = buildId;
        this.projectId = projectId;
        this.configuration = configuration;
        this.specification = specification;
    }

    public String buildId() { return buildId; }
    public String projectId() { return projectId; }
    public BuildConfiguration configuration() { return configuration; }
    public ProjectSpecification specification() { return specification; }

    /** Requests cancellation; returns false if it was already requested. */
    public boolean cancel() {
        if (cancelled.compareAndSet(false, true)) {
            cancelSignal.tryEmitValue(Boolean.TRUE);
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Emits once when {@link #cancel()} is called; used to cut the model stream short. */
    public Mono<Boolean> cancellation() {
        return cancelSignal.asMono();
    }
}
