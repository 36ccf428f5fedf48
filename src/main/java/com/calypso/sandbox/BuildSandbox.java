package com.calypso.sandbox;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Abstraction for running one shell command against a materialized workspace.
 * Implementations: {@link LocalProcessSandbox} (default), {@link DockerBuildSandbox}.
 */
public interface BuildSandbox {

    /**
     * Runs {@code command} with {@code workspace} as the working directory and waits for it,
     * at most {@code timeout}. A command still running at the timeout is killed and reported
     * with {@link CommandResult#timedOut()} set.
     *
     * @throws SandboxUnavailableException when the sandbox itself cannot run the command
     *                                     (shell or container runtime missing)
     */
    CommandResult run(Path workspace, String command, Duration timeout);

    /** Short name for logs and metrics. */
    String name();
}
