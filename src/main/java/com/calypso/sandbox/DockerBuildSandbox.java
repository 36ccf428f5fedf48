package com.calypso.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Runs each command in a throwaway container with the workspace bind-mounted at
 * {@code /workspace}. Containers get the configured memory limit and are always removed.
 * <p>
 * A daemon that cannot be reached, or an image that cannot be pulled, surfaces as
 * {@link SandboxUnavailableException}.
 */
public class DockerBuildSandbox implements BuildSandbox {

    private static final Logger log = LoggerFactory.getLogger(DockerBuildSandbox.class);

    private static final String WORKDIR = "/workspace";

    private final DockerClient dockerClient;
    private final String image;
    private final int memoryLimitMb;
    private final int cpuCount;

    public DockerBuildSandbox(DockerClient dockerClient, String image, int memoryLimitMb, int cpuCount) {
        this.dockerClient = dockerClient;
        this.image = image;
        this.memoryLimitMb = memoryLimitMb;
        this.cpuCount = cpuCount;
    }

    @Override
    public CommandResult run(Path workspace, String command, Duration timeout) {
        String containerId;
        try {
            ensureImage();
            var hostConfig = HostConfig.newHostConfig()
                    .withBinds(new Bind(workspace.toAbsolutePath().toString(), new Volume(WORKDIR), AccessMode.rw))
                    .withMemory((long) memoryLimitMb * 1024 * 1024)
                    .withCpuCount((long) cpuCount);
            containerId = dockerClient.createContainerCmd(image)
                    .withHostConfig(hostConfig)
                    .withWorkingDir(WORKDIR)
                    .withCmd("sh", "-c", command)
                    .exec()
                    .getId();
            dockerClient.startContainerCmd(containerId).exec();
        } catch (SandboxUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SandboxUnavailableException("Docker unavailable: " + e.getMessage(), e);
        }

        log.debug("Container {} running '{}'", containerId, command);
        try {
            Integer exitCode = awaitExit(containerId, timeout);
            String output = captureOutput(containerId);
            if (exitCode == null) {
                log.warn("Container {} exceeded {}s, killing", containerId, timeout.toSeconds());
                return CommandResult.timedOut(output);
            }
            boolean oomKilled = Boolean.TRUE.equals(
                    dockerClient.inspectContainerCmd(containerId).exec().getState().getOOMKilled());
            return new CommandResult(exitCode, output, false, oomKilled);
        } finally {
            remove(containerId);
        }
    }

    @Override
    public String name() {
        return "docker";
    }

    private void ensureImage() {
        try {
            dockerClient.inspectImageCmd(image).exec();
        } catch (NotFoundException e) {
            log.info("Image {} not present locally, pulling", image);
            try {
                dockerClient.pullImageCmd(image).exec(new PullImageResultCallback()).awaitCompletion();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new SandboxUnavailableException("Interrupted pulling " + image, ie);
            }
        }
    }

    private Integer awaitExit(String containerId, Duration timeout) {
        try {
            return dockerClient.waitContainerCmd(containerId)
                    .exec(new WaitContainerResultCallback())
                    .awaitStatusCode(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            // awaitStatusCode signals a timeout with an unchecked exception
            log.debug("Wait on container {} ended: {}", containerId, e.getMessage());
            return null;
        }
    }

    private String captureOutput(String containerId) {
        var sb = new StringBuilder();
        try {
            dockerClient.logContainerCmd(containerId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .exec(new LogContainerResultCallback() {
                        @Override
                        public void onNext(Frame frame) {
                            sb.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                        }
                    }).awaitCompletion(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while capturing output from container {}", containerId);
        }
        return sb.toString();
    }

    private void remove(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
        } catch (Exception e) {
            log.warn("Failed to remove container {}: {}", containerId, e.getMessage());
        }
    }
}
