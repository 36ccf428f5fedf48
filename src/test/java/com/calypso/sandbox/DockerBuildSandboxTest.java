package com.calypso.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.*;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * The docker-java fluent builders are chained by hand rather than with deep stubs so each
 * command can be verified individually.
 */
class DockerBuildSandboxTest {

    private static final Path WORKSPACE = Path.of("/tmp/calypso-ws");
    private static final Duration TIMEOUT = Duration.ofSeconds(120);

    private DockerClient dockerClient;
    private DockerBuildSandbox sandbox;
    private RemoveContainerCmd removeCmd;

    @BeforeEach
    void setUp() {
        dockerClient = mock(DockerClient.class);
        sandbox = new DockerBuildSandbox(dockerClient, "node:22-alpine", 2048, 2);

        var inspectImage = mock(InspectImageCmd.class);
        when(dockerClient.inspectImageCmd(anyString())).thenReturn(inspectImage);
        when(inspectImage.exec()).thenReturn(mock(InspectImageResponse.class));

        removeCmd = mock(RemoveContainerCmd.class);
        when(dockerClient.removeContainerCmd(anyString())).thenReturn(removeCmd);
        when(removeCmd.withForce(true)).thenReturn(removeCmd);
    }

    @Nested
    @DisplayName("successful runs")
    class SuccessfulRuns {

        @Test
        @DisplayName("creates the container with the workspace bound and resource limits applied")
        void createsContainerWithLimits() throws Exception {
            var createCmd = mockCreateContainerCmd("c-1");
            mockStart("c-1");
            mockWait("c-1", 0);
            mockLogs("c-1", "built\n");
            mockInspectContainer("c-1", false);

            CommandResult result = sandbox.run(WORKSPACE, "npm run build", TIMEOUT);

            assertTrue(result.succeeded());
            assertEquals("built\n", result.output());
            verify(dockerClient).createContainerCmd("node:22-alpine");
            verify(createCmd).withWorkingDir("/workspace");
            verify(createCmd).withCmd("sh", "-c", "npm run build");

            var captor = ArgumentCaptor.forClass(HostConfig.class);
            verify(createCmd).withHostConfig(captor.capture());
            HostConfig hostConfig = captor.getValue();
            assertEquals(2048L * 1024 * 1024, hostConfig.getMemory());
            assertEquals(2L, hostConfig.getCpuCount());
            assertEquals("/workspace", hostConfig.getBinds()[0].getVolume().getPath());
        }

        @Test
        @DisplayName("reports a non-zero exit code and removes the container")
        void nonZeroExit() throws Exception {
            mockCreateContainerCmd("c-2");
            mockStart("c-2");
            mockWait("c-2", 1);
            mockLogs("c-2", "error TS2304\n");
            mockInspectContainer("c-2", false);

            CommandResult result = sandbox.run(WORKSPACE, "npx tsc --noEmit", TIMEOUT);

            assertFalse(result.succeeded());
            assertEquals(1, result.exitCode());
            assertFalse(result.timedOut());
            verify(removeCmd).exec();
        }

        @Test
        @DisplayName("flags an out-of-memory kill")
        void outOfMemory() throws Exception {
            mockCreateContainerCmd("c-3");
            mockStart("c-3");
            mockWait("c-3", 137);
            mockLogs("c-3", "");
            mockInspectContainer("c-3", true);

            CommandResult result = sandbox.run(WORKSPACE, "npm install", TIMEOUT);

            assertTrue(result.outOfMemory());
            assertFalse(result.succeeded());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a null status code is reported as a timeout")
        void timeout() throws Exception {
            mockCreateContainerCmd("c-4");
            mockStart("c-4");
            mockWait("c-4", null);
            mockLogs("c-4", "partial");

            CommandResult result = sandbox.run(WORKSPACE, "npm run build", TIMEOUT);

            assertTrue(result.timedOut());
            assertEquals("partial", result.output());
            verify(dockerClient, never()).inspectContainerCmd(anyString());
            verify(removeCmd).exec();
        }

        @Test
        @DisplayName("an unreachable daemon surfaces as SandboxUnavailableException")
        void daemonUnavailable() {
            when(dockerClient.createContainerCmd(anyString()))
                    .thenThrow(new RuntimeException("Cannot connect to the Docker daemon"));

            var ex = assertThrows(SandboxUnavailableException.class,
                    () -> sandbox.run(WORKSPACE, "npm install", TIMEOUT));

            assertTrue(ex.getMessage().contains("Docker unavailable"));
            verify(dockerClient, never()).startContainerCmd(anyString());
        }

        @Test
        @DisplayName("a failed removal does not mask the result")
        void removalFailureIgnored() throws Exception {
            mockCreateContainerCmd("c-5");
            mockStart("c-5");
            mockWait("c-5", 0);
            mockLogs("c-5", "ok");
            mockInspectContainer("c-5", false);
            when(removeCmd.exec()).thenThrow(new RuntimeException("No such container"));

            CommandResult result = assertDoesNotThrow(() -> sandbox.run(WORKSPACE, "npm run build", TIMEOUT));

            assertTrue(result.succeeded());
        }
    }

    private CreateContainerCmd mockCreateContainerCmd(String containerId) {
        var createCmd = mock(CreateContainerCmd.class, RETURNS_SELF);
        when(dockerClient.createContainerCmd(anyString())).thenReturn(createCmd);

        var response = mock(CreateContainerResponse.class);
        when(response.getId()).thenReturn(containerId);
        when(createCmd.exec()).thenReturn(response);
        return createCmd;
    }

    private void mockStart(String containerId) {
        when(dockerClient.startContainerCmd(containerId)).thenReturn(mock(StartContainerCmd.class));
    }

    private void mockWait(String containerId, Integer statusCode) {
        var waitCmd = mock(WaitContainerCmd.class);
        when(dockerClient.waitContainerCmd(containerId)).thenReturn(waitCmd);

        var callback = mock(WaitContainerResultCallback.class);
        when(waitCmd.exec(any(WaitContainerResultCallback.class))).thenReturn(callback);
        when(callback.awaitStatusCode(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)).thenReturn(statusCode);
    }

    private void mockLogs(String containerId, String output) {
        var logCmd = mock(LogContainerCmd.class, RETURNS_SELF);
        when(dockerClient.logContainerCmd(containerId)).thenReturn(logCmd);

        // exec(callback) hands the callback back; onComplete releases awaitCompletion
        doAnswer(invocation -> {
            var callback = (LogContainerResultCallback) invocation.getArgument(0);
            if (!output.isEmpty()) {
                callback.onNext(new Frame(StreamType.STDOUT, output.getBytes(StandardCharsets.UTF_8)));
            }
            callback.onComplete();
            return callback;
        }).when(logCmd).exec(any());
    }

    private void mockInspectContainer(String containerId, boolean oomKilled) {
        var inspectCmd = mock(InspectContainerCmd.class);
        when(dockerClient.inspectContainerCmd(containerId)).thenReturn(inspectCmd);

        var response = mock(InspectContainerResponse.class);
        var state = mock(InspectContainerResponse.ContainerState.class);
        when(state.getOOMKilled()).thenReturn(oomKilled);
        when(response.getState()).thenReturn(state);
        when(inspectCmd.exec()).thenReturn(response);
    }
}
