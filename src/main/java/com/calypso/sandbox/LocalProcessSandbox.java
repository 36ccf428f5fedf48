package com.calypso.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs commands as child processes of the service via {@code sh -c}.
 * <p>
 * Output is merged and drained on a separate thread so a chatty build cannot block on a
 * full pipe. On timeout the whole process tree is destroyed, since {@code npm} forks
 * workers that would otherwise outlive the shell.
 */
public class LocalProcessSandbox implements BuildSandbox {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessSandbox.class);

    /** Grace period for the output reader once the process is gone. */
    private static final long DRAIN_TIMEOUT_SECONDS = 5;

    @Override
    public CommandResult run(Path workspace, String command, Duration timeout) {
        log.debug("Running in {}: {}", workspace, command);
        Process process;
        try {
            process = new ProcessBuilder(List.of("sh", "-c", command))
                    .directory(workspace.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new SandboxUnavailableException("Cannot start shell for '" + command + "': " + e.getMessage(), e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("Command '{}' exceeded {}s, destroying process tree", command, timeout.toSeconds());
                destroyTree(process);
                return CommandResult.timedOut(collect(output));
            }
            return CommandResult.completed(process.exitValue(), collect(output));
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            throw new SandboxUnavailableException("Interrupted while running '" + command + "'", e);
        }
    }

    @Override
    public String name() {
        return "local";
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Output stream closed early: {}", e.getMessage());
            return "";
        }
    }

    private static String collect(CompletableFuture<String> output) {
        try {
            return output.get(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException | ExecutionException e) {
            output.cancel(true);
            return "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        }
    }
}
