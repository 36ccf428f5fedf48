package com.calypso.core.verify;

import com.calypso.core.build.BuildProperties;
import com.calypso.core.model.GeneratedFile;
import com.calypso.sandbox.BuildSandbox;
import com.calypso.sandbox.CommandResult;
import com.calypso.sandbox.SandboxUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Checks that a generated tree builds: materializes it into a fresh working directory,
 * runs the install command and then the build command in a {@link BuildSandbox}, each under
 * its own timeout, and classifies the result.
 * <p>
 * A command timeout counts as a code failure, so the repair loop gets a chance at it.
 * A missing tool or exhausted disk or memory is an infrastructure failure. The working
 * directory is removed on every path.
 */
@Service
public class BuildVerifier {

    private static final Logger log = LoggerFactory.getLogger(BuildVerifier.class);

    static final String WORKSPACE_PREFIX = "calypso-build-";

    /** {@code spawn npm ENOENT} and the like: the tool itself is missing, not a project file. */
    private static final Pattern SPAWN_ENOENT = Pattern.compile("spawn\\s+\\S+\\s+ENOENT");

    private static final int EXIT_COMMAND_NOT_FOUND = 127;

    private final BuildSandbox sandbox;
    private final Path workspaceRoot;
    private final String installCommand;
    private final String buildCommand;
    private final Duration installTimeout;
    private final Duration buildTimeout;
    private final int diagnosticsLimit;

    @Autowired
    public BuildVerifier(BuildSandbox sandbox, BuildProperties properties) {
        this(sandbox, Path.of(properties.getWorkspaceRoot()), properties.getInstallCommand(),
                properties.getBuildCommand(), properties.installTimeout(), properties.buildTimeout(),
                properties.getDiagnosticsLimit());
    }

    BuildVerifier(BuildSandbox sandbox, Path workspaceRoot, String installCommand, String buildCommand,
                  Duration installTimeout, Duration buildTimeout, int diagnosticsLimit) {
        this.sandbox = sandbox;
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        this.installCommand = installCommand;
        this.buildCommand = buildCommand;
        this.installTimeout = installTimeout;
        this.buildTimeout = buildTimeout;
        this.diagnosticsLimit = diagnosticsLimit;
    }

    /**
     * Verifies {@code files} in an isolated working directory.
     */
    public VerificationResult verify(List<GeneratedFile> files) {
        Path workspace;
        try {
            Files.createDirectories(workspaceRoot);
            workspace = Files.createTempDirectory(workspaceRoot, WORKSPACE_PREFIX);
        } catch (IOException e) {
            log.warn("Cannot create build workspace under {}: {}", workspaceRoot, e.getMessage());
            return VerificationResult.infraFailure(truncate("Cannot create workspace: " + e.getMessage()));
        }

        log.info("Verifying {} files in {} via {} sandbox", files.size(), workspace, sandbox.name());
        try {
            VerificationResult written = materialize(workspace, files);
            if (written != null) {
                return written;
            }
            VerificationResult install = runStep(workspace, installCommand, installTimeout);
            if (install != null) {
                return install;
            }
            VerificationResult build = runStep(workspace, buildCommand, buildTimeout);
            return build != null ? build : VerificationResult.passed();
        } finally {
            deleteQuietly(workspace);
        }
    }

    /** Returns a failure result when the files cannot be written, else {@code null}. */
    private VerificationResult materialize(Path workspace, List<GeneratedFile> files) {
        for (GeneratedFile file : files) {
            Path target = workspace.resolve(file.path()).normalize();
            if (!target.startsWith(workspace) || target.equals(workspace)) {
                return VerificationResult.codeFailure("Invalid file path outside the project: " + file.path());
            }
            try {
                Files.createDirectories(target.getParent());
                Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                String message = "Cannot write " + file.path() + ": " + e.getMessage();
                if (isInfraMessage(message)) {
                    return VerificationResult.infraFailure(truncate(message));
                }
                return VerificationResult.codeFailure(truncate(message));
            }
        }
        return null;
    }

    /** Runs one command; {@code null} when it succeeded. */
    private VerificationResult runStep(Path workspace, String command, Duration timeout) {
        CommandResult result;
        try {
            result = sandbox.run(workspace, command, timeout);
        } catch (SandboxUnavailableException e) {
            log.warn("Build verification unavailable: {}", e.getMessage());
            return VerificationResult.infraFailure(truncate(e.getMessage()));
        }
        if (result.succeeded()) {
            return null;
        }
        if (result.timedOut()) {
            log.info("'{}' timed out after {}s", command, timeout.toSeconds());
            return VerificationResult.codeFailure(truncate(
                    "'" + command + "' timed out after " + timeout.toSeconds() + "s\n" + result.output()));
        }
        if (result.outOfMemory()) {
            return VerificationResult.infraFailure(truncate("ENOMEM: '" + command + "' was killed at its memory limit"));
        }
        if (isInfraFailure(result)) {
            log.warn("Build verification unavailable for '{}' (exit {})", command, result.exitCode());
            return VerificationResult.infraFailure(truncate(result.output()));
        }
        log.info("'{}' failed with exit code {}", command, result.exitCode());
        return VerificationResult.codeFailure(truncate(result.output()));
    }

    static boolean isInfraFailure(CommandResult result) {
        return result.exitCode() == EXIT_COMMAND_NOT_FOUND || isInfraMessage(result.output());
    }

    static boolean isInfraMessage(String output) {
        if (output == null) {
            return false;
        }
        return output.contains("command not found")
                || output.contains("ENOSPC")
                || output.contains("ENOMEM")
                || output.contains("No space left on device")
                || SPAWN_ENOENT.matcher(output).find();
    }

    String truncate(String diagnostics) {
        if (diagnostics == null) {
            return "";
        }
        return diagnostics.length() <= diagnosticsLimit ? diagnostics : diagnostics.substring(0, diagnosticsLimit);
    }

    private static void deleteQuietly(Path workspace) {
        try (Stream<Path> walk = Files.walk(workspace)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
            });
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to remove build workspace {}: {}", workspace, e.getMessage());
        }
    }
}
