package com.calypso.core.repair;

import com.calypso.core.build.BuildProperties;
import com.calypso.core.deadline.DeadlineGuard;
import com.calypso.core.events.BuildEvent;
import com.calypso.core.events.EventBus;
import com.calypso.core.extract.StreamingFileExtractor;
import com.calypso.core.llm.CodeGenerationClient;
import com.calypso.core.metrics.CalypsoMetrics;
import com.calypso.core.model.GeneratedFile;
import com.calypso.core.verify.BuildVerifier;
import com.calypso.core.verify.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Bounded verify→fix loop.
 * <p>
 * Each round verifies the current files. A pass or an infrastructure failure ends the loop.
 * A code failure with rounds left triggers one repair call asking only for the files that
 * must change; those are merged by path into the current set. The last round never issues a
 * repair call, so at most {@code maxFixIterations - 1} repair calls happen per build. When
 * rounds run out, the best files so far are returned marked unverified.
 */
@Service
public class RepairLoop {

    private static final Logger log = LoggerFactory.getLogger(RepairLoop.class);

    static final String FIX_SYSTEM_PROMPT = """
            You are an expert developer. You will be given a project that failed to build along with \
            the build error output. Fix ONLY the files that have errors. Output each fixed file using \
            this exact format:

            ===FILE: path/to/file===
            fixed content
            ===END FILE===

            Do NOT output files that don't need changes. Do NOT add explanations outside of file markers.""";

    private final BuildVerifier verifier;
    private final CodeGenerationClient client;
    private final EventBus eventBus;
    private final CalypsoMetrics metrics;
    private final int maxFixIterations;
    private final int eventDiagnosticsLimit;

    public RepairLoop(BuildVerifier verifier, CodeGenerationClient client, EventBus eventBus,
                      CalypsoMetrics metrics, BuildProperties properties) {
        this.verifier = verifier;
        this.client = client;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxFixIterations = Math.max(1, properties.getMaxFixIterations());
        this.eventDiagnosticsLimit = properties.getEventDiagnosticsLimit();
    }

    /**
     * Runs the rounds for one build, publishing progress to the build's event stream.
     *
     * @param cancelled polled before each round; the loop stops when it turns true
     */
    public RepairResult run(String buildId, List<GeneratedFile> files, DeadlineGuard deadline,
                            BooleanSupplier cancelled) {
        List<GeneratedFile> current = new ArrayList<>(files);
        int rounds = 0;
        int fixCalls = 0;
        boolean sawCodeFailure = false;

        for (int iteration = 1; iteration <= maxFixIterations; iteration++) {
            if (cancelled.getAsBoolean()) {
                return finish(buildId, current, verdictSoFar(sawCodeFailure), rounds, fixCalls,
                        RepairResult.StopReason.CANCELLED);
            }
            if (!deadline.canContinue()) {
                log.info("Deadline reached before verification round {}", iteration);
                metrics.incrementDeadlineAborts("verify");
                return finish(buildId, current, verdictSoFar(sawCodeFailure), rounds, fixCalls,
                        RepairResult.StopReason.DEADLINE);
            }
            try {
                publish(buildId, BuildEvent.VERIFY, Map.of(
                        "message", iteration == 1 ? "Installing dependencies..." : "Re-checking build...",
                        "iteration", iteration));

                VerificationResult result = verifier.verify(current);
                rounds++;
                metrics.recordVerification(result.outcome().name().toLowerCase());

                if (result.isPassed()) {
                    publish(buildId, BuildEvent.VERIFY, Map.of("message", "Build passed!", "iteration", iteration));
                    return finish(buildId, current, true, rounds, fixCalls, RepairResult.StopReason.PASSED);
                }
                if (result.isInfraFailure()) {
                    log.warn("Build verification unavailable, accepting files unverified: {}", result.diagnostics());
                    return finish(buildId, current, null, rounds, fixCalls,
                            RepairResult.StopReason.INFRA_UNAVAILABLE);
                }

                sawCodeFailure = true;
                String diagnostics = result.diagnostics();
                publish(buildId, BuildEvent.VERIFY_FAILED, Map.of(
                        "errors", head(diagnostics, eventDiagnosticsLimit),
                        "iteration", iteration,
                        "maxIterations", maxFixIterations));

                if (iteration == maxFixIterations) {
                    return finish(buildId, current, false, rounds, fixCalls,
                            RepairResult.StopReason.ROUNDS_EXHAUSTED);
                }
                if (cancelled.getAsBoolean()) {
                    return finish(buildId, current, false, rounds, fixCalls, RepairResult.StopReason.CANCELLED);
                }
                if (!deadline.canContinue()) {
                    log.info("Deadline reached before repair call {}", iteration);
                    metrics.incrementDeadlineAborts("repair");
                    return finish(buildId, current, false, rounds, fixCalls, RepairResult.StopReason.DEADLINE);
                }

                publish(buildId, BuildEvent.FIXING, Map.of("iteration", iteration));
                String response = client.requestFixes(FIX_SYSTEM_PROMPT, fixUserPrompt(diagnostics, current));
                fixCalls++;
                List<GeneratedFile> fixes = StreamingFileExtractor.parseClosed(response);
                if (fixes.isEmpty()) {
                    log.info("Repair call {} returned no files, stopping", fixCalls);
                    return finish(buildId, current, false, rounds, fixCalls, RepairResult.StopReason.EMPTY_FIX);
                }

                current = GeneratedFile.mergeByPath(current, fixes);
                log.info("Merged {} fixed file(s): {}", fixes.size(),
                        fixes.stream().map(GeneratedFile::path).collect(Collectors.joining(", ")));
                for (GeneratedFile fixed : fixes) {
                    publish(buildId, BuildEvent.FILE_COMPLETE, Map.of(
                            "path", fixed.path(), "content", fixed.content()));
                }
            } catch (RuntimeException e) {
                log.error("Build verification error in round {}", iteration, e);
                return finish(buildId, current, verdictSoFar(sawCodeFailure), rounds, fixCalls,
                        RepairResult.StopReason.ERROR);
            }
        }
        return finish(buildId, current, false, rounds, fixCalls, RepairResult.StopReason.ROUNDS_EXHAUSTED);
    }

    static String fixUserPrompt(String diagnostics, List<GeneratedFile> files) {
        String tree = files.stream()
                .map(f -> "===FILE: " + f.path() + "===\n" + f.content() + "\n" + StreamingFileExtractor.END_MARKER)
                .collect(Collectors.joining("\n\n"));
        return "BUILD ERRORS:\n\n" + diagnostics
                + "\n\nPROJECT FILES:\n\n" + tree
                + "\n\nFix the build errors. Output ONLY the changed files.";
    }

    private RepairResult finish(String buildId, List<GeneratedFile> files, Boolean verified, int rounds,
                                int fixCalls, RepairResult.StopReason reason) {
        if (Boolean.FALSE.equals(verified)) {
            publish(buildId, BuildEvent.VERIFY, Map.of(
                    "message", "Could not fully resolve build errors. Files may need manual fixes."));
        }
        log.info("Repair loop stopped: {} after {} round(s), {} fix call(s)", reason, rounds, fixCalls);
        return new RepairResult(files, verified, rounds, fixCalls, reason);
    }

    private void publish(String buildId, String type, Map<String, Object> payload) {
        eventBus.publish(BuildEvent.of(type, buildId, new LinkedHashMap<>(payload)));
    }

    private static Boolean verdictSoFar(boolean sawCodeFailure) {
        return sawCodeFailure ? Boolean.FALSE : null;
    }

    private static String head(String text, int limit) {
        return text.length() <= limit ? text : text.substring(0, limit);
    }
}
