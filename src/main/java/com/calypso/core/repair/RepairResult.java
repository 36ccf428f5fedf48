package com.calypso.core.repair;

import com.calypso.core.model.GeneratedFile;

import java.util.List;

/**
 * Outcome of the verify/fix rounds for one build.
 *
 * @param files      best file set known when the loop stopped
 * @param verified   {@code true} if the files built, {@code false} if they still fail,
 *                   {@code null} if verification never produced a verdict
 * @param rounds     verification rounds run
 * @param fixCalls   repair model calls issued
 * @param stopReason why the loop stopped
 */
public record RepairResult(
    List<GeneratedFile> files,
    Boolean verified,
    int rounds,
    int fixCalls,
    StopReason stopReason
) {

    public RepairResult {
        files = List.copyOf(files);
    }

    public enum StopReason {
        PASSED,
        INFRA_UNAVAILABLE,
        ROUNDS_EXHAUSTED,
        EMPTY_FIX,
        DEADLINE,
        CANCELLED,
        ERROR,
        SKIPPED
    }

    public static RepairResult skipped(List<GeneratedFile> files) {
        return new RepairResult(files, null, 0, 0, StopReason.SKIPPED);
    }
}
