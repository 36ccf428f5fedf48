package com.calypso.core.verify;

/**
 * @param diagnostics build output explaining a failure, truncated; empty on success
 */
public record VerificationResult(VerificationOutcome outcome, String diagnostics) {

    public static VerificationResult passed() {
        return new VerificationResult(VerificationOutcome.PASSED, "");
    }

    public static VerificationResult codeFailure(String diagnostics) {
        return new VerificationResult(VerificationOutcome.CODE_FAILURE, diagnostics);
    }

    public static VerificationResult infraFailure(String diagnostics) {
        return new VerificationResult(VerificationOutcome.INFRA_FAILURE, diagnostics);
    }

    public boolean isPassed() {
        return outcome == VerificationOutcome.PASSED;
    }

    public boolean isCodeFailure() {
        return outcome == VerificationOutcome.CODE_FAILURE;
    }

    public boolean isInfraFailure() {
        return outcome == VerificationOutcome.INFRA_FAILURE;
    }
}
