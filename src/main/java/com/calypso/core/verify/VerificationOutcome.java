package com.calypso.core.verify;

public enum VerificationOutcome {
    /** Install and build both succeeded. */
    PASSED,
    /** The generated code does not build; diagnostics say why. */
    CODE_FAILURE,
    /** The sandbox could not verify at all. Not evidence against the code. */
    INFRA_FAILURE
}
