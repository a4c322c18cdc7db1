package com.team.formtest.model.run;

/**
 * Why a run did not pass. Set together with the terminal status.
 */
public enum ErrorKind {
    REQUIRED_FIELD_FAILED,  // FAILED: a required field's action did not succeed
    OUTCOME_MISMATCH,       // FAILED: form accepted/rejected against the prediction
    SUBMISSION_UNKNOWN,     // ERRORED: submit missing or outcome indicator unreadable
    RUN_TIMEOUT,            // CANCELLED: executor timeout
    CANCELLED_BY_USER,      // CANCELLED: explicit cancel request
    OVERLOADED,             // ERRORED: run queue full at submission
    INFRASTRUCTURE          // ERRORED: unexpected exception in a phase
}
