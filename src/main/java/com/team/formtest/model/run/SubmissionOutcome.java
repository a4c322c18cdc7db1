package com.team.formtest.model.run;

/**
 * What the page shows after the submit action.
 */
public enum SubmissionOutcome {
    SUCCESS,
    VALIDATION_ERROR,
    UNKNOWN
}
