package com.team.formtest.exception;

/**
 * The submission outcome cannot be judged: the submit control is unusable or the
 * page shows neither a success nor a validation-error indicator.
 */
public class SubmissionUnknownException extends RuntimeException {

    public SubmissionUnknownException(String message) {
        super(message);
    }
}
