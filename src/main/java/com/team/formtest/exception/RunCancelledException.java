package com.team.formtest.exception;

import com.team.formtest.model.run.ErrorKind;

/**
 * Thrown at a suspension point once cancellation was requested or the run deadline passed.
 */
public class RunCancelledException extends RuntimeException {

    private final ErrorKind kind;

    public RunCancelledException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
