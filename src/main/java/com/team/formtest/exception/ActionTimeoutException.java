package com.team.formtest.exception;

/**
 * A browser action did not complete within its timeout.
 */
public class ActionTimeoutException extends RuntimeException {

    public ActionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
