package com.team.formtest.exception;

/**
 * The page refused a value, e.g. a select without the requested option.
 */
public class ValueRejectedException extends RuntimeException {

    public ValueRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
