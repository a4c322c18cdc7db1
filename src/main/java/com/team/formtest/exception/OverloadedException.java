package com.team.formtest.exception;

public class OverloadedException extends RuntimeException {

    public OverloadedException(String message, Throwable cause) {
        super(message, cause);
    }
}
