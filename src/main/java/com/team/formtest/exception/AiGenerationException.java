package com.team.formtest.exception;

/**
 * The AI path could not produce test data. Callers fall back to rule-based generation.
 */
public class AiGenerationException extends RuntimeException {

    public AiGenerationException(String message) {
        super(message);
    }
}
