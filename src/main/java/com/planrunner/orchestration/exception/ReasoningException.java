package com.planrunner.orchestration.exception;

/**
 * An LLM reasoning call failed, timed out or returned output that does not fit the expected schema.
 */
public class ReasoningException extends RuntimeException {

    public ReasoningException(String message) {
        super(message);
    }

    public ReasoningException(String message, Throwable cause) {
        super(message, cause);
    }
}
