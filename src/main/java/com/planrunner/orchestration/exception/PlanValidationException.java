package com.planrunner.orchestration.exception;

/**
 * Rejected input: bad consolidation range, blank required field, unknown tool or unusable parameters.
 * Raised before anything is mutated.
 */
public class PlanValidationException extends RuntimeException {

    public PlanValidationException(String message) {
        super(message);
    }

    public PlanValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
