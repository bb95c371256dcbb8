package com.planrunner.orchestration.model;

/**
 * Outcome handed back to callers once a plan has been finalized.
 */
public record ExecutionResult(Plan plan, String message) {
}
