package com.planrunner.stream;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Progress event kinds. The wire name is what WebSocket clients switch on.
 */
public enum StreamEventType {
    STATUS("status"),
    SNAPSHOT("snapshot"),
    PLAN_STATUS("plan-status"),
    STEPS_ADDED("steps-added"),
    STEP_START("step-start"),
    STEP_COMPLETE("step-complete"),
    CONSOLIDATED("consolidated"),
    FINAL("final"),
    RUN_COMPLETE("run-complete"),
    ERROR("error"),
    RUN_CANCEL("run-cancel");

    private final String wireName;

    StreamEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == RUN_COMPLETE || this == ERROR;
    }

    /**
     * Events still accepted after a cancel request.
     */
    boolean closesCancelledRun() {
        return this == RUN_CANCEL || isTerminal();
    }
}
