package com.planrunner.orchestration.model;

public enum PlanStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    FINALIZED;

    public boolean isTerminalForExecution() {
        return this != RUNNING;
    }
}
