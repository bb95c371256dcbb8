package com.planrunner.orchestration.model;

public enum StepStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
