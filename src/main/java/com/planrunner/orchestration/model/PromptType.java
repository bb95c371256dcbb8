package com.planrunner.orchestration.model;

public enum PromptType {
    TASK_INTAKE("task-intake"),
    PLANNER_REQUIREMENTS("planner-requirements"),
    TOOL_REASONING("tool-reasoning"),
    CONTEXT_COMPACTION("context-compaction"),
    FINALIZER_ANSWER("finalizer-answer"),
    ANALYSIS_REASONING("analysis-reasoning");

    private final String purpose;

    PromptType(String purpose) {
        this.purpose = purpose;
    }

    public String purpose() {
        return purpose;
    }

    public String retryPurpose() {
        return purpose + "-retry";
    }
}
