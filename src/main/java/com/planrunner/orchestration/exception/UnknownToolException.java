package com.planrunner.orchestration.exception;

public class UnknownToolException extends PlanValidationException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown or unregistered tool: '" + toolName + "'");
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
