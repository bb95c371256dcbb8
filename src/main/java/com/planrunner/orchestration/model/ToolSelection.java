package com.planrunner.orchestration.model;

import java.util.Map;

/**
 * Tool chosen for one requirement. {@code reasoning} is kept for the audit log only.
 */
public record ToolSelection(
        String toolName,
        String reasoning,
        Map<String, Object> parameters
) {
    public ToolSelection {
        parameters = parameters == null ? Map.of() : parameters;
    }
}
