package com.planrunner.tools;

import java.util.Map;

/**
 * Everything the registry needs to invoke a tool for one step, whichever shape the tool has.
 */
public record ToolRequest(String instruction, Map<String, Object> parameters, String stepContext) {

    public ToolRequest {
        instruction = instruction == null ? "" : instruction;
        parameters = parameters == null ? Map.of() : parameters;
        stepContext = stepContext == null ? "" : stepContext;
    }
}
