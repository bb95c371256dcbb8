package com.planrunner.tools;

import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.ToolResult;

import java.util.Map;

/**
 * Tool that reads its arguments out of free instruction text.
 */
public non-sealed interface TextTool extends PlanTool {

    String exampleInstruction();

    ToolResult execute(Plan plan, String taskDescription, String stepContext);

    @Override
    default Object exampleParameters() {
        return Map.of("instruction", exampleInstruction());
    }
}
