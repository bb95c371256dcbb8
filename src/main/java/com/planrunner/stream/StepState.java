package com.planrunner.stream;

import com.planrunner.orchestration.model.PlanStep;
import com.planrunner.orchestration.model.ToolResult;
import org.springframework.lang.Nullable;

/**
 * Last known state of one step as seen by stream clients.
 */
public record StepState(
        String stepId,
        int order,
        String tool,
        String instruction,
        String status,
        @Nullable String summary,
        @Nullable String errorMessage
) {

    public static StepState of(PlanStep step) {
        ToolResult result = step.getToolResult();
        return new StepState(
                step.getId().toString(),
                step.getOrder(),
                step.getStepToolName().name(),
                step.getStepInstruction(),
                step.getStatus().name(),
                result != null ? result.summary() : null,
                result != null ? result.errorMessage() : null);
    }

    StepState withOrder(int newOrder) {
        return new StepState(stepId, newOrder, tool, instruction, status, summary, errorMessage);
    }
}
