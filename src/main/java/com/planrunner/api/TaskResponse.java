package com.planrunner.api;

import com.planrunner.orchestration.model.ExecutionResult;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStep;
import com.planrunner.orchestration.model.ToolResult;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record TaskResponse(
        String requestId,
        Instant createdAt,
        String planId,
        String correlationId,
        String status,
        String message,
        List<StepView> steps
) {

    public record StepView(
            int order,
            String tool,
            String instruction,
            String status,
            String summary,
            String errorMessage
    ) {
        static StepView from(PlanStep step) {
            ToolResult result = step.getToolResult();
            return new StepView(
                    step.getOrder(),
                    step.getStepToolName().name(),
                    step.getStepInstruction(),
                    step.getStatus().name(),
                    result != null ? result.summary() : null,
                    result != null ? result.errorMessage() : null
            );
        }
    }

    public static TaskResponse from(ExecutionResult result) {
        Plan plan = result.plan();
        return new TaskResponse(
                UUID.randomUUID().toString(),
                Instant.now(),
                plan.getId().toString(),
                plan.getCorrelationId(),
                plan.getStatus().name(),
                result.message(),
                plan.getSteps().stream().map(StepView::from).toList()
        );
    }
}
