package com.planrunner.orchestration;

import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStep;
import com.planrunner.orchestration.model.ToolResult;
import com.planrunner.tools.ToolName;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class PlanFixtures {

    private PlanFixtures() {
    }

    public static Plan plan(String instruction) {
        return Plan.builder()
                .correlationId("corr-test")
                .originalInstruction(instruction)
                .build();
    }

    public static PlanStep pending(int order, ToolName tool) {
        return PlanStep.pending(order, tool, "step " + order, Map.of());
    }

    public static PlanStep done(int order, ToolName tool, String summary) {
        PlanStep step = pending(order, tool);
        step.markRunning();
        step.complete(ToolResult.success(tool.name(), summary, "output of step " + order));
        return step;
    }

    public static PlanStep failed(int order, ToolName tool, String error) {
        PlanStep step = pending(order, tool);
        step.markRunning();
        step.complete(ToolResult.failure(tool.name(), "Tool execution failed", error));
        return step;
    }

    /**
     * Plan with {@code count} finished steps, alternating web fetches and knowledge stores.
     */
    public static Plan planWithDoneSteps(int count) {
        Plan plan = plan("Compare the vendors");
        List<PlanStep> steps = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            steps.add(pending(i, i % 2 == 0 ? ToolName.DOCUMENT_FROM_WEB : ToolName.KNOWLEDGE_STORE));
        }
        plan.appendSteps(steps);
        for (PlanStep step : plan.getSteps()) {
            step.markRunning();
            step.complete(ToolResult.success(step.getStepToolName().name(), "summary " + step.getOrder(), "content"));
        }
        return plan;
    }

    public static List<Integer> orders(Plan plan) {
        return plan.getSteps().stream().map(PlanStep::getOrder).toList();
    }
}
