package com.planrunner.orchestration.model;

import com.planrunner.tools.ToolName;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One tool-bound unit of work inside a {@link Plan}.
 * DONE and FAILED are terminal: a step is never re-run in place.
 */
public class PlanStep {

    public static final String CONSOLIDATED_PREFIX = "CONSOLIDATED: ";

    private final UUID id;
    private int order;
    private final ToolName stepToolName;
    private final String stepInstruction;
    private final Map<String, Object> parameters;
    private StepStatus status;
    private ToolResult toolResult;

    private PlanStep(UUID id, int order, ToolName stepToolName, String stepInstruction,
                     Map<String, Object> parameters, StepStatus status, @Nullable ToolResult toolResult) {
        this.id = id;
        this.order = order;
        this.stepToolName = stepToolName;
        this.stepInstruction = stepInstruction;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.status = status;
        this.toolResult = toolResult;
    }

    public static PlanStep pending(int order, ToolName toolName, String instruction, Map<String, Object> parameters) {
        return new PlanStep(UUID.randomUUID(), order, toolName, instruction,
                parameters == null ? Map.of() : parameters, StepStatus.PENDING, null);
    }

    public static PlanStep consolidated(int order, String summary) {
        ToolResult result = ToolResult.success(ToolName.CONSOLIDATE_STEPS.name(), summary, summary);
        return new PlanStep(UUID.randomUUID(), order, ToolName.CONSOLIDATE_STEPS,
                CONSOLIDATED_PREFIX + summary, Map.of(), StepStatus.DONE, result);
    }

    public UUID getId() {
        return id;
    }

    public int getOrder() {
        return order;
    }

    void setOrder(int order) {
        this.order = order;
    }

    public ToolName getStepToolName() {
        return stepToolName;
    }

    public String getStepInstruction() {
        return stepInstruction;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public StepStatus getStatus() {
        return status;
    }

    public @Nullable ToolResult getToolResult() {
        return toolResult;
    }

    public void markRunning() {
        if (status != StepStatus.PENDING) {
            throw new IllegalStateException("Step " + order + " cannot start from status " + status);
        }
        status = StepStatus.RUNNING;
    }

    /**
     * Records the tool outcome. A failed result moves the step to FAILED, otherwise DONE.
     */
    public void complete(ToolResult result) {
        if (status != StepStatus.RUNNING) {
            throw new IllegalStateException("Step " + order + " cannot complete from status " + status);
        }
        this.toolResult = result;
        this.status = result.success() ? StepStatus.DONE : StepStatus.FAILED;
    }

    public boolean isConsolidated() {
        return stepToolName == ToolName.CONSOLIDATE_STEPS;
    }

    @Override
    public String toString() {
        return "PlanStep[" + order + ", " + stepToolName + ", " + status + "]";
    }
}
