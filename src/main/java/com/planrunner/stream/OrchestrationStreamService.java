package com.planrunner.stream;

import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStep;
import com.planrunner.orchestration.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Translates plan progress into stream events and keeps the hub's plan state in step with them.
 */
@Component
public class OrchestrationStreamService {
    static final int CHUNK_SIZE = 600;

    private final OrchestrationStreamHub hub;

    public OrchestrationStreamService(OrchestrationStreamHub hub) {
        this.hub = hub;
    }

    public String createRun() {
        return hub.createRun();
    }

    public boolean cancelRun(String runId) {
        return hub.cancelRun(runId);
    }

    public boolean isCancelled(String runId) {
        return hub.isCancelled(runId);
    }

    public void emitStatus(String runId, String message) {
        hub.publish(runId, StreamEventType.STATUS, Map.of("message", message));
    }

    public void emitPlanStatus(String runId, Plan plan) {
        PlanSnapshot snapshot = PlanSnapshot.of(plan);
        hub.publish(runId, StreamEventType.PLAN_STATUS, snapshot, run -> run.bind(snapshot));
    }

    public void emitStepsAdded(String runId, List<PlanStep> steps) {
        List<StepState> added = steps.stream().map(StepState::of).toList();
        hub.publish(runId, StreamEventType.STEPS_ADDED, new StepsAdded(added), run -> run.stepsAdded(added));
    }

    public void emitStepStart(String runId, PlanStep step) {
        StepState state = StepState.of(step);
        hub.publish(runId, StreamEventType.STEP_START, state, run -> run.stepUpdated(state));
    }

    /**
     * Emits the step result, splitting long content into ordered chunks. Step state is updated with the last chunk.
     */
    public void emitStepComplete(String runId, PlanStep step) {
        StepState state = StepState.of(step);
        ToolResult result = step.getToolResult();
        boolean success = result != null && result.success();
        String content = result == null ? "" : result.content();
        if (content.isEmpty()) {
            hub.publish(runId, StreamEventType.STEP_COMPLETE, new StepChunk(state, success, "", 0, true),
                    run -> run.stepUpdated(state));
            return;
        }
        int sequence = 0;
        for (int index = 0; index < content.length(); index += CHUNK_SIZE) {
            int end = Math.min(content.length(), index + CHUNK_SIZE);
            boolean done = end >= content.length();
            hub.publish(runId, StreamEventType.STEP_COMPLETE,
                    new StepChunk(state, success, content.substring(index, end), sequence++, done),
                    done ? run -> run.stepUpdated(state) : null);
        }
    }

    public void emitConsolidated(String runId, PlanStep step, int removedSteps) {
        StepState state = StepState.of(step);
        hub.publish(runId, StreamEventType.CONSOLIDATED, new ConsolidatedRange(state, removedSteps),
                run -> run.consolidated(state, removedSteps));
    }

    public void emitFinalAnswer(String runId, String finalAnswer) {
        hub.publish(runId, StreamEventType.FINAL, Map.of("finalAnswer", finalAnswer));
    }

    public void emitRunComplete(String runId, String status) {
        hub.publish(runId, StreamEventType.RUN_COMPLETE, Map.of("status", status));
    }

    public void emitError(String runId, String message) {
        hub.publish(runId, StreamEventType.ERROR, Map.of("message", message == null ? "Unknown error" : message));
    }

    public record StepsAdded(List<StepState> steps) {
    }

    public record StepChunk(StepState step, boolean success, String chunk, int sequence, boolean done) {
    }

    public record ConsolidatedRange(StepState step, int removedSteps) {
    }
}
