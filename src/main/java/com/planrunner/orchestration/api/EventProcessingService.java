package com.planrunner.orchestration.api;

import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStep;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Service interface for emitting plan progress events to a stream.
 * Every method is a no-op when no stream id is given.
 */
public interface EventProcessingService {

    /**
     * Checks if a given stream has been cancelled.
     *
     * @param streamId The ID of the stream to check.
     * @return {@code true} if the stream is cancelled, {@code false} otherwise.
     */
    boolean isCancelled(@Nullable String streamId);

    /**
     * Emits a status update to a specified stream.
     *
     * @param streamId The ID of the stream to emit to.
     * @param status The status message to emit.
     */
    void emitStatus(@Nullable String streamId, String status);

    /**
     * Emits the plan's current status and step counts.
     *
     * @param streamId The ID of the stream to emit to.
     * @param plan The plan whose status changed.
     */
    void emitPlanStatus(@Nullable String streamId, Plan plan);

    /**
     * Emits the steps appended after a reasoning round.
     *
     * @param streamId The ID of the stream to emit to.
     * @param steps The new PENDING steps.
     */
    void emitStepsAdded(@Nullable String streamId, List<PlanStep> steps);

    /**
     * Emits a step start event.
     *
     * @param streamId The ID of the stream to emit to.
     * @param step The step that moved to RUNNING.
     */
    void emitStepStart(@Nullable String streamId, PlanStep step);

    /**
     * Emits a step completion event, successful or not.
     *
     * @param streamId The ID of the stream to emit to.
     * @param step The step that reached DONE or FAILED.
     */
    void emitStepComplete(@Nullable String streamId, PlanStep step);

    /**
     * Emits a consolidation event.
     *
     * @param streamId The ID of the stream to emit to.
     * @param step The synthetic step that replaced the range.
     * @param removedSteps Number of steps the range held.
     */
    void emitConsolidated(@Nullable String streamId, PlanStep step, int removedSteps);

    /**
     * Emits the final answer to a specified stream.
     *
     * @param streamId The ID of the stream to emit to.
     * @param answer The rendered final message.
     */
    void emitFinalAnswer(@Nullable String streamId, String answer);

    /**
     * Emits a run completion event to a specified stream.
     *
     * @param streamId The ID of the stream to emit to.
     * @param status The final status of the run.
     */
    void emitRunComplete(@Nullable String streamId, String status);

    /**
     * Emits an error message to a specified stream.
     *
     * @param streamId The ID of the stream to emit to.
     * @param message The error message to emit.
     */
    void emitError(@Nullable String streamId, String message);
}
