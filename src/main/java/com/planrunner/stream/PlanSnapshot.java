package com.planrunner.stream;

import com.planrunner.orchestration.model.Plan;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Plan status plus every step, in order. Sent with {@code plan-status} events and replayed to late subscribers.
 */
public record PlanSnapshot(
        String planId,
        String correlationId,
        String status,
        @Nullable String failureReason,
        List<StepState> steps
) {

    public static PlanSnapshot of(Plan plan) {
        return new PlanSnapshot(
                plan.getId().toString(),
                plan.getCorrelationId(),
                plan.getStatus().name(),
                plan.getFailureReason(),
                plan.getSteps().stream().map(StepState::of).toList());
    }
}
