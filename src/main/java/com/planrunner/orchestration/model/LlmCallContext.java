package com.planrunner.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.UUID;

/**
 * Per-call routing data threaded through every LLM request of a plan.
 */
public record LlmCallContext(
        String correlationId,
        @Nullable UUID planId,
        boolean quick,
        boolean backgroundMode,
        @Nullable String provider,
        @Nullable String model
) {

    public static LlmCallContext forPlan(Plan plan) {
        return new LlmCallContext(plan.getCorrelationId(), plan.getId(), plan.isQuick(), plan.isBackgroundMode(),
                plan.getProvider(), plan.getModel());
    }
}
