package com.planrunner.stream;

import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * One buffered progress event. {@code id} increases per run and is the replay cursor for reconnecting clients.
 * Plan and correlation ids are set once the run has reported its plan.
 */
public record StreamEvent(
        long id,
        String runId,
        @Nullable String planId,
        @Nullable String correlationId,
        Instant timestamp,
        StreamEventType type,
        Object data
) {
}
