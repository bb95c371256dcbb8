package com.planrunner.api;

import java.time.Instant;

public record TaskStreamResponse(
        String runId,
        Instant createdAt
) {
}
