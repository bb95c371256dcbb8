package com.planrunner.knowledge;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.UUID;

public record KnowledgeFragment(
        UUID id,
        String title,
        String content,
        @Nullable String source,
        String correlationId,
        Instant storedAt
) {
}
