package com.planrunner.orchestration.model;

import org.springframework.lang.Nullable;

/**
 * A validated request to run one instruction as a plan.
 */
public record TaskCommand(
        String instruction,
        @Nullable String correlationId,
        WorkspaceScope workspace,
        boolean quick,
        boolean backgroundMode,
        @Nullable String provider,
        @Nullable String model
) {
}
