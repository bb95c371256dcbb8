package com.planrunner.api;

import com.planrunner.orchestration.model.TaskCommand;
import com.planrunner.orchestration.model.WorkspaceScope;
import jakarta.validation.constraints.NotBlank;

public record TaskRequest(
        @NotBlank String instruction,
        String clientName,
        String clientDescription,
        String projectName,
        String projectDescription,
        Boolean quick,
        Boolean backgroundMode,
        String provider,
        String model
) {

    public TaskCommand toCommand() {
        return new TaskCommand(
                instruction.trim(),
                null,
                new WorkspaceScope(clientName, clientDescription, projectName, projectDescription),
                Boolean.TRUE.equals(quick),
                Boolean.TRUE.equals(backgroundMode),
                provider,
                model
        );
    }
}
