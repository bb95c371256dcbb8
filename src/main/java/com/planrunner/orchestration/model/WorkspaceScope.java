package com.planrunner.orchestration.model;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

public record WorkspaceScope(
        @Nullable String clientName,
        @Nullable String clientDescription,
        @Nullable String projectName,
        @Nullable String projectDescription
) {

    public static WorkspaceScope empty() {
        return new WorkspaceScope(null, null, null, null);
    }

    public String describeClient() {
        return describe(clientName, clientDescription, "No client selected.");
    }

    public String describeProject() {
        return describe(projectName, projectDescription, "No project selected.");
    }

    private static String describe(@Nullable String name, @Nullable String description, String fallback) {
        if (!StringUtils.hasText(name)) {
            return fallback;
        }
        if (!StringUtils.hasText(description)) {
            return name.trim();
        }
        return name.trim() + ": " + description.trim();
    }
}
