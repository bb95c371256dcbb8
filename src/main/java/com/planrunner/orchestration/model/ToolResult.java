package com.planrunner.orchestration.model;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Uniform envelope returned by every tool call.
 */
public record ToolResult(
        boolean success,
        String toolName,
        String summary,
        String content,
        @Nullable String errorMessage
) {

    public ToolResult {
        if (!success && !StringUtils.hasText(summary)) {
            throw new IllegalArgumentException("Failed tool result for " + toolName + " requires a summary.");
        }
        summary = summary == null ? "" : summary;
        content = content == null ? "" : content;
    }

    public static ToolResult success(String toolName, String summary, String content) {
        return new ToolResult(true, toolName, summary, content, null);
    }

    public static ToolResult failure(String toolName, String summary, @Nullable String errorMessage) {
        return new ToolResult(false, toolName, summary, "", errorMessage);
    }
}
