package com.planrunner.tools;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of tool identifiers a plan step can target.
 */
public enum ToolName {
    ANALYSIS_REASONING(true),
    DOCUMENT_FROM_WEB(true),
    KNOWLEDGE_STORE(true),
    KNOWLEDGE_SEARCH(true),
    PROJECT_EXPLORE_STRUCTURE(true),
    PROJECT_FILE_READ(true),
    // Marks steps produced by consolidation; never dispatched.
    CONSOLIDATE_STEPS(false);

    private final boolean dispatchable;

    ToolName(boolean dispatchable) {
        this.dispatchable = dispatchable;
    }

    public boolean isDispatchable() {
        return dispatchable;
    }

    /**
     * Exact, case-insensitive match after trimming. No prefix or fuzzy matching.
     */
    public static Optional<ToolName> fromIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        String normalized = identifier.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(name -> name.name().equals(normalized))
                .findFirst();
    }
}
