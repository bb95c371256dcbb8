package com.planrunner.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IntakeResponse(
        String originalLanguage,
        String englishText,
        List<String> questionChecklist,
        List<String> initialKnowledgeQueries
) {
}
