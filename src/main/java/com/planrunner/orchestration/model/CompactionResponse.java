package com.planrunner.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CompactionResponse(List<CompactionRange> compactionRanges) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CompactionRange(int fromStep, int toStep, String summary) {
    }
}
