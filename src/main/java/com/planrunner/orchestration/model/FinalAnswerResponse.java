package com.planrunner.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FinalAnswerResponse(String answer) {
}
