package com.planrunner.orchestration.model;

public record LlmResponse<T>(T result, String rawContent) {
}
