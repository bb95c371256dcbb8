package com.planrunner.orchestration.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds step instruction text: the requirement description, then a {@code key: value} parameter listing,
 * so text tools receive both intent and arguments.
 */
@Component
@RequiredArgsConstructor
public class StepInstructionFormatter {

    private final JsonProcessingService jsonProcessingService;

    public String format(String description, Map<String, Object> parameters) {
        if (parameters == null || parameters.isEmpty()) {
            return description;
        }
        StringBuilder sb = new StringBuilder(description).append("\nParameters:");
        parameters.forEach((key, value) -> sb.append("\n").append(key).append(": ").append(renderValue(value)));
        return sb.toString();
    }

    private String renderValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return jsonProcessingService.toCompactJson(value);
    }
}
