package com.planrunner.orchestration.model;

public record Requirement(String description) {
}
