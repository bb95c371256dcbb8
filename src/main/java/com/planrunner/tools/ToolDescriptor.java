package com.planrunner.tools;

public record ToolDescriptor(
        String name,
        String description,
        String invocation,
        Object exampleParameters
) {
}
