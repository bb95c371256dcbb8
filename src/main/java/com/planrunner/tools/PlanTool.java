package com.planrunner.tools;

/**
 * A capability a plan step can dispatch to. Tools come in two invocation shapes:
 * {@link StructuredTool} takes a typed parameter object, {@link TextTool} takes raw instruction text.
 * The registry pattern-matches on the shape when it dispatches.
 */
public sealed interface PlanTool permits StructuredTool, TextTool {

    ToolName name();

    String description();

    /**
     * Example parameters rendered into prompts so the model knows what to send.
     */
    Object exampleParameters();
}
