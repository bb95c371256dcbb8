package com.planrunner.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.planrunner.config.PlanRunnerProperties;
import com.planrunner.orchestration.exception.PlanValidationException;
import com.planrunner.orchestration.exception.UnknownToolException;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Table of dispatchable tools, built once at startup and read-only afterwards,
 * so it can be shared by every plan running concurrently.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<ToolName, PlanTool> tools;
    private final ObjectMapper objectMapper;

    public ToolRegistry(List<PlanTool> candidates, PlanRunnerProperties properties, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        Set<String> disabled = properties.getTools().getDisabled().stream()
                .map(value -> value.trim().toUpperCase())
                .collect(Collectors.toSet());
        EnumMap<ToolName, PlanTool> table = new EnumMap<>(ToolName.class);
        for (PlanTool tool : candidates) {
            ToolName name = tool.name();
            if (!name.isDispatchable()) {
                throw new IllegalStateException("Tool " + name + " cannot be registered for dispatch.");
            }
            if (disabled.contains(name.name())) {
                log.info("Tool {} disabled by configuration.", name);
                continue;
            }
            PlanTool previous = table.putIfAbsent(name, tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool registration for " + name + ": "
                        + previous.getClass().getSimpleName() + " and " + tool.getClass().getSimpleName());
            }
        }
        this.tools = Collections.unmodifiableMap(table);
        log.info("Registered {} tools: {}.", tools.size(), tools.keySet());
    }

    /**
     * Resolves a model-supplied identifier against the registered tools only.
     */
    public Optional<ToolName> resolve(String identifier) {
        return ToolName.fromIdentifier(identifier).filter(tools::containsKey);
    }

    public ToolName require(String identifier) {
        return resolve(identifier).orElseThrow(() -> new UnknownToolException(identifier));
    }

    public boolean isRegistered(ToolName name) {
        return tools.containsKey(name);
    }

    Set<ToolName> registeredNames() {
        return tools.keySet();
    }

    public List<ToolDescriptor> describeTools() {
        return tools.values().stream()
                .map(tool -> new ToolDescriptor(tool.name().name(), tool.description(),
                        tool instanceof StructuredTool<?> ? "structured" : "text",
                        tool.exampleParameters()))
                .toList();
    }

    /**
     * Tool catalog as rendered into reasoning prompts.
     */
    public String renderCatalog() {
        StringBuilder sb = new StringBuilder();
        for (PlanTool tool : tools.values()) {
            sb.append("- ").append(tool.name().name()).append(": ").append(tool.description()).append("\n");
            sb.append("  parameters example: ").append(renderExample(tool)).append("\n");
        }
        return sb.toString().trim();
    }

    public ToolResult execute(ToolName name, Plan plan, ToolRequest request) {
        PlanTool tool = tools.get(name);
        if (tool == null) {
            throw new UnknownToolException(name.name());
        }
        if (tool instanceof StructuredTool<?> structured) {
            return executeStructured(structured, plan, request);
        }
        if (tool instanceof TextTool textTool) {
            return textTool.execute(plan, request.instruction(), request.stepContext());
        }
        throw new IllegalStateException("Unsupported tool shape: " + tool.getClass().getName());
    }

    private <T> ToolResult executeStructured(StructuredTool<T> tool, Plan plan, ToolRequest request) {
        T payload;
        try {
            payload = objectMapper.convertValue(request.parameters(), tool.requestType());
        } catch (IllegalArgumentException ex) {
            throw new PlanValidationException("Parameters for " + tool.name() + " do not match "
                    + tool.requestType().getSimpleName() + ": " + ex.getMessage(), ex);
        }
        return tool.execute(plan, payload);
    }

    private String renderExample(PlanTool tool) {
        try {
            return objectMapper.writeValueAsString(tool.exampleParameters());
        } catch (JsonProcessingException ex) {
            log.warn("Failed to render example parameters for {}: {}", tool.name(), ex.getMessage());
            return "{}";
        }
    }
}
