package com.planrunner.orchestration.service;

import static com.planrunner.orchestration.OrchestrationConstants.*;

import com.planrunner.config.PlanRunnerProperties;
import com.planrunner.orchestration.model.PromptType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrchestrationPromptService {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private final PlanRunnerProperties properties;

    public String systemPrompt(PromptType type, @Nullable String outputLanguage) {
        String basePrompt = switch (type) {
            case TASK_INTAKE -> TASK_INTAKE_SYSTEM_PROMPT;
            case PLANNER_REQUIREMENTS -> PLANNER_SYSTEM_PROMPT.formatted(properties.getMaxRequirementsPerBatch());
            case TOOL_REASONING -> TOOL_REASONING_SYSTEM_PROMPT;
            case CONTEXT_COMPACTION -> CONTEXT_COMPACTION_SYSTEM_PROMPT;
            case FINALIZER_ANSWER -> FINALIZER_SYSTEM_PROMPT;
            case ANALYSIS_REASONING -> ANALYSIS_SYSTEM_PROMPT;
        };
        if (StringUtils.hasText(outputLanguage)) {
            basePrompt = basePrompt + OUTPUT_LANGUAGE_INSTRUCTION.formatted(outputLanguage.trim());
        }
        return basePrompt;
    }

    public String userTemplate(PromptType type) {
        return switch (type) {
            case TASK_INTAKE -> TASK_INTAKE_USER_TEMPLATE;
            case PLANNER_REQUIREMENTS -> PLANNER_USER_TEMPLATE;
            case TOOL_REASONING -> TOOL_REASONING_USER_TEMPLATE;
            case CONTEXT_COMPACTION -> CONTEXT_COMPACTION_USER_TEMPLATE;
            case FINALIZER_ANSWER -> FINALIZER_USER_TEMPLATE;
            case ANALYSIS_REASONING -> ANALYSIS_USER_TEMPLATE;
        };
    }

    /**
     * Parameters for the user template of {@code type}. Every placeholder gets a value,
     * missing or blank ones are filled with {@link com.planrunner.orchestration.OrchestrationConstants#NONE}.
     */
    public Map<String, Object> templateParams(PromptType type, Map<String, String> mappingValue) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (String placeholder : placeholders(userTemplate(type))) {
            String value = mappingValue.get(placeholder);
            if (!StringUtils.hasText(value)) {
                log.debug("Placeholder {} of {} has no value.", placeholder, type);
                value = NONE;
            }
            params.put(placeholder, value);
        }
        return params;
    }

    Set<String> placeholders(String template) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }
}
