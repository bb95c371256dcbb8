package com.planrunner.orchestration.api;

import com.planrunner.orchestration.model.LlmCallContext;
import com.planrunner.orchestration.model.LlmResponse;
import com.planrunner.orchestration.model.PromptType;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Gateway for every structured LLM call made while driving a plan.
 */
public interface LlmGateway {

    /**
     * Renders the prompt for {@code type}, calls the model tier selected by the context flags and parses
     * the response into {@code responseSchema}.
     *
     * @param type The prompt to render.
     * @param responseSchema The type the JSON response is read into.
     * @param context Correlation id, plan id, quick and background flags, provider and model overrides.
     * @param mappingValue Values for the user template placeholders.
     * @param outputLanguage Language the model should answer in, or {@code null} for no constraint.
     * @return The parsed result together with the raw response text.
     * @throws com.planrunner.orchestration.exception.ReasoningException if the call fails, times out or
     *         the response cannot be parsed after the configured re-ask.
     */
    <T> LlmResponse<T> callLlm(PromptType type, Class<T> responseSchema, LlmCallContext context,
                               Map<String, String> mappingValue, @Nullable String outputLanguage);
}
