package com.planrunner.orchestration.service;

import static com.planrunner.orchestration.OrchestrationConstants.INVALID_JSON_RETRY_PROMPT;

import com.planrunner.config.PlanRunnerProperties;
import com.planrunner.orchestration.api.LlmGateway;
import com.planrunner.orchestration.exception.ReasoningException;
import com.planrunner.orchestration.model.LlmCallContext;
import com.planrunner.orchestration.model.LlmResponse;
import com.planrunner.orchestration.model.PromptType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatOptions;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
public class LlmGatewayImpl implements LlmGateway {

    private final ChatClient chatClient;
    private final ChatClient openAiChatClient;
    private final PlanRunnerProperties properties;
    private final Executor llmExecutor;
    private final OrchestrationPromptService promptService;
    private final JsonProcessingService jsonProcessingService;
    private final OrchestrationMetricsService metricsService;
    private final OrchestrationPersistenceService persistenceService;

    public LlmGatewayImpl(
            ChatClient chatClient,
            @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
            PlanRunnerProperties properties,
            @Qualifier("llmExecutor") Executor llmExecutor,
            OrchestrationPromptService promptService,
            JsonProcessingService jsonProcessingService,
            OrchestrationMetricsService metricsService,
            OrchestrationPersistenceService persistenceService) {
        this.chatClient = chatClient;
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.properties = properties;
        this.llmExecutor = llmExecutor;
        this.promptService = promptService;
        this.jsonProcessingService = jsonProcessingService;
        this.metricsService = metricsService;
        this.persistenceService = persistenceService;
    }

    @Override
    public <T> LlmResponse<T> callLlm(PromptType type, Class<T> responseSchema, LlmCallContext context,
                                      Map<String, String> mappingValue, @Nullable String outputLanguage) {
        String systemPrompt = promptService.systemPrompt(type, outputLanguage);
        String userTemplate = promptService.userTemplate(type);
        Map<String, Object> params = promptService.templateParams(type, mappingValue == null ? Map.of() : mappingValue);
        PlanRunnerProperties.TierConfig tier = properties.getLlm().tierFor(context.quick(), context.backgroundMode());
        int attempts = 1 + properties.getLlm().getInvalidJsonRetries();

        for (int attempt = 0; attempt < attempts; attempt++) {
            boolean retry = attempt > 0;
            String purpose = retry ? type.retryPurpose() : type.purpose();
            String prompt = retry ? systemPrompt + INVALID_JSON_RETRY_PROMPT : systemPrompt;
            metricsService.recordLlmRequest(type, context.correlationId(), retry);
            String response = invoke(type, context, tier, prompt, userTemplate, params);
            persistenceService.recordPrompt(context, purpose, prompt, userTemplate, params, response);
            T parsed = jsonProcessingService.parseJsonResponse(purpose, response, responseSchema);
            if (parsed != null) {
                return new LlmResponse<>(parsed, response);
            }
        }
        throw new ReasoningException("The " + type.purpose() + " response could not be read as "
                + responseSchema.getSimpleName() + " (correlationId=" + context.correlationId() + ").");
    }

    private String invoke(PromptType type, LlmCallContext context, PlanRunnerProperties.TierConfig tier,
                          String systemPrompt, String userTemplate, Map<String, Object> params) {
        ChatClient.ChatClientRequestSpec spec = requestSpec(context, tier);
        FutureTask<String> call = new FutureTask<>(() -> spec
                .system(systemPrompt)
                .user(user -> user.text(userTemplate).params(params))
                .call()
                .content());
        try {
            llmExecutor.execute(call);
            return call.get(tier.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            call.cancel(true);
            throw new ReasoningException("The " + type.purpose() + " call timed out after " + tier.getTimeout()
                    + " (correlationId=" + context.correlationId() + ").", ex);
        } catch (InterruptedException ex) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new ReasoningException("The " + type.purpose() + " call was interrupted"
                    + " (correlationId=" + context.correlationId() + ").", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new ReasoningException("The " + type.purpose() + " call failed: " + cause.getMessage()
                    + " (correlationId=" + context.correlationId() + ").", cause);
        }
    }

    private ChatClient.ChatClientRequestSpec requestSpec(LlmCallContext context, PlanRunnerProperties.TierConfig tier) {
        String activeProvider = StringUtils.hasText(context.provider())
                ? context.provider().trim().toUpperCase()
                : properties.getAiProvider().name();

        if (PlanRunnerProperties.AiProvider.OPENAI.name().equals(activeProvider)) {
            if (openAiChatClient == null) {
                throw new ReasoningException("OpenAI provider is not properly configured. "
                        + "Check that you have a valid API key or a custom Base URL in your configuration.");
            }
            String model = StringUtils.hasText(context.model()) ? context.model() : properties.getOpenai().getModel();
            var spec = openAiChatClient.prompt();
            if (StringUtils.hasText(model)) {
                spec = spec.options(OpenAiChatOptions.builder().model(model).build());
            }
            return spec;
        }
        String model = StringUtils.hasText(context.model()) ? context.model() : tier.getModel();
        var spec = chatClient.prompt();
        if (StringUtils.hasText(model)) {
            spec = spec.options(GoogleGenAiChatOptions.builder().model(model).build());
        }
        return spec;
    }
}
