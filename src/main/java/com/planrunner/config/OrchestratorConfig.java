package com.planrunner.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class OrchestratorConfig {

    @Bean
    @Primary
    public ChatClient chatClient(GoogleGenAiChatModel googleGenAiChatModel) {
        return ChatClient.builder(googleGenAiChatModel).build();
    }

    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        OpenAiChatModel model = openAiChatModelProvider.getIfAvailable();
        return model != null ? ChatClient.builder(model).build() : null;
    }

    /**
     * Runs plans. The pool size bounds how many plans execute at once.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService planExecutor(PlanRunnerProperties properties) {
        return Executors.newFixedThreadPool(properties.getPlanPool().getSize(),
                new CustomizableThreadFactory("plan-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService llmExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("llm-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService toolExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("tool-"));
    }

    @Bean
    public ThreadPoolTaskExecutor backgroundTaskExecutor(PlanRunnerProperties properties) {
        PlanRunnerProperties.BackgroundConfig config = properties.getBackground();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("background-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(config.getAwaitTerminationSeconds());
        executor.initialize();
        return executor;
    }
}
