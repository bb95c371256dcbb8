package com.planrunner.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "planrunner")
public class PlanRunnerProperties {

    private int maxPlanningIterations = 15;
    private int maxRequirementsPerBatch = 6;
    private Duration stepTimeout = Duration.ofSeconds(120);
    private Duration quickStepTimeout = Duration.ofSeconds(45);
    private Duration backgroundStepTimeout = Duration.ofSeconds(300);
    private Duration stepCancelGrace = Duration.ofSeconds(5);
    private String workspaceRoot;
    private AiProvider aiProvider = AiProvider.GOOGLE;
    private OpenAIConfig openai = new OpenAIConfig();
    private GoogleConfig google = new GoogleConfig();
    private LlmConfig llm = new LlmConfig();
    private CompactionConfig compaction = new CompactionConfig();
    private BackgroundConfig background = new BackgroundConfig();
    private PlanPoolConfig planPool = new PlanPoolConfig();
    private ToolsConfig tools = new ToolsConfig();
    private KnowledgeConfig knowledge = new KnowledgeConfig();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public static class GoogleConfig {
        private String apiKey;
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }

    public static class OpenAIConfig {
        private String apiKey;
        private String baseUrl = "https://api.openai.com";
        private String model = "gpt-4o-mini";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    /**
     * Model and timeout for one LLM tier. The tier is picked from the plan's quick and background flags.
     */
    public static class TierConfig {
        private String model;
        private Duration timeout = Duration.ofSeconds(90);

        public TierConfig() {}

        public TierConfig(String model, Duration timeout) {
            this.model = model;
            this.timeout = timeout;
        }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class LlmConfig {
        private int invalidJsonRetries = 1;
        private TierConfig standard = new TierConfig(null, Duration.ofSeconds(90));
        private TierConfig quick = new TierConfig(null, Duration.ofSeconds(30));
        private TierConfig background = new TierConfig(null, Duration.ofSeconds(240));

        public int getInvalidJsonRetries() { return invalidJsonRetries; }
        public void setInvalidJsonRetries(int invalidJsonRetries) { this.invalidJsonRetries = Math.max(0, invalidJsonRetries); }
        public TierConfig getStandard() { return standard; }
        public void setStandard(TierConfig standard) { this.standard = standard != null ? standard : new TierConfig(); }
        public TierConfig getQuick() { return quick; }
        public void setQuick(TierConfig quick) { this.quick = quick != null ? quick : new TierConfig(); }
        public TierConfig getBackground() { return background; }
        public void setBackground(TierConfig background) { this.background = background != null ? background : new TierConfig(); }

        public TierConfig tierFor(boolean quickMode, boolean backgroundMode) {
            if (quickMode) {
                return quick;
            }
            return backgroundMode ? background : standard;
        }
    }

    public static class CompactionConfig {
        private boolean enabled = true;
        private int maxContextTokens = 12000;
        private int minSteps = 3;
        private int charsPerToken = 4;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getMaxContextTokens() { return maxContextTokens; }
        public void setMaxContextTokens(int maxContextTokens) { this.maxContextTokens = maxContextTokens; }
        public int getMinSteps() { return minSteps; }
        public void setMinSteps(int minSteps) { this.minSteps = minSteps; }
        public int getCharsPerToken() { return charsPerToken; }
        public void setCharsPerToken(int charsPerToken) { this.charsPerToken = Math.max(1, charsPerToken); }
    }

    public static class BackgroundConfig {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 100;
        private int awaitTerminationSeconds = 30;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public int getAwaitTerminationSeconds() { return awaitTerminationSeconds; }
        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) { this.awaitTerminationSeconds = awaitTerminationSeconds; }
    }

    public static class PlanPoolConfig {
        private int size = 4;

        public int getSize() { return size; }
        public void setSize(int size) { this.size = Math.max(1, size); }
    }

    public static class ToolsConfig {
        private List<String> disabled = new ArrayList<>();

        public List<String> getDisabled() { return disabled; }

        public void setDisabled(List<String> disabled) {
            this.disabled = disabled != null ? new ArrayList<>(disabled) : new ArrayList<>();
        }
    }

    public static class KnowledgeConfig {
        private boolean initialSearch = true;
        private int maxFragments = 1000;

        public boolean isInitialSearch() { return initialSearch; }
        public void setInitialSearch(boolean initialSearch) { this.initialSearch = initialSearch; }
        public int getMaxFragments() { return maxFragments; }
        public void setMaxFragments(int maxFragments) { this.maxFragments = maxFragments; }
    }

    public int getMaxPlanningIterations() {
        return maxPlanningIterations;
    }

    public void setMaxPlanningIterations(int maxPlanningIterations) {
        this.maxPlanningIterations = maxPlanningIterations;
    }

    public int getMaxRequirementsPerBatch() {
        return maxRequirementsPerBatch;
    }

    public void setMaxRequirementsPerBatch(int maxRequirementsPerBatch) {
        this.maxRequirementsPerBatch = maxRequirementsPerBatch;
    }

    public Duration getStepTimeout() {
        return stepTimeout;
    }

    public void setStepTimeout(Duration stepTimeout) {
        this.stepTimeout = stepTimeout;
    }

    public Duration getQuickStepTimeout() {
        return quickStepTimeout;
    }

    public void setQuickStepTimeout(Duration quickStepTimeout) {
        this.quickStepTimeout = quickStepTimeout;
    }

    public Duration getBackgroundStepTimeout() {
        return backgroundStepTimeout;
    }

    public void setBackgroundStepTimeout(Duration backgroundStepTimeout) {
        this.backgroundStepTimeout = backgroundStepTimeout;
    }

    public Duration getStepCancelGrace() {
        return stepCancelGrace;
    }

    public void setStepCancelGrace(Duration stepCancelGrace) {
        this.stepCancelGrace = stepCancelGrace;
    }

    public Duration stepTimeoutFor(boolean quick, boolean backgroundMode) {
        if (quick) {
            return quickStepTimeout;
        }
        return backgroundMode ? backgroundStepTimeout : stepTimeout;
    }

    public String getWorkspaceRoot() {
        return workspaceRoot;
    }

    public void setWorkspaceRoot(String workspaceRoot) {
        this.workspaceRoot = workspaceRoot;
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider;
    }

    public OpenAIConfig getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAIConfig openai) {
        this.openai = openai;
    }

    public GoogleConfig getGoogle() {
        return google;
    }

    public void setGoogle(GoogleConfig google) {
        this.google = google;
    }

    public LlmConfig getLlm() {
        return llm;
    }

    public void setLlm(LlmConfig llm) {
        this.llm = llm != null ? llm : new LlmConfig();
    }

    public CompactionConfig getCompaction() {
        return compaction;
    }

    public void setCompaction(CompactionConfig compaction) {
        this.compaction = compaction != null ? compaction : new CompactionConfig();
    }

    public BackgroundConfig getBackground() {
        return background;
    }

    public void setBackground(BackgroundConfig background) {
        this.background = background != null ? background : new BackgroundConfig();
    }

    public PlanPoolConfig getPlanPool() {
        return planPool;
    }

    public void setPlanPool(PlanPoolConfig planPool) {
        this.planPool = planPool != null ? planPool : new PlanPoolConfig();
    }

    public ToolsConfig getTools() {
        return tools;
    }

    public void setTools(ToolsConfig tools) {
        this.tools = tools != null ? tools : new ToolsConfig();
    }

    public KnowledgeConfig getKnowledge() {
        return knowledge;
    }

    public void setKnowledge(KnowledgeConfig knowledge) {
        this.knowledge = knowledge != null ? knowledge : new KnowledgeConfig();
    }
}
