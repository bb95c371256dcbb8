package com.planrunner.orchestration.service;

import com.planrunner.config.PlanRunnerProperties;
import com.planrunner.orchestration.api.EventProcessingService;
import com.planrunner.orchestration.api.LlmGateway;
import com.planrunner.orchestration.api.StepConsolidationService;
import com.planrunner.orchestration.exception.PlanValidationException;
import com.planrunner.orchestration.exception.ReasoningException;
import com.planrunner.orchestration.model.CompactionResponse;
import com.planrunner.orchestration.model.CompactionResponse.CompactionRange;
import com.planrunner.orchestration.model.LlmCallContext;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStep;
import com.planrunner.orchestration.model.PromptType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keeps the plan's prompt context bounded. When the estimate exceeds the limit the model proposes ranges
 * to summarize, and each valid range goes through step consolidation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextCompactionService {

    private final LlmGateway llmGateway;
    private final StepConsolidationService consolidationService;
    private final OrchestrationContextService contextService;
    private final EventProcessingService eventProcessingService;
    private final PlanRunnerProperties properties;

    public long estimateTokens(Plan plan) {
        return contextService.estimateContextChars(plan) / properties.getCompaction().getCharsPerToken();
    }

    /**
     * @return number of steps removed from the plan
     */
    public int compactIfNeeded(Plan plan, @Nullable String streamId) {
        PlanRunnerProperties.CompactionConfig config = properties.getCompaction();
        if (!config.isEnabled() || plan.getSteps().size() <= config.getMinSteps()) {
            return 0;
        }
        long estimatedTokens = estimateTokens(plan);
        if (estimatedTokens <= config.getMaxContextTokens()) {
            return 0;
        }
        log.info("Plan {} context estimated at {} tokens exceeds {}, compacting {} steps (correlationId={}).",
                plan.getId(), estimatedTokens, config.getMaxContextTokens(), plan.getSteps().size(), plan.getCorrelationId());

        List<CompactionRange> ranges;
        try {
            Map<String, String> mapping = Map.of(
                    "userRequest", plan.getNormalizedInstruction(),
                    "estimatedTokens", Long.toString(estimatedTokens),
                    "maxTokens", Integer.toString(config.getMaxContextTokens()),
                    "stepCount", Integer.toString(plan.getSteps().size()),
                    "steps", contextService.renderStepsForCompaction(plan));
            CompactionResponse response = llmGateway.callLlm(PromptType.CONTEXT_COMPACTION, CompactionResponse.class,
                    LlmCallContext.forPlan(plan), mapping, null).result();
            ranges = response.compactionRanges() == null ? List.of() : response.compactionRanges();
        } catch (ReasoningException ex) {
            log.warn("Compaction of plan {} skipped (correlationId={}): {}", plan.getId(), plan.getCorrelationId(), ex.getMessage());
            return 0;
        }
        if (ranges.isEmpty()) {
            log.warn("Compaction of plan {} proposed no ranges (correlationId={}).", plan.getId(), plan.getCorrelationId());
            return 0;
        }

        // Highest range first so lower indices stay valid while applying.
        long malformed = ranges.stream().filter(Objects::isNull).count();
        if (malformed > 0) {
            log.warn("Ignoring {} empty compaction ranges for plan {} (correlationId={}).",
                    malformed, plan.getId(), plan.getCorrelationId());
        }
        List<CompactionRange> ordered = ranges.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingInt(CompactionRange::fromStep).reversed())
                .toList();
        int removed = 0;
        for (CompactionRange range : ordered) {
            try {
                PlanStep step = consolidationService.consolidate(plan, range.fromStep(), range.toStep(), range.summary());
                int rangeSize = range.toStep() - range.fromStep() + 1;
                removed += rangeSize - 1;
                eventProcessingService.emitConsolidated(streamId, step, rangeSize);
            } catch (PlanValidationException ex) {
                log.warn("Skipping compaction range [{}, {}] of plan {} (correlationId={}): {}",
                        range.fromStep(), range.toStep(), plan.getId(), plan.getCorrelationId(), ex.getMessage());
            }
        }
        long after = estimateTokens(plan);
        if (after > config.getMaxContextTokens()) {
            log.warn("Plan {} still estimated at {} tokens after compaction (correlationId={}).",
                    plan.getId(), after, plan.getCorrelationId());
        }
        return removed;
    }
}
