package com.planrunner.orchestration.service;

import com.planrunner.entity.PlanRunLog;
import com.planrunner.entity.PromptLog;
import com.planrunner.entity.StepLog;
import com.planrunner.orchestration.model.LlmCallContext;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStep;
import com.planrunner.orchestration.model.ToolResult;
import com.planrunner.repository.PlanRunLogRepository;
import com.planrunner.repository.PromptLogRepository;
import com.planrunner.repository.StepLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Write-through audit trail. A failed audit write is logged and never interrupts the plan.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrchestrationPersistenceService {

    private final PlanRunLogRepository planRunLogRepository;
    private final StepLogRepository stepLogRepository;
    private final PromptLogRepository promptLogRepository;

    public void recordPlan(Plan plan) {
        try {
            PlanRunLog runLog = PlanRunLog.builder()
                    .id(plan.getId())
                    .correlationId(plan.getCorrelationId())
                    .instruction(plan.getOriginalInstruction())
                    .normalizedInstruction(plan.getNormalizedInstruction())
                    .originalLanguage(plan.getOriginalLanguage())
                    .provider(plan.getProvider())
                    .model(plan.getModel())
                    .status(plan.getStatus().name())
                    .stepCount(plan.getSteps().size())
                    .failureReason(plan.getFailureReason())
                    .finalAnswer(plan.getFinalAnswer())
                    .build();
            planRunLogRepository.save(runLog);
        } catch (RuntimeException ex) {
            log.warn("Audit write for plan {} failed (correlationId={}): {}", plan.getId(), plan.getCorrelationId(), ex.getMessage());
        }
    }

    public void recordStep(Plan plan, PlanStep step, long durationMs) {
        try {
            ToolResult result = step.getToolResult();
            StepLog stepLog = StepLog.builder()
                    .planId(plan.getId())
                    .stepId(step.getId())
                    .stepOrder(step.getOrder())
                    .toolName(step.getStepToolName().name())
                    .instruction(step.getStepInstruction())
                    .status(step.getStatus().name())
                    .summary(result != null ? result.summary() : null)
                    .content(result != null ? result.content() : null)
                    .errorMessage(result != null ? result.errorMessage() : null)
                    .durationMs(durationMs)
                    .build();
            stepLogRepository.save(stepLog);
        } catch (RuntimeException ex) {
            log.warn("Audit write for step {} of plan {} failed (correlationId={}): {}",
                    step.getOrder(), plan.getId(), plan.getCorrelationId(), ex.getMessage());
        }
    }

    public void recordPrompt(LlmCallContext context, String purpose, @Nullable String systemPrompt,
                             @Nullable String userTemplate, Map<String, Object> params, @Nullable String fullResponse) {
        try {
            String userPrompt = userTemplate == null ? null : fillTemplate(userTemplate, params);
            PromptLog promptLog = PromptLog.builder()
                    .planId(context.planId())
                    .correlationId(context.correlationId())
                    .purpose(purpose)
                    .systemPrompt(systemPrompt)
                    .userPrompt(userPrompt)
                    .fullResponse(fullResponse)
                    .build();
            promptLogRepository.save(promptLog);
        } catch (RuntimeException ex) {
            log.warn("Audit write for prompt {} failed (correlationId={}): {}", purpose, context.correlationId(), ex.getMessage());
        }
    }

    private String fillTemplate(String template, Map<String, Object> params) {
        String out = template;
        if (params != null) {
            for (Map.Entry<String, Object> e : params.entrySet()) {
                String key = "{" + e.getKey() + "}";
                out = out.replace(key, e.getValue() == null ? "" : e.getValue().toString());
            }
        }
        return out;
    }
}
