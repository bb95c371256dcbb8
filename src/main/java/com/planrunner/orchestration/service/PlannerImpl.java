package com.planrunner.orchestration.service;

import com.planrunner.config.PlanRunnerProperties;
import com.planrunner.orchestration.api.LlmGateway;
import com.planrunner.orchestration.api.Planner;
import com.planrunner.orchestration.exception.ReasoningException;
import com.planrunner.orchestration.model.LlmCallContext;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlannerResponse;
import com.planrunner.orchestration.model.PromptType;
import com.planrunner.orchestration.model.Requirement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class PlannerImpl implements Planner {

    private final LlmGateway llmGateway;
    private final OrchestrationContextService contextService;
    private final OrchestrationMetricsService metricsService;
    private final PlanRunnerProperties properties;

    @Override
    public List<Requirement> nextRequirements(Plan plan) {
        Map<String, String> mapping = Map.of(
                "userRequest", plan.getNormalizedInstruction(),
                "clientDescription", plan.getWorkspace().describeClient(),
                "projectDescription", plan.getWorkspace().describeProject(),
                "questionChecklist", contextService.formatList(plan.getQuestionChecklist()),
                "planContext", contextService.buildPlanContext(plan));
        PlannerResponse response = llmGateway.callLlm(PromptType.PLANNER_REQUIREMENTS, PlannerResponse.class,
                LlmCallContext.forPlan(plan), mapping, null).result();
        if (response.requirements() == null) {
            throw new ReasoningException("Planner response has no requirements list (correlationId="
                    + plan.getCorrelationId() + ").");
        }
        if (response.requirements().stream().anyMatch(text -> !StringUtils.hasText(text))) {
            throw new ReasoningException("Planner returned a blank requirement (correlationId="
                    + plan.getCorrelationId() + ").");
        }
        List<Requirement> requirements = response.requirements().stream()
                .map(text -> new Requirement(text.trim()))
                .toList();
        int limit = properties.getMaxRequirementsPerBatch();
        if (requirements.size() > limit) {
            log.warn("Planner returned {} requirements, keeping the first {} (correlationId={}).",
                    requirements.size(), limit, plan.getCorrelationId());
            requirements = requirements.subList(0, limit);
        }
        metricsService.recordPlannerResponse(plan.getCorrelationId(), requirements.size());
        if (requirements.isEmpty()) {
            log.info("Planner reports plan {} complete (correlationId={}).", plan.getId(), plan.getCorrelationId());
        }
        return requirements;
    }
}
