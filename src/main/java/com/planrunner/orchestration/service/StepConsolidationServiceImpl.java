package com.planrunner.orchestration.service;

import com.planrunner.orchestration.api.StepConsolidationService;
import com.planrunner.orchestration.exception.PlanValidationException;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStatus;
import com.planrunner.orchestration.model.PlanStep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class StepConsolidationServiceImpl implements StepConsolidationService {

    private final OrchestrationMetricsService metricsService;

    @Override
    public PlanStep consolidate(Plan plan, int from, int to, String summary) {
        List<PlanStep> steps = plan.getSteps();
        if (plan.getStatus() == PlanStatus.FINALIZED) {
            throw new PlanValidationException("Plan " + plan.getId() + " is finalized and cannot be consolidated.");
        }
        if (from < 0 || to < from || to >= steps.size()) {
            throw new PlanValidationException("Invalid consolidation range [" + from + ", " + to + "] for a plan with "
                    + steps.size() + " steps.");
        }
        if (!StringUtils.hasText(summary)) {
            throw new PlanValidationException("Consolidation summary must not be blank.");
        }
        for (int index = from; index <= to; index++) {
            PlanStep step = steps.get(index);
            if (!step.getStatus().isTerminal()) {
                throw new PlanValidationException("Step " + index + " is " + step.getStatus()
                        + "; only finished steps can be consolidated.");
            }
        }
        PlanStep consolidated = PlanStep.consolidated(from, summary.trim());
        int removed = to - from + 1;
        plan.replaceRange(from, to, consolidated);
        metricsService.recordConsolidation(removed);
        log.info("Consolidated steps [{}, {}] of plan {} into one step, {} steps remain (correlationId={}).",
                from, to, plan.getId(), plan.getSteps().size(), plan.getCorrelationId());
        return consolidated;
    }
}
