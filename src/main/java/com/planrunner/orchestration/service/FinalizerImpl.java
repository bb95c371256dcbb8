package com.planrunner.orchestration.service;

import static com.planrunner.orchestration.OrchestrationConstants.ANSWER_PREFIX;
import static com.planrunner.orchestration.OrchestrationConstants.QUESTION_PREFIX;

import com.planrunner.orchestration.api.Finalizer;
import com.planrunner.orchestration.api.LlmGateway;
import com.planrunner.orchestration.exception.ReasoningException;
import com.planrunner.orchestration.model.FinalAnswerResponse;
import com.planrunner.orchestration.model.LlmCallContext;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStatus;
import com.planrunner.orchestration.model.PromptType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class FinalizerImpl implements Finalizer {

    private final LlmGateway llmGateway;
    private final OrchestrationContextService contextService;

    @Override
    public String finalizePlan(Plan plan) {
        if (plan.hasFinalAnswer()) {
            return render(plan);
        }
        if (plan.getStatus() == PlanStatus.RUNNING) {
            throw new IllegalStateException("Plan " + plan.getId() + " is still running and cannot be finalized.");
        }
        Map<String, String> mapping = new HashMap<>();
        mapping.put("originalInstruction", plan.getOriginalInstruction());
        mapping.put("normalizedInstruction", plan.getNormalizedInstruction());
        mapping.put("clientDescription", plan.getWorkspace().describeClient());
        mapping.put("projectDescription", plan.getWorkspace().describeProject());
        mapping.put("questionChecklist", contextService.formatList(plan.getQuestionChecklist()));
        mapping.put("planStatus", describeStatus(plan));
        mapping.put("completedSteps", contextService.completedStepsTranscript(plan));
        mapping.put("failedSteps", contextService.failedStepsTranscript(plan));

        FinalAnswerResponse response = llmGateway.callLlm(PromptType.FINALIZER_ANSWER, FinalAnswerResponse.class,
                LlmCallContext.forPlan(plan), mapping, plan.getOriginalLanguage()).result();
        if (!StringUtils.hasText(response.answer())) {
            throw new ReasoningException("Finalizer returned an empty answer (correlationId=" + plan.getCorrelationId() + ").");
        }
        plan.finalizeWith(response.answer().trim());
        log.info("Plan {} finalized (correlationId={}).", plan.getId(), plan.getCorrelationId());
        return render(plan);
    }

    @Override
    public String render(Plan plan) {
        if (!plan.hasFinalAnswer()) {
            throw new IllegalStateException("Plan " + plan.getId() + " has no final answer.");
        }
        StringBuilder sb = new StringBuilder();
        if (StringUtils.hasText(plan.getOriginalInstruction())) {
            sb.append(QUESTION_PREFIX).append(plan.getOriginalInstruction().trim()).append("\n");
        }
        sb.append(ANSWER_PREFIX).append(plan.getFinalAnswer());
        return sb.toString();
    }

    private String describeStatus(Plan plan) {
        if (plan.getStatus() == PlanStatus.FAILED && StringUtils.hasText(plan.getFailureReason())) {
            return "FAILED: " + plan.getFailureReason();
        }
        return plan.getStatus().name();
    }
}
