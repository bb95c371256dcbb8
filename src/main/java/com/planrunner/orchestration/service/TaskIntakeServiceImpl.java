package com.planrunner.orchestration.service;

import com.planrunner.orchestration.api.LlmGateway;
import com.planrunner.orchestration.api.TaskIntakeService;
import com.planrunner.orchestration.model.IntakeResponse;
import com.planrunner.orchestration.model.LlmCallContext;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PromptType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class TaskIntakeServiceImpl implements TaskIntakeService {

    private final LlmGateway llmGateway;

    @Override
    public void normalize(Plan plan) {
        Map<String, String> mapping = Map.of(
                "instruction", plan.getOriginalInstruction(),
                "clientDescription", plan.getWorkspace().describeClient(),
                "projectDescription", plan.getWorkspace().describeProject());
        IntakeResponse intake = llmGateway.callLlm(PromptType.TASK_INTAKE, IntakeResponse.class,
                LlmCallContext.forPlan(plan), mapping, null).result();
        plan.applyIntake(intake.englishText(), intake.originalLanguage(),
                intake.questionChecklist(), intake.initialKnowledgeQueries());
        log.info("Intake for plan {} detected language={} checklist={} knowledgeQueries={} (correlationId={}).",
                plan.getId(), plan.getOriginalLanguage(), plan.getQuestionChecklist().size(),
                plan.getInitialKnowledgeQueries().size(), plan.getCorrelationId());
    }
}
