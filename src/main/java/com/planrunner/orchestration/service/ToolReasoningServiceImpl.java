package com.planrunner.orchestration.service;

import static com.planrunner.orchestration.OrchestrationConstants.PROGRESS_RECENT_STEPS;

import com.planrunner.orchestration.api.LlmGateway;
import com.planrunner.orchestration.api.ToolReasoningService;
import com.planrunner.orchestration.exception.ReasoningException;
import com.planrunner.orchestration.model.LlmCallContext;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStep;
import com.planrunner.orchestration.model.PromptType;
import com.planrunner.orchestration.model.Requirement;
import com.planrunner.orchestration.model.ToolReasoningResponse;
import com.planrunner.orchestration.model.ToolSelection;
import com.planrunner.tools.ToolName;
import com.planrunner.tools.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ToolReasoningServiceImpl implements ToolReasoningService {

    private final LlmGateway llmGateway;
    private final ToolRegistry toolRegistry;
    private final OrchestrationContextService contextService;
    private final StepInstructionFormatter instructionFormatter;

    @Override
    public List<PlanStep> selectSteps(List<Requirement> requirements, Plan plan) {
        if (requirements == null || requirements.isEmpty()) {
            return List.of();
        }
        Map<String, String> mapping = Map.of(
                "userRequest", plan.getNormalizedInstruction(),
                "requirements", contextService.formatNumbered(requirements.stream().map(Requirement::description).toList()),
                "toolCatalog", toolRegistry.renderCatalog(),
                "progress", contextService.buildProgressSummary(plan, PROGRESS_RECENT_STEPS));
        ToolReasoningResponse response = llmGateway.callLlm(PromptType.TOOL_REASONING, ToolReasoningResponse.class,
                LlmCallContext.forPlan(plan), mapping, null).result();

        List<ToolSelection> selections = response.selections();
        if (selections == null || selections.size() != requirements.size()) {
            throw new ReasoningException("Tool reasoning returned " + (selections == null ? 0 : selections.size())
                    + " selections for " + requirements.size() + " requirements (correlationId="
                    + plan.getCorrelationId() + ").");
        }

        // Resolve the whole batch before building anything.
        List<ToolName> tools = new ArrayList<>(selections.size());
        for (ToolSelection selection : selections) {
            if (selection == null) {
                throw new ReasoningException("Tool reasoning returned an empty selection (correlationId="
                        + plan.getCorrelationId() + ").");
            }
            tools.add(toolRegistry.require(selection.toolName()));
        }

        int base = plan.getSteps().size();
        List<PlanStep> steps = new ArrayList<>(selections.size());
        for (int index = 0; index < selections.size(); index++) {
            ToolSelection selection = selections.get(index);
            String description = requirements.get(index).description();
            steps.add(PlanStep.pending(base + index, tools.get(index),
                    instructionFormatter.format(description, selection.parameters()), selection.parameters()));
            log.info("Requirement '{}' -> {} ({}) (correlationId={}).", description, tools.get(index),
                    selection.reasoning(), plan.getCorrelationId());
        }
        return steps;
    }
}
