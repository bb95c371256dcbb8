package com.planrunner.tools.impl;

import com.planrunner.orchestration.api.LlmGateway;
import com.planrunner.orchestration.model.AnalysisResponse;
import com.planrunner.orchestration.model.LlmCallContext;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PromptType;
import com.planrunner.orchestration.model.ToolResult;
import com.planrunner.orchestration.service.OrchestrationContextService;
import com.planrunner.tools.StructuredTool;
import com.planrunner.tools.ToolName;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;

/**
 * Model-side reasoning step over what earlier steps produced.
 */
@Component
@RequiredArgsConstructor
public class AnalysisReasoningTool implements StructuredTool<AnalysisReasoningTool.Request> {

    public record Request(String question, String focus) {
    }

    private final LlmGateway llmGateway;
    private final OrchestrationContextService contextService;

    @Override
    public ToolName name() {
        return ToolName.ANALYSIS_REASONING;
    }

    @Override
    public String description() {
        return "Reasons over the results of completed steps to answer a focused question. Use it to compare, "
                + "summarize or draw conclusions; it does not fetch new information.";
    }

    @Override
    public Request descriptionObject() {
        return new Request("Which of the fetched vendors supports streaming exports?", "feature comparison");
    }

    @Override
    public Class<Request> requestType() {
        return Request.class;
    }

    @Override
    public ToolResult execute(Plan plan, Request request) {
        if (request == null || !StringUtils.hasText(request.question())) {
            return ToolResult.failure(name().name(), "No question to analyze", "Parameter 'question' is required.");
        }
        Map<String, String> mapping = Map.of(
                "question", request.question().trim(),
                "focus", contextService.defaultContext(request.focus()),
                "userRequest", plan.getNormalizedInstruction(),
                "context", contextService.defaultContext(contextService.completedStepsTranscript(plan)));
        AnalysisResponse response = llmGateway.callLlm(PromptType.ANALYSIS_REASONING, AnalysisResponse.class,
                LlmCallContext.forPlan(plan), mapping, null).result();
        if (!StringUtils.hasText(response.conclusion())) {
            return ToolResult.failure(name().name(), "Analysis produced no conclusion", "Empty conclusion from model.");
        }
        List<String> findings = response.keyFindings() == null ? List.of() : response.keyFindings();
        StringBuilder content = new StringBuilder(response.conclusion().trim());
        if (!findings.isEmpty()) {
            content.append("\n\nKey findings:");
            findings.forEach(finding -> content.append("\n- ").append(finding));
        }
        return ToolResult.success(name().name(), response.conclusion().trim(), content.toString());
    }
}
