package com.planrunner.orchestration.service;

import static com.planrunner.orchestration.OrchestrationConstants.NONE;
import static com.planrunner.orchestration.OrchestrationConstants.STEP_OUTPUT_PREVIEW;

import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStep;
import com.planrunner.orchestration.model.StepStatus;
import com.planrunner.orchestration.model.ToolResult;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Renders plan state into the text blocks the prompts are built from.
 */
@Service
public class OrchestrationContextService {

    public String defaultContext(@Nullable String context) {
        return StringUtils.hasText(context) ? context : NONE;
    }

    public String formatList(@Nullable List<String> items) {
        if (items == null || items.isEmpty()) {
            return NONE;
        }
        StringBuilder sb = new StringBuilder();
        for (String item : items) {
            sb.append("- ").append(item).append("\n");
        }
        return sb.toString().trim();
    }

    public String formatNumbered(List<String> items) {
        StringBuilder sb = new StringBuilder();
        for (int index = 0; index < items.size(); index++) {
            sb.append(index + 1).append(". ").append(items.get(index)).append("\n");
        }
        return sb.toString().trim();
    }

    public String buildPlanContext(Plan plan) {
        List<PlanStep> steps = plan.getSteps();
        long completed = plan.countSteps(StepStatus.DONE);
        long failed = plan.countSteps(StepStatus.FAILED);
        long pending = plan.countSteps(StepStatus.PENDING);

        StringBuilder sb = new StringBuilder();
        sb.append("PLAN_CONTEXT: progress=").append(completed).append("/").append(steps.size());
        if (failed > 0) {
            sb.append(" failed=").append(failed);
        }
        if (pending > 0) {
            sb.append(" pending=").append(pending);
        }
        sb.append("\n");
        if (completed > 0) {
            sb.append("\nCOMPLETED_STEPS:\n");
            steps.stream().filter(step -> step.getStatus() == StepStatus.DONE).forEach(step ->
                    sb.append("[").append(step.getOrder()).append("] ").append(step.getStepToolName())
                            .append(": ").append(step.getStepInstruction()).append("\n")
                            .append(stepOutput(step.getToolResult())).append("\n"));
        }
        if (failed > 0) {
            sb.append("\nFAILED_STEPS:\n");
            steps.stream().filter(step -> step.getStatus() == StepStatus.FAILED).forEach(step ->
                    sb.append("- ").append(step.getStepToolName()).append(": ").append(step.getStepInstruction()).append("\n")
                            .append("  ERROR: ").append(stepError(step.getToolResult())).append("\n"));
        }
        if (pending > 0) {
            sb.append("\nPENDING_STEPS:\n");
            steps.stream().filter(step -> step.getStatus() == StepStatus.PENDING).forEach(step ->
                    sb.append("- ").append(step.getStepToolName()).append(": ").append(step.getStepInstruction()).append("\n"));
        }
        return sb.toString().trim();
    }

    /**
     * Completed/total counts plus the summaries of the last few completed steps.
     */
    public String buildProgressSummary(Plan plan, int recentLimit) {
        List<PlanStep> done = plan.getSteps().stream()
                .filter(step -> step.getStatus() == StepStatus.DONE)
                .toList();
        StringBuilder sb = new StringBuilder();
        sb.append("Completed ").append(done.size()).append(" of ").append(plan.getSteps().size()).append(" steps.");
        long failed = plan.countSteps(StepStatus.FAILED);
        if (failed > 0) {
            sb.append(" Failed: ").append(failed).append(".");
        }
        List<PlanStep> recent = done.subList(Math.max(0, done.size() - recentLimit), done.size());
        for (PlanStep step : recent) {
            sb.append("\n- [").append(step.getOrder()).append("] ").append(step.getStepToolName())
                    .append(": ").append(summaryOf(step.getToolResult()));
        }
        return sb.toString();
    }

    public String recentStepContext(Plan plan, int recentLimit) {
        List<PlanStep> finished = plan.getSteps().stream()
                .filter(step -> step.getStatus() == StepStatus.DONE)
                .toList();
        if (finished.isEmpty()) {
            return NONE;
        }
        StringBuilder sb = new StringBuilder();
        for (PlanStep step : finished.subList(Math.max(0, finished.size() - recentLimit), finished.size())) {
            sb.append("[").append(step.getOrder()).append("] ").append(step.getStepToolName()).append(": ")
                    .append(summaryOf(step.getToolResult())).append("\n");
        }
        return sb.toString().trim();
    }

    public String completedStepsTranscript(Plan plan) {
        StringBuilder sb = new StringBuilder();
        for (PlanStep step : plan.getSteps()) {
            if (step.getStatus() != StepStatus.DONE) {
                continue;
            }
            sb.append("[").append(step.getOrder()).append("] Tool: ").append(step.getStepToolName()).append("\n")
                    .append("Instruction: ").append(step.getStepInstruction()).append("\n")
                    .append("Output: ").append(stepOutput(step.getToolResult())).append("\n\n");
        }
        return defaultContext(sb.toString().trim());
    }

    public String failedStepsTranscript(Plan plan) {
        StringBuilder sb = new StringBuilder();
        for (PlanStep step : plan.getSteps()) {
            if (step.getStatus() != StepStatus.FAILED) {
                continue;
            }
            sb.append("[").append(step.getOrder()).append("] Tool: ").append(step.getStepToolName()).append("\n")
                    .append("Instruction: ").append(step.getStepInstruction()).append("\n")
                    .append("Error: ").append(stepError(step.getToolResult())).append("\n\n");
        }
        return defaultContext(sb.toString().trim());
    }

    public String renderStepsForCompaction(Plan plan) {
        StringBuilder sb = new StringBuilder();
        for (PlanStep step : plan.getSteps()) {
            sb.append("[").append(step.getOrder()).append("] ").append(step.getStatus()).append(" ")
                    .append(step.getStepToolName()).append(": ").append(step.getStepInstruction()).append("\n");
            if (step.getToolResult() != null) {
                sb.append("    ").append(stepOutput(step.getToolResult())).append("\n");
            }
        }
        return sb.toString().trim();
    }

    /**
     * Characters the plan contributes to a prompt: instructions plus every recorded output.
     */
    public long estimateContextChars(Plan plan) {
        long chars = plan.getNormalizedInstruction().length();
        for (PlanStep step : plan.getSteps()) {
            chars += step.getStepInstruction().length();
            ToolResult result = step.getToolResult();
            if (result != null) {
                chars += result.summary().length() + result.content().length();
                if (result.errorMessage() != null) {
                    chars += result.errorMessage().length();
                }
            }
        }
        return chars;
    }

    private String stepOutput(@Nullable ToolResult result) {
        if (result == null) {
            return NONE;
        }
        String output = StringUtils.hasText(result.content()) ? result.content() : result.summary();
        return preview(output);
    }

    private String summaryOf(@Nullable ToolResult result) {
        if (result == null) {
            return NONE;
        }
        return preview(StringUtils.hasText(result.summary()) ? result.summary() : result.content());
    }

    private String stepError(@Nullable ToolResult result) {
        if (result == null) {
            return NONE;
        }
        String error = StringUtils.hasText(result.errorMessage())
                ? result.summary() + ": " + result.errorMessage()
                : result.summary();
        return preview(error);
    }

    private String preview(String value) {
        if (!StringUtils.hasText(value)) {
            return NONE;
        }
        String trimmed = value.trim();
        return trimmed.length() <= STEP_OUTPUT_PREVIEW ? trimmed : trimmed.substring(0, STEP_OUTPUT_PREVIEW) + "...";
    }
}
