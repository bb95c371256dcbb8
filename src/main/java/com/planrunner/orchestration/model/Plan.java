package com.planrunner.orchestration.model;

import lombok.Builder;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Mutable record of one task execution.
 * <p>
 * A plan is owned by the single flow that drives it. Every structural mutation keeps step
 * orders contiguous from zero, and FINALIZED is terminal.
 */
public class Plan {

    private final UUID id;
    private final String correlationId;
    private final String originalInstruction;
    private final boolean quick;
    private final boolean backgroundMode;
    private final WorkspaceScope workspace;
    private final String provider;
    private final String model;
    private final Instant createdAt;
    private final List<PlanStep> steps = new ArrayList<>();
    private final List<String> questionChecklist = new ArrayList<>();
    private final List<String> initialKnowledgeQueries = new ArrayList<>();
    private String normalizedInstruction;
    private String originalLanguage = "en";
    private String finalAnswer;
    private String failureReason;
    private PlanStatus status = PlanStatus.RUNNING;

    @Builder
    private Plan(@Nullable String correlationId, String originalInstruction, boolean quick, boolean backgroundMode,
                 @Nullable WorkspaceScope workspace, @Nullable String provider, @Nullable String model) {
        this.id = UUID.randomUUID();
        this.correlationId = StringUtils.hasText(correlationId) ? correlationId : UUID.randomUUID().toString();
        this.originalInstruction = originalInstruction == null ? "" : originalInstruction;
        this.normalizedInstruction = this.originalInstruction;
        this.quick = quick;
        this.backgroundMode = backgroundMode;
        this.workspace = workspace != null ? workspace : WorkspaceScope.empty();
        this.provider = provider;
        this.model = model;
        this.createdAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getOriginalInstruction() {
        return originalInstruction;
    }

    public String getNormalizedInstruction() {
        return normalizedInstruction;
    }

    public String getOriginalLanguage() {
        return originalLanguage;
    }

    public boolean isQuick() {
        return quick;
    }

    public boolean isBackgroundMode() {
        return backgroundMode;
    }

    public WorkspaceScope getWorkspace() {
        return workspace;
    }

    public @Nullable String getProvider() {
        return provider;
    }

    public @Nullable String getModel() {
        return model;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public List<PlanStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public List<String> getQuestionChecklist() {
        return Collections.unmodifiableList(questionChecklist);
    }

    public List<String> getInitialKnowledgeQueries() {
        return Collections.unmodifiableList(initialKnowledgeQueries);
    }

    public @Nullable String getFinalAnswer() {
        return finalAnswer;
    }

    public @Nullable String getFailureReason() {
        return failureReason;
    }

    public PlanStatus getStatus() {
        return status;
    }

    public boolean hasFinalAnswer() {
        return StringUtils.hasText(finalAnswer);
    }

    public void applyIntake(@Nullable String normalized, @Nullable String language,
                            @Nullable List<String> checklist, @Nullable List<String> knowledgeQueries) {
        requireStatus(PlanStatus.RUNNING, "apply intake");
        if (StringUtils.hasText(normalized)) {
            normalizedInstruction = normalized.trim();
        }
        if (StringUtils.hasText(language)) {
            originalLanguage = language.trim();
        }
        questionChecklist.clear();
        if (checklist != null) {
            checklist.stream().filter(StringUtils::hasText).map(String::trim).forEach(questionChecklist::add);
        }
        initialKnowledgeQueries.clear();
        if (knowledgeQueries != null) {
            knowledgeQueries.stream().filter(StringUtils::hasText).map(String::trim).forEach(initialKnowledgeQueries::add);
        }
    }

    public Optional<PlanStep> nextPendingStep() {
        return steps.stream()
                .filter(step -> step.getStatus() == StepStatus.PENDING)
                .findFirst();
    }

    public long countSteps(StepStatus stepStatus) {
        return steps.stream().filter(step -> step.getStatus() == stepStatus).count();
    }

    /**
     * Appends a batch of PENDING steps. The batch is validated as a whole before any step is added.
     */
    public void appendSteps(List<PlanStep> newSteps) {
        requireStatus(PlanStatus.RUNNING, "append steps");
        if (newSteps == null || newSteps.isEmpty()) {
            return;
        }
        int base = steps.size();
        for (int index = 0; index < newSteps.size(); index++) {
            PlanStep step = newSteps.get(index);
            if (step.getOrder() != base + index) {
                throw new IllegalArgumentException("Step order " + step.getOrder() + " does not continue plan at " + (base + index));
            }
            if (step.getStatus() != StepStatus.PENDING) {
                throw new IllegalArgumentException("Only PENDING steps can be appended, got " + step.getStatus());
            }
        }
        steps.addAll(newSteps);
    }

    /**
     * Replaces steps {@code [from, to]} with a single step and renumbers the remainder.
     * Callers validate the range first; this only guards the structural invariant.
     */
    public void replaceRange(int from, int to, PlanStep replacement) {
        if (status == PlanStatus.FINALIZED) {
            throw new IllegalStateException("Plan " + id + " is finalized.");
        }
        if (from < 0 || to < from || to >= steps.size()) {
            throw new IllegalArgumentException("Invalid range [" + from + ", " + to + "] for " + steps.size() + " steps.");
        }
        steps.subList(from, to + 1).clear();
        steps.add(from, replacement);
        renumber();
    }

    public void complete() {
        requireStatus(PlanStatus.RUNNING, "complete");
        status = PlanStatus.COMPLETED;
    }

    public void fail(String reason) {
        requireStatus(PlanStatus.RUNNING, "fail");
        failureReason = reason;
        status = PlanStatus.FAILED;
    }

    public void finalizeWith(String answer) {
        if (status != PlanStatus.COMPLETED && status != PlanStatus.FAILED) {
            throw new IllegalStateException("Plan " + id + " cannot be finalized from status " + status);
        }
        if (!StringUtils.hasText(answer)) {
            throw new IllegalArgumentException("Final answer must not be blank.");
        }
        finalAnswer = answer;
        status = PlanStatus.FINALIZED;
    }

    private void renumber() {
        for (int index = 0; index < steps.size(); index++) {
            steps.get(index).setOrder(index);
        }
    }

    private void requireStatus(PlanStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException("Cannot " + action + " on plan " + id + " in status " + status);
        }
    }
}
