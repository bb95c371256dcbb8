package com.planrunner.orchestration;

import static com.planrunner.orchestration.OrchestrationConstants.EXECUTION_CANCELLED;
import static com.planrunner.orchestration.OrchestrationConstants.ITERATION_LIMIT_REACHED;
import static com.planrunner.orchestration.OrchestrationConstants.KNOWLEDGE_SEARCH_DEFAULT_LIMIT;
import static com.planrunner.orchestration.OrchestrationConstants.UNEXPECTED_FAILURE;

import com.planrunner.config.PlanRunnerProperties;
import com.planrunner.orchestration.api.EventProcessingService;
import com.planrunner.orchestration.api.Finalizer;
import com.planrunner.orchestration.api.Planner;
import com.planrunner.orchestration.api.TaskIntakeService;
import com.planrunner.orchestration.api.ToolReasoningService;
import com.planrunner.orchestration.exception.PlanValidationException;
import com.planrunner.orchestration.exception.ReasoningException;
import com.planrunner.orchestration.model.ExecutionResult;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStatus;
import com.planrunner.orchestration.model.PlanStep;
import com.planrunner.orchestration.model.Requirement;
import com.planrunner.orchestration.service.ContextCompactionService;
import com.planrunner.orchestration.service.OrchestrationMetricsService;
import com.planrunner.orchestration.service.OrchestrationPersistenceService;
import com.planrunner.orchestration.service.PlanLeaseRegistry;
import com.planrunner.orchestration.service.PlanStepExecutor;
import com.planrunner.orchestration.service.StepInstructionFormatter;
import com.planrunner.tools.ToolName;
import com.planrunner.tools.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one plan from intake to its final answer. Steps of a plan run one at a time on the calling thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanExecutionService {

    private final TaskIntakeService taskIntakeService;
    private final Planner planner;
    private final ToolReasoningService toolReasoningService;
    private final Finalizer finalizer;
    private final PlanStepExecutor stepExecutor;
    private final ContextCompactionService compactionService;
    private final PlanLeaseRegistry leaseRegistry;
    private final ToolRegistry toolRegistry;
    private final StepInstructionFormatter instructionFormatter;
    private final EventProcessingService eventProcessingService;
    private final OrchestrationPersistenceService persistenceService;
    private final OrchestrationMetricsService metricsService;
    private final PlanRunnerProperties properties;

    /**
     * Runs the plan until it is COMPLETED or FAILED, then finalizes it.
     *
     * @param streamId run id for progress events, or {@code null} for a synchronous run
     * @throws com.planrunner.orchestration.exception.PlanAlreadyRunningException if another worker owns the plan
     * @throws ReasoningException if the final answer cannot be produced
     */
    public ExecutionResult execute(Plan plan, @Nullable String streamId) {
        String owner = Thread.currentThread().getName() + "/" + UUID.randomUUID();
        leaseRegistry.acquire(plan.getId(), owner);
        MDC.put("correlationId", plan.getCorrelationId());
        try {
            log.info("Plan {} started (correlationId={}).", plan.getId(), plan.getCorrelationId());
            persistenceService.recordPlan(plan);
            eventProcessingService.emitPlanStatus(streamId, plan);

            drive(plan, streamId);
            persistenceService.recordPlan(plan);
            eventProcessingService.emitPlanStatus(streamId, plan);

            eventProcessingService.emitStatus(streamId, "Writing final answer");
            String message = finalizer.finalizePlan(plan);
            persistenceService.recordPlan(plan);
            eventProcessingService.emitFinalAnswer(streamId, message);
            metricsService.logSummary(plan);
            return new ExecutionResult(plan, message);
        } finally {
            MDC.remove("correlationId");
            leaseRegistry.release(plan.getId(), owner);
        }
    }

    private void drive(Plan plan, @Nullable String streamId) {
        try {
            eventProcessingService.emitStatus(streamId, "Understanding the request");
            taskIntakeService.normalize(plan);
            seedKnowledgeSearch(plan, streamId);

            int planningRounds = 0;
            int maxRounds = properties.getMaxPlanningIterations();
            while (plan.getStatus() == PlanStatus.RUNNING) {
                if (eventProcessingService.isCancelled(streamId)) {
                    log.info("Plan {} cancelled (correlationId={}).", plan.getId(), plan.getCorrelationId());
                    plan.fail(EXECUTION_CANCELLED);
                    break;
                }
                Optional<PlanStep> next = plan.nextPendingStep();
                if (next.isPresent()) {
                    runStep(plan, next.get(), streamId);
                    compactionService.compactIfNeeded(plan, streamId);
                    continue;
                }
                if (planningRounds >= maxRounds) {
                    log.warn("Plan {} hit the planning limit of {} rounds (correlationId={}).",
                            plan.getId(), maxRounds, plan.getCorrelationId());
                    plan.fail(ITERATION_LIMIT_REACHED + " (" + maxRounds + ")");
                    break;
                }
                planningRounds++;
                eventProcessingService.emitStatus(streamId, "Planning round " + planningRounds);
                List<Requirement> requirements = planner.nextRequirements(plan);
                if (requirements.isEmpty()) {
                    log.info("Planner reports plan {} done after {} rounds (correlationId={}).",
                            plan.getId(), planningRounds, plan.getCorrelationId());
                    plan.complete();
                    break;
                }
                List<PlanStep> steps = toolReasoningService.selectSteps(requirements, plan);
                plan.appendSteps(steps);
                eventProcessingService.emitStepsAdded(streamId, steps);
            }
        } catch (ReasoningException | PlanValidationException ex) {
            log.warn("Plan {} failed (correlationId={}): {}", plan.getId(), plan.getCorrelationId(), ex.getMessage());
            failRunning(plan, ex.getMessage(), streamId);
        } catch (RuntimeException ex) {
            log.error("Plan {} failed unexpectedly (correlationId={}).", plan.getId(), plan.getCorrelationId(), ex);
            failRunning(plan, UNEXPECTED_FAILURE + ": " + ex.getClass().getSimpleName(), streamId);
        }
    }

    private void failRunning(Plan plan, String reason, @Nullable String streamId) {
        if (plan.getStatus() == PlanStatus.RUNNING) {
            plan.fail(reason);
        }
        eventProcessingService.emitError(streamId, reason);
    }

    private void runStep(Plan plan, PlanStep step, @Nullable String streamId) {
        eventProcessingService.emitStepStart(streamId, step);
        long started = System.currentTimeMillis();
        stepExecutor.execute(plan, step);
        long durationMs = System.currentTimeMillis() - started;
        persistenceService.recordStep(plan, step, durationMs);
        eventProcessingService.emitStepComplete(streamId, step);
    }

    private void seedKnowledgeSearch(Plan plan, @Nullable String streamId) {
        List<String> queries = plan.getInitialKnowledgeQueries();
        if (queries.isEmpty() || !properties.getKnowledge().isInitialSearch()) {
            return;
        }
        if (!toolRegistry.isRegistered(ToolName.KNOWLEDGE_SEARCH)) {
            log.info("Skipping {} initial knowledge queries, {} is not registered (correlationId={}).",
                    queries.size(), ToolName.KNOWLEDGE_SEARCH, plan.getCorrelationId());
            return;
        }
        int base = plan.getSteps().size();
        List<PlanStep> seeded = new ArrayList<>(queries.size());
        for (int index = 0; index < queries.size(); index++) {
            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("query", queries.get(index));
            parameters.put("limit", KNOWLEDGE_SEARCH_DEFAULT_LIMIT);
            seeded.add(PlanStep.pending(base + index, ToolName.KNOWLEDGE_SEARCH,
                    instructionFormatter.format("Search the knowledge base for prior findings", parameters), parameters));
        }
        plan.appendSteps(seeded);
        eventProcessingService.emitStepsAdded(streamId, seeded);
        log.info("Seeded {} knowledge search steps (correlationId={}).", seeded.size(), plan.getCorrelationId());
    }
}
