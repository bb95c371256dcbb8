package com.planrunner.orchestration;

import com.planrunner.orchestration.api.EventProcessingService;
import com.planrunner.orchestration.model.ExecutionResult;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.TaskCommand;
import com.planrunner.stream.OrchestrationStreamService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for running tasks. Every plan runs on the bounded plan pool, so the pool size caps
 * concurrent plans for synchronous and streaming callers alike.
 */
@Service
@Slf4j
public class OrchestratorService {

    private final PlanExecutionService planExecutionService;
    private final OrchestrationStreamService streamService;
    private final EventProcessingService eventProcessingService;
    private final ExecutorService planExecutor;

    public OrchestratorService(PlanExecutionService planExecutionService,
                               OrchestrationStreamService streamService,
                               EventProcessingService eventProcessingService,
                               @Qualifier("planExecutor") ExecutorService planExecutor) {
        this.planExecutionService = planExecutionService;
        this.streamService = streamService;
        this.eventProcessingService = eventProcessingService;
        this.planExecutor = planExecutor;
    }

    public Plan createPlan(TaskCommand command) {
        return Plan.builder()
                .correlationId(command.correlationId())
                .originalInstruction(command.instruction())
                .quick(command.quick())
                .backgroundMode(command.backgroundMode())
                .workspace(command.workspace())
                .provider(command.provider())
                .model(command.model())
                .build();
    }

    /**
     * Runs the task and waits for its final answer.
     */
    public ExecutionResult run(TaskCommand command) {
        Plan plan = createPlan(command);
        try {
            return CompletableFuture.supplyAsync(() -> planExecutionService.execute(plan, null), planExecutor).join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw ex;
        }
    }

    /**
     * Starts the task in the background and returns the run id its events are published under.
     */
    public String startStreaming(TaskCommand command) {
        String runId = streamService.createRun();
        Plan plan = createPlan(command);
        eventProcessingService.emitStatus(runId, "Queued");
        CompletableFuture.runAsync(() -> runStreaming(plan, runId), planExecutor);
        log.info("Streaming run {} queued for plan {} (correlationId={}).", runId, plan.getId(), plan.getCorrelationId());
        return runId;
    }

    public boolean cancel(String runId) {
        return streamService.cancelRun(runId);
    }

    private void runStreaming(Plan plan, String runId) {
        try {
            planExecutionService.execute(plan, runId);
            eventProcessingService.emitRunComplete(runId, plan.getStatus().name());
        } catch (RuntimeException ex) {
            log.error("Streaming run {} failed (correlationId={}).", runId, plan.getCorrelationId(), ex);
            eventProcessingService.emitError(runId, ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
            eventProcessingService.emitRunComplete(runId, plan.getStatus().name());
        }
    }
}
