package com.planrunner.orchestration.service;

import static com.planrunner.orchestration.OrchestrationConstants.STEP_CONTEXT_RECENT_STEPS;
import static com.planrunner.orchestration.OrchestrationConstants.STEP_FAILED_SUMMARY;

import com.planrunner.config.PlanRunnerProperties;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStep;
import com.planrunner.orchestration.model.ToolResult;
import com.planrunner.tools.ToolRegistry;
import com.planrunner.tools.ToolRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one step through the registry. Tool exceptions and timeouts end as a FAILED step, never as a plan failure.
 * A timed-out tool is interrupted.
 */
@Service
@Slf4j
public class PlanStepExecutor {

    private final ToolRegistry toolRegistry;
    private final PlanRunnerProperties properties;
    private final OrchestrationContextService contextService;
    private final OrchestrationMetricsService metricsService;
    private final Executor toolExecutor;

    public PlanStepExecutor(ToolRegistry toolRegistry,
                            PlanRunnerProperties properties,
                            OrchestrationContextService contextService,
                            OrchestrationMetricsService metricsService,
                            @Qualifier("toolExecutor") Executor toolExecutor) {
        this.toolRegistry = toolRegistry;
        this.properties = properties;
        this.contextService = contextService;
        this.metricsService = metricsService;
        this.toolExecutor = toolExecutor;
    }

    public ToolResult execute(Plan plan, PlanStep step) {
        ToolRequest request = new ToolRequest(step.getStepInstruction(), step.getParameters(),
                contextService.recentStepContext(plan, STEP_CONTEXT_RECENT_STEPS));
        Duration timeout = properties.stepTimeoutFor(plan.isQuick(), plan.isBackgroundMode());
        String correlationId = plan.getCorrelationId();
        step.markRunning();
        log.info("Executing step {} with {} (planId={}, correlationId={}).",
                step.getOrder(), step.getStepToolName(), plan.getId(), correlationId);

        AtomicBoolean started = new AtomicBoolean();
        CountDownLatch finished = new CountDownLatch(1);
        FutureTask<ToolResult> task = new FutureTask<>(() -> {
            started.set(true);
            MDC.put("correlationId", correlationId);
            try {
                return toolRegistry.execute(step.getStepToolName(), plan, request);
            } finally {
                MDC.remove("correlationId");
                finished.countDown();
            }
        });

        ToolResult result;
        try {
            toolExecutor.execute(task);
            result = task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                result = failure(step, "Tool returned no result.");
            }
        } catch (TimeoutException ex) {
            stop(task, started, finished, step, correlationId);
            result = failure(step, "Timed out after " + timeout);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            result = failure(step, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            stop(task, started, finished, step, correlationId);
            result = failure(step, "Interrupted while waiting for the tool.");
        } catch (RejectedExecutionException ex) {
            result = failure(step, "Tool pool rejected the step: " + ex.getMessage());
        }
        if (!result.success()) {
            log.warn("Step {} with {} failed (planId={}, correlationId={}): {}",
                    step.getOrder(), step.getStepToolName(), plan.getId(), correlationId, result.errorMessage());
        }
        step.complete(result);
        metricsService.recordStepExecuted(correlationId, result.success());
        return result;
    }

    /**
     * Interrupts the tool and waits up to the cancel grace for it to return.
     */
    private void stop(FutureTask<ToolResult> task, AtomicBoolean started, CountDownLatch finished,
                      PlanStep step, String correlationId) {
        task.cancel(true);
        if (!started.get()) {
            return;
        }
        Duration grace = properties.getStepCancelGrace();
        try {
            if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Step {} with {} ignored interruption and is still running after {} (correlationId={}).",
                        step.getOrder(), step.getStepToolName(), grace, correlationId);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static ToolResult failure(PlanStep step, String message) {
        return ToolResult.failure(step.getStepToolName().name(), STEP_FAILED_SUMMARY, message);
    }
}
