package com.planrunner.orchestration.service;

import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PromptType;
import com.planrunner.orchestration.model.StepStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class OrchestrationMetricsService {

    private final AtomicLong llmRequestCount = new AtomicLong();
    private final Map<PromptType, AtomicLong> llmRequestsByType = new EnumMap<>(PromptType.class);
    private final AtomicLong plannerResponseCount = new AtomicLong();
    private final AtomicLong requirementReceivedCount = new AtomicLong();
    private final AtomicLong stepExecutedCount = new AtomicLong();
    private final AtomicLong stepFailedCount = new AtomicLong();
    private final AtomicLong consolidatedStepCount = new AtomicLong();

    public OrchestrationMetricsService() {
        for (PromptType type : PromptType.values()) {
            llmRequestsByType.put(type, new AtomicLong());
        }
    }

    public void recordLlmRequest(PromptType type, String correlationId, boolean retry) {
        long count = llmRequestCount.incrementAndGet();
        long typeCount = llmRequestsByType.get(type).incrementAndGet();
        log.info("LLM request #{} sent (purpose={}, retry={}, correlationId={}). Requests of this type={}.",
                count, type.purpose(), retry, correlationId, typeCount);
    }

    public void recordPlannerResponse(String correlationId, int requirementCount) {
        long responses = plannerResponseCount.incrementAndGet();
        long totalRequirements = requirementReceivedCount.addAndGet(requirementCount);
        log.info("Planner response #{} returned {} requirements (correlationId={}). Total requirements received={}.",
                responses, requirementCount, correlationId, totalRequirements);
    }

    public void recordStepExecuted(String correlationId, boolean success) {
        long executed = stepExecutedCount.incrementAndGet();
        if (!success) {
            stepFailedCount.incrementAndGet();
        }
        log.debug("Step executed (success={}, correlationId={}). Total steps executed={}.", success, correlationId, executed);
    }

    public void recordConsolidation(int removedSteps) {
        if (removedSteps <= 0) {
            return;
        }
        long total = consolidatedStepCount.addAndGet(removedSteps);
        log.info("Consolidated {} steps. Total consolidated so far={}.", removedSteps, total);
    }

    public long llmRequests(PromptType type) {
        return llmRequestsByType.get(type).get();
    }

    public long totalLlmRequests() {
        return llmRequestCount.get();
    }

    public long plannerResponses() {
        return plannerResponseCount.get();
    }

    public long stepsExecuted() {
        return stepExecutedCount.get();
    }

    public long stepsFailed() {
        return stepFailedCount.get();
    }

    public void logSummary(Plan plan) {
        log.info("Plan {} finished with status={} steps={} done={} failed={} (correlationId={}).",
                plan.getId(), plan.getStatus(), plan.getSteps().size(),
                plan.countSteps(StepStatus.DONE), plan.countSteps(StepStatus.FAILED), plan.getCorrelationId());
        log.info("LLM stats: totalRequests={}, plannerResponses={}, requirementsReceived={}, stepsExecuted={}, stepsFailed={}, stepsConsolidated={}.",
                llmRequestCount.get(), plannerResponseCount.get(), requirementReceivedCount.get(),
                stepExecutedCount.get(), stepFailedCount.get(), consolidatedStepCount.get());
    }
}
