package com.planrunner.orchestration.service;

import com.planrunner.orchestration.api.EventProcessingService;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStep;
import com.planrunner.stream.OrchestrationStreamService;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class EventProcessingServiceImpl implements EventProcessingService {

    private final OrchestrationStreamService streamService;

    public EventProcessingServiceImpl(OrchestrationStreamService streamService) {
        this.streamService = streamService;
    }

    @Override
    public boolean isCancelled(@Nullable String streamId) {
        return streamId != null && streamService.isCancelled(streamId);
    }

    @Override
    public void emitStatus(@Nullable String streamId, String status) {
        if (streamId != null) {
            streamService.emitStatus(streamId, status);
        }
    }

    @Override
    public void emitPlanStatus(@Nullable String streamId, Plan plan) {
        if (streamId != null) {
            streamService.emitPlanStatus(streamId, plan);
        }
    }

    @Override
    public void emitStepsAdded(@Nullable String streamId, List<PlanStep> steps) {
        if (streamId != null && !steps.isEmpty()) {
            streamService.emitStepsAdded(streamId, steps);
        }
    }

    @Override
    public void emitStepStart(@Nullable String streamId, PlanStep step) {
        if (streamId != null) {
            streamService.emitStepStart(streamId, step);
        }
    }

    @Override
    public void emitStepComplete(@Nullable String streamId, PlanStep step) {
        if (streamId != null) {
            streamService.emitStepComplete(streamId, step);
        }
    }

    @Override
    public void emitConsolidated(@Nullable String streamId, PlanStep step, int removedSteps) {
        if (streamId != null) {
            streamService.emitConsolidated(streamId, step, removedSteps);
        }
    }

    @Override
    public void emitFinalAnswer(@Nullable String streamId, String answer) {
        if (streamId != null) {
            streamService.emitFinalAnswer(streamId, answer);
        }
    }

    @Override
    public void emitRunComplete(@Nullable String streamId, String status) {
        if (streamId != null) {
            streamService.emitRunComplete(streamId, status);
        }
    }

    @Override
    public void emitError(@Nullable String streamId, String message) {
        if (streamId != null) {
            streamService.emitError(streamId, message);
        }
    }
}
