package com.planrunner.orchestration.api;

import com.planrunner.orchestration.model.Plan;

/**
 * Normalizes the task before planning starts.
 */
public interface TaskIntakeService {

    /**
     * Detects the instruction language and fills the plan's normalized instruction, original language,
     * question checklist and initial knowledge queries.
     *
     * @param plan The freshly created plan, still RUNNING and without steps.
     * @throws com.planrunner.orchestration.exception.ReasoningException if the intake call fails.
     */
    void normalize(Plan plan);
}
