package com.planrunner.orchestration.api;

import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStep;

/**
 * Collapses a closed range of finished steps into one summary step.
 */
public interface StepConsolidationService {

    /**
     * Replaces steps {@code [from, to]} with a single DONE step whose instruction is
     * {@code "CONSOLIDATED: " + summary}, then renumbers the plan from zero.
     *
     * @param plan The plan to edit. Only its driving flow may call this.
     * @param from First step order of the range, inclusive.
     * @param to Last step order of the range, inclusive.
     * @param summary Text that replaces the range.
     * @return The synthetic step now at position {@code from}.
     * @throws com.planrunner.orchestration.exception.PlanValidationException if the range is out of
     *         bounds, the summary is blank or the range holds a step that has not finished. The plan is
     *         left untouched.
     */
    PlanStep consolidate(Plan plan, int from, int to, String summary);
}
