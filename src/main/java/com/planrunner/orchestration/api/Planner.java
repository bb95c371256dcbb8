package com.planrunner.orchestration.api;

import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.Requirement;

import java.util.List;

/**
 * First planning phase: decides what still has to happen, without choosing tools.
 */
public interface Planner {

    /**
     * Produces the next ordered batch of requirements for the plan.
     *
     * @param plan The plan being driven. It is read, never mutated.
     * @return The requirements in execution order. An empty list means no further work is needed.
     * @throws com.planrunner.orchestration.exception.ReasoningException if the reasoning call fails or
     *         its output cannot be read.
     */
    List<Requirement> nextRequirements(Plan plan);
}
