package com.planrunner.orchestration.api;

import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStep;
import com.planrunner.orchestration.model.Requirement;

import java.util.List;

/**
 * Second planning phase: maps requirements onto registered tools.
 */
public interface ToolReasoningService {

    /**
     * Selects one tool per requirement and builds the matching PENDING steps.
     * The steps are numbered to follow the plan's current last step; the caller appends them.
     *
     * @param requirements The Planner output, in order.
     * @param plan The plan being driven. It is read, never mutated.
     * @return One new step per requirement, or an empty list without any LLM call when
     *         {@code requirements} is empty.
     * @throws com.planrunner.orchestration.exception.UnknownToolException if any selection names a tool
     *         that is not registered. No step of the batch is returned.
     * @throws com.planrunner.orchestration.exception.ReasoningException if the reasoning call fails or
     *         does not return exactly one selection per requirement.
     */
    List<PlanStep> selectSteps(List<Requirement> requirements, Plan plan);
}
