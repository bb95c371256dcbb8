package com.planrunner.orchestration.api;

import com.planrunner.orchestration.model.Plan;

/**
 * Produces the user-facing answer once a plan stops running.
 */
public interface Finalizer {

    /**
     * Writes the final answer, stores it on the plan and moves the plan to FINALIZED.
     * A plan that already has a final answer is returned as is, without another LLM call.
     *
     * @param plan A COMPLETED or FAILED plan, or one that is already FINALIZED.
     * @return The rendered message: a {@code Question:} line when the instruction is not blank,
     *         followed by an {@code Answer:} line.
     * @throws IllegalStateException if the plan is still RUNNING.
     * @throws com.planrunner.orchestration.exception.ReasoningException if the answer call fails.
     */
    String finalizePlan(Plan plan);

    /**
     * Renders the message for a plan that already has a final answer.
     *
     * @param plan The finalized plan.
     * @return The {@code Question:}/{@code Answer:} message.
     */
    String render(Plan plan);
}
