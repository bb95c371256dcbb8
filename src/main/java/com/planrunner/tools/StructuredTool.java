package com.planrunner.tools;

import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.ToolResult;

/**
 * Tool whose input is a schema-validated parameter object.
 *
 * @param <T> request type the step parameters are converted into
 */
public non-sealed interface StructuredTool<T> extends PlanTool {

    /**
     * Example or default request, used for prompt construction.
     */
    T descriptionObject();

    Class<T> requestType();

    ToolResult execute(Plan plan, T request);

    @Override
    default Object exampleParameters() {
        return descriptionObject();
    }
}
