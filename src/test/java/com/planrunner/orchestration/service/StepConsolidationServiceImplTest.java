package com.planrunner.orchestration.service;

import com.planrunner.orchestration.PlanFixtures;
import com.planrunner.orchestration.exception.PlanValidationException;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStep;
import com.planrunner.orchestration.model.StepStatus;
import com.planrunner.tools.ToolName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.planrunner.orchestration.PlanFixtures.orders;
import static org.junit.jupiter.api.Assertions.*;

class StepConsolidationServiceImplTest {

    private final OrchestrationMetricsService metricsService = new OrchestrationMetricsService();
    private final StepConsolidationServiceImpl service = new StepConsolidationServiceImpl(metricsService);

    @Test
    void consolidatesRangeIntoSingleDoneStep() {
        Plan plan = PlanFixtures.planWithDoneSteps(5);
        PlanStep last = plan.getSteps().get(4);

        PlanStep consolidated = service.consolidate(plan, 1, 3, "  fetched and stored three sources ");

        assertEquals(3, plan.getSteps().size());
        assertEquals(List.of(0, 1, 2), orders(plan));
        assertSame(consolidated, plan.getSteps().get(1));
        assertEquals(StepStatus.DONE, consolidated.getStatus());
        assertEquals(ToolName.CONSOLIDATE_STEPS, consolidated.getStepToolName());
        assertEquals("CONSOLIDATED: fetched and stored three sources", consolidated.getStepInstruction());
        assertEquals("fetched and stored three sources", consolidated.getToolResult().summary());
        assertTrue(consolidated.getToolResult().success());
        assertSame(last, plan.getSteps().get(2));
        assertEquals(2, last.getOrder());
    }

    @Test
    void singleStepRangeKeepsCount() {
        Plan plan = PlanFixtures.planWithDoneSteps(3);
        service.consolidate(plan, 2, 2, "one");

        assertEquals(3, plan.getSteps().size());
        assertTrue(plan.getSteps().get(2).isConsolidated());
    }

    @Test
    void rejectsOutOfBoundsRangeWithoutChangingSteps() {
        Plan plan = PlanFixtures.planWithDoneSteps(3);
        List<PlanStep> before = List.copyOf(plan.getSteps());

        assertThrows(PlanValidationException.class, () -> service.consolidate(plan, 1, 3, "x"));
        assertThrows(PlanValidationException.class, () -> service.consolidate(plan, -1, 1, "x"));
        assertThrows(PlanValidationException.class, () -> service.consolidate(plan, 2, 1, "x"));
        assertEquals(before, plan.getSteps());
    }

    @Test
    void rejectsBlankSummary() {
        Plan plan = PlanFixtures.planWithDoneSteps(3);
        assertThrows(PlanValidationException.class, () -> service.consolidate(plan, 0, 1, "   "));
        assertEquals(3, plan.getSteps().size());
    }

    @Test
    void staleRangeFromEarlierSizeIsRejected() {
        Plan plan = PlanFixtures.planWithDoneSteps(5);
        service.consolidate(plan, 0, 3, "first pass");

        // [2,4] was valid for five steps but the plan now has two.
        assertThrows(PlanValidationException.class, () -> service.consolidate(plan, 2, 4, "stale"));
        assertEquals(List.of(0, 1), orders(plan));
    }

    @Test
    void rejectsRangeWithUnfinishedStep() {
        Plan plan = PlanFixtures.planWithDoneSteps(2);
        plan.appendSteps(List.of(PlanFixtures.pending(2, ToolName.KNOWLEDGE_SEARCH)));

        assertThrows(PlanValidationException.class, () -> service.consolidate(plan, 1, 2, "x"));
        assertEquals(3, plan.getSteps().size());
    }

    @Test
    void rejectsFinalizedPlan() {
        Plan plan = PlanFixtures.planWithDoneSteps(2);
        plan.complete();
        plan.finalizeWith("done");

        assertThrows(PlanValidationException.class, () -> service.consolidate(plan, 0, 1, "x"));
    }

    @Test
    void completedPlanCanStillBeConsolidated() {
        Plan plan = PlanFixtures.planWithDoneSteps(3);
        plan.complete();

        service.consolidate(plan, 0, 2, "all");

        assertEquals(1, plan.getSteps().size());
        assertEquals(0, plan.getSteps().get(0).getOrder());
    }
}
