package com.planrunner.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planrunner.config.PlanRunnerProperties;
import com.planrunner.orchestration.api.EventProcessingService;
import com.planrunner.orchestration.api.Finalizer;
import com.planrunner.orchestration.api.LlmGateway;
import com.planrunner.orchestration.api.Planner;
import com.planrunner.orchestration.api.TaskIntakeService;
import com.planrunner.orchestration.api.ToolReasoningService;
import com.planrunner.orchestration.exception.PlanAlreadyRunningException;
import com.planrunner.orchestration.exception.ReasoningException;
import com.planrunner.orchestration.exception.UnknownToolException;
import com.planrunner.orchestration.model.ExecutionResult;
import com.planrunner.orchestration.model.LlmResponse;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.PlanStatus;
import com.planrunner.orchestration.model.PlanStep;
import com.planrunner.orchestration.model.PromptType;
import com.planrunner.orchestration.model.Requirement;
import com.planrunner.orchestration.model.StepStatus;
import com.planrunner.orchestration.model.ToolReasoningResponse;
import com.planrunner.orchestration.model.ToolResult;
import com.planrunner.orchestration.service.ContextCompactionService;
import com.planrunner.orchestration.service.JsonProcessingService;
import com.planrunner.orchestration.service.OrchestrationContextService;
import com.planrunner.orchestration.service.OrchestrationMetricsService;
import com.planrunner.orchestration.service.OrchestrationPersistenceService;
import com.planrunner.orchestration.service.PlanLeaseRegistry;
import com.planrunner.orchestration.service.PlanStepExecutor;
import com.planrunner.orchestration.service.StepInstructionFormatter;
import com.planrunner.orchestration.service.ToolReasoningServiceImpl;
import com.planrunner.tools.StubTool;
import com.planrunner.tools.ToolName;
import com.planrunner.tools.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PlanExecutionServiceTest {

    private TaskIntakeService intake;
    private Planner planner;
    private ToolReasoningService reasoning;
    private Finalizer finalizer;
    private ContextCompactionService compaction;
    private EventProcessingService events;
    private OrchestrationPersistenceService persistence;
    private PlanLeaseRegistry leases;
    private PlanRunnerProperties properties;
    private StubTool webTool;
    private StubTool searchTool;

    @BeforeEach
    void setUp() {
        intake = mock(TaskIntakeService.class);
        planner = mock(Planner.class);
        reasoning = mock(ToolReasoningService.class);
        finalizer = mock(Finalizer.class);
        compaction = mock(ContextCompactionService.class);
        events = mock(EventProcessingService.class);
        persistence = mock(OrchestrationPersistenceService.class);
        leases = new PlanLeaseRegistry();
        properties = new PlanRunnerProperties();
        webTool = StubTool.succeeding(ToolName.DOCUMENT_FROM_WEB);
        searchTool = StubTool.succeeding(ToolName.KNOWLEDGE_SEARCH);
        when(finalizer.finalizePlan(any())).thenReturn("Question: q\nAnswer: a");
        // each requirement becomes one web step
        when(reasoning.selectSteps(anyList(), any())).thenAnswer(invocation -> {
            List<Requirement> requirements = invocation.getArgument(0);
            Plan plan = invocation.getArgument(1);
            List<PlanStep> steps = new ArrayList<>();
            for (int i = 0; i < requirements.size(); i++) {
                steps.add(PlanStep.pending(plan.getSteps().size() + i, ToolName.DOCUMENT_FROM_WEB,
                        requirements.get(i).description(), Map.of("url", "https://example.com/" + i)));
            }
            return steps;
        });
    }

    private PlanExecutionService service() {
        ObjectMapper objectMapper = new ObjectMapper();
        OrchestrationMetricsService metrics = new OrchestrationMetricsService();
        ToolRegistry registry = new ToolRegistry(List.of(webTool, searchTool), properties, objectMapper);
        PlanStepExecutor stepExecutor = new PlanStepExecutor(registry, properties, new OrchestrationContextService(),
                metrics, Runnable::run);
        return new PlanExecutionService(intake, planner, reasoning, finalizer, stepExecutor, compaction, leases,
                registry, new StepInstructionFormatter(new JsonProcessingService(objectMapper)), events,
                persistence, metrics, properties);
    }

    @Test
    void runsStepsUntilPlannerIsDone() {
        Plan plan = PlanFixtures.plan("Summarize page X");
        when(planner.nextRequirements(plan))
                .thenReturn(List.of(new Requirement("fetch page X")))
                .thenReturn(List.of());

        ExecutionResult result = service().execute(plan, "run-1");

        assertEquals("Question: q\nAnswer: a", result.message());
        assertEquals(PlanStatus.COMPLETED, plan.getStatus());
        assertEquals(1, plan.getSteps().size());
        assertEquals(StepStatus.DONE, plan.getSteps().get(0).getStatus());
        assertEquals(1, webTool.calls().size());
        verify(finalizer).finalizePlan(plan);
        verify(compaction).compactIfNeeded(plan, "run-1");
        verify(events).emitStepsAdded(eq("run-1"), anyList());
        verify(persistence).recordStep(eq(plan), any(), anyLong());
        assertTrue(leases.ownerOf(plan.getId()).isEmpty());
    }

    @Test
    void failedStepDoesNotStopThePlan() {
        webTool = new StubTool(ToolName.DOCUMENT_FROM_WEB,
                params -> ToolResult.failure("DOCUMENT_FROM_WEB", "Failed to fetch", "HTTP 404"));
        Plan plan = PlanFixtures.plan("q");
        when(planner.nextRequirements(plan))
                .thenReturn(List.of(new Requirement("fetch page X")))
                .thenReturn(List.of());

        service().execute(plan, null);

        assertEquals(PlanStatus.COMPLETED, plan.getStatus());
        assertEquals(StepStatus.FAILED, plan.getSteps().get(0).getStatus());
        verify(planner, times(2)).nextRequirements(plan);
    }

    @Test
    void unknownToolFailsPlanWithoutSteps() {
        Plan plan = PlanFixtures.plan("q");
        when(planner.nextRequirements(plan)).thenReturn(List.of(new Requirement("search the web")));
        when(reasoning.selectSteps(anyList(), eq(plan))).thenThrow(new UnknownToolException("WEB_SEARCH"));

        service().execute(plan, "run-1");

        assertEquals(PlanStatus.FAILED, plan.getStatus());
        assertTrue(plan.getFailureReason().contains("WEB_SEARCH"));
        assertTrue(plan.getSteps().isEmpty());
        verify(finalizer).finalizePlan(plan);
        verify(events).emitError(eq("run-1"), any());
    }

    @Test
    void malformedSelectionFailsAndFinalizes() {
        ObjectMapper objectMapper = new ObjectMapper();
        JsonProcessingService json = new JsonProcessingService(objectMapper);
        LlmGateway gateway = mock(LlmGateway.class);
        when(gateway.callLlm(eq(PromptType.TOOL_REASONING), eq(ToolReasoningResponse.class), any(), anyMap(), any()))
                .thenReturn(new LlmResponse<>(json.parseJsonResponse("tool reasoning", "{\"selections\":[null]}",
                        ToolReasoningResponse.class), "{\"selections\":[null]}"));
        reasoning = new ToolReasoningServiceImpl(gateway,
                new ToolRegistry(List.of(webTool), properties, objectMapper),
                new OrchestrationContextService(), new StepInstructionFormatter(json));
        Plan plan = PlanFixtures.plan("q");
        when(planner.nextRequirements(plan)).thenReturn(List.of(new Requirement("fetch page X")));

        ExecutionResult result = service().execute(plan, "run-1");

        assertEquals(PlanStatus.FAILED, plan.getStatus());
        assertTrue(plan.getSteps().isEmpty());
        assertEquals("Question: q\nAnswer: a", result.message());
        verify(finalizer).finalizePlan(plan);
    }

    @Test
    void unexpectedExceptionFailsAndFinalizes() {
        Plan plan = PlanFixtures.plan("q");
        when(planner.nextRequirements(plan)).thenThrow(new IllegalStateException("boom"));

        ExecutionResult result = service().execute(plan, "run-1");

        assertEquals(PlanStatus.FAILED, plan.getStatus());
        assertEquals("Unexpected failure while driving the plan: IllegalStateException", plan.getFailureReason());
        assertEquals("Question: q\nAnswer: a", result.message());
        verify(finalizer).finalizePlan(plan);
        verify(events).emitError(eq("run-1"), any());
    }

    @Test
    void planningLimitFailsPlan() {
        properties.setMaxPlanningIterations(2);
        Plan plan = PlanFixtures.plan("q");
        when(planner.nextRequirements(plan)).thenReturn(List.of(new Requirement("fetch more")));

        service().execute(plan, null);

        assertEquals(PlanStatus.FAILED, plan.getStatus());
        assertEquals("Planning iteration limit reached (2)", plan.getFailureReason());
        assertEquals(2, plan.getSteps().size());
        verify(planner, times(2)).nextRequirements(plan);
    }

    @Test
    void cancellationFailsPlan() {
        Plan plan = PlanFixtures.plan("q");
        when(events.isCancelled("run-1")).thenReturn(true);

        service().execute(plan, "run-1");

        assertEquals(PlanStatus.FAILED, plan.getStatus());
        assertEquals("Execution cancelled", plan.getFailureReason());
        verifyNoInteractions(planner);
        verify(finalizer).finalizePlan(plan);
    }

    @Test
    void intakeFailureFailsAndFinalizes() {
        Plan plan = PlanFixtures.plan("q");
        doThrow(new ReasoningException("intake timed out")).when(intake).normalize(plan);

        service().execute(plan, null);

        assertEquals(PlanStatus.FAILED, plan.getStatus());
        assertEquals("intake timed out", plan.getFailureReason());
        verifyNoInteractions(planner);
        verify(finalizer).finalizePlan(plan);
    }

    @Test
    void intakeQueriesSeedKnowledgeSearchSteps() {
        Plan plan = PlanFixtures.plan("q");
        doAnswer(invocation -> {
            plan.applyIntake("q", "en", List.of(), List.of("vendor pricing"));
            return null;
        }).when(intake).normalize(plan);
        when(planner.nextRequirements(plan)).thenReturn(List.of());

        service().execute(plan, null);

        assertEquals(1, plan.getSteps().size());
        PlanStep seeded = plan.getSteps().get(0);
        assertEquals(ToolName.KNOWLEDGE_SEARCH, seeded.getStepToolName());
        assertEquals(StepStatus.DONE, seeded.getStatus());
        assertEquals("vendor pricing", searchTool.calls().get(0).get("query"));
    }

    @Test
    void seedingCanBeDisabled() {
        properties.getKnowledge().setInitialSearch(false);
        Plan plan = PlanFixtures.plan("q");
        doAnswer(invocation -> {
            plan.applyIntake("q", "en", List.of(), List.of("vendor pricing"));
            return null;
        }).when(intake).normalize(plan);
        when(planner.nextRequirements(plan)).thenReturn(List.of());

        service().execute(plan, null);

        assertTrue(plan.getSteps().isEmpty());
    }

    @Test
    void heldLeaseRejectsSecondWorker() {
        Plan plan = PlanFixtures.plan("q");
        leases.acquire(plan.getId(), "other-worker");

        assertThrows(PlanAlreadyRunningException.class, () -> service().execute(plan, null));
        verifyNoInteractions(intake, planner, finalizer);
        assertEquals("other-worker", leases.ownerOf(plan.getId()).orElseThrow());
    }

    @Test
    void finalizerErrorPropagatesAndReleasesLease() {
        Plan plan = PlanFixtures.plan("q");
        when(planner.nextRequirements(plan)).thenReturn(List.of());
        when(finalizer.finalizePlan(plan)).thenThrow(new ReasoningException("model down"));

        assertThrows(ReasoningException.class, () -> service().execute(plan, null));
        assertEquals(PlanStatus.COMPLETED, plan.getStatus());
        assertTrue(leases.ownerOf(plan.getId()).isEmpty());
    }
}
