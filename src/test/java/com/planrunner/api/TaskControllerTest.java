package com.planrunner.api;

import com.planrunner.orchestration.OrchestratorService;
import com.planrunner.orchestration.PlanFixtures;
import com.planrunner.orchestration.exception.ReasoningException;
import com.planrunner.orchestration.exception.UnknownToolException;
import com.planrunner.orchestration.model.ExecutionResult;
import com.planrunner.orchestration.model.Plan;
import com.planrunner.orchestration.model.TaskCommand;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TaskController.class)
class TaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OrchestratorService orchestratorService;

    @Test
    void runReturnsPlanSteps() throws Exception {
        Plan plan = PlanFixtures.planWithDoneSteps(2);
        plan.complete();
        when(orchestratorService.run(any())).thenReturn(new ExecutionResult(plan, "Vendor A is cheaper."));

        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instruction\":\"  Compare the vendors \",\"quick\":true,\"projectName\":\"acme\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.message").value("Vendor A is cheaper."))
                .andExpect(jsonPath("$.correlationId").value("corr-test"))
                .andExpect(jsonPath("$.steps.length()").value(2))
                .andExpect(jsonPath("$.steps[0].tool").value("DOCUMENT_FROM_WEB"))
                .andExpect(jsonPath("$.steps[1].summary").value("summary 1"));

        ArgumentCaptor<TaskCommand> command = ArgumentCaptor.forClass(TaskCommand.class);
        verify(orchestratorService).run(command.capture());
        assertEquals("Compare the vendors", command.getValue().instruction());
        assertTrue(command.getValue().quick());
        assertFalse(command.getValue().backgroundMode());
        assertEquals("acme", command.getValue().workspace().projectName());
    }

    @Test
    void blankInstructionIsRejected() throws Exception {
        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instruction\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation-error"));
    }

    @Test
    void reasoningFailureMapsToBadGateway() throws Exception {
        when(orchestratorService.run(any())).thenThrow(new ReasoningException("Planner timed out"));

        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instruction\":\"Compare the vendors\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("reasoning-error"))
                .andExpect(jsonPath("$.message").value("Planner timed out"))
                .andExpect(jsonPath("$.path").value("/api/tasks"));
    }

    @Test
    void unknownToolMapsToBadRequest() throws Exception {
        when(orchestratorService.run(any())).thenThrow(new UnknownToolException("TELEPORT"));

        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instruction\":\"Compare the vendors\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation-error"));
    }

    @Test
    void streamReturnsRunId() throws Exception {
        when(orchestratorService.startStreaming(any())).thenReturn("run-42");

        mockMvc.perform(post("/api/tasks/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"instruction\":\"Compare the vendors\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("run-42"));
    }

    @Test
    void cancelKnownAndUnknownRuns() throws Exception {
        when(orchestratorService.cancel("run-42")).thenReturn(true);
        when(orchestratorService.cancel("run-0")).thenReturn(false);

        mockMvc.perform(post("/api/tasks/cancel/{runId}", "run-42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("run-42"));
        mockMvc.perform(post("/api/tasks/cancel/{runId}", "run-0"))
                .andExpect(status().isNotFound());
    }
}
