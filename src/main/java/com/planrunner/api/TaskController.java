package com.planrunner.api;

import com.planrunner.orchestration.OrchestratorService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final OrchestratorService orchestratorService;

    @PostMapping
    public TaskResponse run(@Valid @RequestBody TaskRequest request) {
        return TaskResponse.from(orchestratorService.run(request.toCommand()));
    }

    @PostMapping("/stream")
    public TaskStreamResponse stream(@Valid @RequestBody TaskRequest request) {
        String runId = orchestratorService.startStreaming(request.toCommand());
        return new TaskStreamResponse(runId, Instant.now());
    }

    @PostMapping("/cancel/{runId}")
    public ResponseEntity<CancelRunResponse> cancel(@PathVariable String runId) {
        return orchestratorService.cancel(runId)
                ? ResponseEntity.ok(CancelRunResponse.requested(runId))
                : ResponseEntity.status(HttpStatus.NOT_FOUND).body(CancelRunResponse.notFound(runId));
    }
}
