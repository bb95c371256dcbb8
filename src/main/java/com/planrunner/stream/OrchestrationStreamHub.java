package com.planrunner.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one {@link PlanRunStream} per run and fans its events out to the attached WebSocket sessions.
 * A subscriber resumes from the last event id it saw; if that id has already left the buffer it first
 * receives a snapshot of the plan.
 */
@Component
@Slf4j
public class OrchestrationStreamHub {

    static final int MAX_BUFFER_SIZE = 500;
    private static final Duration COMPLETED_RUN_TTL = Duration.ofMinutes(30);
    private static final String RUN_ID_ATTRIBUTE = "runId";

    private final ObjectMapper objectMapper;
    private final int maxBufferSize;
    private final Map<String, PlanRunStream> runs = new ConcurrentHashMap<>();

    @Autowired
    public OrchestrationStreamHub(ObjectMapper objectMapper) {
        this(objectMapper, MAX_BUFFER_SIZE);
    }

    OrchestrationStreamHub(ObjectMapper objectMapper, int maxBufferSize) {
        this.objectMapper = objectMapper;
        this.maxBufferSize = maxBufferSize;
    }

    public String createRun() {
        evictExpiredRuns();
        String runId = UUID.randomUUID().toString();
        runs.put(runId, new PlanRunStream(runId, maxBufferSize));
        return runId;
    }

    /**
     * Attaches {@code session} to the run and replays everything after {@code sinceId}. Unknown runs close the session.
     */
    public void attach(String runId, WebSocketSession session, long sinceId) throws IOException {
        PlanRunStream run = runs.get(runId);
        if (run == null) {
            log.debug("Closing session {} for unknown run {}", session.getId(), runId);
            session.close();
            return;
        }
        session.getAttributes().put(RUN_ID_ATTRIBUTE, runId);
        run.sessions().put(session.getId(), session);
        for (StreamEvent event : run.replaySince(sinceId)) {
            send(session, event);
        }
    }

    public void detach(WebSocketSession session) {
        Object runId = session.getAttributes().get(RUN_ID_ATTRIBUTE);
        if (runId == null) {
            return;
        }
        PlanRunStream run = runs.get(runId.toString());
        if (run != null) {
            run.sessions().remove(session.getId());
        }
        evictExpiredRuns();
    }

    public void publish(String runId, StreamEventType type, Object data) {
        publish(runId, type, data, null);
    }

    void publish(String runId, StreamEventType type, Object data, @Nullable PlanRunStream.StateChange stateChange) {
        PlanRunStream run = runs.get(runId);
        if (run == null) {
            return;
        }
        StreamEvent event = run.record(type, data, stateChange);
        if (event == null) {
            log.debug("Dropped {} event for cancelled run {}", type.wireName(), runId);
            return;
        }
        run.sessions().values().forEach(session -> send(session, event));
    }

    public boolean cancelRun(String runId) {
        PlanRunStream run = runs.get(runId);
        if (run == null) {
            return false;
        }
        if (!run.cancelled()) {
            publish(runId, StreamEventType.RUN_CANCEL, Map.of());
        }
        return true;
    }

    public boolean isCancelled(String runId) {
        PlanRunStream run = runs.get(runId);
        return run != null && run.cancelled();
    }

    Optional<List<StreamEvent>> eventsSince(String runId, long sinceId) {
        return Optional.ofNullable(runs.get(runId)).map(run -> run.replaySince(sinceId));
    }

    Optional<PlanSnapshot> snapshot(String runId) {
        return Optional.ofNullable(runs.get(runId)).map(PlanRunStream::snapshot);
    }

    private void send(WebSocketSession session, StreamEvent event) {
        if (!session.isOpen()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(event);
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (IOException ex) {
            log.debug("Failed to send {} event to session {}: {}", event.type().wireName(), session.getId(), ex.getMessage());
        }
    }

    private void evictExpiredRuns() {
        Instant cutoff = Instant.now().minus(COMPLETED_RUN_TTL);
        runs.values().removeIf(run -> run.completed()
                && run.sessions().isEmpty()
                && run.lastUpdated().isBefore(cutoff));
    }
}
