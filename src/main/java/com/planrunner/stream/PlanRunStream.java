package com.planrunner.stream;

import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Event buffer and live plan state of one streamed run.
 * <p>
 * Step state follows the events published for the run: added steps are appended, start and completion
 * replace a step by id, and a consolidation replaces its range and renumbers what follows, the same
 * way the plan itself does. A subscriber whose cursor is older than the buffer receives this state as a
 * {@link StreamEventType#SNAPSHOT} before the buffered events.
 */
class PlanRunStream {

    private final String runId;
    private final int maxBufferSize;
    private final Deque<StreamEvent> buffer = new ArrayDeque<>();
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final List<StepState> steps = new ArrayList<>();
    private long sequence;
    private String planId;
    private String correlationId;
    private String planStatus;
    private String failureReason;
    private volatile boolean completed;
    private volatile boolean cancelled;
    private volatile Instant lastUpdated = Instant.now();

    PlanRunStream(String runId, int maxBufferSize) {
        this.runId = runId;
        this.maxBufferSize = maxBufferSize;
    }

    String runId() {
        return runId;
    }

    Map<String, WebSocketSession> sessions() {
        return sessions;
    }

    boolean completed() {
        return completed;
    }

    boolean cancelled() {
        return cancelled;
    }

    Instant lastUpdated() {
        return lastUpdated;
    }

    /**
     * Applies {@code stateChange} and buffers the event in one step, so a replay never shows an event
     * without its state or the other way round.
     *
     * @return the buffered event, or {@code null} if the run no longer accepts {@code type}
     */
    @Nullable
    synchronized StreamEvent record(StreamEventType type, Object data, @Nullable StateChange stateChange) {
        if (cancelled && !type.closesCancelledRun()) {
            return null;
        }
        if (stateChange != null) {
            stateChange.apply(this);
        }
        if (type == StreamEventType.RUN_CANCEL) {
            cancelled = true;
        }
        if (type.isTerminal()) {
            completed = true;
        }
        StreamEvent event = new StreamEvent(++sequence, runId, planId, correlationId, Instant.now(), type, data);
        buffer.addLast(event);
        while (buffer.size() > maxBufferSize) {
            buffer.removeFirst();
        }
        lastUpdated = event.timestamp();
        return event;
    }

    synchronized List<StreamEvent> replaySince(long sinceId) {
        List<StreamEvent> replay = new ArrayList<>();
        long firstBuffered = buffer.isEmpty() ? sequence + 1 : buffer.peekFirst().id();
        if (sinceId < firstBuffered - 1 && planId != null) {
            replay.add(new StreamEvent(firstBuffered - 1, runId, planId, correlationId, Instant.now(),
                    StreamEventType.SNAPSHOT, snapshot()));
        }
        for (StreamEvent event : buffer) {
            if (event.id() > sinceId) {
                replay.add(event);
            }
        }
        return replay;
    }

    synchronized PlanSnapshot snapshot() {
        return new PlanSnapshot(planId, correlationId, planStatus, failureReason, List.copyOf(steps));
    }

    void bind(PlanSnapshot plan) {
        planId = plan.planId();
        correlationId = plan.correlationId();
        planStatus = plan.status();
        failureReason = plan.failureReason();
        steps.clear();
        steps.addAll(plan.steps());
    }

    void stepsAdded(List<StepState> added) {
        steps.addAll(added);
    }

    void stepUpdated(StepState state) {
        for (int index = 0; index < steps.size(); index++) {
            if (steps.get(index).stepId().equals(state.stepId())) {
                steps.set(index, state);
                return;
            }
        }
        steps.add(state);
    }

    void consolidated(StepState replacement, int removedSteps) {
        int from = replacement.order();
        int to = Math.min(steps.size(), from + removedSteps);
        if (from < 0 || from > steps.size()) {
            return;
        }
        steps.subList(from, to).clear();
        steps.add(from, replacement);
        for (int index = from + 1; index < steps.size(); index++) {
            steps.set(index, steps.get(index).withOrder(index));
        }
    }

    @FunctionalInterface
    interface StateChange {
        void apply(PlanRunStream run);
    }
}
