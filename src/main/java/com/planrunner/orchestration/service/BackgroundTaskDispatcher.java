package com.planrunner.orchestration.service;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands detached work, such as indexing fetched content, to a bounded pool.
 * Submission never blocks the step that triggered it, and failures stay inside the pool.
 */
@Service
@Slf4j
public class BackgroundTaskDispatcher {

    private final ThreadPoolTaskExecutor executor;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public BackgroundTaskDispatcher(@Qualifier("backgroundTaskExecutor") ThreadPoolTaskExecutor executor) {
        this.executor = executor;
    }

    /**
     * @return {@code false} when the pool is saturated and the task was dropped
     */
    public boolean submit(String label, String correlationId, Runnable task) {
        try {
            executor.execute(() -> runIsolated(label, correlationId, task));
            return true;
        } catch (TaskRejectedException ex) {
            long total = dropped.incrementAndGet();
            log.warn("Background task '{}' dropped, pool saturated correlationId={} totalDropped={}.",
                    label, correlationId, total);
            return false;
        }
    }

    long droppedCount() {
        return dropped.get();
    }

    long failedCount() {
        return failed.get();
    }

    private void runIsolated(String label, String correlationId, Runnable task) {
        MDC.put("correlationId", correlationId);
        try {
            task.run();
            log.debug("Background task '{}' finished correlationId={}.", label, correlationId);
        } catch (RuntimeException ex) {
            failed.incrementAndGet();
            log.warn("Background task '{}' failed correlationId={}: {}", label, correlationId, ex.getMessage(), ex);
        } finally {
            MDC.remove("correlationId");
        }
    }
}
