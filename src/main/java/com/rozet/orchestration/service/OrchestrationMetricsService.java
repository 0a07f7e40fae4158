package com.rozet.orchestration.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class OrchestrationMetricsService {

    private final AtomicLong llmRequestCount = new AtomicLong();
    private final AtomicLong planResponseCount = new AtomicLong();
    private final AtomicLong planFallbackCount = new AtomicLong();
    private final AtomicLong taskReceivedCount = new AtomicLong();
    private final AtomicLong taskExecutedCount = new AtomicLong();
    private final AtomicLong taskFailedCount = new AtomicLong();
    private final AtomicLong lockTimeoutCount = new AtomicLong();

    public void recordLlmRequest(String purpose) {
        long count = llmRequestCount.incrementAndGet();
        log.info("LLM request #{} sent (purpose={}). Total requests={}.", count, purpose, count);
    }

    public void recordPlanResponse(String label, int taskCount) {
        long planCount = planResponseCount.incrementAndGet();
        long totalTasks = taskReceivedCount.addAndGet(taskCount);
        log.info("Plan response #{} ({}) received {} tasks. Total plans={}, total tasks received={}.",
                planCount, label, taskCount, planCount, totalTasks);
    }

    public void recordPlanFallback(String reason) {
        long count = planFallbackCount.incrementAndGet();
        log.warn("Using fallback plan (#{}): {}", count, reason);
    }

    public void recordTaskExecuted(boolean success) {
        long executed = taskExecutedCount.incrementAndGet();
        if (!success) {
            taskFailedCount.incrementAndGet();
        }
        log.debug("Task finished (success={}). Total tasks executed so far={}.", success, executed);
    }

    public void recordLockTimeout(String resourceKey) {
        long count = lockTimeoutCount.incrementAndGet();
        log.warn("Lock timeout #{} on {}.", count, resourceKey);
    }

    public long getLlmRequestCount() {
        return llmRequestCount.get();
    }

    public long getPlanFallbackCount() {
        return planFallbackCount.get();
    }

    public long getTaskExecutedCount() {
        return taskExecutedCount.get();
    }

    public long getLockTimeoutCount() {
        return lockTimeoutCount.get();
    }

    public void logSummary() {
        log.info("Orchestration stats: totalRequests={}, totalPlans={}, fallbackPlans={}, totalTasksReceived={}, "
                        + "totalTasksExecuted={}, failedTasks={}, lockTimeouts={}.",
                llmRequestCount.get(), planResponseCount.get(), planFallbackCount.get(), taskReceivedCount.get(),
                taskExecutedCount.get(), taskFailedCount.get(), lockTimeoutCount.get());
    }
}
