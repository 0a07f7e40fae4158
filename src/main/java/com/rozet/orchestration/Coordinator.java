package com.rozet.orchestration;

import static com.rozet.orchestration.OrchestrationConstants.TASK_CANCELLED_MESSAGE;
import com.rozet.locking.FileLockManager;
import com.rozet.locking.LockTimeoutException;
import com.rozet.locking.ScopedLock;
import com.rozet.orchestration.api.EventProcessingService;
import com.rozet.orchestration.model.CancellationSignal;
import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.model.WorkerResult;
import com.rozet.orchestration.service.OrchestrationMetricsService;
import com.rozet.worker.Worker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Runs planned tasks one after another, holding a lock on every declared file while the worker
 * runs. Each task yields exactly one {@link WorkerResult}; no task failure escapes
 * {@link #executeTasks}.
 * <p>
 * Tasks run in list order. {@code dependencies} are not checked: the planner is trusted to
 * emit tasks in an order that satisfies them.
 */
@Slf4j
public class Coordinator {

    private final Worker worker;
    private final FileLockManager lockManager;
    private final EventProcessingService eventProcessingService;
    private final OrchestrationMetricsService metricsService;
    private final Duration lockTimeout;
    @Nullable
    private final Duration lockExpiry;

    public Coordinator(Worker worker,
                       FileLockManager lockManager,
                       EventProcessingService eventProcessingService,
                       OrchestrationMetricsService metricsService,
                       Duration lockTimeout,
                       @Nullable Duration lockExpiry) {
        this.worker = worker;
        this.lockManager = lockManager;
        this.eventProcessingService = eventProcessingService;
        this.metricsService = metricsService;
        this.lockTimeout = lockTimeout;
        this.lockExpiry = lockExpiry;
    }

    public List<WorkerResult> executeTasks(List<TaskSpec> tasks, Path workingDir) {
        return executeTasks(tasks, workingDir, CancellationSignal.none());
    }

    public List<WorkerResult> executeTasks(List<TaskSpec> tasks, Path workingDir, CancellationSignal cancellation) {
        List<WorkerResult> results = new ArrayList<>();
        if (tasks == null || tasks.isEmpty()) {
            return results;
        }
        Path root = workingDir.toAbsolutePath().normalize();
        boolean stopped = false;
        for (TaskSpec task : tasks) {
            if (task == null) {
                results.add(WorkerResult.failure("", "Task is missing", ""));
                continue;
            }
            if (stopped || cancellation.isCancelled()) {
                stopped = true;
                results.add(cancelled(task));
                continue;
            }

            log.info("Executing task {}: {}", task.taskId(), task.description());
            notifyAssigned(task);
            WorkerResult result;
            try {
                result = runTask(task, root, cancellation);
            } catch (CancellationException ex) {
                log.warn("Task {} cancelled while waiting for locks: {}", task.taskId(), ex.getMessage());
                stopped = true;
                result = cancelled(task);
            }
            metricsService.recordTaskExecuted(result.success());
            notifyCompleted(result);
            results.add(result);
        }
        return results;
    }

    // Spellings of one file that normalize to the same path share a single lock.
    private WorkerResult runTask(TaskSpec task, Path workingDir, CancellationSignal cancellation) {
        Map<Path, String> lockTargets = new LinkedHashMap<>();
        for (String file : task.files()) {
            try {
                lockTargets.putIfAbsent(workingDir.resolve(file).normalize(), file);
            } catch (InvalidPathException ex) {
                log.warn("Skipping task {}: invalid file path {}", task.taskId(), file);
                return WorkerResult.failure(task.taskId(), "Invalid file path " + file + ": " + ex.getMessage(), "");
            }
        }
        try (TaskLocks locks = new TaskLocks()) {
            for (Map.Entry<Path, String> target : lockTargets.entrySet()) {
                String file = target.getValue();
                try {
                    locks.add(lockManager.scopedAcquire(
                            target.getKey().toString(), lockTimeout, lockExpiry, cancellation));
                } catch (LockTimeoutException ex) {
                    metricsService.recordLockTimeout(ex.getResourceKey());
                    log.warn("Skipping task {}: {}", task.taskId(), ex.getMessage());
                    return WorkerResult.failure(task.taskId(),
                            "Could not acquire lock for " + file + ": " + ex.getMessage(),
                            "Lock timeout: " + ex.getMessage());
                } catch (IllegalArgumentException ex) {
                    log.warn("Skipping task {}: invalid file path {}", task.taskId(), file);
                    return WorkerResult.failure(task.taskId(),
                            "Invalid file path " + file + ": " + ex.getMessage(), "");
                }
            }
            return invokeWorker(task, workingDir);
        }
    }

    private WorkerResult invokeWorker(TaskSpec task, Path workingDir) {
        try {
            WorkerResult result = worker.execute(task, workingDir);
            if (result == null) {
                return WorkerResult.failure(task.taskId(), "Worker returned no result", "Exception: Worker returned no result");
            }
            return result;
        } catch (RuntimeException ex) {
            log.error("Task {} failed with exception: {}", task.taskId(), ex.getMessage(), ex);
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return WorkerResult.failure(task.taskId(), message, "Exception: " + message);
        }
    }

    private WorkerResult cancelled(TaskSpec task) {
        return WorkerResult.failure(task.taskId(), TASK_CANCELLED_MESSAGE, "");
    }

    private void notifyAssigned(TaskSpec task) {
        try {
            eventProcessingService.emitTaskAssigned(task.taskId(), worker.id(), task.description());
        } catch (RuntimeException ex) {
            log.warn("Failed to emit task assigned event for {}: {}", task.taskId(), ex.getMessage());
        }
    }

    private void notifyCompleted(WorkerResult result) {
        try {
            eventProcessingService.emitWorkerCompleted(result);
        } catch (RuntimeException ex) {
            log.warn("Failed to emit worker completed event for {}: {}", result.taskId(), ex.getMessage());
        }
    }

    /**
     * Locks taken for one task, released in reverse order of acquisition.
     */
    private static final class TaskLocks implements AutoCloseable {

        private final Deque<ScopedLock> held = new ArrayDeque<>();

        void add(ScopedLock lock) {
            held.push(lock);
        }

        @Override
        public void close() {
            while (!held.isEmpty()) {
                held.pop().close();
            }
        }
    }
}
