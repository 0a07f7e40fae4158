package com.rozet.orchestration.api;

import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.model.WorkerResult;

/**
 * Fire-and-forget lifecycle notifications emitted while planning and executing tasks.
 * Implementations must never throw: a delivery failure cannot fail the calling operation.
 */
public interface EventProcessingService {

    /**
     * Emits a notification that the planner produced a task.
     *
     * @param task The planned {@link TaskSpec}.
     */
    void emitTaskPlanned(TaskSpec task);

    /**
     * Emits a notification that a task was handed to a worker.
     *
     * @param taskId The id of the assigned task.
     * @param workerId An opaque identifier of the worker.
     * @param description The task description.
     */
    void emitTaskAssigned(String taskId, String workerId, String description);

    /**
     * Emits a notification that a worker finished a task, successfully or not.
     *
     * @param result The {@link WorkerResult} recorded for the task.
     */
    void emitWorkerCompleted(WorkerResult result);
}
