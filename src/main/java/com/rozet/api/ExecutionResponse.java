package com.rozet.api;

import com.rozet.orchestration.model.OrchestrationResult;
import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.model.WorkerResult;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ExecutionResponse(
        String requestId,
        Instant completedAt,
        boolean success,
        List<TaskSpec> tasks,
        List<WorkerResult> results
) {

    public static ExecutionResponse from(OrchestrationResult result) {
        return new ExecutionResponse(UUID.randomUUID().toString(), Instant.now(), result.allSucceeded(),
                result.tasks(), result.results());
    }
}
