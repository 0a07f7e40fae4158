package com.rozet.api;

import com.rozet.orchestration.model.TaskSpec;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record PlanResponse(
        String requestId,
        Instant createdAt,
        List<TaskSpec> tasks
) {

    public static PlanResponse from(List<TaskSpec> tasks) {
        return new PlanResponse(UUID.randomUUID().toString(), Instant.now(), tasks);
    }
}
