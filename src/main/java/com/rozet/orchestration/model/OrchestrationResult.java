package com.rozet.orchestration.model;

import java.util.List;

public record OrchestrationResult(
        List<TaskSpec> tasks,
        List<WorkerResult> results
) {

    public boolean allSucceeded() {
        return results.stream().allMatch(WorkerResult::success);
    }
}
