package com.rozet.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Outcome of parsing a planner response: either the coerced task list or the reason the
 * response could not be used.
 */
public record PlanParseResult(
        List<TaskSpec> tasks,
        @Nullable String failureReason
) {

    public PlanParseResult {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static PlanParseResult parsed(List<TaskSpec> tasks) {
        return new PlanParseResult(tasks, null);
    }

    public static PlanParseResult failure(String reason) {
        return new PlanParseResult(List.of(), reason);
    }

    public boolean isParsed() {
        return failureReason == null;
    }
}
