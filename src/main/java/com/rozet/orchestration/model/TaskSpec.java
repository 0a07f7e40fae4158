package com.rozet.orchestration.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;

public record TaskSpec(
        @JsonProperty("task_id") String taskId,
        String description,
        List<String> files,
        @JsonProperty("success_criteria") List<String> successCriteria,
        TaskBudget budget,
        List<String> dependencies
) {

    public TaskSpec {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Task id is required.");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Task description is required.");
        }
        files = files == null ? List.of() : List.copyOf(new LinkedHashSet<>(files));
        successCriteria = successCriteria == null ? List.of() : List.copyOf(successCriteria);
        budget = budget == null ? TaskBudget.MEDIUM : budget;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static TaskSpec of(String taskId, String description, List<String> files) {
        return new TaskSpec(taskId, description, files, List.of(), TaskBudget.MEDIUM, List.of());
    }
}
