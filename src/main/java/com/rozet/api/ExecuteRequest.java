package com.rozet.api;

import com.rozet.orchestration.model.TaskSpec;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ExecuteRequest(
        @NotNull List<TaskSpec> tasks,
        String workingDir
) {
}
