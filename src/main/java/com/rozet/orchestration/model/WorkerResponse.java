package com.rozet.orchestration.model;

import java.util.List;

/**
 * Typed view of the JSON object a worker model returns, after coercion of loose fields.
 */
public record WorkerResponse(
        boolean success,
        List<ToolAction> toolsUsed,
        List<String> filesModified,
        List<String> filesCreated,
        List<TestRun> testsRun,
        boolean verificationPassed,
        List<String> errors,
        String logs
) {

    public WorkerResponse {
        toolsUsed = toolsUsed == null ? List.of() : List.copyOf(toolsUsed);
        filesModified = filesModified == null ? List.of() : List.copyOf(filesModified);
        filesCreated = filesCreated == null ? List.of() : List.copyOf(filesCreated);
        testsRun = testsRun == null ? List.of() : List.copyOf(testsRun);
        errors = errors == null ? List.of() : List.copyOf(errors);
        logs = logs == null ? "" : logs;
    }
}
