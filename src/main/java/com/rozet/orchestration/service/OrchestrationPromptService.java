package com.rozet.orchestration.service;

import static com.rozet.orchestration.OrchestrationConstants.*;
import com.rozet.orchestration.model.TaskSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class OrchestrationPromptService {

    private final JsonProcessingService jsonProcessingService;

    public String plannerSystemPrompt(int maxTasks) {
        return PLANNER_SYSTEM_PROMPT.formatted(maxTasks).strip();
    }

    public String plannerUserMessage(String request, String contextSummary, int maxTasks) {
        Map<String, Object> instructions = new LinkedHashMap<>();
        instructions.put("user_request", request);
        instructions.put("context_summary", contextSummary == null ? "" : contextSummary);
        instructions.put("max_tasks", maxTasks);
        return jsonProcessingService.toJson(instructions);
    }

    public String workerSystemPrompt() {
        return WORKER_SYSTEM_PROMPT.strip();
    }

    public String workerTaskPrompt(TaskSpec task) {
        StringBuilder sb = new StringBuilder();
        sb.append("Task ID: ").append(task.taskId()).append("\n");
        sb.append("Description: ").append(task.description()).append("\n\n");
        if (!task.files().isEmpty()) {
            sb.append("Files to work with:\n");
            for (String file : task.files()) {
                sb.append("  - ").append(file).append("\n");
            }
            sb.append("\n");
        }
        if (!task.successCriteria().isEmpty()) {
            sb.append("Success criteria:\n");
            for (String criterion : task.successCriteria()) {
                sb.append("  - ").append(criterion).append("\n");
            }
            sb.append("\n");
        }
        sb.append(WORKER_TOOLS_SECTION).append("\n");
        sb.append(WORKER_RESULT_SCHEMA);
        return sb.toString();
    }
}
