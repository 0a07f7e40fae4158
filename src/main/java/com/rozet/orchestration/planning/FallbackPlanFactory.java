package com.rozet.orchestration.planning;

import static com.rozet.orchestration.OrchestrationConstants.*;
import com.rozet.orchestration.model.TaskBudget;
import com.rozet.orchestration.model.TaskSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the single-task plan used when the model cannot produce a usable one.
 */
@Component
public class FallbackPlanFactory {

    public List<TaskSpec> fallbackPlan(String request) {
        String safeRequest = request == null ? "" : request;
        TaskSpec task = new TaskSpec(
                TASK_ID_FALLBACK,
                FALLBACK_DESCRIPTION_PREFIX + safeRequest,
                guessFiles(safeRequest),
                List.of(FALLBACK_SUCCESS_CRITERION),
                TaskBudget.MEDIUM,
                List.of());
        return List.of(task);
    }

    /**
     * Whitespace-separated tokens that contain a '/' and end with a known source or document
     * extension, in order of first appearance.
     */
    List<String> guessFiles(String request) {
        Set<String> files = new LinkedHashSet<>();
        for (String token : request.trim().split("\\s+")) {
            if (token.contains("/") && hasKnownExtension(token)) {
                files.add(token);
            }
        }
        return new ArrayList<>(files);
    }

    private boolean hasKnownExtension(String token) {
        String lower = token.toLowerCase(Locale.ROOT);
        return FALLBACK_FILE_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }
}
