package com.rozet.orchestration.planning;

import static com.rozet.orchestration.OrchestrationConstants.TASK_ID_PREFIX;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.rozet.orchestration.model.PlanParseResult;
import com.rozet.orchestration.model.TaskBudget;
import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.service.JsonProcessingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a planner answer into task specs. Loose model output is coerced where the intent is
 * clear (scalar where a list is expected, missing ids, unknown budgets); entries that cannot
 * become a task are skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlanResponseParser {

    private final JsonProcessingService jsonProcessingService;

    public PlanParseResult parse(String raw, int maxTasks) {
        String json = jsonProcessingService.extractFencedJson(raw);
        if (!StringUtils.hasText(json)) {
            return PlanParseResult.failure("Planner returned an empty response");
        }
        JsonNode root;
        try {
            root = jsonProcessingService.readTree(json);
        } catch (JsonProcessingException ex) {
            return PlanParseResult.failure("Planner returned invalid JSON: " + ex.getOriginalMessage());
        }
        JsonNode tasksNode = root.isArray() ? root : root.path("tasks");
        if (!tasksNode.isArray()) {
            return PlanParseResult.failure("Planner response has no tasks array");
        }

        int limit = Math.min(tasksNode.size(), Math.max(1, maxTasks));
        if (tasksNode.size() > limit) {
            log.info("Planner returned {} tasks, keeping the first {}", tasksNode.size(), limit);
        }
        List<TaskSpec> tasks = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        for (int index = 0; index < limit; index++) {
            JsonNode entry = tasksNode.get(index);
            if (!entry.isObject()) {
                log.warn("Skipping planner task #{}: not an object", index + 1);
                continue;
            }
            String description = text(entry.get("description"));
            if (description.isEmpty()) {
                log.warn("Skipping planner task #{}: missing description", index + 1);
                continue;
            }
            String taskId = uniqueId(text(entry.get("task_id")), tasks.size() + 1, seenIds);
            seenIds.add(taskId);
            tasks.add(new TaskSpec(
                    taskId,
                    description,
                    textList(entry.get("files")),
                    textList(entry.get("success_criteria")),
                    TaskBudget.fromLabel(text(entry.get("budget"))),
                    textList(entry.get("dependencies"))));
        }
        if (tasks.isEmpty()) {
            return PlanParseResult.failure("Planner returned no usable tasks");
        }
        return PlanParseResult.parsed(tasks);
    }

    private String uniqueId(String proposed, int position, Set<String> seenIds) {
        if (StringUtils.hasText(proposed) && !seenIds.contains(proposed)) {
            return proposed;
        }
        if (StringUtils.hasText(proposed)) {
            log.warn("Duplicate task id {} renamed", proposed);
        }
        int counter = position;
        String candidate = TASK_ID_PREFIX + counter;
        while (seenIds.contains(candidate)) {
            counter++;
            candidate = TASK_ID_PREFIX + counter;
        }
        return candidate;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        return (node.isValueNode() ? node.asText() : node.toString()).trim();
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                String value = text(element);
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
            return values;
        }
        String single = text(node);
        if (!single.isEmpty()) {
            values.add(single);
        }
        return values;
    }
}
