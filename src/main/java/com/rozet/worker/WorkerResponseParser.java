package com.rozet.worker;

import static com.rozet.orchestration.OrchestrationConstants.RAW_RESPONSE_LOG_LIMIT;
import com.fasterxml.jackson.databind.JsonNode;
import com.rozet.orchestration.model.TestRun;
import com.rozet.orchestration.model.ToolAction;
import com.rozet.orchestration.model.WorkerResponse;
import com.rozet.orchestration.service.JsonProcessingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the worker model's answer. Tolerates markdown fences, ANSI escapes and text around
 * the JSON value, and coerces loosely typed fields: a scalar where a list is expected, an
 * array of log lines, a bare tool name in {@code tools_used}, structured values where text is
 * expected. Entries that cannot be coerced are skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkerResponseParser {

    private final JsonProcessingService jsonProcessingService;

    /**
     * @throws WorkerResponseParseException if the answer contains no JSON object
     */
    public WorkerResponse parse(String raw) {
        JsonNode node = jsonProcessingService.decodeFirstJsonValue(raw)
                .orElseThrow(() -> new WorkerResponseParseException("no JSON object found in response"));
        if (node.isArray()) {
            node = firstObject(node);
        }
        if (!node.isObject()) {
            throw new WorkerResponseParseException("no JSON object found in response");
        }

        List<String> errors = textList(node.get("errors"));
        String error = text(node.get("error"));
        if (!error.isEmpty()) {
            errors.add(error);
        }
        return new WorkerResponse(
                flag(node.get("success")),
                toolActions(node.get("tools_used")),
                textList(node.get("files_modified")),
                textList(node.get("files_created")),
                testRuns(node.get("tests_run")),
                flag(node.get("verification_passed")),
                errors,
                logs(node.get("logs")));
    }

    public String preview(String raw) {
        return jsonProcessingService.truncate(raw, RAW_RESPONSE_LOG_LIMIT);
    }

    private JsonNode firstObject(JsonNode array) {
        for (JsonNode element : array) {
            if (element.isObject()) {
                return element;
            }
        }
        throw new WorkerResponseParseException("JSON array contains no object");
    }

    private List<ToolAction> toolActions(@Nullable JsonNode node) {
        List<ToolAction> actions = new ArrayList<>();
        for (JsonNode entry : elements(node)) {
            if (entry.isObject()) {
                String tool = text(entry.get("tool"));
                if (tool.isEmpty()) {
                    log.warn("Skipping tools_used entry without a tool name");
                    continue;
                }
                actions.add(new ToolAction(tool,
                        optionalText(entry.get("file")),
                        optionalText(entry.get("path")),
                        optionalText(entry.get("content")),
                        optionalText(entry.get("command")),
                        optionalText(entry.get("directory")),
                        optionalText(entry.get("pattern")),
                        optionalText(entry.get("result"))));
            } else if (entry.isTextual() && !entry.asText().isBlank()) {
                actions.add(new ToolAction(entry.asText().trim(), null, null, null, null, null, null, null));
            } else {
                log.warn("Skipping tools_used entry of type {}", entry.getNodeType());
            }
        }
        return actions;
    }

    private List<TestRun> testRuns(@Nullable JsonNode node) {
        List<TestRun> runs = new ArrayList<>();
        for (JsonNode entry : elements(node)) {
            if (entry.isObject()) {
                runs.add(new TestRun(text(entry.get("name")), text(entry.get("status")),
                        entry.path("duration_ms").asLong(0L)));
            } else if (entry.isTextual() && !entry.asText().isBlank()) {
                runs.add(new TestRun(entry.asText().trim(), "", 0L));
            } else {
                log.warn("Skipping tests_run entry of type {}", entry.getNodeType());
            }
        }
        return runs;
    }

    private static String logs(@Nullable JsonNode node) {
        if (node != null && node.isArray()) {
            List<String> lines = new ArrayList<>();
            for (JsonNode line : node) {
                lines.add(line.isValueNode() ? line.asText() : line.toString());
            }
            return String.join("\n", lines);
        }
        return text(node);
    }

    private static boolean flag(@Nullable JsonNode node) {
        return node != null && !node.isNull() && node.asBoolean(false);
    }

    private static List<JsonNode> elements(@Nullable JsonNode node) {
        List<JsonNode> values = new ArrayList<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return values;
        }
        if (node.isArray()) {
            node.forEach(values::add);
        } else {
            values.add(node);
        }
        return values;
    }

    private static String text(@Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        return (node.isValueNode() ? node.asText() : node.toString()).trim();
    }

    @Nullable
    private static String optionalText(@Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static List<String> textList(@Nullable JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode element : elements(node)) {
            String value = text(element);
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }
}
