package com.rozet.orchestration.service;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private static final Pattern ANSI_ESCAPE = Pattern.compile("\u001B\\[[0-?]*[ -/]*[@-~]|\u001B[@-Z\\\\-_]");
    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    /**
     * Pulls the JSON document out of a planner answer: the body of a {@code ```json} fence,
     * else of a generic fence, else the text between the first '{' and the last '}'.
     */
    public String extractFencedJson(@Nullable String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw;
        int jsonFence = text.indexOf(JSON_FENCE);
        if (jsonFence >= 0) {
            text = fenceBody(text, jsonFence + JSON_FENCE.length());
        } else {
            int fence = text.indexOf(FENCE);
            if (fence >= 0) {
                text = fenceBody(text, fence + FENCE.length());
            }
        }
        text = text.trim();
        if (!text.isEmpty() && !text.startsWith("{")) {
            int firstBrace = text.indexOf('{');
            int lastBrace = text.lastIndexOf('}');
            if (firstBrace >= 0 && lastBrace > firstBrace) {
                text = text.substring(firstBrace, lastBrace + 1);
            }
        }
        return text;
    }

    public JsonNode readTree(String json) throws JsonProcessingException {
        return objectMapper.readTree(json);
    }

    /**
     * Finds the first '{' or '[' in the ANSI-stripped text from which a complete JSON object or
     * array decodes, ignoring any trailing text.
     */
    public Optional<JsonNode> decodeFirstJsonValue(@Nullable String raw) {
        if (!StringUtils.hasText(raw)) {
            return Optional.empty();
        }
        String text = stripAnsi(raw);
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current != '{' && current != '[') {
                continue;
            }
            try (JsonParser parser = objectMapper.getFactory().createParser(text.substring(index))) {
                JsonNode node = objectMapper.readTree(parser);
                if (node != null && node.isContainerNode()) {
                    return Optional.of(node);
                }
            } catch (IOException ex) {
                log.trace("No JSON value at offset {}: {}", index, ex.getMessage());
            }
        }
        return Optional.empty();
    }

    public String stripAnsi(String text) {
        return ANSI_ESCAPE.matcher(text).replaceAll("");
    }

    public String truncate(@Nullable String value, int maxLength) {
        if (value == null) {
            return "";
        }
        if (value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return "\"serialization-failed-" + UUID.randomUUID() + "\"";
        }
    }

    private String fenceBody(String text, int start) {
        int end = text.indexOf(FENCE, start);
        return end < 0 ? text.substring(start) : text.substring(start, end);
    }
}
