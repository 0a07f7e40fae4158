package com.rozet.orchestration.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JsonProcessingServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonProcessingService service = new JsonProcessingService(objectMapper);

    @Test
    void testExtractJsonFence() {
        String raw = "Plan:\n```json\n{\"tasks\": []}\n```\nDone.";
        assertEquals("{\"tasks\": []}", service.extractFencedJson(raw));
    }

    @Test
    void testExtractGenericFence() {
        String raw = "```\n{\"a\": 1}\n```";
        assertEquals("{\"a\": 1}", service.extractFencedJson(raw));
    }

    @Test
    void testExtractBracesFromProse() {
        String raw = "Here is the result: {\"name\":\"John\", \"age\":30} and some extra text.";
        assertEquals("{\"name\":\"John\", \"age\":30}", service.extractFencedJson(raw));
    }

    @Test
    void testExtractLeavesPlainJsonAlone() {
        assertEquals("{\"a\": 1}", service.extractFencedJson("  {\"a\": 1}  "));
        assertEquals("", service.extractFencedJson(null));
    }

    @Test
    void testDecodeFirstJsonValueIgnoresTrailingText() {
        Optional<JsonNode> node = service.decodeFirstJsonValue("Result {\"success\": true} trailing {oops");

        assertTrue(node.isPresent());
        assertTrue(node.get().get("success").asBoolean());
    }

    @Test
    void testDecodeFirstJsonValueSkipsBrokenCandidates() {
        Optional<JsonNode> node = service.decodeFirstJsonValue("{not json} then {\"ok\": 1}");

        assertTrue(node.isPresent());
        assertEquals(1, node.get().get("ok").asInt());
    }

    @Test
    void testDecodeFirstJsonValueStripsAnsi() {
        String raw = "\u001B[32m{\"success\": \u001B[1mtrue\u001B[0m}\u001B[0m";

        Optional<JsonNode> node = service.decodeFirstJsonValue(raw);

        assertTrue(node.isPresent());
        assertTrue(node.get().get("success").asBoolean());
    }

    @Test
    void testDecodeFirstJsonValueEmpty() {
        assertTrue(service.decodeFirstJsonValue("no json here").isEmpty());
        assertTrue(service.decodeFirstJsonValue("").isEmpty());
        assertTrue(service.decodeFirstJsonValue(null).isEmpty());
    }

    @Test
    void testTruncate() {
        assertEquals("abc", service.truncate("abcdef", 3));
        assertEquals("ab", service.truncate("ab", 3));
        assertEquals("", service.truncate(null, 3));
    }

    @Test
    void testToJson() {
        String json = service.toJson(Map.of("name", "Alice"));
        assertTrue(json.contains("\"name\" : \"Alice\""));
    }
}
