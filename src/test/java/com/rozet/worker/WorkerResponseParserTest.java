package com.rozet.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rozet.orchestration.model.WorkerResponse;
import com.rozet.orchestration.service.JsonProcessingService;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkerResponseParserTest {

    private final WorkerResponseParser parser = new WorkerResponseParser(new JsonProcessingService(new ObjectMapper()));

    @Test
    void testParsesFencedAnsiResponse() {
        String raw = "\u001B[36mDone!\u001B[0m\n```json\n{\"success\": true, \"files_created\": [\"a.txt\"],"
                + " \"tools_used\": [{\"tool\": \"write_file\", \"file\": \"a.txt\", \"content\": \"hi\"}],"
                + " \"tests_run\": [{\"name\": \"t\", \"status\": \"passed\", \"duration_ms\": 12, \"extra\": 1}],"
                + " \"verification_passed\": true, \"unknown\": 5, \"logs\": \"ok\"}\n```";

        WorkerResponse response = parser.parse(raw);

        assertTrue(response.success());
        assertEquals(List.of("a.txt"), response.filesCreated());
        assertEquals("write_file", response.toolsUsed().get(0).normalizedTool());
        assertEquals("a.txt", response.toolsUsed().get(0).targetPath());
        assertEquals(12, response.testsRun().get(0).durationMs());
        assertTrue(response.verificationPassed());
        assertEquals("ok", response.logs());
        assertTrue(response.errors().isEmpty());
    }

    @Test
    void testTopLevelArrayUsesFirstObject() {
        WorkerResponse response = parser.parse("[1, {\"success\": true, \"errors\": \"single error\"}]");

        assertTrue(response.success());
        assertEquals(List.of("single error"), response.errors());
    }

    @Test
    void testLogsArrayIsJoinedIntoText() {
        WorkerResponse response = parser.parse(
                "{\"success\": true, \"files_created\": [\"a.txt\"], \"logs\": [\"wrote a.txt\", \"done\"]}");

        assertTrue(response.success());
        assertEquals(List.of("a.txt"), response.filesCreated());
        assertEquals("wrote a.txt\ndone", response.logs());
    }

    @Test
    void testBareToolNamesBecomeToolActions() {
        WorkerResponse response = parser.parse(
                "{\"success\": true, \"tools_used\": [\"write_file\", 42, {\"file\": \"no-tool.txt\"}]}");

        assertEquals(1, response.toolsUsed().size());
        assertEquals("write_file", response.toolsUsed().get(0).normalizedTool());
        assertNull(response.toolsUsed().get(0).targetPath());
    }

    @Test
    void testStructuredValuesAreRenderedAsText() {
        WorkerResponse response = parser.parse("{\"success\": true, \"result\": {\"ok\": true},"
                + " \"error\": {\"code\": 7},"
                + " \"logs\": {\"step\": 1},"
                + " \"tools_used\": [{\"tool\": \"execute_bash\", \"command\": \"ls\", \"result\": {\"exit\": 0}}]}");

        assertTrue(response.success());
        assertEquals(List.of("{\"code\":7}"), response.errors());
        assertEquals("{\"step\":1}", response.logs());
        assertEquals("{\"exit\":0}", response.toolsUsed().get(0).result());
    }

    @Test
    void testStringFlagsAreCoerced() {
        WorkerResponse response = parser.parse("{\"success\": \"true\", \"verification_passed\": \"yes\", \"tests_run\": \"unit\"}");

        assertTrue(response.success());
        assertFalse(response.verificationPassed());
        assertEquals("unit", response.testsRun().get(0).name());
    }

    @Test
    void testNoJsonRaises() {
        assertThrows(WorkerResponseParseException.class, () -> parser.parse("I could not do it."));
        assertThrows(WorkerResponseParseException.class, () -> parser.parse("[1, 2, 3]"));
        assertThrows(WorkerResponseParseException.class, () -> parser.parse("\"just a string\""));
    }

    @Test
    void testPreviewTruncatesTo500Characters() {
        assertEquals(500, parser.preview("x".repeat(900)).length());
    }
}
