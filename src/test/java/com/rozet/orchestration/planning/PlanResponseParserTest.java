package com.rozet.orchestration.planning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rozet.orchestration.model.PlanParseResult;
import com.rozet.orchestration.model.TaskBudget;
import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.service.JsonProcessingService;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanResponseParserTest {

    private final PlanResponseParser parser = new PlanResponseParser(new JsonProcessingService(new ObjectMapper()));

    @Test
    void testParsesFencedPlan() {
        String raw = """
                Here is the plan:
                ```json
                {"tasks": [
                  {"task_id": "T1", "description": "Create module", "files": ["src/app.py"],
                   "success_criteria": ["module imports"], "budget": "small", "dependencies": []},
                  {"task_id": "T2", "description": "Write tests", "files": ["tests/test_app.py"],
                   "success_criteria": ["tests pass"], "budget": "large", "dependencies": ["T1"]}
                ]}
                ```
                """;

        PlanParseResult result = parser.parse(raw, 6);

        assertTrue(result.isParsed());
        List<TaskSpec> tasks = result.tasks();
        assertEquals(2, tasks.size());
        assertEquals("T1", tasks.get(0).taskId());
        assertEquals(List.of("src/app.py"), tasks.get(0).files());
        assertEquals(TaskBudget.SMALL, tasks.get(0).budget());
        assertEquals(TaskBudget.LARGE, tasks.get(1).budget());
        assertEquals(List.of("T1"), tasks.get(1).dependencies());
    }

    @Test
    void testParsesJsonSurroundedByProse() {
        PlanParseResult result = parser.parse(
                "Sure! {\"tasks\": [{\"description\": \"Do it\"}]} Let me know.", 6);

        assertTrue(result.isParsed());
        assertEquals("Do it", result.tasks().get(0).description());
    }

    @Test
    void testCoercesLooseEntries() {
        String raw = """
                {"tasks": [
                  {"description": "  First  ", "files": "a.txt", "success_criteria": "works", "budget": "huge"},
                  {"task_id": "X", "description": "Second", "dependencies": "T1", "budget": null}
                ]}
                """;

        List<TaskSpec> tasks = parser.parse(raw, 6).tasks();

        assertEquals("T1", tasks.get(0).taskId());
        assertEquals("First", tasks.get(0).description());
        assertEquals(List.of("a.txt"), tasks.get(0).files());
        assertEquals(List.of("works"), tasks.get(0).successCriteria());
        assertEquals(TaskBudget.MEDIUM, tasks.get(0).budget());
        assertEquals("X", tasks.get(1).taskId());
        assertEquals(List.of("T1"), tasks.get(1).dependencies());
        assertEquals(TaskBudget.MEDIUM, tasks.get(1).budget());
    }

    @Test
    void testSkipsUnusableEntriesAndRenamesDuplicates() {
        String raw = """
                {"tasks": ["just a string", {"task_id": "T1"}, {"task_id": "T1", "description": "A"},
                           {"task_id": "T1", "description": "B"}]}
                """;

        List<TaskSpec> tasks = parser.parse(raw, 6).tasks();

        assertEquals(2, tasks.size());
        assertEquals("T1", tasks.get(0).taskId());
        assertEquals("T2", tasks.get(1).taskId());
        assertEquals("B", tasks.get(1).description());
    }

    @Test
    void testTruncatesToMaxTasks() {
        String raw = """
                {"tasks": [{"description": "1"}, {"description": "2"}, {"description": "3"}]}
                """;

        List<TaskSpec> tasks = parser.parse(raw, 2).tasks();

        assertEquals(2, tasks.size());
        assertEquals("T2", tasks.get(1).taskId());
    }

    @Test
    void testFailures() {
        assertFalse(parser.parse("not-json", 6).isParsed());
        assertFalse(parser.parse("", 6).isParsed());
        assertFalse(parser.parse(null, 6).isParsed());
        assertFalse(parser.parse("{\"steps\": []}", 6).isParsed());
        assertFalse(parser.parse("{\"tasks\": []}", 6).isParsed());

        PlanParseResult noDescriptions = parser.parse("{\"tasks\": [{\"task_id\": \"T1\"}]}", 6);
        assertFalse(noDescriptions.isParsed());
        assertNotNull(noDescriptions.failureReason());
    }
}
