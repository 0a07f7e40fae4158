package com.rozet.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rozet.config.RozetProperties;
import com.rozet.orchestration.api.CompletionService;
import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.model.WorkerResult;
import com.rozet.orchestration.service.JsonProcessingService;
import com.rozet.orchestration.service.OrchestrationMetricsService;
import com.rozet.orchestration.service.OrchestrationPromptService;
import com.rozet.tools.RemoteToolClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteToolWorkerTest {

    @TempDir
    Path tempDir;

    private CompletionService completionService;
    private WorkerPipeline pipeline;
    private final TaskSpec task = TaskSpec.of("T1", "Create files", List.of("a.txt"));

    @BeforeEach
    void setUp() {
        completionService = mock(CompletionService.class);
        when(completionService.modelName()).thenReturn("test-model");
        JsonProcessingService json = new JsonProcessingService(new ObjectMapper());
        pipeline = new WorkerPipeline(completionService, new OrchestrationPromptService(json),
                new WorkerResponseParser(json), new ResultVerifier(), new OrchestrationMetricsService(), true);
    }

    private RemoteToolWorker localOnlyWorker() {
        RemoteToolClient client = new RemoteToolClient(RestClient.builder(), new RozetProperties());
        return new RemoteToolWorker(pipeline, new RemoteToolActionExecutor(client, Duration.ofSeconds(5)));
    }

    @Test
    void testExecutesActionsLocallyWhenEndpointNotConfigured() throws IOException {
        when(completionService.complete(anyString(), anyString())).thenReturn("""
                {"success": true, "verification_passed": true, "files_created": [],
                 "tools_used": [
                   {"tool": "write_file", "file": "a.txt", "content": "alpha"},
                   {"tool": "Write_File", "path": "docs/b.md", "content": "beta"},
                   {"tool": "read_file", "file": "a.txt"},
                   {"tool": "list_files", "directory": ".", "pattern": "*.txt"},
                   {"tool": "execute_bash", "command": "echo ran > c.log"},
                   {"tool": "browse_web"}
                 ]}
                """);

        WorkerResult result = localOnlyWorker().execute(task, tempDir);

        assertTrue(result.success(), () -> String.valueOf(result.errors()));
        assertEquals(List.of("a.txt", "docs/b.md"), result.filesCreated());
        assertEquals("alpha", Files.readString(tempDir.resolve("a.txt")));
        assertEquals("beta", Files.readString(tempDir.resolve("docs/b.md")));
        assertEquals("ran", Files.readString(tempDir.resolve("c.log")).trim());
        assertTrue(result.logs().contains("Unsupported tool 'browse_web', skipped"));
        assertEquals("remote:test-model", localOnlyWorker().id());
    }

    @Test
    void testActionErrorsFailTheTask() {
        when(completionService.complete(anyString(), anyString())).thenReturn("""
                {"success": true, "tools_used": [
                   {"tool": "write_file", "content": "no path"},
                   {"tool": "read_file"},
                   {"tool": "execute_bash"},
                   {"tool": "read_file", "file": "missing.txt"},
                   {"tool": "execute_bash", "command": "exit 2"}
                 ]}
                """);

        WorkerResult result = localOnlyWorker().execute(task, tempDir);

        assertFalse(result.success());
        assertTrue(result.errors().contains("write_file missing path"));
        assertTrue(result.errors().contains("read_file missing path"));
        assertTrue(result.errors().contains("execute_bash missing command"));
        assertTrue(result.errors().stream().anyMatch(error -> error.contains("missing.txt")));
        assertTrue(result.errors().stream().anyMatch(error -> error.contains("exit 2")));
    }

    @Test
    void testRoutesActionsToRemoteEndpoint() throws IOException {
        RozetProperties properties = new RozetProperties();
        properties.getRemoteTools().setBaseUrl("http://tools.local");
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        RemoteToolClient client = new RemoteToolClient(builder, properties);
        RemoteToolWorker worker = new RemoteToolWorker(pipeline, new RemoteToolActionExecutor(client, Duration.ofSeconds(5)));

        Files.writeString(tempDir.resolve("a.txt"), "remote wrote this");
        server.expect(once(), requestTo("http://tools.local/tool/execute?directory=" + tempDir.toAbsolutePath().normalize()))
                .andExpect(jsonPath("$.tool").value("write"))
                .andExpect(jsonPath("$.args.filePath").value("a.txt"))
                .andExpect(jsonPath("$.args.content").value("remote wrote this"))
                .andRespond(withSuccess("{\"success\": true, \"result\": {\"output\": \"ok\"}}", MediaType.APPLICATION_JSON));
        when(completionService.complete(anyString(), anyString())).thenReturn("""
                {"success": true, "tools_used": [{"tool": "write_file", "file": "a.txt", "content": "remote wrote this"}]}
                """);

        WorkerResult result = worker.execute(task, tempDir);

        server.verify();
        assertTrue(result.success());
        assertEquals(List.of("a.txt"), result.filesCreated());
    }

    @Test
    void testFallsBackToLocalExecutionWhenEndpointFails() throws IOException {
        RozetProperties properties = new RozetProperties();
        properties.getRemoteTools().setBaseUrl("http://tools.local");
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        RemoteToolClient client = new RemoteToolClient(builder, properties);
        RemoteToolWorker worker = new RemoteToolWorker(pipeline, new RemoteToolActionExecutor(client, Duration.ofSeconds(5)));

        server.expect(once(), requestTo("http://tools.local/tool/execute?directory=" + tempDir.toAbsolutePath().normalize()))
                .andRespond(withServerError());
        when(completionService.complete(anyString(), anyString())).thenReturn("""
                {"success": true, "tools_used": [{"tool": "write_file", "file": "a.txt", "content": "local"}]}
                """);

        WorkerResult result = worker.execute(task, tempDir);

        server.verify();
        assertTrue(result.success());
        assertEquals("local", Files.readString(tempDir.resolve("a.txt")));
        assertEquals(List.of("a.txt"), result.filesCreated());
    }
}
