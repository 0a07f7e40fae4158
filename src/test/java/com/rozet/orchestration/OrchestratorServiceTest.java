package com.rozet.orchestration;

import com.rozet.config.RozetProperties;
import com.rozet.orchestration.api.CompletionService;
import com.rozet.orchestration.model.CancellationSignal;
import com.rozet.orchestration.model.OrchestrationResult;
import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.model.WorkerResult;
import com.rozet.orchestration.planning.TaskPlanner;
import com.rozet.orchestration.service.ConversationContextService;
import com.rozet.orchestration.service.OrchestrationMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class OrchestratorServiceTest {

    @TempDir
    Path tempDir;

    private TaskPlanner taskPlanner;
    private Coordinator coordinator;
    private RozetProperties properties;
    private ConversationContextService contextService;
    private OrchestratorService service;

    @BeforeEach
    void setUp() {
        taskPlanner = mock(TaskPlanner.class);
        coordinator = mock(Coordinator.class);
        properties = new RozetProperties();
        OrchestrationMetricsService metricsService = new OrchestrationMetricsService();
        contextService = new ConversationContextService(mock(CompletionService.class), metricsService, properties);
        service = new OrchestratorService(taskPlanner, coordinator, contextService, metricsService, properties);
    }

    @Test
    void testRunPlansThenExecutes() {
        List<TaskSpec> tasks = List.of(TaskSpec.of("T1", "Write README", List.of("README.md")));
        List<WorkerResult> results = List.of(WorkerResult.builder("T1").success(true).build());
        when(taskPlanner.plan("add readme", "")).thenReturn(tasks);
        when(coordinator.executeTasks(eq(tasks), eq(tempDir.toAbsolutePath().normalize()), any(CancellationSignal.class)))
                .thenReturn(results);

        OrchestrationResult result = service.run("add readme", null, tempDir.toString());

        assertEquals(tasks, result.tasks());
        assertEquals(results, result.results());
        assertTrue(result.allSucceeded());
    }

    @Test
    void testRunRecordsConversationAndFeedsNextPlan() {
        when(taskPlanner.plan(eq("add readme"), anyString()))
                .thenReturn(List.of(TaskSpec.of("T1", "Write README", List.of("README.md"))));
        when(coordinator.executeTasks(any(), any(), any(CancellationSignal.class)))
                .thenReturn(List.of(WorkerResult.failure("T1", "disk full", "")));

        service.run("add readme", null, tempDir.toString());

        assertEquals(List.of("user: add readme", "assistant: Planned 1 tasks: T1",
                        "assistant: Task T1: FAILED Errors: disk full"),
                contextService.recentMessages().stream().map(m -> m.render()).toList());

        when(taskPlanner.plan(eq("retry"), anyString())).thenReturn(List.of());
        service.plan("retry", null);

        verify(taskPlanner).plan(eq("retry"), eq(
                "Recent conversation:\nuser: add readme\nassistant: Planned 1 tasks: T1\n"
                        + "assistant: Task T1: FAILED Errors: disk full"));
    }

    @Test
    void testExplicitContextSummaryWins() {
        when(taskPlanner.plan(anyString(), anyString())).thenReturn(List.of());
        contextService.recordUser("earlier request");

        service.plan("next", "caller supplied context");

        verify(taskPlanner).plan("next", "caller supplied context");
    }

    @Test
    void testWorkingDirDefaultsToWorkspaceRoot() {
        properties.setWorkspaceRoot(tempDir.toString());
        assertEquals(tempDir.toAbsolutePath().normalize(), service.resolveWorkingDir(null));

        properties.setWorkspaceRoot(null);
        assertEquals(Path.of(System.getProperty("user.dir")).toAbsolutePath().normalize(),
                service.resolveWorkingDir(" "));
    }

    @Test
    void testWorkingDirConfinedToWorkspaceRoot() {
        properties.setWorkspaceRoot(tempDir.toString());
        Path root = tempDir.toAbsolutePath().normalize();

        assertEquals(root.resolve("project"), service.resolveWorkingDir("project"));
        assertEquals(root.resolve("project"), service.resolveWorkingDir(root.resolve("project").toString()));
        assertThrows(IllegalArgumentException.class, () -> service.resolveWorkingDir("../outside"));
        assertThrows(IllegalArgumentException.class, () -> service.resolveWorkingDir("/etc"));
    }

    @Test
    void testRunRejectsOutsideWorkingDirBeforePlanning() {
        properties.setWorkspaceRoot(tempDir.resolve("root").toString());

        assertThrows(IllegalArgumentException.class,
                () -> service.run("add readme", null, tempDir.toString()));

        verifyNoInteractions(taskPlanner, coordinator);
    }
}
