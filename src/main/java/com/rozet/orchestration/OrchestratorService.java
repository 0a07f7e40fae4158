package com.rozet.orchestration;

import com.rozet.config.RozetProperties;
import com.rozet.orchestration.model.CancellationSignal;
import com.rozet.orchestration.model.OrchestrationResult;
import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.model.WorkerResult;
import com.rozet.orchestration.planning.TaskPlanner;
import com.rozet.orchestration.service.ConversationContextService;
import com.rozet.orchestration.service.OrchestrationMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point for callers: plan a request, execute a task list, or both. Requests, plans and
 * results are recorded in the conversation context, whose summary feeds the next plan when
 * the caller passes none. When a workspace root is configured, every working directory must
 * lie inside it.
 */
@Service
@Slf4j
public class OrchestratorService {

    private final TaskPlanner taskPlanner;
    private final Coordinator coordinator;
    private final ConversationContextService contextService;
    private final OrchestrationMetricsService metricsService;
    private final RozetProperties properties;

    public OrchestratorService(TaskPlanner taskPlanner,
                               Coordinator coordinator,
                               ConversationContextService contextService,
                               OrchestrationMetricsService metricsService,
                               RozetProperties properties) {
        this.taskPlanner = taskPlanner;
        this.coordinator = coordinator;
        this.contextService = contextService;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    public List<TaskSpec> plan(String request, @Nullable String contextSummary) {
        log.info("Planning request: {}", request);
        String context = StringUtils.hasText(contextSummary) ? contextSummary : contextService.contextSummary();
        contextService.recordUser(request);
        List<TaskSpec> tasks = taskPlanner.plan(request, context);
        contextService.recordAssistant("Planned " + tasks.size() + " tasks: "
                + tasks.stream().map(TaskSpec::taskId).collect(Collectors.joining(", ")));
        return tasks;
    }

    public List<WorkerResult> execute(List<TaskSpec> tasks, @Nullable String workingDir) {
        return execute(tasks, workingDir, CancellationSignal.none());
    }

    public List<WorkerResult> execute(List<TaskSpec> tasks, @Nullable String workingDir, CancellationSignal cancellation) {
        Path directory = resolveWorkingDir(workingDir);
        log.info("Executing {} tasks in {}", tasks == null ? 0 : tasks.size(), directory);
        List<WorkerResult> results = coordinator.executeTasks(tasks, directory, cancellation);
        for (WorkerResult result : results) {
            contextService.recordAssistant(describe(result));
        }
        contextService.prune();
        metricsService.logSummary();
        return results;
    }

    public OrchestrationResult run(String request, @Nullable String contextSummary, @Nullable String workingDir) {
        // Reject an out-of-root directory before planning.
        resolveWorkingDir(workingDir);
        List<TaskSpec> tasks = plan(request, contextSummary);
        List<WorkerResult> results = execute(tasks, workingDir);
        return new OrchestrationResult(tasks, results);
    }

    /**
     * Resolves the caller's working directory. Relative paths resolve against the workspace
     * root when one is configured, and the result must stay inside it.
     *
     * @throws IllegalArgumentException if the directory lies outside the workspace root
     */
    Path resolveWorkingDir(@Nullable String workingDir) {
        String rootValue = properties.getWorkspaceRoot();
        if (!StringUtils.hasText(rootValue)) {
            String directory = StringUtils.hasText(workingDir) ? workingDir : System.getProperty("user.dir");
            return Path.of(directory).toAbsolutePath().normalize();
        }
        Path root = Path.of(rootValue).toAbsolutePath().normalize();
        if (!StringUtils.hasText(workingDir)) {
            return root;
        }
        Path target = root.resolve(workingDir).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("Working directory is outside the workspace root: " + workingDir);
        }
        return target;
    }

    private static String describe(WorkerResult result) {
        String line = "Task " + result.taskId() + ": " + (result.success() ? "SUCCESS" : "FAILED");
        return result.errors().isEmpty() ? line : line + " Errors: " + String.join(", ", result.errors());
    }
}
