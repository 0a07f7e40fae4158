package com.rozet.orchestration.planning;

import static com.rozet.orchestration.OrchestrationConstants.PURPOSE_PLAN;
import com.rozet.config.RozetProperties;
import com.rozet.orchestration.api.CompletionService;
import com.rozet.orchestration.api.EventProcessingService;
import com.rozet.orchestration.model.PlanParseResult;
import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.service.OrchestrationMetricsService;
import com.rozet.orchestration.service.OrchestrationPromptService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Asks the model to decompose a request into tasks. Never fails: any model error or unusable
 * answer yields the single-task fallback plan.
 */
@Service
@Slf4j
public class TaskPlanner {

    private final CompletionService completionService;
    private final OrchestrationPromptService promptService;
    private final PlanResponseParser planResponseParser;
    private final FallbackPlanFactory fallbackPlanFactory;
    private final EventProcessingService eventProcessingService;
    private final OrchestrationMetricsService metricsService;
    private final int maxTasks;

    public TaskPlanner(CompletionService completionService,
                       OrchestrationPromptService promptService,
                       PlanResponseParser planResponseParser,
                       FallbackPlanFactory fallbackPlanFactory,
                       EventProcessingService eventProcessingService,
                       OrchestrationMetricsService metricsService,
                       RozetProperties properties) {
        this.completionService = completionService;
        this.promptService = promptService;
        this.planResponseParser = planResponseParser;
        this.fallbackPlanFactory = fallbackPlanFactory;
        this.eventProcessingService = eventProcessingService;
        this.metricsService = metricsService;
        this.maxTasks = Math.max(1, properties.getPlanner().getMaxTasks());
    }

    public List<TaskSpec> plan(String request) {
        return plan(request, "");
    }

    public List<TaskSpec> plan(String request, String contextSummary) {
        String raw;
        try {
            metricsService.recordLlmRequest(PURPOSE_PLAN);
            raw = completionService.complete(
                    promptService.plannerSystemPrompt(maxTasks),
                    promptService.plannerUserMessage(request, contextSummary, maxTasks));
        } catch (RuntimeException ex) {
            log.error("Planner model call failed: {}", ex.getMessage(), ex);
            return fallback(request, "model call failed: " + ex.getMessage());
        }
        log.debug("Planner raw response: {}", raw);

        PlanParseResult result = planResponseParser.parse(raw, maxTasks);
        if (!result.isParsed()) {
            return fallback(request, result.failureReason());
        }
        metricsService.recordPlanResponse(PURPOSE_PLAN, result.tasks().size());
        announce(result.tasks());
        return result.tasks();
    }

    public int getMaxTasks() {
        return maxTasks;
    }

    private List<TaskSpec> fallback(String request, String reason) {
        metricsService.recordPlanFallback(reason);
        List<TaskSpec> tasks = fallbackPlanFactory.fallbackPlan(request);
        announce(tasks);
        return tasks;
    }

    private void announce(List<TaskSpec> tasks) {
        for (TaskSpec task : tasks) {
            log.info("Planned task {}: {}", task.taskId(), task.description());
            try {
                eventProcessingService.emitTaskPlanned(task);
            } catch (RuntimeException ex) {
                log.warn("Failed to emit planned event for {}: {}", task.taskId(), ex.getMessage());
            }
        }
    }
}
