package com.rozet.worker;

import static com.rozet.orchestration.OrchestrationConstants.INVALID_JSON_MESSAGE;
import static com.rozet.orchestration.OrchestrationConstants.PURPOSE_WORKER_TASK;
import com.rozet.orchestration.api.CompletionService;
import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.model.WorkerResponse;
import com.rozet.orchestration.model.WorkerResult;
import com.rozet.orchestration.service.OrchestrationMetricsService;
import com.rozet.orchestration.service.OrchestrationPromptService;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * Steps shared by every worker: prompt the model, parse its answer, hand the reported tool
 * actions to a {@link ToolActionProcessor}, then verify the claimed files.
 */
@Slf4j
public class WorkerPipeline {

    private final CompletionService completionService;
    private final OrchestrationPromptService promptService;
    private final WorkerResponseParser responseParser;
    private final ResultVerifier resultVerifier;
    private final OrchestrationMetricsService metricsService;
    private final boolean verifyOutputs;

    public WorkerPipeline(CompletionService completionService,
                          OrchestrationPromptService promptService,
                          WorkerResponseParser responseParser,
                          ResultVerifier resultVerifier,
                          OrchestrationMetricsService metricsService,
                          boolean verifyOutputs) {
        this.completionService = completionService;
        this.promptService = promptService;
        this.responseParser = responseParser;
        this.resultVerifier = resultVerifier;
        this.metricsService = metricsService;
        this.verifyOutputs = verifyOutputs;
    }

    public String modelName() {
        return completionService.modelName();
    }

    public WorkerResult run(TaskSpec task, Path workingDir, ToolActionProcessor toolActionProcessor) {
        String raw = null;
        try {
            metricsService.recordLlmRequest(PURPOSE_WORKER_TASK);
            raw = completionService.complete(promptService.workerSystemPrompt(), promptService.workerTaskPrompt(task));
            WorkerResponse response = responseParser.parse(raw);

            WorkerResult.Builder builder = WorkerResult.builder(task.taskId())
                    .success(response.success())
                    .filesModified(response.filesModified())
                    .filesCreated(response.filesCreated())
                    .testsRun(response.testsRun())
                    .verificationPassed(response.verificationPassed())
                    .errors(response.errors())
                    .logs(response.logs());
            if (!response.toolsUsed().isEmpty()) {
                toolActionProcessor.process(response.toolsUsed(), workingDir, builder);
            }
            WorkerResult result = builder.build();
            return verifyOutputs ? resultVerifier.verify(result, workingDir) : result;
        } catch (WorkerResponseParseException ex) {
            log.error("Failed to parse worker response for task {}: {}", task.taskId(), ex.getMessage());
            log.debug("Raw response: {}", raw);
            return WorkerResult.failure(task.taskId(), INVALID_JSON_MESSAGE + ex.getMessage(),
                    "Raw response: " + responseParser.preview(raw));
        } catch (RuntimeException ex) {
            log.error("Worker execution failed for task {}: {}", task.taskId(), ex.getMessage(), ex);
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return WorkerResult.failure(task.taskId(), message, "Exception: " + message);
        }
    }
}
