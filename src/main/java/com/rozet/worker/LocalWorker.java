package com.rozet.worker;

import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.model.WorkerResult;

import java.nio.file.Path;

/**
 * Worker that trusts the model to have performed its tool actions and only confirms them.
 */
public class LocalWorker implements Worker {

    private final WorkerPipeline pipeline;
    private final ToolUsageVerifier toolUsageVerifier;

    public LocalWorker(WorkerPipeline pipeline, ToolUsageVerifier toolUsageVerifier) {
        this.pipeline = pipeline;
        this.toolUsageVerifier = toolUsageVerifier;
    }

    @Override
    public String id() {
        return "local:" + pipeline.modelName();
    }

    @Override
    public WorkerResult execute(TaskSpec task, Path workingDir) {
        return pipeline.run(task, workingDir, toolUsageVerifier);
    }
}
