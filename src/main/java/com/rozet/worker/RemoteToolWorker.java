package com.rozet.worker;

import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.model.WorkerResult;

import java.nio.file.Path;

/**
 * Worker that performs the model's tool actions itself and reports the files it actually
 * wrote.
 */
public class RemoteToolWorker implements Worker {

    private final WorkerPipeline pipeline;
    private final RemoteToolActionExecutor actionExecutor;

    public RemoteToolWorker(WorkerPipeline pipeline, RemoteToolActionExecutor actionExecutor) {
        this.pipeline = pipeline;
        this.actionExecutor = actionExecutor;
    }

    @Override
    public String id() {
        return "remote:" + pipeline.modelName();
    }

    @Override
    public WorkerResult execute(TaskSpec task, Path workingDir) {
        return pipeline.run(task, workingDir, actionExecutor);
    }
}
