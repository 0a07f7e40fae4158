package com.rozet.worker;

import com.rozet.orchestration.model.ToolAction;
import com.rozet.orchestration.model.WorkerResult;

import java.nio.file.Path;
import java.util.List;

/**
 * What a worker does with the {@code tools_used} entries the model reported.
 */
@FunctionalInterface
public interface ToolActionProcessor {

    void process(List<ToolAction> actions, Path workingDir, WorkerResult.Builder result);
}
