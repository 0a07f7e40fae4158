package com.rozet.worker;

import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.model.WorkerResult;

import java.nio.file.Path;

/**
 * Executes one task against a working directory and reports what it did.
 */
public interface Worker {

    /**
     * Opaque identifier reported in task assignment events.
     */
    String id();

    /**
     * Implementations capture their own failures in the returned result; callers still guard
     * against unexpected exceptions.
     */
    WorkerResult execute(TaskSpec task, Path workingDir);
}
