package com.rozet.orchestration.service;

import com.rozet.observability.ObservabilityClient;
import com.rozet.orchestration.api.EventProcessingService;
import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.model.WorkerResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

@Service
@Slf4j
public class EventProcessingServiceImpl implements EventProcessingService {

    static final String TASK_PLANNED = "TaskPlanned";
    static final String TASK_ASSIGNED = "TaskAssigned";
    static final String WORKER_COMPLETED = "WorkerCompleted";

    private final ObservabilityClient observabilityClient;

    public EventProcessingServiceImpl(ObservabilityClient observabilityClient) {
        this.observabilityClient = observabilityClient;
    }

    @Override
    public void emitTaskPlanned(TaskSpec task) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("task_id", task.taskId());
        payload.put("description", task.description());
        payload.put("files", task.files());
        payload.put("budget", task.budget().label());
        send(TASK_PLANNED, payload);
    }

    @Override
    public void emitTaskAssigned(String taskId, String workerId, String description) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("task_id", taskId);
        payload.put("worker_id", workerId);
        payload.put("description", description);
        send(TASK_ASSIGNED, payload);
    }

    @Override
    public void emitWorkerCompleted(WorkerResult result) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("task_id", result.taskId());
        payload.put("success", result.success());
        payload.put("files_modified", result.filesModified());
        payload.put("files_created", result.filesCreated());
        payload.put("errors", result.errors());
        send(WORKER_COMPLETED, payload);
    }

    private void send(String eventType, Map<String, Object> payload) {
        try {
            observabilityClient.sendEvent(eventType, payload);
        } catch (RuntimeException ex) {
            log.warn("Dropping {} event: {}", eventType, ex.getMessage());
        }
    }
}
