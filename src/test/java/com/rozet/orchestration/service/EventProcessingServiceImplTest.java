package com.rozet.orchestration.service;

import com.rozet.observability.ObservabilityClient;
import com.rozet.orchestration.model.TaskSpec;
import com.rozet.orchestration.model.WorkerResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class EventProcessingServiceImplTest {

    private ObservabilityClient observabilityClient;
    private EventProcessingServiceImpl service;

    @BeforeEach
    void setUp() {
        observabilityClient = mock(ObservabilityClient.class);
        service = new EventProcessingServiceImpl(observabilityClient);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testTaskAssignedPayload() {
        service.emitTaskAssigned("T1", "local:gemini", "Write README");

        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(observabilityClient).sendEvent(eq("TaskAssigned"), payload.capture());
        assertEquals("T1", payload.getValue().get("task_id"));
        assertEquals("local:gemini", payload.getValue().get("worker_id"));
        assertEquals("Write README", payload.getValue().get("description"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testWorkerCompletedPayload() {
        WorkerResult result = WorkerResult.builder("T2")
                .success(true)
                .filesCreated(List.of("a.txt"))
                .build();

        service.emitWorkerCompleted(result);

        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(observabilityClient).sendEvent(eq("WorkerCompleted"), payload.capture());
        assertEquals(true, payload.getValue().get("success"));
        assertEquals(List.of("a.txt"), payload.getValue().get("files_created"));
        assertEquals(List.of(), payload.getValue().get("errors"));
    }

    @Test
    void testTaskPlannedSent() {
        service.emitTaskPlanned(TaskSpec.of("T1", "Plan", List.of("x.md")));

        verify(observabilityClient).sendEvent(eq("TaskPlanned"), anyMap());
    }

    @Test
    void testClientFailureIsSwallowed() {
        doThrow(new IllegalStateException("down")).when(observabilityClient).sendEvent(any(), any());

        assertDoesNotThrow(() -> service.emitTaskAssigned("T1", "w", "d"));
    }
}
