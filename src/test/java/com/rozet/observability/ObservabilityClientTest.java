package com.rozet.observability;

import com.rozet.config.RozetProperties;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ObservabilityClientTest {

    @Test
    void testSendsEventEnvelope() {
        RozetProperties properties = new RozetProperties();
        properties.getObservability().setUrl("http://events.local/events");
        properties.getObservability().setSessionId("run-1");
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        ObservabilityClient client = new ObservabilityClient(builder, properties);

        server.expect(requestTo("http://events.local/events"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.source_app").value("orchestrator"))
                .andExpect(jsonPath("$.hook_event_type").value("TaskAssigned"))
                .andExpect(jsonPath("$.session_id").value("run-1"))
                .andExpect(jsonPath("$.payload.task_id").value("T1"))
                .andRespond(withSuccess());

        client.sendEvent("TaskAssigned", Map.of("task_id", "T1"));

        server.verify();
    }

    @Test
    void testDeliveryFailureIsLoggedNotThrown() {
        RozetProperties properties = new RozetProperties();
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        ObservabilityClient client = new ObservabilityClient(builder, properties);
        server.expect(requestTo("http://localhost:4000/events")).andRespond(withServerError());

        assertDoesNotThrow(() -> client.sendEvent("WorkerCompleted", Map.of()));
        server.verify();
    }

    @Test
    void testDisabledClientSendsNothing() {
        RozetProperties properties = new RozetProperties();
        properties.getObservability().setEnabled(false);

        ObservabilityClient client = new ObservabilityClient(RestClient.builder(), properties);

        assertFalse(client.isEnabled());
        assertDoesNotThrow(() -> client.sendEvent("TaskPlanned", Map.of()));
    }
}
