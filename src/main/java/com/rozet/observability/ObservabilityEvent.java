package com.rozet.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ObservabilityEvent(
        @JsonProperty("source_app") String sourceApp,
        @JsonProperty("hook_event_type") String hookEventType,
        Map<String, Object> payload,
        @JsonProperty("session_id") String sessionId
) {
}
