package com.rozet.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TestRun(
        String name,
        String status,
        @JsonProperty("duration_ms") long durationMs
) {
}
