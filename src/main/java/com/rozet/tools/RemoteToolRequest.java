package com.rozet.tools;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record RemoteToolRequest(
        String tool,
        String provider,
        String model,
        Map<String, Object> args,
        @JsonProperty("sessionID") String sessionId,
        String agent,
        Map<String, Object> extra
) {
}
