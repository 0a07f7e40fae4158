package com.rozet.tools;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.lang.Nullable;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteToolResponse(
        boolean success,
        @Nullable Result result
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(
            @Nullable String output,
            @Nullable Map<String, Object> metadata
    ) {
    }

    public String output() {
        return result != null && result.output() != null ? result.output() : "";
    }
}
