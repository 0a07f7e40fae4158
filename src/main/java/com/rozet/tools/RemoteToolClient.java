package com.rozet.tools;

import com.rozet.config.RozetProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.file.Path;
import java.util.Map;

/**
 * Client for the remote tool execution endpoint
 * ({@code POST {base}/tool/execute?directory=<dir>}).
 */
@Slf4j
public class RemoteToolClient {

    private final RozetProperties.RemoteToolsConfig config;
    @Nullable
    private final RestClient restClient;

    public RemoteToolClient(RestClient.Builder restClientBuilder, RozetProperties properties) {
        this.config = properties.getRemoteTools();
        String baseUrl = config.getBaseUrl();
        if (StringUtils.hasText(baseUrl)) {
            String normalized = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
            this.restClient = restClientBuilder.baseUrl(normalized).build();
        } else {
            this.restClient = null;
        }
    }

    public boolean isConfigured() {
        return restClient != null;
    }

    /**
     * Executes {@code tool} remotely.
     *
     * @throws IllegalStateException if no endpoint is configured
     * @throws RestClientException if the endpoint cannot be reached or answers with an error status
     */
    public RemoteToolResponse execute(String tool, Map<String, Object> args, Path directory) {
        if (restClient == null) {
            throw new IllegalStateException("Remote tool endpoint is not configured.");
        }
        RemoteToolRequest request = new RemoteToolRequest(tool, config.getProvider(), config.getModel(), args,
                config.getSessionId(), config.getAgent(), Map.of());
        log.debug("Remote tool call: tool={}, directory={}", tool, directory);
        RemoteToolResponse response = restClient.post()
                .uri(uriBuilder -> uriBuilder.path("/tool/execute")
                        .queryParam("directory", directory.toString())
                        .build())
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(RemoteToolResponse.class);
        if (response == null) {
            throw new RestClientException("Empty response from remote tool endpoint for " + tool);
        }
        return response;
    }
}
