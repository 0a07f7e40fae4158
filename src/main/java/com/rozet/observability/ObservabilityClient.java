package com.rozet.observability;

import com.rozet.config.RozetProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.util.Map;

/**
 * Posts lifecycle events to the observability server. Delivery is best effort: failures are
 * logged and never reach the caller.
 */
@Slf4j
public class ObservabilityClient {

    private final RozetProperties.ObservabilityConfig config;
    @Nullable
    private final RestClient restClient;

    public ObservabilityClient(RestClient.Builder restClientBuilder, RozetProperties properties) {
        this.config = properties.getObservability();
        boolean enabled = config.isEnabled() && StringUtils.hasText(config.getUrl());
        this.restClient = enabled ? restClientBuilder.build() : null;
        if (!enabled) {
            log.info("Observability disabled, events will not be sent.");
        }
    }

    public boolean isEnabled() {
        return restClient != null;
    }

    public void sendEvent(String eventType, Map<String, Object> payload) {
        if (restClient == null) {
            log.debug("Observability disabled, skipping event: {}", eventType);
            return;
        }
        ObservabilityEvent event = new ObservabilityEvent(config.getSourceApp(), eventType, payload,
                StringUtils.hasText(config.getSessionId()) ? config.getSessionId() : null);
        try {
            restClient.post()
                    .uri(config.getUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(event)
                    .retrieve()
                    .toBodilessEntity();
            log.debug("Sent observability event: {}", eventType);
        } catch (Exception ex) {
            log.warn("Failed to send observability event {}: {}", eventType, ex.getMessage());
        }
    }
}
