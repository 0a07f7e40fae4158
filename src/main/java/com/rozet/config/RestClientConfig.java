package com.rozet.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

@Configuration
@Slf4j
public class RestClientConfig {

    @Bean
    public RestClientCustomizer restClientCustomizer(RozetProperties properties) {
        RozetProperties.HttpConfig http = properties.getHttp();
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            restClientBuilder.requestFactory(requestFactory(http.getConnectTimeout(), http.getReadTimeout()));
        };
    }

    /**
     * Request factory with explicit timeouts. Buffered so the logging interceptor can read the
     * response body without consuming it.
     */
    public static ClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return new BufferingClientHttpRequestFactory(factory);
    }

    private static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.rozet.http.logging");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            // Local OpenAI-compatible servers reject placeholder bearer tokens
            var headers = request.getHeaders();
            String auth = headers.getFirst("Authorization");
            if (auth != null) {
                String trimmed = auth.trim();
                if (trimmed.equalsIgnoreCase("Bearer none") || trimmed.equalsIgnoreCase("Bearer EMPTY")) {
                    headers.set("Authorization", "");
                }
            }

            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(response);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            if (!httpLogger.isDebugEnabled()) {
                return;
            }
            httpLogger.debug("HTTP request: {} {}", request.getMethod(), request.getURI());
            if (body.length > 0) {
                httpLogger.debug("Request body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }

        private void logResponse(ClientHttpResponse response) throws IOException {
            if (!httpLogger.isDebugEnabled()) {
                return;
            }
            httpLogger.debug("HTTP response status: {}", response.getStatusCode());
            byte[] body = StreamUtils.copyToByteArray(response.getBody());
            if (body.length > 0) {
                httpLogger.debug("Response body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }
    }
}
