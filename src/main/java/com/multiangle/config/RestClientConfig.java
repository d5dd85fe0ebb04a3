package com.multiangle.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.MediaType;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Configuration
@Slf4j
public class RestClientConfig {

    static final String MASKED = "****";

    @Bean
    public RestClientCustomizer restClientCustomizer(MultiAngleProperties properties) {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor(properties.getAssistant().getApiKeyHeader()));
            // BufferingClientHttpRequestFactory allows multiple reads of the response body
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(new SimpleClientHttpRequestFactory()));
        };
    }

    @Bean
    public RestClient assistantRestClient(RestClient.Builder builder, MultiAngleProperties properties) {
        MultiAngleProperties.AssistantConfig assistant = properties.getAssistant();
        RestClient.Builder configured = builder.clone()
                .requestFactory(assistantRequestFactory(assistant))
                .baseUrl(assistant.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(assistant.getApiKey())) {
            configured.defaultHeader(assistant.getApiKeyHeader(), assistant.getApiKey());
        } else {
            log.warn("No assistant API key configured (multiangle.assistant.api-key). Requests will be unauthenticated.");
        }
        return configured.build();
    }

    /**
     * Request factory for assistant calls, with connect and read waits bounded by the configured timeouts.
     */
    static ClientHttpRequestFactory assistantRequestFactory(MultiAngleProperties.AssistantConfig assistant) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(assistant.getConnectTimeout());
        factory.setReadTimeout(assistant.getReadTimeout());
        return new BufferingClientHttpRequestFactory(factory);
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger = org.slf4j.LoggerFactory.getLogger("com.multiangle.http.logging");

        private final String apiKeyHeader;

        LoggingRequestInterceptor(String apiKeyHeader) {
            this.apiKeyHeader = apiKeyHeader;
        }

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            if (httpLogger.isDebugEnabled()) {
                logRequest(request, body);
            }
            ClientHttpResponse response = execution.execute(request, body);
            if (httpLogger.isDebugEnabled()) {
                logResponse(response);
            }
            return response;
        }

        HttpHeaders maskedHeaders(HttpHeaders headers) {
            HttpHeaders copy = new HttpHeaders();
            copy.putAll(headers);
            if (copy.containsKey(apiKeyHeader)) {
                copy.set(apiKeyHeader, MASKED);
            }
            if (copy.containsKey(HttpHeaders.AUTHORIZATION)) {
                copy.set(HttpHeaders.AUTHORIZATION, MASKED);
            }
            return copy;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            httpLogger.debug("--- HTTP Request ---");
            httpLogger.debug("URI: {} {}", request.getMethod(), request.getURI());
            httpLogger.debug("Headers: {}", maskedHeaders(request.getHeaders()));
            if (body.length > 0) {
                httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
            httpLogger.debug("--------------------");
        }

        private void logResponse(ClientHttpResponse response) throws IOException {
            httpLogger.debug("--- HTTP Response ---");
            try {
                httpLogger.debug("Status: {}", response.getStatusCode());
            } catch (IOException e) {
                httpLogger.debug("Status: Unknown");
            }
            httpLogger.debug("Headers: {}", response.getHeaders());
            byte[] body = StreamUtils.copyToByteArray(response.getBody());
            if (body.length > 0) {
                httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
            httpLogger.debug("---------------------");
        }
    }
}
