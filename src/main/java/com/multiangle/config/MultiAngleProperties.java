package com.multiangle.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "multiangle")
@Validated
public class MultiAngleProperties {

    @Valid
    private PollingConfig polling = new PollingConfig();
    @Valid
    private AssistantConfig assistant = new AssistantConfig();
    private AiProvider aiProvider = AiProvider.GOOGLE;
    private OpenAIConfig openai = new OpenAIConfig();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public static class PollingConfig {
        @NotNull
        private Duration interval = Duration.ofSeconds(2);
        @Min(1)
        private int maxAttempts = 60; // 60 polls at 2s = 2 minutes

        public PollingConfig() {}

        public PollingConfig(Duration interval, int maxAttempts) {
            this.interval = interval;
            this.maxAttempts = maxAttempts;
        }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    public static class AssistantConfig {
        @NotBlank
        private String baseUrl = "http://localhost:8081";
        private String apiKey;
        @NotBlank
        private String apiKeyHeader = "x-api-key";
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getApiKeyHeader() { return apiKeyHeader; }
        public void setApiKeyHeader(String apiKeyHeader) { this.apiKeyHeader = apiKeyHeader; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    }

    public static class OpenAIConfig {
        private String model;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public PollingConfig getPolling() {
        return polling;
    }

    public void setPolling(PollingConfig polling) {
        this.polling = polling != null ? polling : new PollingConfig();
    }

    public AssistantConfig getAssistant() {
        return assistant;
    }

    public void setAssistant(AssistantConfig assistant) {
        this.assistant = assistant != null ? assistant : new AssistantConfig();
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider;
    }

    public OpenAIConfig getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAIConfig openai) {
        this.openai = openai;
    }
}
