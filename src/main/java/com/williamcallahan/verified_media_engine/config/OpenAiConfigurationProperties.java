package com.williamcallahan.verified_media_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

/**
 * Settings for the OpenAI-compatible vision endpoint, bound from {@code app.openai}
 */
@Component
@ConfigurationProperties(prefix = "app.openai")
public class OpenAiConfigurationProperties {

    private String apiKey;
    private String baseUrl = "https://api.openai.com";
    private String model = "gpt-4o";
    private double temperature = 0.3;
    private int maxTokens = 500;
    private long timeoutMs = 30000;

    @NestedConfigurationProperty
    private Retry retry = new Retry();

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }

    public int getMaxTokens() { return maxTokens; }
    public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public static class Retry {
        private int maxRetries = 2;
        private long initialBackoffMs = 500;
        private long maxBackoffMs = 4000;
        private double multiplier = 2.0;
        private double jitterFactor = 0.2;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }
    }
}
