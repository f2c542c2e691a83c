package com.williamcallahan.verified_media_engine.service.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.verified_media_engine.config.OpenAiConfigurationProperties;
import com.williamcallahan.verified_media_engine.util.AsyncUtils;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Vision oracle backed by an OpenAI-compatible chat completions endpoint
 *
 * Features:
 * - Sends the prompt and an inline base64 image, asks for a JSON object response
 * - Retries rate limits, server errors and timeouts with exponential backoff
 * - Guarded by the "visionOracle" circuit breaker; an open circuit fails fast
 */
@Service
public class OpenAiVisionOracle implements VisionOracle {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiVisionOracle.class);
    private static final String COMPLETIONS_PATH = "/v1/chat/completions";

    private final WebClient webClient;
    private final OpenAiConfigurationProperties properties;
    private final Executor oracleExecutor;

    public OpenAiVisionOracle(WebClient.Builder webClientBuilder,
                              OpenAiConfigurationProperties properties,
                              @Qualifier("oracleExecutor") Executor oracleExecutor) {
        this.properties = properties;
        this.oracleExecutor = oracleExecutor;
        this.webClient = webClientBuilder.clone()
            .baseUrl(properties.getBaseUrl())
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        logger.info("OpenAI vision oracle initialized. Model: {}, base URL: {}, API key configured: {}",
            properties.getModel(), properties.getBaseUrl(), properties.hasApiKey());
    }

    @Override
    @CircuitBreaker(name = "visionOracle", fallbackMethod = "completeFallback")
    public CompletableFuture<String> complete(VisionRequest request) {
        if (!properties.hasApiKey()) {
            return CompletableFuture.failedFuture(new OracleUnavailableException("OpenAI API key is not configured"));
        }
        OpenAiConfigurationProperties.Retry retry = properties.getRetry();
        return AsyncUtils.withRetry(
            () -> send(request),
            "vision oracle " + request.purpose(),
            logger,
            oracleExecutor,
            retry.getMaxRetries(),
            retry.getInitialBackoffMs(),
            retry.getMaxBackoffMs(),
            retry.getMultiplier(),
            retry.getJitterFactor(),
            OpenAiVisionOracle::isTransient);
    }

    /**
     * Circuit breaker fallback; callers turn the failure into an ERROR verdict
     */
    public CompletableFuture<String> completeFallback(VisionRequest request, Throwable t) {
        logger.warn("Vision oracle unavailable for {} request: {}", request.purpose(), t.getMessage());
        return CompletableFuture.failedFuture(new OracleUnavailableException("Vision oracle unavailable: " + t.getMessage(), t));
    }

    private CompletableFuture<String> send(VisionRequest request) {
        return webClient.post()
            .uri(COMPLETIONS_PATH)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
            .bodyValue(requestBody(request))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofMillis(properties.getTimeoutMs()))
            .map(response -> {
                JsonNode content = response.path("choices").path(0).path("message").path("content");
                if (content.isMissingNode() || content.isNull()) {
                    throw new OracleUnavailableException("Chat completion response had no message content");
                }
                return content.asText();
            })
            .toFuture();
    }

    Map<String, Object> requestBody(VisionRequest request) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (request.systemPrompt() != null) {
            messages.add(Map.of("role", "system", "content", request.systemPrompt()));
        }
        String dataUrl = "data:image/jpeg;base64," + Base64.getEncoder().encodeToString(request.imageBytes());
        List<Map<String, Object>> content = List.of(
            Map.of("type", "text", "text", request.userPrompt()),
            Map.of("type", "image_url", "image_url", Map.of("url", dataUrl, "detail", request.detail())));
        messages.add(Map.of("role", "user", "content", content));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.getModel());
        body.put("messages", messages);
        body.put("max_tokens", properties.getMaxTokens());
        body.put("temperature", properties.getTemperature());
        body.put("response_format", Map.of("type", "json_object"));
        return body;
    }

    static boolean isTransient(Throwable throwable) {
        if (throwable instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            return status == 429 || status >= 500;
        }
        return throwable instanceof TimeoutException || throwable instanceof WebClientRequestException;
    }
}
