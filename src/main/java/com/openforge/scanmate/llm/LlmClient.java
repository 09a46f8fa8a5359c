package com.openforge.scanmate.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.scanmate.llm.model.ChatRequest;
import com.openforge.scanmate.llm.model.ChatResponse;
import com.openforge.scanmate.llm.model.Message;
import com.openforge.scanmate.task.ErrorKind;
import com.openforge.scanmate.task.GatewayException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * Stateless, blocking client for an OpenAI-compatible chat completion endpoint.
 *
 * Every call goes through the "modelService" circuit breaker: once the
 * provider keeps failing, calls are refused immediately with
 * CallNotPermittedException instead of waiting out another timeout.
 *
 * Interrupting the calling thread aborts the in-flight exchange; the
 * orchestrator relies on that to stop abandoned analyses.
 */
@Slf4j
public class LlmClient implements ModelClient {

    private final HttpClient     httpClient;
    private final ObjectMapper   objectMapper;
    private final LlmProperties  config;
    private final CircuitBreaker circuitBreaker;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     LlmProperties config,
                     CircuitBreaker circuitBreaker) {
        this.httpClient     = httpClient;
        this.objectMapper   = objectMapper;
        this.config         = config;
        this.circuitBreaker = circuitBreaker;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public String generate(List<Message> messages, GenerationOptions options) {
        ChatRequest request = ChatRequest.builder()
                .model(config.model())
                .messages(messages)
                .temperature(options.temperature())
                .maxTokens(options.maxTokens())
                .stream(false)
                .build();

        ChatResponse response = circuitBreaker.executeSupplier(() -> chat(request));
        String content = response.firstMessage() != null ? response.firstMessage().content() : null;
        return content == null ? "" : content;
    }

    @Override
    public String modelName() {
        return config.model();
    }

    /**
     * Blocking (non-streaming) chat completion, without the circuit breaker.
     */
    public ChatResponse chat(ChatRequest request) {
        String requestBody = serialize(request);
        log.debug("[LlmClient:{}] → chat POST messages={} body-length={}",
                config.name(), request.messages().size(), requestBody.length());

        HttpResponse<String> httpResponse = sendBlocking(buildHttpRequest(requestBody));
        return parseFullResponse(httpResponse);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (config.hasApiKey()) {
            builder.header("Authorization", "Bearer " + config.apiKey());
        }
        return builder.build();
    }

    private HttpResponse<String> sendBlocking(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new LlmException(ErrorKind.TIMEOUT,
                    "Provider [%s] did not answer within %ds".formatted(config.name(), config.timeoutSeconds()), e);
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]: %s"
                    .formatted(config.name(), e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException(ErrorKind.CANCELLED,
                    "Call to provider [%s] interrupted".formatted(config.name()), e);
        }
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:{}] ← HTTP {} body-length={}", config.name(), status,
                body == null ? 0 : body.length());

        if (status == 429) {
            throw new LlmException("Rate-limited by provider [%s].".formatted(config.name()));
        }
        if (status < 200 || status >= 300) {
            throw new LlmException("Provider [%s] returned HTTP %d: %s"
                    .formatted(config.name(), status, abbreviate(body)));
        }

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException("Failed to parse response from provider [%s]: %s"
                    .formatted(config.name(), abbreviate(body)), e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new LlmException(ErrorKind.INTERNAL, "Failed to serialize request", e);
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 512 ? body : body.substring(0, 512) + "...";
    }

    // ── Exception type ───────────────────────────────────────────────────────

    /** Provider failure; unavailable-upstream unless stated otherwise. */
    public static class LlmException extends GatewayException {
        public LlmException(String message) {
            super(ErrorKind.UPSTREAM_UNAVAILABLE, message);
        }

        public LlmException(String message, Throwable cause) {
            super(ErrorKind.UPSTREAM_UNAVAILABLE, message, cause);
        }

        public LlmException(ErrorKind kind, String message, Throwable cause) {
            super(kind, message, cause);
        }
    }
}
