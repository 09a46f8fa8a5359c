package com.openforge.scanmate.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.scanmate.config.JacksonConfig;
import com.openforge.scanmate.llm.model.Message;
import com.openforge.scanmate.task.ErrorKind;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmClientTest {

    private static final String COMPLETION = """
            {"id":"c-1","object":"chat.completion","created":1,"model":"test-model",
             "choices":[{"index":0,"message":{"role":"assistant","content":"Stay safe."},"finish_reason":"stop"}],
             "usage":{"prompt_tokens":5,"completion_tokens":2,"total_tokens":7},
             "system_fingerprint":"ignored"}
            """;

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private final HttpClient   httpClient   = HttpClient.newHttpClient();

    private final BlockingQueue<JsonNode>    bodies        = new LinkedBlockingQueue<>();
    private final AtomicReference<String>    authorization = new AtomicReference<>();
    private final AtomicInteger              requests      = new AtomicInteger();
    private final AtomicInteger              status        = new AtomicInteger(200);
    private final AtomicReference<String>    answer        = new AtomicReference<>(COMPLETION);
    private volatile long                    delayMs;

    private HttpServer server;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", this::handle);
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    @DisplayName("A completion request carries model, messages and sampling settings in snake_case")
    void generate_postsCompletionRequest() throws Exception {
        LlmClient client = client("secret-key", CircuitBreaker.ofDefaults("test"));

        String reply = client.generate(List.of(Message.system("be brief"), Message.user("hi")), GenerationOptions.SCAN);

        assertEquals("Stay safe.", reply);
        JsonNode body = bodies.poll(1, TimeUnit.SECONDS);
        assertNotNull(body);
        assertEquals("test-model", body.get("model").asText());
        assertEquals(512, body.get("max_tokens").asInt());
        assertEquals(0.1, body.get("temperature").asDouble(), 1e-9);
        assertFalse(body.get("stream").asBoolean());
        assertEquals("system", body.get("messages").get(0).get("role").asText());
        assertEquals("hi", body.get("messages").get(1).get("content").asText());
        assertEquals("Bearer secret-key", authorization.get());
        assertEquals("test-model", client.modelName());
    }

    @Test
    void generate_omitsAuthorizationWithoutKey() {
        client("", CircuitBreaker.ofDefaults("test")).generate(List.of(Message.user("hi")), GenerationOptions.CHAT);

        assertNull(authorization.get());
    }

    @Test
    void generate_serverErrorIsUpstreamUnavailable() {
        status.set(500);
        answer.set("{\"error\":\"overloaded\"}");
        LlmClient client = client("", CircuitBreaker.ofDefaults("test"));

        LlmClient.LlmException e = assertThrows(LlmClient.LlmException.class,
                () -> client.generate(List.of(Message.user("hi")), GenerationOptions.CHAT));

        assertEquals(ErrorKind.UPSTREAM_UNAVAILABLE, e.kind());
        assertTrue(e.getMessage().contains("returned HTTP 500"));
    }

    @Test
    void generate_slowProviderTimesOut() {
        delayMs = 2_500;
        LlmClient client = client("", CircuitBreaker.ofDefaults("test"));

        LlmClient.LlmException e = assertThrows(LlmClient.LlmException.class,
                () -> client.generate(List.of(Message.user("hi")), GenerationOptions.CHAT));

        assertEquals(ErrorKind.TIMEOUT, e.kind());
    }

    @Test
    @DisplayName("Once the breaker opens, calls are refused without reaching the provider")
    void generate_openBreakerShortCircuits() {
        status.set(503);
        CircuitBreaker breaker = CircuitBreaker.of("test", CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .build());
        LlmClient client = client("", breaker);
        List<Message> prompt = List.of(Message.user("hi"));

        assertThrows(LlmClient.LlmException.class, () -> client.generate(prompt, GenerationOptions.CHAT));
        assertThrows(LlmClient.LlmException.class, () -> client.generate(prompt, GenerationOptions.CHAT));
        assertThrows(CallNotPermittedException.class, () -> client.generate(prompt, GenerationOptions.CHAT));

        assertEquals(2, requests.get());
        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private LlmClient client(String apiKey, CircuitBreaker breaker) {
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1";
        LlmProperties properties = new LlmProperties("stub", baseUrl, apiKey, "test-model", 1);
        return new LlmClient(httpClient, objectMapper, properties, breaker);
    }

    private void handle(HttpExchange exchange) throws IOException {
        requests.incrementAndGet();
        authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
        bodies.add(objectMapper.readTree(exchange.getRequestBody()));
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        byte[] response = answer.get().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status.get(), response.length);
        exchange.getResponseBody().write(response);
        exchange.close();
    }
}
