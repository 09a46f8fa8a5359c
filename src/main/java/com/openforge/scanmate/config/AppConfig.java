package com.openforge.scanmate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.scanmate.fetch.HttpPageFetcher;
import com.openforge.scanmate.fetch.PageFetcher;
import com.openforge.scanmate.llm.LlmClient;
import com.openforge.scanmate.llm.LlmProperties;
import com.openforge.scanmate.llm.ModelClient;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Core infrastructure beans:
 *  - operationExecutor   → orchestrated work and every blocking adapter call
 *  - operationScheduler  → progress ticks, deadline watchdogs, cancellation grace
 *  - connectionExecutor  → one receive loop per live WebSocket connection
 *  - Java HttpClient     → the ONLY HTTP engine; one for the model, one for page fetches
 *
 * The pools are unbounded cached pools: every blocking call holds a thread
 * for at most its own timeout, and deadlines bound how many pile up.
 */
@Configuration
public class AppConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService operationExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("op-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService operationScheduler() {
        ScheduledThreadPoolExecutor scheduler =
                new ScheduledThreadPoolExecutor(2, new CustomizableThreadFactory("op-timer-"));
        // Watchdogs of operations that finish early are cancelled; drop them from the queue right away
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService connectionExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("conn-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Model endpoint client.  Connect timeout only; per-request read timeouts
     * are set at the call site.
     */
    @Bean
    public HttpClient modelHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /** Page fetches follow redirects so the probe can report the whole chain. */
    @Bean
    public HttpClient fetchHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public ModelClient modelClient(@Qualifier("modelHttpClient") HttpClient modelHttpClient,
                                   ObjectMapper objectMapper,
                                   LlmProperties llmProperties,
                                   @Qualifier("modelServiceCircuitBreaker") CircuitBreaker circuitBreaker) {
        return new LlmClient(modelHttpClient, objectMapper, llmProperties, circuitBreaker);
    }

    @Bean
    public PageFetcher pageFetcher(@Qualifier("fetchHttpClient") HttpClient fetchHttpClient) {
        return new HttpPageFetcher(fetchHttpClient);
    }
}
