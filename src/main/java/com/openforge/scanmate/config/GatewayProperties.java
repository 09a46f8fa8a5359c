package com.openforge.scanmate.config;

import com.openforge.scanmate.connection.SessionEndpoint;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Limits, budgets and timeouts of the session gateway.
 *
 * Reads from application.yml under the "scanmate.gateway" prefix:
 *
 * scanmate:
 *   gateway:
 *     data-dir: ~/.scanmate
 *     memory:
 *       max-memory-turns: 5
 *       max-scan-history: 5
 *     chat:
 *       deadline: 35s
 *       model-timeout: 30s
 *     scan:
 *       deadline: 45s
 *       redirect-check-timeout: 8s
 *       content-fetch-timeout: 8s
 *     orchestrator:
 *       progress-interval: 2s
 *       cancellation-grace: 2s
 *     connection:
 *       chat: { receive-timeout: 120s, idle-limit: 300s, abort-on-receive-timeout: false }
 *       scan: { receive-timeout: 15s,  idle-limit: 300s, abort-on-receive-timeout: true }
 */
@Validated
@ConfigurationProperties(prefix = "scanmate.gateway")
public record GatewayProperties(
        @DefaultValue("1.0.0") @NotBlank String version,
        @DefaultValue("data")  @NotBlank String dataDir,
        @DefaultValue @Valid Memory       memory,
        @DefaultValue @Valid Chat         chat,
        @DefaultValue @Valid Scan         scan,
        @DefaultValue @Valid Orchestrator orchestrator,
        @DefaultValue        Connection   connection
) {

    public record Memory(
            @DefaultValue("5")    @Min(1) int maxMemoryTurns,
            @DefaultValue("5")    @Min(1) int maxScanHistory,
            @DefaultValue("1500") @Min(1) int scanDigestChars
    ) {}

    public record Chat(
            @DefaultValue("35s")  @NotNull Duration deadline,
            @DefaultValue("30s")  @NotNull Duration modelTimeout,
            @DefaultValue("2000") @Min(1)  int      replyLimit
    ) {}

    public record Scan(
            @DefaultValue("45s")  @NotNull Duration deadline,
            @DefaultValue("8s")   @NotNull Duration redirectCheckTimeout,
            @DefaultValue("5s")   @NotNull Duration probeRequestTimeout,
            @DefaultValue("8s")   @NotNull Duration contentFetchTimeout,
            @DefaultValue("5s")   @NotNull Duration fetchRequestTimeout,
            @DefaultValue("6000") @Min(1)  int      contentLimit,
            @DefaultValue("1500") @Min(1)  int      reportLimit
    ) {}

    public record Orchestrator(
            @DefaultValue("2s") @NotNull Duration progressInterval,
            @DefaultValue("2s") @NotNull Duration cancellationGrace
    ) {}

    /** Receive-loop policy of one duplex endpoint. */
    public record EndpointPolicy(
            Duration receiveTimeout,
            Duration idleLimit,
            boolean  abortOnReceiveTimeout
    ) {}

    public record Connection(EndpointPolicy chat, EndpointPolicy scan) {

        private static final EndpointPolicy CHAT_DEFAULT =
                new EndpointPolicy(Duration.ofSeconds(120), Duration.ofSeconds(300), false);
        private static final EndpointPolicy SCAN_DEFAULT =
                new EndpointPolicy(Duration.ofSeconds(15), Duration.ofSeconds(300), true);

        public EndpointPolicy policyFor(SessionEndpoint endpoint) {
            return switch (endpoint) {
                case CHAT -> chat != null ? chat : CHAT_DEFAULT;
                case SCAN -> scan != null ? scan : SCAN_DEFAULT;
            };
        }
    }
}
