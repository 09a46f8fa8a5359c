package com.openforge.scanmate.web;

import com.openforge.scanmate.config.GatewayProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@RestController
public class HealthController {

    public record HealthResponse(String status, String version, long uptimeSeconds) {}

    private final GatewayProperties properties;
    private final Clock             clock;
    private final Instant           startedAt;

    public HealthController(GatewayProperties properties, Clock clock) {
        this.properties = properties;
        this.clock      = clock;
        this.startedAt  = clock.instant();
    }

    @GetMapping("/health")
    public HealthResponse health() {
        long uptime = Duration.between(startedAt, clock.instant()).toSeconds();
        return new HealthResponse("healthy", properties.version(), uptime);
    }
}
