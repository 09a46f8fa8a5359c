package com.openforge.scanmate.config;

import com.openforge.scanmate.task.ErrorKind;
import com.openforge.scanmate.task.GatewayException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One named breaker guards the text-generation service:
 *   • "modelService" - every chat completion and scan analysis
 *
 * Failures are reported once per request; there is deliberately no Retry
 * instance, callers resubmit instead.
 */
@Configuration
public class Resilience4jConfig {

    static final String MODEL_SERVICE = "modelService";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // treat slow calls (>60 s) as failures
                .slowCallDurationThreshold(Duration.ofSeconds(60))
                .slowCallRateThreshold(80)
                // allow 2 probe calls while HALF-OPEN
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                // only provider-side trouble counts; cancelled or malformed calls do not
                .recordException(Resilience4jConfig::isProviderFailure)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(MODEL_SERVICE);
        return registry;
    }

    @Bean
    public CircuitBreaker modelServiceCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(MODEL_SERVICE);
    }

    static boolean isProviderFailure(Throwable failure) {
        if (failure instanceof GatewayException gatewayException) {
            return gatewayException.kind() == ErrorKind.UPSTREAM_UNAVAILABLE
                    || gatewayException.kind() == ErrorKind.TIMEOUT;
        }
        return failure instanceof IOException;
    }
}
