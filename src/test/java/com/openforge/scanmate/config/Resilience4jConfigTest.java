package com.openforge.scanmate.config;

import com.openforge.scanmate.task.ErrorKind;
import com.openforge.scanmate.task.GatewayException;
import com.openforge.scanmate.task.ValidationException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Resilience4jConfigTest {

    @Test
    void onlyProviderTroubleCountsAsFailure() {
        assertTrue(Resilience4jConfig.isProviderFailure(new GatewayException(ErrorKind.UPSTREAM_UNAVAILABLE, "down")));
        assertTrue(Resilience4jConfig.isProviderFailure(new GatewayException(ErrorKind.TIMEOUT, "slow")));
        assertTrue(Resilience4jConfig.isProviderFailure(new IOException("reset")));
        assertFalse(Resilience4jConfig.isProviderFailure(new GatewayException(ErrorKind.CANCELLED, "stop")));
        assertFalse(Resilience4jConfig.isProviderFailure(new ValidationException("bad")));
        assertFalse(Resilience4jConfig.isProviderFailure(new IllegalStateException()));
    }

    @Test
    void modelServiceBreakerIsRegistered() {
        Resilience4jConfig config = new Resilience4jConfig();
        CircuitBreakerRegistry registry = config.circuitBreakerRegistry();

        assertEquals("modelService", config.modelServiceCircuitBreaker(registry).getName());
        assertEquals(10, registry.circuitBreaker("modelService").getCircuitBreakerConfig().getSlidingWindowSize());
    }
}
