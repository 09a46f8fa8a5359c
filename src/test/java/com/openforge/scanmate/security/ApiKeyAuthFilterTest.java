package com.openforge.scanmate.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiKeyAuthFilterTest {

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void matchingKey_authenticatesRequest() throws Exception {
        Authentication auth = filter("k-123", "k-123");

        assertNotNull(auth);
        assertEquals(ApiKeyAuthFilter.PRINCIPAL, auth.getPrincipal());
        assertTrue(auth.isAuthenticated());
    }

    @Test
    void wrongOrMissingKey_leavesRequestAnonymous() throws Exception {
        assertNull(filter("k-123", "k-124"));
        SecurityContextHolder.clearContext();
        assertNull(filter("k-123", null));
    }

    @Test
    void noConfiguredKey_ignoresHeader() throws Exception {
        assertNull(filter("", "anything"));
    }

    @Test
    void matches_comparesWholeKey() {
        assertTrue(ApiKeyAuthFilter.matches("abc", "abc"));
        assertFalse(ApiKeyAuthFilter.matches("ab", "abc"));
    }

    private static Authentication filter(String configuredKey, String presented) throws Exception {
        ApiKeyAuthFilter filter = new ApiKeyAuthFilter(new SecurityProperties(configuredKey, List.of("*")));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/history/x");
        if (presented != null) {
            request.addHeader(SecurityProperties.API_KEY_HEADER, presented);
        }
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertNotNull(chain.getRequest(), "the chain must always continue");
        return SecurityContextHolder.getContext().getAuthentication();
    }
}
