package com.openforge.scanmate.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Reads the gateway key from the X-API-Key header on every request.
 * If it matches the configured key, puts an authenticated principal into the
 * SecurityContext; otherwise the request stays anonymous and protected paths
 * answer 401.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyAuthFilter extends OncePerRequestFilter {

    static final String PRINCIPAL = "api-client";

    private final SecurityProperties securityProperties;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest  request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain         chain) throws ServletException, IOException {

        String presented = request.getHeader(SecurityProperties.API_KEY_HEADER);

        if (securityProperties.hasApiKey() && presented != null
                && SecurityContextHolder.getContext().getAuthentication() == null) {
            if (matches(presented, securityProperties.apiKey())) {
                var auth = new UsernamePasswordAuthenticationToken(PRINCIPAL, null, List.of());
                auth.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(auth);
                log.debug("[ApiKey] Authenticated path={}", request.getRequestURI());
            } else {
                log.debug("[ApiKey] Rejected key for path={}", request.getRequestURI());
            }
        }

        chain.doFilter(request, response);
    }

    /** Constant-time comparison. */
    static boolean matches(String presented, String expected) {
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }
}
