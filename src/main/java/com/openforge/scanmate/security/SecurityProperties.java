package com.openforge.scanmate.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Gateway access control, under the "scanmate.security" prefix:
 *
 * scanmate:
 *   security:
 *     api-key: ${SCANMATE_API_KEY:}
 *     allowed-origins: ["*"]
 *
 * The key is supplied from outside; when blank the HTTP API is open.
 */
@ConfigurationProperties(prefix = "scanmate.security")
public record SecurityProperties(
                           String       apiKey,
        @DefaultValue("*") List<String> allowedOrigins
) {

    public static final String API_KEY_HEADER = "X-API-Key";

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
