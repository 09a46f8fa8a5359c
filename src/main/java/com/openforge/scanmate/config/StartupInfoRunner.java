package com.openforge.scanmate.config;

import com.openforge.scanmate.llm.LlmProperties;
import com.openforge.scanmate.security.SecurityProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - Model service: GET {base-url}/models, reported but never fatal
 *   - Storage: resolved data directory
 *   - Limits: memory window, scan history, deadlines
 *   - Runtime: Java version, server port, whether the HTTP API is key-protected
 */
@Slf4j
@Component
public class StartupInfoRunner implements ApplicationRunner {

    private final GatewayProperties  gatewayProperties;
    private final LlmProperties      llmProperties;
    private final SecurityProperties securityProperties;
    private final HttpClient         modelHttpClient;
    private final Environment        env;

    public StartupInfoRunner(GatewayProperties gatewayProperties,
                             LlmProperties llmProperties,
                             SecurityProperties securityProperties,
                             @Qualifier("modelHttpClient") HttpClient modelHttpClient,
                             Environment env) {
        this.gatewayProperties  = gatewayProperties;
        this.llmProperties      = llmProperties;
        this.securityProperties = securityProperties;
        this.modelHttpClient    = modelHttpClient;
        this.env                = env;
    }

    @Override
    public void run(ApplicationArguments args) {
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              ScanMate  -  Startup Summary                ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ║    Version        : {}
                ║    API key        : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Storage                                                 ║
                ║    Data dir       : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Model Service                                           ║
                ║    Provider       : {}  [{}]  key={}
                ║    Endpoint       : {}
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Limits                                                  ║
                ║    Memory turns   : {}   Scan history: {}
                ║    Chat deadline  : {}s  Scan deadline: {}s
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,
                gatewayProperties.version(),
                securityProperties.hasApiKey() ? maskKey(securityProperties.apiKey()) : "(open)",

                Path.of(gatewayProperties.dataDir()).toAbsolutePath(),

                llmProperties.name(),
                llmProperties.model(),
                maskKey(llmProperties.apiKey()),
                llmProperties.baseUrl(),
                probeModelService(),

                gatewayProperties.memory().maxMemoryTurns(),
                gatewayProperties.memory().maxScanHistory(),
                gatewayProperties.chat().deadline().toSeconds(),
                gatewayProperties.scan().deadline().toSeconds()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Lists the provider's models.  Returns a one-line summary or error message.
     */
    private String probeModelService() {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(llmProperties.baseUrl() + "/models"))
                .timeout(Duration.ofSeconds(5))
                .GET();
        if (llmProperties.hasApiKey()) {
            builder.header("Authorization", "Bearer " + llmProperties.apiKey());
        }
        try {
            HttpResponse<Void> response = modelHttpClient.send(builder.build(), HttpResponse.BodyHandlers.discarding());
            return response.statusCode() == 200
                    ? "✔ Reachable"
                    : "✘ HTTP " + response.statusCode();
        } catch (IOException e) {
            return "✘ FAILED - " + e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "✘ Probe interrupted";
        }
    }

    /**
     * Masks a key: shows first 6 chars + "..." + last 4 chars.
     */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
