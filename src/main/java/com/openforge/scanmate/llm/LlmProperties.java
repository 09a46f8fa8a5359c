package com.openforge.scanmate.llm;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Externalised text-generation provider configuration.
 *
 * Reads from application.yml under the "scanmate.llm" prefix:
 *
 * scanmate:
 *   llm:
 *     name: ollama
 *     base-url: http://localhost:11434/v1
 *     api-key: ${LLM_API_KEY:}
 *     model: llama2:7b-chat-q4_0
 *     timeout-seconds: 60
 *
 * Any OpenAI-compatible /chat/completions endpoint works.  The key is
 * optional (local Ollama needs none) and is only ever logged masked.
 */
@Validated
@ConfigurationProperties(prefix = "scanmate.llm")
public record LlmProperties(
        @DefaultValue("ollama")                    @NotBlank String name,
        @DefaultValue("http://localhost:11434/v1") @NotBlank
        @Pattern(regexp = "https?://.+", message = "must be an absolute http(s) URL") String baseUrl,
                                                             String apiKey,
        @DefaultValue("llama2:7b-chat-q4_0")       @NotBlank String model,
        @DefaultValue("60")                        @Min(1)   int    timeoutSeconds
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
