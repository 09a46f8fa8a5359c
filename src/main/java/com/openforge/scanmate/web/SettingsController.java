package com.openforge.scanmate.web;

import com.openforge.scanmate.config.GatewayProperties;
import com.openforge.scanmate.llm.ModelClient;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class SettingsController {

    public record Settings(int maxMemoryTurns, int maxScanHistory, String modelName, String version) {}

    private final GatewayProperties properties;
    private final ModelClient       modelClient;

    @GetMapping("/api/settings")
    public ApiResponse settings() {
        return ApiResponse.success(new Settings(
                properties.memory().maxMemoryTurns(),
                properties.memory().maxScanHistory(),
                modelClient.modelName(),
                properties.version()));
    }
}
