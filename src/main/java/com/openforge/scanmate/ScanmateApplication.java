package com.openforge.scanmate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

// Picks up GatewayProperties, LlmProperties and SecurityProperties
@SpringBootApplication
@ConfigurationPropertiesScan
public class ScanmateApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScanmateApplication.class, args);
    }
}
