package com.example.jobtrigger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Remote trigger definition service configuration properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "external-services.trigger-provider")
public class TriggerProviderProperties {
    private String baseUrl = "http://localhost:8081";
    private int timeoutSeconds = 10;
}
