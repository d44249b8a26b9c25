package com.example.jobtrigger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack alerting for jobs that could not be scheduled on startup
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#scheduler-alerts";
    private String username = "job-trigger-scheduler";
    private boolean enabled = false;

    public boolean isConfigured() {
        return enabled && webhookUrl != null && !webhookUrl.isBlank();
    }
}
