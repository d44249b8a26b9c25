package com.example.jobtrigger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Trigger configuration for scheduled jobs.
 * Loaded from application.yml once at startup and never mutated afterwards.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "jobs")
public class JobsProperties {

    /**
     * Job name to cron expression; the trigger is named after the job
     */
    private Map<String, String> triggers = new HashMap<>();

    /**
     * Job name to its named triggers with static data
     */
    @Valid
    private Map<String, List<TriggerWithData>> triggersWithData = new HashMap<>();

    /**
     * Job name to its named triggers whose cron and data are looked up at scheduling time
     */
    @Valid
    private Map<String, List<TriggerFromDb>> triggersFromDb = new HashMap<>();

    /**
     * Provider used for triggers-from-db entries that name none
     */
    @NotBlank
    private String defaultProviderType = "database";

    /**
     * How long a scheduling request may take before it is cancelled
     */
    @Min(1)
    private int requestTimeoutSeconds = 30;

    /**
     * Threads serving scheduler and provider lookups
     */
    @Min(1)
    private int executorPoolSize = 8;

    /**
     * Schedule every configured job once the application is ready
     */
    private boolean scheduleOnStartup = false;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TriggerWithData {
        private String triggerName;
        private String cronExpression;
        private Map<String, Object> triggerData;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TriggerFromDb {
        private String triggerName;

        /**
         * Which trigger data provider resolves this trigger (e.g. database, http)
         */
        private String providerType;
    }
}
