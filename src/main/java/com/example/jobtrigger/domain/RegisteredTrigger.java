package com.example.jobtrigger.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Read view of a trigger currently held by the scheduler.
 */
@Value
@Builder
public class RegisteredTrigger {

    TriggerIdentity identity;

    JobIdentity jobIdentity;

    /**
     * Null for non-cron triggers registered by other means
     */
    String cronExpression;

    Instant previousFireTime;

    Instant nextFireTime;

    @Builder.Default
    Map<String, Object> data = Map.of();
}
