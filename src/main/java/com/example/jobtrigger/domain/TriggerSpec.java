package com.example.jobtrigger.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * A fully assembled cron trigger, ready to be handed to the scheduler.
 * <p>
 * Built fresh for every scheduling attempt and consumed exactly once.
 * A {@code null} payload means the trigger carries no data context.
 */
@Value
@Builder
public class TriggerSpec {

    @NonNull
    TriggerIdentity identity;

    @NonNull
    JobIdentity jobIdentity;

    @NonNull
    String cronExpression;

    Map<String, Object> payload;

    public Optional<Map<String, Object>> getPayloadIfPresent() {
        return Optional.ofNullable(payload);
    }
}
