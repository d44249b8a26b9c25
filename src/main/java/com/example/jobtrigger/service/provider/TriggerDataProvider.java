package com.example.jobtrigger.service.provider;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Supplies cron expressions and trigger data for triggers configured
 * under {@code jobs.triggers-from-db}, looked up by trigger name at
 * scheduling time.
 * <p>
 * An empty result means the provider does not know the trigger. A failed
 * future means the lookup itself broke. Results must not be cached.
 */
public interface TriggerDataProvider {

    /**
     * Provider type configured entries refer to (e.g. database, http)
     */
    String getProviderType();

    CompletableFuture<Optional<String>> getCronExpression(String triggerName);

    CompletableFuture<Optional<Map<String, Object>>> getTriggerData(String triggerName);
}
