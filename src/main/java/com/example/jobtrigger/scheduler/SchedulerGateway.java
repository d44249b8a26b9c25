package com.example.jobtrigger.scheduler;

import com.example.jobtrigger.domain.JobIdentity;
import com.example.jobtrigger.domain.RegisteredTrigger;
import com.example.jobtrigger.domain.TriggerIdentity;
import com.example.jobtrigger.domain.TriggerSpec;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous access to the shared job scheduler's trigger registry.
 * <p>
 * Implementations must read live state on every call and must reject a
 * trigger whose identity already exists, atomically, with
 * {@link com.example.jobtrigger.exception.DuplicateTriggerKeyException}.
 */
public interface SchedulerGateway {

    /**
     * Look up a single trigger
     *
     * @param identity The trigger identity
     * @return The trigger, or empty if the scheduler does not hold it
     */
    CompletableFuture<Optional<RegisteredTrigger>> getTrigger(TriggerIdentity identity);

    /**
     * Get every trigger currently attached to a job
     */
    CompletableFuture<List<RegisteredTrigger>> getTriggersOfJob(JobIdentity jobIdentity);

    /**
     * Register a cron trigger for an existing job
     */
    CompletableFuture<Void> scheduleJob(TriggerSpec spec);
}
