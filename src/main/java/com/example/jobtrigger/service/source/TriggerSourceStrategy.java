package com.example.jobtrigger.service.source;

import com.example.jobtrigger.domain.JobIdentity;
import com.example.jobtrigger.domain.TriggerSpec;
import com.example.jobtrigger.domain.enums.TriggerSource;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * One origin of trigger definitions.
 * <p>
 * The scheduling service asks every strategy, in {@link TriggerSource}
 * order, whether it has entries for a job; the first that does is the
 * only one used for that request.
 * <p>
 * Strategies should:
 * - Be stateless
 * - Never register anything themselves
 * - Report a missing trigger through a failed future, not a null spec
 */
public interface TriggerSourceStrategy {

    /**
     * Get the source this strategy reads
     */
    TriggerSource getSource();

    /**
     * Check if this source has an entry for the job
     */
    boolean hasEntries(String jobName);

    /**
     * Effective trigger names configured for the job, in configuration order, without repeats
     */
    List<String> getTriggerNames(String jobName);

    /**
     * Resolve one configured trigger into a spec ready for registration
     *
     * @param jobIdentity  The job the trigger fires
     * @param triggerName  Name of the configured trigger
     * @param cronOverride Cron expression from the request; wins over the configured one when non-blank
     * @return Future of the spec; fails with
     * {@link com.example.jobtrigger.exception.ConfiguredTriggerNotFoundException} if the name is not configured
     */
    CompletableFuture<TriggerSpec> resolve(JobIdentity jobIdentity, String triggerName, String cronOverride);

    /**
     * Whether the job may have several named triggers in this source
     */
    default boolean supportsMultipleTriggers() {
        return true;
    }
}
