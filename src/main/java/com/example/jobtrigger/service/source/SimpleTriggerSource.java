package com.example.jobtrigger.service.source;

import com.example.jobtrigger.domain.JobIdentity;
import com.example.jobtrigger.domain.TriggerSpec;
import com.example.jobtrigger.domain.enums.TriggerSource;
import com.example.jobtrigger.service.TriggerSpecFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A single cron trigger per job, named after the job, from {@code jobs.triggers}.
 */
@Component
@RequiredArgsConstructor
public class SimpleTriggerSource implements TriggerSourceStrategy {

    private final TriggerSourceResolver resolver;
    private final TriggerSpecFactory triggerSpecFactory;

    @Override
    public TriggerSource getSource() {
        return TriggerSource.SIMPLE;
    }

    @Override
    public boolean hasEntries(String jobName) {
        return resolver.hasSimple(jobName);
    }

    @Override
    public List<String> getTriggerNames(String jobName) {
        return hasEntries(jobName) ? List.of(jobName) : List.of();
    }

    /**
     * The trigger name is ignored: the only trigger is the job-named one.
     */
    @Override
    public CompletableFuture<TriggerSpec> resolve(JobIdentity jobIdentity, String triggerName, String cronOverride) {
        var configuredCron = resolver.getSimple(jobIdentity.getName()).orElse(null);

        return CompletableFuture.completedFuture(triggerSpecFactory.create(
                jobIdentity.getName(),
                jobIdentity.getGroup(),
                jobIdentity.getName(),
                jobIdentity.getGroup(),
                TriggerSpecFactory.effectiveCron(cronOverride, configuredCron),
                null));
    }

    @Override
    public boolean supportsMultipleTriggers() {
        return false;
    }
}
