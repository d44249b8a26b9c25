package com.example.jobtrigger.service.source;

import com.example.jobtrigger.config.JobsProperties.TriggerWithData;
import com.example.jobtrigger.domain.JobIdentity;
import com.example.jobtrigger.domain.TriggerSpec;
import com.example.jobtrigger.domain.enums.TriggerSource;
import com.example.jobtrigger.exception.ConfiguredTriggerNotFoundException;
import com.example.jobtrigger.service.TriggerSpecFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Named triggers with static data, from {@code jobs.triggers-with-data}.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredDataTriggerSource implements TriggerSourceStrategy {

    private final TriggerSourceResolver resolver;
    private final TriggerSpecFactory triggerSpecFactory;

    @Override
    public TriggerSource getSource() {
        return TriggerSource.WITH_DATA;
    }

    @Override
    public boolean hasEntries(String jobName) {
        return resolver.hasWithData(jobName);
    }

    @Override
    public List<String> getTriggerNames(String jobName) {
        return resolver.getWithData(jobName).stream()
                .map(entry -> effectiveName(entry, jobName))
                .distinct()
                .toList();
    }

    @Override
    public CompletableFuture<TriggerSpec> resolve(JobIdentity jobIdentity, String triggerName, String cronOverride) {
        var jobName = jobIdentity.getName();
        var entry = resolver.getWithData(jobName).stream()
                .filter(candidate -> effectiveName(candidate, jobName).equals(triggerName))
                .findFirst();

        if (entry.isEmpty()) {
            return CompletableFuture.failedFuture(new ConfiguredTriggerNotFoundException(jobName, triggerName, getSource()));
        }

        var configured = entry.get();
        return CompletableFuture.completedFuture(triggerSpecFactory.create(
                triggerName,
                jobIdentity.getGroup(),
                jobName,
                jobIdentity.getGroup(),
                TriggerSpecFactory.effectiveCron(cronOverride, configured.getCronExpression()),
                configured.getTriggerData()));
    }

    private static String effectiveName(TriggerWithData entry, String jobName) {
        return StringUtils.hasText(entry.getTriggerName()) ? entry.getTriggerName() : jobName;
    }
}
