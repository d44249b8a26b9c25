package com.example.jobtrigger.service.source;

import com.example.jobtrigger.config.JobsProperties.TriggerFromDb;
import com.example.jobtrigger.domain.JobIdentity;
import com.example.jobtrigger.domain.TriggerSpec;
import com.example.jobtrigger.domain.enums.TriggerSource;
import com.example.jobtrigger.exception.ConfiguredTriggerNotFoundException;
import com.example.jobtrigger.exception.TriggerProviderLookupException;
import com.example.jobtrigger.service.TriggerSpecFactory;
import com.example.jobtrigger.service.provider.TriggerDataProvider;
import com.example.jobtrigger.service.provider.TriggerDataProviderRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Named triggers from {@code jobs.triggers-from-db} whose cron expression
 * and data are fetched from a trigger data provider at scheduling time.
 * <p>
 * The cron lookup completes before the data lookup starts. Either one
 * coming back empty or failing fails the resolution.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoredTriggerSource implements TriggerSourceStrategy {

    private final TriggerSourceResolver resolver;
    private final TriggerSpecFactory triggerSpecFactory;
    private final TriggerDataProviderRegistry providerRegistry;

    @Override
    public TriggerSource getSource() {
        return TriggerSource.FROM_STORE;
    }

    @Override
    public boolean hasEntries(String jobName) {
        return resolver.hasFromStore(jobName);
    }

    @Override
    public List<String> getTriggerNames(String jobName) {
        return resolver.getFromStore(jobName).stream()
                .map(entry -> effectiveName(entry, jobName))
                .distinct()
                .toList();
    }

    @Override
    public CompletableFuture<TriggerSpec> resolve(JobIdentity jobIdentity, String triggerName, String cronOverride) {
        var jobName = jobIdentity.getName();
        var entry = resolver.getFromStore(jobName).stream()
                .filter(candidate -> effectiveName(candidate, jobName).equals(triggerName))
                .findFirst();

        if (entry.isEmpty()) {
            return CompletableFuture.failedFuture(new ConfiguredTriggerNotFoundException(jobName, triggerName, getSource()));
        }

        var providerType = providerRegistry.resolveProviderType(entry.get().getProviderType());
        var provider = providerRegistry.getProvider(providerType);
        if (provider.isEmpty()) {
            return CompletableFuture.failedFuture(new TriggerProviderLookupException(
                    jobName, triggerName, providerType, "no provider registered for this type"));
        }

        return lookup(provider.get(), jobName, triggerName, "cron expression", TriggerDataProvider::getCronExpression)
                .thenCompose(fetchedCron -> lookup(provider.get(), jobName, triggerName, "trigger data", TriggerDataProvider::getTriggerData)
                        .thenApply(triggerData -> triggerSpecFactory.create(
                                triggerName,
                                jobIdentity.getGroup(),
                                jobName,
                                jobIdentity.getGroup(),
                                TriggerSpecFactory.effectiveCron(cronOverride, fetchedCron),
                                triggerData)));
    }

    private <T> CompletableFuture<T> lookup(TriggerDataProvider provider, String jobName, String triggerName, String what,
                                            LookupCall<T> call) {
        CompletableFuture<Optional<T>> pending;
        try {
            pending = call.apply(provider, triggerName);
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }

        return pending.handle((result, error) -> {
            if (error != null) {
                var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                log.error("Provider {} failed to look up {} for trigger {} of job {}: {}",
                        provider.getProviderType(), what, triggerName, jobName, cause.getMessage());
                throw new TriggerProviderLookupException(jobName, triggerName, provider.getProviderType(), cause);
            }
            return result.orElseThrow(() -> new TriggerProviderLookupException(
                    jobName, triggerName, provider.getProviderType(), "no " + what + " found"));
        });
    }

    private static String effectiveName(TriggerFromDb entry, String jobName) {
        return StringUtils.hasText(entry.getTriggerName()) ? entry.getTriggerName() : jobName;
    }

    @FunctionalInterface
    private interface LookupCall<T> {
        CompletableFuture<Optional<T>> apply(TriggerDataProvider provider, String triggerName);
    }
}
