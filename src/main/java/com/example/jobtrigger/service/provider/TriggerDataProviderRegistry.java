package com.example.jobtrigger.service.provider;

import com.example.jobtrigger.config.JobsProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.*;

/**
 * Registry for trigger data providers.
 * <p>
 * Automatically discovers all TriggerDataProvider beans and resolves
 * provider types named by configuration, falling back to the default
 * provider type for entries that name none.
 */
@Slf4j
@Component
public class TriggerDataProviderRegistry {

    private final Map<String, TriggerDataProvider> providers = new HashMap<>();
    private final List<TriggerDataProvider> providerBeans;
    private final JobsProperties jobsProperties;

    public TriggerDataProviderRegistry(List<TriggerDataProvider> providerBeans, JobsProperties jobsProperties) {
        this.providerBeans = providerBeans;
        this.jobsProperties = jobsProperties;
    }

    @PostConstruct
    public void initialize() {
        for (var provider : providerBeans) {
            var type = provider.getProviderType();
            if (providers.containsKey(type)) {
                log.warn("Duplicate trigger data provider for type {}: {} will override {}",
                        type, provider.getClass().getSimpleName(),
                        providers.get(type).getClass().getSimpleName());
            }
            providers.put(type, provider);
            log.info("Registered trigger data provider for type {}: {}", type, provider.getClass().getSimpleName());
        }

        // Log warning for configured provider types nobody serves
        var triggersFromDb = jobsProperties.getTriggersFromDb() != null ? jobsProperties.getTriggersFromDb() : Map.<String, List<JobsProperties.TriggerFromDb>>of();
        triggersFromDb.forEach((jobName, entries) -> {
            for (var entry : entries) {
                var type = resolveProviderType(entry.getProviderType());
                if (!providers.containsKey(type)) {
                    log.warn("No trigger data provider registered for type {} used by trigger {} of job {}",
                            type, entry.getTriggerName(), jobName);
                }
            }
        });
    }

    /**
     * Provider type to use for a configured entry
     */
    public String resolveProviderType(String providerType) {
        return StringUtils.hasText(providerType) ? providerType : jobsProperties.getDefaultProviderType();
    }

    /**
     * Get provider for a configured provider type (blank means default)
     *
     * @param providerType The provider type, may be blank
     * @return Optional containing the provider if found
     */
    public Optional<TriggerDataProvider> getProvider(String providerType) {
        return Optional.ofNullable(providers.get(resolveProviderType(providerType)));
    }

    /**
     * Get all registered provider types
     */
    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(providers.keySet());
    }
}
