package com.example.jobtrigger.service.provider;

import com.example.jobtrigger.domain.entity.TriggerDefinition;
import com.example.jobtrigger.domain.repository.TriggerDefinitionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Reads trigger definitions from the {@code trigger_definitions} table.
 */
@Slf4j
@Component
public class JpaTriggerDataProvider implements TriggerDataProvider {

    public static final String PROVIDER_TYPE = "database";

    private final TriggerDefinitionRepository repository;
    private final Executor executor;

    public JpaTriggerDataProvider(TriggerDefinitionRepository repository, @Qualifier("schedulingExecutor") Executor executor) {
        this.repository = repository;
        this.executor = executor;
    }

    @Override
    public String getProviderType() {
        return PROVIDER_TYPE;
    }

    @Override
    public CompletableFuture<Optional<String>> getCronExpression(String triggerName) {
        return CompletableFuture.supplyAsync(() -> {
            log.debug("Loading cron expression for trigger {}", triggerName);
            return repository.findByTriggerName(triggerName)
                    .filter(TriggerDefinition::hasCronExpression)
                    .map(TriggerDefinition::getCronExpression);
        }, executor);
    }

    /**
     * A stored definition without data yields an empty map, not an empty result
     */
    @Override
    public CompletableFuture<Optional<Map<String, Object>>> getTriggerData(String triggerName) {
        return CompletableFuture.supplyAsync(() -> {
            log.debug("Loading trigger data for trigger {}", triggerName);
            return repository.findByTriggerName(triggerName)
                    .map(definition -> copyOf(definition.getTriggerData()));
        }, executor);
    }

    private static Map<String, Object> copyOf(Map<String, Object> triggerData) {
        return triggerData != null ? new HashMap<>(triggerData) : new HashMap<>();
    }
}
