package com.example.jobtrigger.service.provider;

import com.example.jobtrigger.client.ClientModels.TriggerDefinitionResponse;
import com.example.jobtrigger.client.TriggerProviderClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Reads trigger definitions from the remote trigger definition service.
 */
@Component
public class HttpTriggerDataProvider implements TriggerDataProvider {

    public static final String PROVIDER_TYPE = "http";

    private final TriggerProviderClient client;
    private final Executor executor;

    public HttpTriggerDataProvider(TriggerProviderClient client, @Qualifier("schedulingExecutor") Executor executor) {
        this.client = client;
        this.executor = executor;
    }

    @Override
    public String getProviderType() {
        return PROVIDER_TYPE;
    }

    @Override
    public CompletableFuture<Optional<String>> getCronExpression(String triggerName) {
        return CompletableFuture.supplyAsync(() -> client.getTriggerDefinition(triggerName)
                .map(TriggerDefinitionResponse::getCronExpression)
                .filter(StringUtils::hasText), executor);
    }

    @Override
    public CompletableFuture<Optional<Map<String, Object>>> getTriggerData(String triggerName) {
        return CompletableFuture.supplyAsync(() -> client.getTriggerDefinition(triggerName)
                .map(definition -> copyOf(definition.getTriggerData())), executor);
    }

    private static Map<String, Object> copyOf(Map<String, Object> triggerData) {
        return triggerData != null ? new HashMap<>(triggerData) : new HashMap<>();
    }
}
