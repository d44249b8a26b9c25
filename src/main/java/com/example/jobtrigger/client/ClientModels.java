package com.example.jobtrigger.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Response DTOs for external service clients
 */
public class ClientModels {
    private ClientModels() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TriggerDefinitionResponse {
        private String triggerName;
        private String cronExpression;
        private Map<String, Object> triggerData;
    }
}
