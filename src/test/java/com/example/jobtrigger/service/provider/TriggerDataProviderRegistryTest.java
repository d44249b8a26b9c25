package com.example.jobtrigger.service.provider;

import com.example.jobtrigger.config.JobsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TriggerDataProviderRegistry Tests")
class TriggerDataProviderRegistryTest {

    private TriggerDataProviderRegistry registry;
    private JobsProperties jobsProperties;

    private final TriggerDataProvider databaseProvider = new StubProvider("database");
    private final TriggerDataProvider httpProvider = new StubProvider("http");

    @BeforeEach
    void setUp() {
        jobsProperties = new JobsProperties();
        jobsProperties.getTriggersFromDb().put("sync", List.of(
                JobsProperties.TriggerFromDb.builder().triggerName("hourly").providerType("ftp").build()));
        registry = new TriggerDataProviderRegistry(List.of(databaseProvider, httpProvider), jobsProperties);
        registry.initialize();
    }

    @Test
    @DisplayName("Should register and retrieve providers")
    void shouldRegisterAndRetrieveProviders() {
        assertThat(registry.getProvider("database")).containsSame(databaseProvider);
        assertThat(registry.getProvider("http")).containsSame(httpProvider);
    }

    @Test
    @DisplayName("Should return empty for unregistered type")
    void shouldReturnEmptyForUnregisteredType() {
        assertThat(registry.getProvider("ftp")).isEmpty();
    }

    @Test
    @DisplayName("Should fall back to default provider type for blank type")
    void shouldFallBackToDefaultType() {
        assertThat(registry.resolveProviderType(null)).isEqualTo("database");
        assertThat(registry.resolveProviderType(" ")).isEqualTo("database");
        assertThat(registry.getProvider(null)).containsSame(databaseProvider);
    }

    @Test
    @DisplayName("Should honour a configured default provider type")
    void shouldHonourConfiguredDefault() {
        jobsProperties.setDefaultProviderType("http");

        assertThat(registry.getProvider("")).containsSame(httpProvider);
    }

    @Test
    @DisplayName("Should let a later provider of the same type win")
    void shouldLetLaterProviderWin() {
        var replacement = new StubProvider("http");
        registry = new TriggerDataProviderRegistry(List.of(httpProvider, replacement), jobsProperties);
        registry.initialize();

        assertThat(registry.getProvider("http")).containsSame(replacement);
    }

    @Test
    @DisplayName("Should return registered types")
    void shouldReturnRegisteredTypes() {
        assertThat(registry.getRegisteredTypes()).containsExactlyInAnyOrder("database", "http");
    }

    private static final class StubProvider implements TriggerDataProvider {

        private final String type;

        private StubProvider(String type) {
            this.type = type;
        }

        @Override
        public String getProviderType() {
            return type;
        }

        @Override
        public CompletableFuture<Optional<String>> getCronExpression(String triggerName) {
            return CompletableFuture.completedFuture(Optional.empty());
        }

        @Override
        public CompletableFuture<Optional<Map<String, Object>>> getTriggerData(String triggerName) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }
}
