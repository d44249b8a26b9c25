package com.example.jobtrigger.client;

import com.example.jobtrigger.client.ClientModels.TriggerDefinitionResponse;
import com.example.jobtrigger.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Client for the remote trigger definition service.
 * <p>
 * Uses a Resilience4j circuit breaker; requests are never retried, a
 * failed lookup fails the scheduling request that needed it.
 */
@Slf4j
@Component
public class TriggerProviderClient {

    private static final String SERVICE_NAME = "Trigger Provider";

    private final WebClient webClient;

    public TriggerProviderClient(@Qualifier("triggerProviderWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * Fetch a trigger definition by trigger name
     *
     * @param triggerName The trigger name
     * @return The definition, or empty when the service does not know the trigger
     * @throws ExternalServiceException if the API call fails
     */
    @CircuitBreaker(name = "triggerProvider", fallbackMethod = "getTriggerDefinitionFallback")
    public Optional<TriggerDefinitionResponse> getTriggerDefinition(String triggerName) {
        log.debug("Fetching trigger definition for: {}", triggerName);

        try {
            return webClient.get()
                    .uri("/api/v1/trigger-definitions/{triggerName}", triggerName)
                    .exchangeToMono(response -> {
                        if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                            return response.releaseBody().then(Mono.<TriggerDefinitionResponse>empty());
                        }
                        if (response.statusCode().isError()) {
                            return response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .flatMap(body -> Mono.error(
                                            new ExternalServiceException(SERVICE_NAME, response.statusCode().value(), body)));
                        }
                        return response.bodyToMono(TriggerDefinitionResponse.class);
                    })
                    .timeout(Duration.ofSeconds(10))
                    .blockOptional();
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to fetch trigger definition {}: {}", triggerName, e.getMessage());
            throw new ExternalServiceException(SERVICE_NAME, e);
        }
    }

    /**
     * Fallback method when circuit breaker is open or the call failed
     */
    @SuppressWarnings("unused")
    private Optional<TriggerDefinitionResponse> getTriggerDefinitionFallback(String triggerName, Exception e) {
        if (e instanceof ExternalServiceException serviceException) {
            throw serviceException;
        }
        log.warn("Circuit breaker open for Trigger Provider, trigger: {}, error: {}", triggerName, e.getMessage());
        throw new ExternalServiceException(SERVICE_NAME, "Service temporarily unavailable (circuit breaker open)", e);
    }
}
