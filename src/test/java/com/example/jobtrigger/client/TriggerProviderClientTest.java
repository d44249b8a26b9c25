package com.example.jobtrigger.client;

import com.example.jobtrigger.exception.ExternalServiceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TriggerProviderClient Tests")
class TriggerProviderClientTest {

    private final AtomicReference<String> requestedPath = new AtomicReference<>();

    private TriggerProviderClient clientRespondingWith(HttpStatus status, String body) {
        var webClient = WebClient.builder()
                .baseUrl("http://trigger-provider")
                .exchangeFunction(request -> {
                    requestedPath.set(request.url().getPath());
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new TriggerProviderClient(webClient);
    }

    @Test
    @DisplayName("Should fetch trigger definition by name")
    void shouldFetchDefinition() {
        var client = clientRespondingWith(HttpStatus.OK,
                "{\"triggerName\":\"hourly\",\"cronExpression\":\"0 * * * *\",\"triggerData\":{\"target\":\"crm\"}}");

        var definition = client.getTriggerDefinition("hourly");

        assertThat(requestedPath.get()).isEqualTo("/api/v1/trigger-definitions/hourly");
        assertThat(definition).hasValueSatisfying(response -> {
            assertThat(response.getCronExpression()).isEqualTo("0 * * * *");
            assertThat(response.getTriggerData()).containsEntry("target", "crm");
        });
    }

    @Test
    @DisplayName("Should return empty for unknown trigger")
    void shouldReturnEmptyOnNotFound() {
        var client = clientRespondingWith(HttpStatus.NOT_FOUND, "");

        assertThat(client.getTriggerDefinition("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Should raise external service error on server error")
    void shouldRaiseOnServerError() {
        var client = clientRespondingWith(HttpStatus.INTERNAL_SERVER_ERROR, "boom");

        assertThatThrownBy(() -> client.getTriggerDefinition("hourly"))
                .isInstanceOf(ExternalServiceException.class);
    }
}
