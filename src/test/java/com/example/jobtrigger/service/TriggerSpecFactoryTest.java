package com.example.jobtrigger.service;

import com.example.jobtrigger.domain.JobGroups;
import com.example.jobtrigger.exception.InvalidTriggerConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TriggerSpecFactory Tests")
class TriggerSpecFactoryTest {

    private final TriggerSpecFactory factory = new TriggerSpecFactory();

    @Nested
    @DisplayName("Defaulting Tests")
    class DefaultingTests {

        @Test
        @DisplayName("Should name trigger after job when no trigger name given")
        void shouldDefaultTriggerNameToJobName() {
            var spec = factory.create(null, null, "reports", null, "0 0 * * *", null);

            assertThat(spec.getIdentity().getName()).isEqualTo("reports");
            assertThat(spec.getJobIdentity().getName()).isEqualTo("reports");
        }

        @Test
        @DisplayName("Should treat blank trigger name as absent")
        void shouldTreatBlankTriggerNameAsAbsent() {
            var spec = factory.create("  ", null, "reports", null, "0 0 * * *", null);

            assertThat(spec.getIdentity().getName()).isEqualTo("reports");
        }

        @Test
        @DisplayName("Should put trigger and job in default group when none given")
        void shouldDefaultGroups() {
            var spec = factory.create("daily", null, "reports", "", "0 0 * * *", null);

            assertThat(spec.getIdentity().getGroup()).isEqualTo(JobGroups.DEFAULT_GROUP);
            assertThat(spec.getJobIdentity().getGroup()).isEqualTo(JobGroups.DEFAULT_GROUP);
        }

        @Test
        @DisplayName("Should keep explicit groups")
        void shouldKeepExplicitGroups() {
            var spec = factory.create("daily", "trigger-group", "reports", "finance", "0 0 * * *", null);

            assertThat(spec.getIdentity().getGroup()).isEqualTo("trigger-group");
            assertThat(spec.getJobIdentity().getGroup()).isEqualTo("finance");
        }
    }

    @Nested
    @DisplayName("Payload and Cron Tests")
    class PayloadAndCronTests {

        @Test
        @DisplayName("Should carry no data when payload is absent")
        void shouldCarryNoDataWithoutPayload() {
            var spec = factory.create("daily", null, "reports", null, "0 0 * * *", null);

            assertThat(spec.getPayload()).isNull();
            assertThat(spec.getPayloadIfPresent()).isEmpty();
        }

        @Test
        @DisplayName("Should attach payload verbatim and detach it from the caller's map")
        void shouldAttachPayloadCopy() {
            var payload = new HashMap<String, Object>();
            payload.put("format", "pdf");

            var spec = factory.create("daily", null, "reports", null, "0 0 * * *", payload);
            payload.put("format", "csv");

            assertThat(spec.getPayload()).containsExactlyEntriesOf(Map.of("format", "pdf"));
        }

        @Test
        @DisplayName("Should pass cron expression through without validating it")
        void shouldNotValidateCron() {
            var spec = factory.create("daily", null, "reports", null, "not a cron", null);

            assertThat(spec.getCronExpression()).isEqualTo("not a cron");
        }

        @Test
        @DisplayName("Should report a missing cron expression as a configuration fault")
        void shouldRejectMissingCron() {
            assertThatThrownBy(() -> factory.create("daily", null, "reports", null, " ", null))
                    .isInstanceOf(InvalidTriggerConfigurationException.class)
                    .hasMessageContaining("daily")
                    .hasMessageContaining("reports");
        }

        @Test
        @DisplayName("Should reject a missing job name as a bad request")
        void shouldRejectMissingJobName() {
            assertThatThrownBy(() -> factory.create("daily", null, "", null, "0 0 * * *", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should prefer non-blank override over configured cron")
        void shouldResolveEffectiveCron() {
            assertThat(TriggerSpecFactory.effectiveCron("0 5 * * *", "0 0 * * *")).isEqualTo("0 5 * * *");
            assertThat(TriggerSpecFactory.effectiveCron(null, "0 0 * * *")).isEqualTo("0 0 * * *");
            assertThat(TriggerSpecFactory.effectiveCron("", "0 0 * * *")).isEqualTo("0 0 * * *");
        }
    }
}
