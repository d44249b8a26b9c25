package com.example.jobtrigger.domain;

import com.example.jobtrigger.domain.enums.TriggerSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Identity Tests")
class IdentityTest {

    @Test
    @DisplayName("Should default blank group")
    void shouldDefaultBlankGroup() {
        assertThat(JobIdentity.of("reports", null).getGroup()).isEqualTo("DEFAULT");
        assertThat(TriggerIdentity.of("daily", " ").getGroup()).isEqualTo("DEFAULT");
        assertThat(JobIdentity.of("reports", "finance").getGroup()).isEqualTo("finance");
    }

    @Test
    @DisplayName("Should compare by name and group")
    void shouldCompareByValue() {
        assertThat(TriggerIdentity.of("daily", null)).isEqualTo(TriggerIdentity.of("daily", "DEFAULT"));
        assertThat(TriggerIdentity.of("daily", "a")).isNotEqualTo(TriggerIdentity.of("daily", "b"));
        assertThat(JobIdentity.of("reports", "finance")).hasToString("finance.reports");
    }

    @Test
    @DisplayName("Should require a name")
    void shouldRequireName() {
        assertThatThrownBy(() -> JobIdentity.of(null, null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Should order sources by priority")
    void shouldOrderSourcesByPriority() {
        assertThat(TriggerSource.values())
                .containsExactly(TriggerSource.SIMPLE, TriggerSource.WITH_DATA, TriggerSource.FROM_STORE);
        assertThat(TriggerSource.FROM_STORE.getCode()).isEqualTo("from-store");
    }
}
