package com.example.jobtrigger.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Stored trigger definition read by the database trigger data provider.
 * <p>
 * Jobs listed under {@code jobs.triggers-from-db} reference these rows by
 * trigger name; the cron expression and data are looked up at scheduling
 * time and never cached.
 */
@Entity
@Table(name = "trigger_definitions", indexes = {
        @Index(name = "idx_trigger_definition_name", columnList = "trigger_name", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TriggerDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "trigger_name", nullable = false, length = 200)
    private String triggerName;

    @Column(name = "cron_expression", length = 100)
    private String cronExpression;

    /**
     * Data handed to the job on every fire of the trigger
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "trigger_data", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> triggerData = new HashMap<>();

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean hasCronExpression() {
        return cronExpression != null && !cronExpression.isBlank();
    }
}
