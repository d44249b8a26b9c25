package com.example.jobtrigger.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for a trigger held by the scheduler
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerResponse {

    private String name;
    private String group;
    private String jobName;
    private String jobGroup;
    private String cronExpression;
    private Instant previousFireTime;
    private Instant nextFireTime;
    private Map<String, Object> triggerData;
}
