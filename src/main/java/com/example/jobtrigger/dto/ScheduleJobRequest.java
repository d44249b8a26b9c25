package com.example.jobtrigger.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for scheduling a job's triggers.
 * The job name comes from the request path.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleJobRequest {

    private String jobName;

    /**
     * Job group (default: DEFAULT)
     */
    @Size(max = 200)
    private String jobGroup;

    /**
     * Cron expression overriding the configured one for every trigger scheduled
     */
    @Size(max = 120)
    private String cronExpression;

    /**
     * Schedule only this trigger; when absent every missing trigger of the job is scheduled
     */
    @Size(max = 200)
    private String triggerName;
}
