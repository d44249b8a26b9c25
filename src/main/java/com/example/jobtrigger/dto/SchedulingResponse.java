package com.example.jobtrigger.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for a scheduling request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulingResponse {

    private String jobName;
    private String jobGroup;

    /**
     * Code of the trigger source used, null when no source knows the job
     */
    private String source;

    /**
     * Names of the triggers registered by this request, in registration order
     */
    private List<String> registeredTriggers;
}
