package com.example.jobtrigger.exception;

import com.example.jobtrigger.domain.enums.TriggerSource;
import lombok.Getter;

/**
 * Exception for a requested trigger that is not configured for the job
 */
@Getter
public class ConfiguredTriggerNotFoundException extends RuntimeException {

    private final String jobName;
    private final String triggerName;
    private final TriggerSource source;

    public ConfiguredTriggerNotFoundException(String jobName, String triggerName, TriggerSource source) {
        super(String.format("Trigger %s is not configured for job %s in %s", triggerName, jobName, source.getDisplayName()));
        this.jobName = jobName;
        this.triggerName = triggerName;
        this.source = source;
    }
}
