package com.example.jobtrigger.exception;

import lombok.Getter;

/**
 * Exception for a configured trigger that cannot be built as configured,
 * such as an entry without a cron expression when the request gives no override
 */
@Getter
public class InvalidTriggerConfigurationException extends RuntimeException {

    private final String jobName;
    private final String triggerName;

    public InvalidTriggerConfigurationException(String jobName, String triggerName, String reason) {
        super(String.format("Trigger %s of job %s is misconfigured: %s", triggerName, jobName, reason));
        this.jobName = jobName;
        this.triggerName = triggerName;
    }
}
