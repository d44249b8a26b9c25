package com.example.jobtrigger.exception;

import lombok.Getter;

/**
 * Exception for a trigger whose cron expression or data could not be
 * resolved by its trigger data provider
 */
@Getter
public class TriggerProviderLookupException extends RuntimeException {

    private final String jobName;
    private final String triggerName;
    private final String providerType;

    public TriggerProviderLookupException(String jobName, String triggerName, String providerType, String reason) {
        super(String.format("Provider %s could not resolve trigger %s of job %s: %s", providerType, triggerName, jobName, reason));
        this.jobName = jobName;
        this.triggerName = triggerName;
        this.providerType = providerType;
    }

    public TriggerProviderLookupException(String jobName, String triggerName, String providerType, Throwable cause) {
        super(String.format("Provider %s failed for trigger %s of job %s: %s", providerType, triggerName, jobName, cause.getMessage()), cause);
        this.jobName = jobName;
        this.triggerName = triggerName;
        this.providerType = providerType;
    }
}
