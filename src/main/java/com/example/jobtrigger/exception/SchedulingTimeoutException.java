package com.example.jobtrigger.exception;

import lombok.Getter;

/**
 * Exception for a scheduling request cancelled after exceeding its timeout.
 * Triggers registered before the cancellation stay registered.
 */
@Getter
public class SchedulingTimeoutException extends RuntimeException {

    private final String jobName;
    private final String jobGroup;

    public SchedulingTimeoutException(String jobName, String jobGroup, long timeoutSeconds) {
        super(String.format("Scheduling of job %s.%s did not complete within %d seconds", jobGroup, jobName, timeoutSeconds));
        this.jobName = jobName;
        this.jobGroup = jobGroup;
    }
}
