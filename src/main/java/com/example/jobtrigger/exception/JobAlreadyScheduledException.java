package com.example.jobtrigger.exception;

import lombok.Getter;

/**
 * Thrown when a trigger named after the job already exists in the job's group,
 * meaning the job is already managed by the scheduler
 */
@Getter
public class JobAlreadyScheduledException extends RuntimeException {

    private final String jobName;
    private final String jobGroup;

    public JobAlreadyScheduledException(String jobName, String jobGroup) {
        super(String.format("Job %s.%s is already scheduled", jobGroup, jobName));
        this.jobName = jobName;
        this.jobGroup = jobGroup;
    }
}
