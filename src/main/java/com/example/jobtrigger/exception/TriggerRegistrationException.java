package com.example.jobtrigger.exception;

import lombok.Getter;

/**
 * Exception for scheduler failures other than duplicate triggers
 */
@Getter
public class TriggerRegistrationException extends RuntimeException {

    private final String operation;
    private final String target;

    public TriggerRegistrationException(String operation, String target, Throwable cause) {
        super(String.format("Scheduler %s failed for %s: %s", operation, target, cause.getMessage()), cause);
        this.operation = operation;
        this.target = target;
    }
}
