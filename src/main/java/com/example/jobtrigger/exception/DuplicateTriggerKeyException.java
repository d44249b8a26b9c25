package com.example.jobtrigger.exception;

import lombok.Getter;

/**
 * Exception for a trigger the scheduler already holds. Raised by the
 * scheduler itself, typically when two requests race for the same job.
 */
@Getter
public class DuplicateTriggerKeyException extends RuntimeException {

    private final String triggerName;
    private final String triggerGroup;

    public DuplicateTriggerKeyException(String triggerName, String triggerGroup, Throwable cause) {
        super(String.format("Trigger %s.%s already exists", triggerGroup, triggerName), cause);
        this.triggerName = triggerName;
        this.triggerGroup = triggerGroup;
    }
}
