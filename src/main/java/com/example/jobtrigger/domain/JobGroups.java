package com.example.jobtrigger.domain;

/**
 * Well-known job and trigger group names.
 */
public final class JobGroups {

    /**
     * Fallback group used when no explicit group is supplied.
     * Same value as Quartz's {@code Scheduler.DEFAULT_GROUP}.
     */
    public static final String DEFAULT_GROUP = "DEFAULT";

    private JobGroups() {
    }

    public static String orDefault(String group) {
        return group == null || group.isBlank() ? DEFAULT_GROUP : group;
    }
}
