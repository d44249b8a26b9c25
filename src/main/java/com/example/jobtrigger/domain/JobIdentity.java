package com.example.jobtrigger.domain;

import lombok.NonNull;
import lombok.Value;

/**
 * Identifies a job's logical namespace. A job may own many triggers.
 */
@Value
public class JobIdentity {

    @NonNull
    String name;

    @NonNull
    String group;

    /**
     * Create an identity, falling back to the default group when none is given
     */
    public static JobIdentity of(String name, String group) {
        return new JobIdentity(name, JobGroups.orDefault(group));
    }

    @Override
    public String toString() {
        return group + "." + name;
    }
}
