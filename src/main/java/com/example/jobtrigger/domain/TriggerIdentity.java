package com.example.jobtrigger.domain;

import lombok.NonNull;
import lombok.Value;

/**
 * Identifies a trigger. Unique within the scheduler's trigger namespace;
 * registering an identity that already exists is a conflict, never a merge.
 */
@Value
public class TriggerIdentity {

    @NonNull
    String name;

    @NonNull
    String group;

    public static TriggerIdentity of(String name, String group) {
        return new TriggerIdentity(name, JobGroups.orDefault(group));
    }

    @Override
    public String toString() {
        return group + "." + name;
    }
}
