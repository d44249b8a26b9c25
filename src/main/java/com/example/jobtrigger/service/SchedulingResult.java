package com.example.jobtrigger.service;

import com.example.jobtrigger.domain.JobIdentity;
import com.example.jobtrigger.domain.TriggerIdentity;
import com.example.jobtrigger.domain.enums.TriggerSource;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What a scheduling request did.
 * A null source means no configuration source knew the job, which is not an error.
 */
@Value
@Builder
public class SchedulingResult {

    JobIdentity jobIdentity;

    TriggerSource source;

    @Builder.Default
    List<TriggerIdentity> registeredTriggers = List.of();

    public static SchedulingResult noMatchingSource(JobIdentity jobIdentity) {
        return SchedulingResult.builder().jobIdentity(jobIdentity).build();
    }

    public boolean isSourceResolved() {
        return source != null;
    }
}
