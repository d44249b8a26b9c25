package com.example.jobtrigger.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Configuration origins trigger definitions are drawn from.
 * <p>
 * Declaration order is resolution priority: the first source with an
 * entry for a job is the only one consulted for it.
 */
@Getter
@RequiredArgsConstructor
public enum TriggerSource {

    /**
     * One trigger per job, named after the job: {@code jobs.triggers}
     */
    SIMPLE("simple", "Simple Trigger"),

    /**
     * Named triggers with static data: {@code jobs.triggers-with-data}
     */
    WITH_DATA("with-data", "Trigger With Data"),

    /**
     * Named triggers whose cron and data come from a provider: {@code jobs.triggers-from-db}
     */
    FROM_STORE("from-store", "Trigger From Store");

    private final String code;
    private final String displayName;
}
