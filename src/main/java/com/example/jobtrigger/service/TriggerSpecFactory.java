package com.example.jobtrigger.service;

import com.example.jobtrigger.domain.JobIdentity;
import com.example.jobtrigger.domain.TriggerIdentity;
import com.example.jobtrigger.domain.TriggerSpec;
import com.example.jobtrigger.exception.InvalidTriggerConfigurationException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assembles trigger specs, filling in defaults.
 * <p>
 * Only assembly happens here. Which cron expression wins (request
 * override or configured value) is decided by the caller beforehand,
 * see {@link #effectiveCron(String, String)}.
 */
@Component
public class TriggerSpecFactory {

    /**
     * Build a trigger spec
     *
     * @param triggerName    Trigger name, defaults to the job name
     * @param triggerGroup   Trigger group, defaults to the default group
     * @param jobName        Target job name
     * @param jobGroup       Target job group, defaults to the default group
     * @param cronExpression Cron expression, passed through unvalidated
     * @param payload        Trigger data, or null for none
     * @throws IllegalArgumentException if the job name is missing
     * @throws InvalidTriggerConfigurationException if no cron expression is available
     */
    public TriggerSpec create(String triggerName, String triggerGroup, String jobName, String jobGroup,
                              String cronExpression, Map<String, Object> payload) {
        if (!StringUtils.hasText(jobName)) {
            throw new IllegalArgumentException("Job name is required");
        }

        var effectiveTriggerName = StringUtils.hasText(triggerName) ? triggerName : jobName;
        if (!StringUtils.hasText(cronExpression)) {
            throw new InvalidTriggerConfigurationException(jobName, effectiveTriggerName, "no cron expression configured");
        }

        return TriggerSpec.builder()
                .identity(TriggerIdentity.of(effectiveTriggerName, triggerGroup))
                .jobIdentity(JobIdentity.of(jobName, jobGroup))
                .cronExpression(cronExpression)
                .payload(payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : null)
                .build();
    }

    /**
     * Request override wins when non-blank, otherwise the configured or fetched value
     */
    public static String effectiveCron(String override, String configured) {
        return StringUtils.hasText(override) ? override : configured;
    }
}
