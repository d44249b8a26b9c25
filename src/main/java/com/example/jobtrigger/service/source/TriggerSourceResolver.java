package com.example.jobtrigger.service.source;

import com.example.jobtrigger.config.JobsProperties;
import com.example.jobtrigger.config.JobsProperties.TriggerFromDb;
import com.example.jobtrigger.config.JobsProperties.TriggerWithData;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookups over the three trigger configuration mappings.
 * <p>
 * Answers only whether a mapping has an entry for a job and what it is;
 * the order sources are tried in belongs to the scheduling service.
 * A job counts as present when its key is configured, even with an empty list.
 */
@Component
@RequiredArgsConstructor
public class TriggerSourceResolver {

    private final JobsProperties jobsProperties;

    public boolean hasSimple(String jobName) {
        return simpleTriggers().containsKey(jobName);
    }

    public Optional<String> getSimple(String jobName) {
        return Optional.ofNullable(simpleTriggers().get(jobName));
    }

    public boolean hasWithData(String jobName) {
        return triggersWithData().containsKey(jobName);
    }

    public List<TriggerWithData> getWithData(String jobName) {
        return unmodifiable(triggersWithData().get(jobName));
    }

    public boolean hasFromStore(String jobName) {
        return triggersFromDb().containsKey(jobName);
    }

    public List<TriggerFromDb> getFromStore(String jobName) {
        return unmodifiable(triggersFromDb().get(jobName));
    }

    /**
     * Every job named by any mapping, simple jobs first
     */
    public Set<String> getConfiguredJobNames() {
        var names = new LinkedHashSet<String>();
        names.addAll(simpleTriggers().keySet());
        names.addAll(triggersWithData().keySet());
        names.addAll(triggersFromDb().keySet());
        return Collections.unmodifiableSet(names);
    }

    private Map<String, String> simpleTriggers() {
        return jobsProperties.getTriggers() != null ? jobsProperties.getTriggers() : Map.of();
    }

    private Map<String, List<TriggerWithData>> triggersWithData() {
        return jobsProperties.getTriggersWithData() != null ? jobsProperties.getTriggersWithData() : Map.of();
    }

    private Map<String, List<TriggerFromDb>> triggersFromDb() {
        return jobsProperties.getTriggersFromDb() != null ? jobsProperties.getTriggersFromDb() : Map.of();
    }

    private static <T> List<T> unmodifiable(List<T> entries) {
        return entries != null ? Collections.unmodifiableList(entries) : List.of();
    }
}
