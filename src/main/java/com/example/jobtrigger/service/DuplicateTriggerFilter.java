package com.example.jobtrigger.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Works out which configured triggers of a job still need registering.
 */
@Component
public class DuplicateTriggerFilter {

    /**
     * @param configuredNames Trigger names from configuration, in configuration order
     * @param registeredNames Names of triggers the scheduler currently holds for the job,
     *                        read immediately before the call
     * @return Configured names not yet registered, in their original order
     */
    public List<String> pending(List<String> configuredNames, Set<String> registeredNames) {
        if (registeredNames.isEmpty()) {
            return List.copyOf(configuredNames);
        }
        return configuredNames.stream()
                .filter(name -> !registeredNames.contains(name))
                .toList();
    }
}
