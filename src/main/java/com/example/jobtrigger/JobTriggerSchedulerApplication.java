package com.example.jobtrigger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Job Trigger Scheduler Application
 * <p>
 * Registers cron triggers for named recurring jobs against a shared
 * Quartz scheduler, sourcing trigger definitions from configuration
 * or from a trigger definition store.
 * <p>
 * Features:
 * - Priority-ordered trigger source resolution (simple, with data, from store)
 * - Duplicate suppression against live scheduler state
 * - Asynchronous enrichment of trigger cron/data from pluggable providers
 * - Optional cluster-safe scheduling of all configured jobs on startup
 */
@SpringBootApplication
public class JobTriggerSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobTriggerSchedulerApplication.class, args);
    }
}
