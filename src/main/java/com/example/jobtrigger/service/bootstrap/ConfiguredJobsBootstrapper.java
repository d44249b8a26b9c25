package com.example.jobtrigger.service.bootstrap;

import com.example.jobtrigger.domain.JobGroups;
import com.example.jobtrigger.dto.ScheduleJobRequest;
import com.example.jobtrigger.exception.JobAlreadyScheduledException;
import com.example.jobtrigger.service.JobSchedulingService;
import com.example.jobtrigger.service.alert.SlackAlertService;
import com.example.jobtrigger.service.source.TriggerSourceResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Schedules every configured job once the application is ready, when
 * {@code jobs.schedule-on-startup} is enabled.
 * <p>
 * ShedLock keeps instances starting together from bootstrapping at the
 * same time. Jobs that are already scheduled are skipped; any other
 * failure is logged and alerted, and the next job is processed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "jobs", name = "schedule-on-startup", havingValue = "true")
public class ConfiguredJobsBootstrapper {

    private final TriggerSourceResolver triggerSourceResolver;
    private final JobSchedulingService jobSchedulingService;
    private final SlackAlertService slackAlertService;

    @EventListener(ApplicationReadyEvent.class)
    @SchedulerLock(name = "configuredJobsBootstrap", lockAtLeastFor = "30s", lockAtMostFor = "10m")
    public void onApplicationReady() {
        scheduleConfiguredJobs();
    }

    /**
     * Schedule every configured job in the default group
     *
     * @return Number of jobs for which at least one trigger was registered
     */
    public int scheduleConfiguredJobs() {
        var jobNames = triggerSourceResolver.getConfiguredJobNames();
        log.info("Scheduling {} configured job(s) on startup", jobNames.size());

        var scheduled = 0;
        for (var jobName : jobNames) {
            try {
                var result = jobSchedulingService.scheduleAndAwait(ScheduleJobRequest.builder().jobName(jobName).build());
                if (!result.getRegisteredTriggers().isEmpty()) {
                    scheduled++;
                }
            } catch (JobAlreadyScheduledException e) {
                log.info("Job {} is already scheduled, skipping", jobName);
            } catch (RuntimeException e) {
                log.error("Failed to schedule job {} on startup: {}", jobName, e.getMessage(), e);
                slackAlertService.sendSchedulingFailureAlert(jobName, JobGroups.DEFAULT_GROUP, e.getClass().getSimpleName(), e.getMessage());
            }
        }

        log.info("Startup scheduling finished: {} of {} job(s) had triggers registered", scheduled, jobNames.size());
        return scheduled;
    }
}
