package com.example.jobtrigger.service;

import com.example.jobtrigger.config.JobsProperties;
import com.example.jobtrigger.config.MetricsConfig;
import com.example.jobtrigger.domain.JobGroups;
import com.example.jobtrigger.domain.JobIdentity;
import com.example.jobtrigger.domain.RegisteredTrigger;
import com.example.jobtrigger.domain.TriggerIdentity;
import com.example.jobtrigger.dto.ScheduleJobRequest;
import com.example.jobtrigger.exception.JobAlreadyScheduledException;
import com.example.jobtrigger.exception.SchedulingTimeoutException;
import com.example.jobtrigger.scheduler.SchedulerGateway;
import com.example.jobtrigger.service.source.TriggerSourceStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Registers the triggers of a named job with the scheduler.
 * <p>
 * Flow, strictly sequential within a request:
 * 1. Fail if a trigger named after the job already exists in the job's group
 * 2. Ask each trigger source, in priority order, whether it knows the job; first match wins
 * 3. Register the one requested trigger, or every configured trigger the job is still missing
 * <p>
 * A job no source knows is a successful no-op. There is no locking between
 * requests: if two requests for the same job race past step 1, the
 * scheduler rejects the second registration with a duplicate trigger error.
 * Nothing registered earlier in a request is rolled back when a later
 * step fails or the request is cancelled.
 */
@Slf4j
@Service
public class JobSchedulingService {

    private final SchedulerGateway schedulerGateway;
    private final List<TriggerSourceStrategy> sources;
    private final DuplicateTriggerFilter duplicateTriggerFilter;
    private final JobsProperties jobsProperties;
    private final MetricsConfig metricsConfig;

    public JobSchedulingService(SchedulerGateway schedulerGateway, List<TriggerSourceStrategy> sources,
                                DuplicateTriggerFilter duplicateTriggerFilter, JobsProperties jobsProperties,
                                MetricsConfig metricsConfig) {
        this.schedulerGateway = schedulerGateway;
        this.sources = sources.stream()
                .sorted(Comparator.comparing(TriggerSourceStrategy::getSource))
                .toList();
        this.duplicateTriggerFilter = duplicateTriggerFilter;
        this.jobsProperties = jobsProperties;
        this.metricsConfig = metricsConfig;
    }

    // === Scheduling ===

    /**
     * Schedule a job's triggers.
     * <p>
     * Cancelling the returned future aborts the request at its next step.
     *
     * @param request Job name plus optional group, cron override and trigger name
     * @return Future of what was registered
     * @throws IllegalArgumentException if the job name is missing
     */
    public CompletableFuture<SchedulingResult> schedule(ScheduleJobRequest request) {
        if (request == null || !StringUtils.hasText(request.getJobName())) {
            throw new IllegalArgumentException("Job name is required");
        }

        var jobIdentity = JobIdentity.of(request.getJobName(), request.getJobGroup());
        var triggerName = request.getTriggerName();
        var cronOverride = request.getCronExpression();
        var outcome = new CompletableFuture<SchedulingResult>();
        var timer = metricsConfig.startSchedulingTimer();

        log.info("Scheduling job {} (trigger: {}, cron override: {})", jobIdentity,
                StringUtils.hasText(triggerName) ? triggerName : "all", StringUtils.hasText(cronOverride) ? cronOverride : "none");

        schedulerGateway.getTrigger(TriggerIdentity.of(jobIdentity.getName(), jobIdentity.getGroup()))
                .thenCompose(existing -> {
                    ensureNotCancelled(outcome, jobIdentity);
                    if (existing.isPresent()) {
                        throw new JobAlreadyScheduledException(jobIdentity.getName(), jobIdentity.getGroup());
                    }
                    return scheduleFromFirstMatchingSource(jobIdentity, triggerName, cronOverride, outcome);
                })
                .whenComplete((result, error) -> {
                    if (error == null) {
                        log.info("Scheduled job {}: source {}, {} trigger(s) registered", jobIdentity,
                                result.isSourceResolved() ? result.getSource().getCode() : "none", result.getRegisteredTriggers().size());
                        metricsConfig.recordSchedulingRequest(timer, result.isSourceResolved() ? "success" : "no_source");
                        outcome.complete(result);
                        return;
                    }

                    var cause = unwrap(error);
                    if (cause instanceof JobAlreadyScheduledException) {
                        log.warn("Scheduling of job {} rejected: {}", jobIdentity, cause.getMessage());
                    } else if (cause instanceof CancellationException) {
                        log.warn("Scheduling of job {} cancelled", jobIdentity);
                    } else {
                        log.error("Scheduling of job {} failed: {}", jobIdentity, cause.getMessage());
                    }
                    metricsConfig.recordSchedulingFailure(cause.getClass().getSimpleName());
                    metricsConfig.recordSchedulingRequest(timer, cause instanceof CancellationException ? "cancelled" : "failure");
                    outcome.completeExceptionally(cause);
                });

        return outcome;
    }

    /**
     * Schedule a job's triggers and wait for the outcome, cancelling the
     * request once the configured request timeout has elapsed.
     */
    public SchedulingResult scheduleAndAwait(ScheduleJobRequest request) {
        var future = schedule(request);
        return await(future, request.getJobName(), request.getJobGroup());
    }

    /**
     * Get the triggers the scheduler currently holds for a job
     */
    public List<RegisteredTrigger> getRegisteredTriggers(String jobName, String jobGroup) {
        if (!StringUtils.hasText(jobName)) {
            throw new IllegalArgumentException("Job name is required");
        }
        return await(schedulerGateway.getTriggersOfJob(JobIdentity.of(jobName, jobGroup)), jobName, jobGroup);
    }

    // === Source resolution ===

    private CompletableFuture<SchedulingResult> scheduleFromFirstMatchingSource(JobIdentity jobIdentity, String triggerName,
                                                                                String cronOverride,
                                                                                CompletableFuture<SchedulingResult> outcome) {
        var matching = sources.stream()
                .filter(source -> source.hasEntries(jobIdentity.getName()))
                .findFirst();

        if (matching.isEmpty()) {
            log.info("No trigger source configured for job {}, nothing to schedule", jobIdentity);
            return CompletableFuture.completedFuture(SchedulingResult.noMatchingSource(jobIdentity));
        }

        var source = matching.get();
        log.debug("Job {} resolved to source {}", jobIdentity, source.getSource().getCode());

        CompletableFuture<List<TriggerIdentity>> registered;
        if (!source.supportsMultipleTriggers()) {
            registered = scheduleTrigger(source, jobIdentity, jobIdentity.getName(), cronOverride, outcome).thenApply(identity -> List.of(identity));
        } else if (StringUtils.hasText(triggerName)) {
            registered = scheduleTrigger(source, jobIdentity, triggerName, cronOverride, outcome).thenApply(identity -> List.of(identity));
        } else {
            registered = scheduleMissingTriggers(source, jobIdentity, cronOverride, outcome);
        }

        return registered.thenApply(identities -> SchedulingResult.builder()
                .jobIdentity(jobIdentity)
                .source(source.getSource())
                .registeredTriggers(List.copyOf(identities))
                .build());
    }

    private CompletableFuture<List<TriggerIdentity>> scheduleMissingTriggers(TriggerSourceStrategy source, JobIdentity jobIdentity,
                                                                             String cronOverride,
                                                                             CompletableFuture<SchedulingResult> outcome) {
        var configuredNames = source.getTriggerNames(jobIdentity.getName());

        return schedulerGateway.getTriggersOfJob(jobIdentity)
                .thenCompose(registeredTriggers -> {
                    ensureNotCancelled(outcome, jobIdentity);

                    var registeredNames = registeredTriggers.stream()
                            .map(trigger -> trigger.getIdentity().getName())
                            .collect(Collectors.toSet());
                    var pending = duplicateTriggerFilter.pending(configuredNames, registeredNames);

                    log.info("Job {} has {} trigger(s) configured in {}, {} pending registration",
                            jobIdentity, configuredNames.size(), source.getSource().getCode(), pending.size());

                    CompletableFuture<List<TriggerIdentity>> chain = CompletableFuture.completedFuture(new ArrayList<>());
                    for (var pendingName : pending) {
                        chain = chain.thenCompose(done -> scheduleTrigger(source, jobIdentity, pendingName, cronOverride, outcome)
                                .thenApply(identity -> {
                                    done.add(identity);
                                    return done;
                                }));
                    }
                    return chain;
                });
    }

    private CompletableFuture<TriggerIdentity> scheduleTrigger(TriggerSourceStrategy source, JobIdentity jobIdentity,
                                                               String triggerName, String cronOverride,
                                                               CompletableFuture<SchedulingResult> outcome) {
        ensureNotCancelled(outcome, jobIdentity);

        return source.resolve(jobIdentity, triggerName, cronOverride)
                .thenCompose(spec -> {
                    ensureNotCancelled(outcome, jobIdentity);
                    return schedulerGateway.scheduleJob(spec).thenApply(ignored -> spec);
                })
                .thenApply(spec -> {
                    log.info("Registered trigger {} ({}) for job {} from {}",
                            spec.getIdentity(), spec.getCronExpression(), jobIdentity, source.getSource().getCode());
                    metricsConfig.recordTriggerRegistered(source.getSource());
                    return spec.getIdentity();
                });
    }

    // === Helpers ===

    private static void ensureNotCancelled(CompletableFuture<?> outcome, JobIdentity jobIdentity) {
        if (outcome.isCancelled()) {
            throw new CancellationException("Scheduling of job " + jobIdentity + " was cancelled");
        }
    }

    private <T> T await(CompletableFuture<T> future, String jobName, String jobGroup) {
        var timeoutSeconds = jobsProperties.getRequestTimeoutSeconds();
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SchedulingTimeoutException(jobName, JobGroups.orDefault(jobGroup), timeoutSeconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new IllegalStateException("Interrupted while scheduling job " + jobName, e);
        } catch (ExecutionException e) {
            var cause = unwrap(e.getCause());
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(cause.getMessage(), cause);
        }
    }

    private static Throwable unwrap(Throwable error) {
        var cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
