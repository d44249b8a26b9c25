package com.example.jobtrigger.scheduler;

import com.example.jobtrigger.domain.JobIdentity;
import com.example.jobtrigger.domain.RegisteredTrigger;
import com.example.jobtrigger.domain.TriggerIdentity;
import com.example.jobtrigger.domain.TriggerSpec;
import com.example.jobtrigger.exception.DuplicateTriggerKeyException;
import com.example.jobtrigger.exception.TriggerRegistrationException;
import lombok.extern.slf4j.Slf4j;
import org.quartz.CronExpression;
import org.quartz.CronScheduleBuilder;
import org.quartz.CronTrigger;
import org.quartz.JobDataMap;
import org.quartz.JobKey;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.text.ParseException;
import java.time.Instant;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link SchedulerGateway} backed by a Quartz {@link Scheduler}.
 * <p>
 * Quartz calls block (the JDBC job store hits the database), so every
 * call is dispatched to the scheduling executor.
 */
@Slf4j
@Component
public class QuartzSchedulerGateway implements SchedulerGateway {

    private final Scheduler scheduler;
    private final Executor executor;

    public QuartzSchedulerGateway(Scheduler scheduler, @Qualifier("schedulingExecutor") Executor executor) {
        this.scheduler = scheduler;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Optional<RegisteredTrigger>> getTrigger(TriggerIdentity identity) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                var trigger = scheduler.getTrigger(TriggerKey.triggerKey(identity.getName(), identity.getGroup()));
                return Optional.ofNullable(trigger).map(this::toRegisteredTrigger);
            } catch (SchedulerException e) {
                throw new TriggerRegistrationException("getTrigger", identity.toString(), e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<List<RegisteredTrigger>> getTriggersOfJob(JobIdentity jobIdentity) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return scheduler.getTriggersOfJob(JobKey.jobKey(jobIdentity.getName(), jobIdentity.getGroup()))
                        .stream()
                        .map(this::toRegisteredTrigger)
                        .toList();
            } catch (SchedulerException e) {
                throw new TriggerRegistrationException("getTriggersOfJob", jobIdentity.toString(), e);
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> scheduleJob(TriggerSpec spec) {
        return CompletableFuture.runAsync(() -> {
            var identity = spec.getIdentity();
            try {
                var nextFireTime = scheduler.scheduleJob(toCronTrigger(spec));
                log.debug("Quartz accepted trigger {} for job {}, next fire at {}", identity, spec.getJobIdentity(), nextFireTime);
            } catch (ObjectAlreadyExistsException e) {
                throw new DuplicateTriggerKeyException(identity.getName(), identity.getGroup(), e);
            } catch (SchedulerException | ParseException e) {
                throw new TriggerRegistrationException("scheduleJob", identity.toString(), e);
            }
        }, executor);
    }

    private Trigger toCronTrigger(TriggerSpec spec) throws ParseException {
        var builder = TriggerBuilder.newTrigger()
                .withIdentity(spec.getIdentity().getName(), spec.getIdentity().getGroup())
                .forJob(spec.getJobIdentity().getName(), spec.getJobIdentity().getGroup())
                .withSchedule(CronScheduleBuilder.cronSchedule(new CronExpression(spec.getCronExpression())));

        spec.getPayloadIfPresent().ifPresent(payload -> builder.usingJobData(new JobDataMap(payload)));

        return builder.build();
    }

    private RegisteredTrigger toRegisteredTrigger(Trigger trigger) {
        return RegisteredTrigger.builder()
                .identity(TriggerIdentity.of(trigger.getKey().getName(), trigger.getKey().getGroup()))
                .jobIdentity(JobIdentity.of(trigger.getJobKey().getName(), trigger.getJobKey().getGroup()))
                .cronExpression(trigger instanceof CronTrigger cronTrigger ? cronTrigger.getCronExpression() : null)
                .previousFireTime(toInstant(trigger.getPreviousFireTime()))
                .nextFireTime(toInstant(trigger.getNextFireTime()))
                .data(Collections.unmodifiableMap(new HashMap<>(trigger.getJobDataMap())))
                .build();
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }
}
