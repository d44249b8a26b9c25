package com.example.jobtrigger;

import org.quartz.Job;
import org.quartz.JobBuilder;
import org.quartz.JobExecutionContext;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;

import java.util.Properties;
import java.util.UUID;

/**
 * In-memory Quartz scheduler for tests. The scheduler is never started,
 * so triggers are stored but never fire.
 */
public final class QuartzTestSupport {

    private QuartzTestSupport() {
    }

    public static Scheduler newInMemoryScheduler() throws SchedulerException {
        var properties = new Properties();
        properties.setProperty("org.quartz.scheduler.instanceName", "test-" + UUID.randomUUID());
        properties.setProperty("org.quartz.scheduler.skipUpdateCheck", "true");
        properties.setProperty("org.quartz.threadPool.threadCount", "1");
        properties.setProperty("org.quartz.jobStore.class", "org.quartz.simpl.RAMJobStore");
        return new StdSchedulerFactory(properties).getScheduler();
    }

    /**
     * Store a durable job so triggers can be attached to it
     */
    public static void addDurableJob(Scheduler scheduler, String jobName, String jobGroup) throws SchedulerException {
        scheduler.addJob(JobBuilder.newJob(NoOpJob.class)
                .withIdentity(jobName, jobGroup)
                .storeDurably()
                .build(), false);
    }

    public static class NoOpJob implements Job {
        @Override
        public void execute(JobExecutionContext context) {
            // never fires in tests
        }
    }
}
