package com.example.jobtrigger.service.alert;

import com.example.jobtrigger.config.SlackProperties;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Sends Slack alerts for jobs that could not be scheduled on startup.
 * <p>
 * Alert delivery problems are logged and never affect scheduling.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Send alert for a configured job the startup bootstrap failed to schedule.
     * Runs asynchronously to not hold up the remaining jobs.
     */
    @Async
    public void sendSchedulingFailureAlert(String jobName, String jobGroup, String errorType, String errorMessage) {
        if (!slackProperties.isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Job {}.{} failed to schedule but no alert was sent.", jobGroup, jobName);
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildSchedulingFailurePayload(jobName, jobGroup, errorType, errorMessage));

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for job {}.{} scheduling failure", jobGroup, jobName);
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for job {}.{}: {}", jobGroup, jobName, e.getMessage(), e);
        }
    }

    Payload buildSchedulingFailurePayload(String jobName, String jobGroup, String errorType, String errorMessage) {
        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(slackProperties.getUsername())
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Job Could Not Be Scheduled On Startup*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(jobGroup + "." + jobName)
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Job")
                                                .value(jobName)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Group")
                                                .value(jobGroup)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Error Type")
                                                .value(errorType)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Error")
                                                .value(truncate(errorMessage, 500))
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(slackProperties.getUsername())
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) {
            return "Unknown error";
        }
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }
}
