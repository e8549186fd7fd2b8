package com.example.cronishe.service.alert;

import com.example.cronishe.config.SlackProperties;
import com.example.cronishe.domain.entity.Job;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Sends an on-call alert to Slack when a job has used up all of its retries.
 * <p>
 * Disabled unless a webhook URL is configured and alerting is enabled.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Value("${spring.application.name:cronishe}")
    private String applicationName;

    @Autowired
    public SlackAlertService(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackAlertService(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    /**
     * Send alert for a retry cascade that ended in failure.
     * Runs asynchronously to not block the job worker.
     *
     * @param job      the job that gave up
     * @param runId    the last failed run
     * @param attempts retry attempts made
     */
    @Async
    public void sendRetriesExhaustedAlert(Job job, Long runId, int attempts) {
        if (!slackProperties.isConfigured()) {
            log.debug("Slack alerting is disabled. Job {} exhausted its retries but no alert was sent.", job.getId());
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildRetriesExhaustedPayload(job, runId, attempts));

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for job {} retries exhausted", job.getId());
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for job {}: {}", job.getId(), e.getMessage(), e);
        }
    }

    Payload buildRetriesExhaustedPayload(Job job, Long runId, int attempts) {
        var jobId = String.valueOf(job.getId());

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Job Retries Exhausted - Manual Intervention Required*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(job.getName())
                                .titleLink(slackProperties.getDashboardBaseUrl() + "/runs/" + runId)
                                .fields(Arrays.asList(
                                        Field.builder()
                                                .title("Job ID")
                                                .value(jobId)
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Last Run")
                                                .value(String.valueOf(runId))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Retry Attempts")
                                                .value(String.valueOf(attempts))
                                                .valueShortEnough(true)
                                                .build(),
                                        Field.builder()
                                                .title("Command")
                                                .value("```" + truncate(job.getCommand(), 400) + "```")
                                                .valueShortEnough(false)
                                                .build()
                                ))
                                .footer(applicationName + " | Next attempt is the next scheduled run")
                                .ts(String.valueOf(Instant.now().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
