package com.dependency.flow.maestro.service.updater;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Component
public class ReminderSettings {

    private final Duration pullRequestCheckInterval;
    private final Duration pullRequestUpdateRetry;
    private final Duration codeFlowPollInterval;

    public ReminderSettings(
            @Value("${maestro.reminders.pull-request-check-interval-ms:300000}") long pullRequestCheckIntervalMs,
            @Value("${maestro.reminders.pull-request-update-retry-ms:300000}") long pullRequestUpdateRetryMs,
            @Value("${maestro.reminders.code-flow-poll-interval-ms:180000}") long codeFlowPollIntervalMs) {
        this.pullRequestCheckInterval = Duration.ofMillis(pullRequestCheckIntervalMs);
        this.pullRequestUpdateRetry = Duration.ofMillis(pullRequestUpdateRetryMs);
        this.codeFlowPollInterval = Duration.ofMillis(codeFlowPollIntervalMs);
    }
}
