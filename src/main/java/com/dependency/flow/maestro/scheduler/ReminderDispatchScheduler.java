package com.dependency.flow.maestro.scheduler;

import com.dependency.flow.maestro.model.Reminder;
import com.dependency.flow.maestro.model.UpdaterState;
import com.dependency.flow.maestro.repository.UpdaterStateRepository;
import com.dependency.flow.maestro.service.updater.PullRequestUpdater;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Fires due reminders stored in updater state bundles.
 * A reminder whose handler fails stays due and is retried on the next run.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReminderDispatchScheduler {

    private final UpdaterStateRepository stateRepository;
    private final PullRequestUpdater pullRequestUpdater;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${maestro.reminders.dispatch-interval-ms:30000}")
    public void dispatchDueReminders() {
        Instant now = clock.instant();
        List<UpdaterState> states = stateRepository.findByRemindersDueAtLessThanEqual(now);
        if (states.isEmpty()) {
            log.debug("No reminders due");
            return;
        }

        int fired = 0;
        int failed = 0;
        for (UpdaterState state : states) {
            for (Reminder reminder : state.dueReminders(now)) {
                try {
                    pullRequestUpdater.processReminder(state.getId(), reminder.getKind());
                    fired++;
                } catch (Exception e) {
                    failed++;
                    log.error("{} reminder for {} failed, will retry: {}",
                            reminder.getKind(), state.getId(), e.getMessage(), e);
                }
            }
        }
        log.info("Reminder dispatch completed: {} fired, {} failed", fired, failed);
    }
}
