package com.dependency.flow.maestro.service.updater;

import com.dependency.flow.maestro.dto.UpdateAssetsRequest;
import com.dependency.flow.maestro.model.DependencyFlowEvent;
import com.dependency.flow.maestro.model.DependencyUpdateSummary;
import com.dependency.flow.maestro.model.PendingUpdate;
import com.dependency.flow.maestro.model.Reminder;
import com.dependency.flow.maestro.model.ReminderKind;
import com.dependency.flow.maestro.model.SubscriptionBuild;
import com.dependency.flow.maestro.model.UpdaterState;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One invocation against an updater state bundle. Changes made here are only visible to
 * others once {@link UpdaterStateStore} saves the bundle; applied builds and flow events are
 * flushed after that save.
 */
@Slf4j
@Getter
public class UpdaterContext {

    private final PullRequestUpdaterId id;
    private final UpdaterState state;
    private final Clock clock;

    private final List<SubscriptionBuild> appliedBuilds = new ArrayList<>();
    private final List<DependencyFlowEvent> events = new ArrayList<>();

    public UpdaterContext(PullRequestUpdaterId id, UpdaterState state, Clock clock) {
        this.id = id;
        this.state = state;
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    // ========================= REMINDERS =========================

    public void scheduleReminder(ReminderKind kind, Duration delay, String payload) {
        Instant now = now();
        state.putReminder(Reminder.builder()
                .kind(kind)
                .dueAt(now.plus(delay))
                .scheduledAt(now)
                .payload(payload)
                .build());
        log.debug("Scheduled {} reminder for {} in {}", kind, id, delay);
    }

    public void cancelReminder(ReminderKind kind) {
        if (state.removeReminder(kind)) {
            log.debug("Cancelled {} reminder for {}", kind, id);
        }
    }

    // ========================= PENDING UPDATES =========================

    /**
     * Queues the build for later. An already queued newer build of the same subscription is kept.
     */
    public void queuePendingUpdate(UpdateAssetsRequest request, boolean codeFlow) {
        Optional<PendingUpdate> existing = state.findPendingUpdate(request.getSubscriptionId());
        if (existing.isPresent() && existing.get().getBuildId() > request.getBuildId()) {
            log.debug("Keeping queued build {} of subscription {} over older build {}",
                    existing.get().getBuildId(), request.getSubscriptionId(), request.getBuildId());
            return;
        }
        state.putPendingUpdate(PendingUpdate.builder()
                .subscriptionId(request.getSubscriptionId())
                .buildId(request.getBuildId())
                .sourceRepository(request.getSourceRepository())
                .sourceSha(request.getSourceSha())
                .assets(new ArrayList<>(request.getAssets()))
                .codeFlow(codeFlow)
                .queuedAt(now())
                .build());
    }

    /**
     * Drops the subscription's queued build if it is not newer than {@code buildId}.
     */
    public void removePendingUpdate(String subscriptionId, long buildId) {
        state.findPendingUpdate(subscriptionId)
                .filter(pending -> pending.getBuildId() <= buildId)
                .ifPresent(pending -> state.removePendingUpdate(subscriptionId));
    }

    public void cancelUpdateReminderIfIdle() {
        if (state.getPendingUpdates().isEmpty()) {
            cancelReminder(ReminderKind.PULL_REQUEST_UPDATE);
        }
    }

    // ========================= BOOKKEEPING =========================

    public void markApplied(String subscriptionId, long buildId) {
        appliedBuilds.add(new SubscriptionBuild(subscriptionId, buildId));
    }

    public void emitFlowEvent(DependencyFlowEvent.EventType eventType,
                              DependencyFlowEvent.FlowType flowType,
                              long buildId,
                              String pullRequestUrl,
                              DependencyUpdateSummary update) {
        events.add(DependencyFlowEvent.builder()
                .sourceBuildId(buildId)
                .subscriptionId(update.getSubscriptionId())
                .updaterId(id.getKey())
                .eventType(eventType)
                .flowType(flowType)
                .pullRequestUrl(pullRequestUrl)
                .assetName(update.getDependencyName())
                .fromVersion(update.getFromVersion())
                .toVersion(update.getToVersion())
                .timestamp(now())
                .build());
    }
}
