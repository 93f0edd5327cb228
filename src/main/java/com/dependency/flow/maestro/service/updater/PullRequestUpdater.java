package com.dependency.flow.maestro.service.updater;

import com.dependency.flow.maestro.dto.UpdateAssetsRequest;
import com.dependency.flow.maestro.dto.UpdateAssetsResponse;
import com.dependency.flow.maestro.exception.SubscriptionNotFoundException;
import com.dependency.flow.maestro.model.CodeFlowState;
import com.dependency.flow.maestro.model.CoherencyErrorDetails;
import com.dependency.flow.maestro.model.DependencyFlowEvent;
import com.dependency.flow.maestro.model.DependencyUpdateSummary;
import com.dependency.flow.maestro.model.PendingUpdate;
import com.dependency.flow.maestro.model.PullRequestState;
import com.dependency.flow.maestro.model.Reminder;
import com.dependency.flow.maestro.model.ReminderKind;
import com.dependency.flow.maestro.model.Subscription;
import com.dependency.flow.maestro.model.UpdaterPhase;
import com.dependency.flow.maestro.model.UpdaterState;
import com.dependency.flow.maestro.repository.SubscriptionRepository;
import com.dependency.flow.maestro.service.codeflow.CodeFlowCoordinator;
import com.dependency.flow.maestro.service.coherency.CoherencyEngine;
import com.dependency.flow.maestro.service.coherency.CoherencyResult;
import com.dependency.flow.maestro.service.coherency.DependencyUpdate;
import com.dependency.flow.maestro.service.coherency.DependencyUpdates;
import com.dependency.flow.maestro.service.host.CreatedPullRequest;
import com.dependency.flow.maestro.service.host.RepositoryHost;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry points of the pull request updater state machine.
 *
 * A build either updates the tracked pull request, opens a new one, or is queued as a pending
 * update when the tracked pull request carries commits from someone else. Each entry point
 * works on the state bundle of one updater key through {@link UpdaterStateStore}; any failure
 * of the repository host or the code flow service leaves the stored bundle unchanged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PullRequestUpdater {

    private final SubscriptionRepository subscriptionRepository;
    private final UpdaterStateStore stateStore;
    private final PullRequestSynchronizer synchronizer;
    private final CoherencyEngine coherencyEngine;
    private final RepositoryHost repositoryHost;
    private final PullRequestDescriptionBuilder descriptionBuilder;
    private final CodeFlowCoordinator codeFlowCoordinator;
    private final ReminderSettings reminderSettings;

    // ========================= ENTRY POINTS =========================

    public UpdateAssetsResponse updateAssets(UpdateAssetsRequest request) {
        Subscription subscription = subscriptionRepository.findById(request.getSubscriptionId())
                .orElseThrow(() -> new SubscriptionNotFoundException(request.getSubscriptionId()));

        boolean codeFlow = subscription.isSourceEnabled() || request.isSourceEnabled();
        PullRequestUpdaterId id = PullRequestUpdaterId.forSubscription(subscription, codeFlow);

        if (!subscription.isEnabled()) {
            log.warn("Ignoring build {} for disabled subscription {}", request.getBuildId(), subscription.getId());
            UpdaterPhase phase = stateStore.find(id.getKey()).map(UpdaterState::phase).orElse(UpdaterPhase.IDLE);
            return UpdateAssetsResponse.builder()
                    .updaterId(id.getKey())
                    .buildId(request.getBuildId())
                    .phase(phase)
                    .build();
        }

        log.info("Processing build {} of {}@{} with {} assets for subscription {} ({})",
                request.getBuildId(), request.getSourceRepository(), request.getSourceSha(),
                request.getAssets().size(), subscription.getId(), id);

        return stateStore.withState(id, context -> {
            if (codeFlow) {
                codeFlowCoordinator.updateCodeFlow(context, subscription, request);
            } else {
                updateClassic(context, List.of(new SubscriptionUpdate(subscription, request)));
            }
            context.cancelUpdateReminderIfIdle();
            return toResponse(context, request.getBuildId());
        });
    }

    public void processReminder(String key, ReminderKind kind) {
        switch (kind) {
            case PULL_REQUEST_UPDATE -> processPendingUpdates(key);
            case PULL_REQUEST_CHECK -> processPullRequestCheck(key);
            case CODE_FLOW -> processCodeFlowReminder(key);
        }
    }

    /**
     * Replays queued builds. Classic builds are merged into a single commit.
     */
    public void processPendingUpdates(String key) {
        stateStore.withState(PullRequestUpdaterId.parse(key), context -> {
            if (!isDue(context, ReminderKind.PULL_REQUEST_UPDATE)) {
                return null;
            }
            context.cancelReminder(ReminderKind.PULL_REQUEST_UPDATE);
            if (context.getState().getPendingUpdates().isEmpty()) {
                log.debug("No pending updates left for {}", key);
                return null;
            }
            replayPendingUpdates(context);
            return null;
        });
    }

    public void processPullRequestCheck(String key) {
        stateStore.withState(PullRequestUpdaterId.parse(key), context -> {
            if (!isDue(context, ReminderKind.PULL_REQUEST_CHECK)) {
                return null;
            }
            context.cancelReminder(ReminderKind.PULL_REQUEST_CHECK);
            if (context.getState().getPullRequest() == null) {
                log.debug("No pull request tracked for {}", key);
                return null;
            }

            SynchronizePullRequestResult result = synchronizer.synchronize(context);
            if (result == SynchronizePullRequestResult.IN_PROGRESS_CAN_UPDATE
                    || result == SynchronizePullRequestResult.IN_PROGRESS_CANNOT_UPDATE) {
                context.scheduleReminder(ReminderKind.PULL_REQUEST_CHECK, reminderSettings.getPullRequestCheckInterval(), null);
                return null;
            }

            if (!context.getState().getPendingUpdates().isEmpty()) {
                log.info("Pull request of {} completed, replaying {} pending updates",
                        key, context.getState().getPendingUpdates().size());
                context.cancelReminder(ReminderKind.PULL_REQUEST_UPDATE);
                replayPendingUpdates(context);
            }
            return null;
        });
    }

    public void processCodeFlowReminder(String key) {
        stateStore.withState(PullRequestUpdaterId.parse(key), context -> {
            if (!isDue(context, ReminderKind.CODE_FLOW)) {
                return null;
            }
            context.cancelReminder(ReminderKind.CODE_FLOW);
            Optional<PendingUpdate> pending = context.getState().codeFlowPendingUpdate();
            if (pending.isEmpty()) {
                log.debug("No code flow awaiting a branch for {}", key);
                return null;
            }
            CodeFlowState codeFlow = context.getState().getCodeFlow();
            if (codeFlow == null || !codeFlow.isCycleActive()) {
                // cycle already ended; the queued build starts a new one on replay
                if (!context.getState().hasReminder(ReminderKind.PULL_REQUEST_UPDATE)) {
                    context.scheduleReminder(ReminderKind.PULL_REQUEST_UPDATE, reminderSettings.getPullRequestUpdateRetry(), null);
                }
                return null;
            }
            Optional<Subscription> subscription = loadSubscriptionOf(context, pending.get());
            if (subscription.isPresent()) {
                codeFlowCoordinator.processCodeFlowReminder(context, subscription.get());
            }
            context.cancelUpdateReminderIfIdle();
            return null;
        });
    }

    public Optional<UpdaterState> getState(String key) {
        return stateStore.find(key);
    }

    /**
     * The dispatcher works from a snapshot; a reminder cancelled or re-armed since then must not fire.
     */
    private boolean isDue(UpdaterContext context, ReminderKind kind) {
        Optional<Reminder> reminder = context.getState().findReminder(kind);
        if (reminder.isEmpty() || reminder.get().getDueAt().isAfter(context.now())) {
            log.debug("{} reminder for {} is no longer due, skipping", kind, context.getId());
            return false;
        }
        return true;
    }

    // ========================= CLASSIC FLOW =========================

    private void replayPendingUpdates(UpdaterContext context) {
        UpdaterState state = context.getState();

        Optional<PendingUpdate> codeFlowPending = state.codeFlowPendingUpdate();
        if (codeFlowPending.isPresent()) {
            Optional<Subscription> subscription = loadSubscriptionOf(context, codeFlowPending.get());
            if (subscription.isPresent()) {
                codeFlowCoordinator.updateCodeFlow(context, subscription.get(),
                        UpdateAssetsRequest.fromPendingUpdate(codeFlowPending.get()));
            }
        }

        List<SubscriptionUpdate> classic = new ArrayList<>();
        for (PendingUpdate pending : state.classicPendingUpdates()) {
            loadSubscriptionOf(context, pending).ifPresent(subscription ->
                    classic.add(new SubscriptionUpdate(subscription, UpdateAssetsRequest.fromPendingUpdate(pending))));
        }
        if (!classic.isEmpty()) {
            updateClassic(context, classic);
        }
        context.cancelUpdateReminderIfIdle();
    }

    /**
     * Decision tree for one or more builds targeting the same branch.
     */
    private void updateClassic(UpdaterContext context, List<SubscriptionUpdate> updates) {
        UpdaterState state = context.getState();

        if (state.getPullRequest() != null) {
            SynchronizePullRequestResult result = synchronizer.synchronize(context);
            if (result == SynchronizePullRequestResult.IN_PROGRESS_CANNOT_UPDATE) {
                for (SubscriptionUpdate update : updates) {
                    context.queuePendingUpdate(update.request, false);
                }
                context.scheduleReminder(ReminderKind.PULL_REQUEST_UPDATE, reminderSettings.getPullRequestUpdateRetry(), null);
                log.info("Pull request {} of {} cannot be updated, deferred {} builds",
                        state.getPullRequest().getUrl(), context.getId(), updates.size());
                return;
            }
        }

        List<AppliedUpdate> applied = new ArrayList<>();
        for (SubscriptionUpdate update : updates) {
            UpdateAssetsRequest request = update.request;
            if (request.getAssets().isEmpty()) {
                log.info("Build {} of subscription {} has no assets, nothing to merge",
                        request.getBuildId(), request.getSubscriptionId());
                markAppliedWithoutChanges(context, request);
                continue;
            }

            Subscription subscription = update.subscription;
            CoherencyResult result = coherencyEngine.getRequiredUpdates(
                    subscription.getTargetRepository(), subscription.getTargetBranch(),
                    request.getSourceRepository(), request.getSourceSha(),
                    request.getAssets(), subscription.getCoherencyMode());
            if (!result.hasUpdates()) {
                log.info("{}@{} is already up to date with build {}",
                        subscription.getTargetRepository(), subscription.getTargetBranch(), request.getBuildId());
                markAppliedWithoutChanges(context, request);
                continue;
            }
            applied.add(new AppliedUpdate(subscription, request, result));
        }

        if (applied.isEmpty()) {
            return;
        }
        if (state.getPullRequest() == null) {
            createPullRequest(context, applied);
        } else {
            updatePullRequest(context, applied);
        }
    }

    private void createPullRequest(UpdaterContext context, List<AppliedUpdate> applied) {
        Subscription target = applied.get(0).subscription;
        MergedUpdates merged = merge(applied);
        Instant now = context.now();

        String headBranch = "deps/" + target.getTargetBranch() + "-" + UUID.randomUUID();
        repositoryHost.createBranch(target.getTargetRepository(), target.getTargetBranch(), headBranch);
        String commit = repositoryHost.commitUpdates(target.getTargetRepository(), headBranch,
                merged.updates, descriptionBuilder.commitMessage(merged.summaries));

        PullRequestState pullRequest = PullRequestState.builder()
                .headBranch(headBranch)
                .coherencySuccessful(merged.coherencySuccessful)
                .coherencyErrors(merged.errors)
                .requiredUpdates(merged.summaries)
                .createdAt(now)
                .lastUpdatedAt(now)
                .build();
        for (AppliedUpdate update : applied) {
            pullRequest.recordContribution(update.request.getSubscriptionId(), update.request.getBuildId());
        }

        CreatedPullRequest created = repositoryHost.createPullRequest(target.getTargetRepository(),
                descriptionBuilder.build(pullRequest, target.getTargetBranch()));
        pullRequest.setUrl(created.getUrl());
        pullRequest.setHeadBranch(created.getHeadBranch());
        context.getState().setPullRequest(pullRequest);

        context.scheduleReminder(ReminderKind.PULL_REQUEST_CHECK, reminderSettings.getPullRequestCheckInterval(), null);
        for (AppliedUpdate update : applied) {
            context.removePendingUpdate(update.request.getSubscriptionId(), update.request.getBuildId());
        }
        emitEvents(context, DependencyFlowEvent.EventType.CREATED, created.getUrl(), applied, merged.summaries);

        log.info("Opened pull request {} for {} with {} updates (commit {}, coherency {})",
                created.getUrl(), context.getId(), merged.summaries.size(), commit,
                merged.coherencySuccessful ? "ok" : "failed");
    }

    private void updatePullRequest(UpdaterContext context, List<AppliedUpdate> applied) {
        Subscription target = applied.get(0).subscription;
        PullRequestState pullRequest = context.getState().getPullRequest();
        MergedUpdates merged = merge(applied);

        String commit = repositoryHost.commitUpdates(target.getTargetRepository(), pullRequest.getHeadBranch(),
                merged.updates, descriptionBuilder.commitMessage(merged.summaries));

        pullRequest.setRequiredUpdates(DependencyUpdates.mergeSummaries(pullRequest.getRequiredUpdates(), merged.summaries));
        pullRequest.setCoherencySuccessful(merged.coherencySuccessful);
        pullRequest.setCoherencyErrors(merged.errors);
        for (AppliedUpdate update : applied) {
            pullRequest.recordContribution(update.request.getSubscriptionId(), update.request.getBuildId());
        }
        pullRequest.setLastUpdatedAt(context.now());

        repositoryHost.updatePullRequest(pullRequest.getUrl(),
                descriptionBuilder.build(pullRequest, target.getTargetBranch()));

        for (AppliedUpdate update : applied) {
            context.removePendingUpdate(update.request.getSubscriptionId(), update.request.getBuildId());
        }
        emitEvents(context, DependencyFlowEvent.EventType.UPDATED, pullRequest.getUrl(), applied, merged.summaries);

        log.info("Updated pull request {} for {} with {} updates (commit {})",
                pullRequest.getUrl(), context.getId(), merged.summaries.size(), commit);
    }

    private void markAppliedWithoutChanges(UpdaterContext context, UpdateAssetsRequest request) {
        context.markApplied(request.getSubscriptionId(), request.getBuildId());
        context.removePendingUpdate(request.getSubscriptionId(), request.getBuildId());
    }

    // ========================= HELPERS =========================

    private MergedUpdates merge(List<AppliedUpdate> applied) {
        MergedUpdates merged = new MergedUpdates();
        for (AppliedUpdate update : applied) {
            List<DependencyUpdate> required = update.result.getRequiredUpdates();
            merged.updates = DependencyUpdates.merge(merged.updates, required);
            merged.summaries = DependencyUpdates.mergeSummaries(merged.summaries,
                    DependencyUpdates.toSummaries(required, update.request.getSubscriptionId()));
            merged.coherencySuccessful &= update.result.isCoherencySuccessful();
            merged.errors.addAll(update.result.getErrors());
        }
        return merged;
    }

    private void emitEvents(UpdaterContext context,
                            DependencyFlowEvent.EventType eventType,
                            String pullRequestUrl,
                            List<AppliedUpdate> applied,
                            List<DependencyUpdateSummary> summaries) {
        Map<String, Long> buildBySubscription = new HashMap<>();
        for (AppliedUpdate update : applied) {
            buildBySubscription.put(update.request.getSubscriptionId(), update.request.getBuildId());
        }
        for (DependencyUpdateSummary summary : summaries) {
            Long buildId = buildBySubscription.get(summary.getSubscriptionId());
            context.emitFlowEvent(eventType, DependencyFlowEvent.FlowType.CLASSIC,
                    buildId == null ? 0L : buildId, pullRequestUrl, summary);
        }
    }

    private Optional<Subscription> loadSubscriptionOf(UpdaterContext context, PendingUpdate pending) {
        Optional<Subscription> subscription = subscriptionRepository.findById(pending.getSubscriptionId());
        if (subscription.isEmpty()) {
            log.warn("Dropping pending build {} of deleted subscription {} from {}",
                    pending.getBuildId(), pending.getSubscriptionId(), context.getId());
            context.getState().removePendingUpdate(pending.getSubscriptionId());
        }
        return subscription;
    }

    private UpdateAssetsResponse toResponse(UpdaterContext context, long buildId) {
        UpdaterState state = context.getState();
        return UpdateAssetsResponse.builder()
                .updaterId(context.getId().getKey())
                .buildId(buildId)
                .phase(state.phase())
                .pullRequestUrl(state.getPullRequest() != null ? state.getPullRequest().getUrl() : null)
                .build();
    }

    private static final class SubscriptionUpdate {
        private final Subscription subscription;
        private final UpdateAssetsRequest request;

        private SubscriptionUpdate(Subscription subscription, UpdateAssetsRequest request) {
            this.subscription = subscription;
            this.request = request;
        }
    }

    private static final class AppliedUpdate {
        private final Subscription subscription;
        private final UpdateAssetsRequest request;
        private final CoherencyResult result;

        private AppliedUpdate(Subscription subscription, UpdateAssetsRequest request, CoherencyResult result) {
            this.subscription = subscription;
            this.request = request;
            this.result = result;
        }
    }

    private static final class MergedUpdates {
        private List<DependencyUpdate> updates = new ArrayList<>();
        private List<DependencyUpdateSummary> summaries = new ArrayList<>();
        private boolean coherencySuccessful = true;
        private final List<CoherencyErrorDetails> errors = new ArrayList<>();
    }
}
