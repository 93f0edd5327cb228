package com.dependency.flow.maestro.service.codeflow;

import com.dependency.flow.maestro.dto.UpdateAssetsRequest;
import com.dependency.flow.maestro.model.Asset;
import com.dependency.flow.maestro.model.CodeFlowState;
import com.dependency.flow.maestro.model.DependencyFlowEvent;
import com.dependency.flow.maestro.model.DependencyUpdateSummary;
import com.dependency.flow.maestro.model.PendingUpdate;
import com.dependency.flow.maestro.model.PullRequestState;
import com.dependency.flow.maestro.model.ReminderKind;
import com.dependency.flow.maestro.model.Subscription;
import com.dependency.flow.maestro.model.UpdaterState;
import com.dependency.flow.maestro.service.coherency.DependencyUpdates;
import com.dependency.flow.maestro.service.host.CreatedPullRequest;
import com.dependency.flow.maestro.service.host.RepositoryHost;
import com.dependency.flow.maestro.service.updater.PullRequestDescriptionBuilder;
import com.dependency.flow.maestro.service.updater.PullRequestSynchronizer;
import com.dependency.flow.maestro.service.updater.ReminderSettings;
import com.dependency.flow.maestro.service.updater.SynchronizePullRequestResult;
import com.dependency.flow.maestro.service.updater.UpdaterContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives code-flow subscriptions. Source changes are never committed by this service; the
 * branch synchronization service prepares the head branch and a pull request is opened once
 * that branch is ready.
 *
 * Within one cycle (from the first request until the pull request completes) the same head
 * branch is reused and the last requested commit is remembered, so a repeated build of that
 * commit does not trigger another synchronization.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CodeFlowCoordinator {

    private final PcsClient pcsClient;
    private final RepositoryHost repositoryHost;
    private final PullRequestSynchronizer synchronizer;
    private final PullRequestDescriptionBuilder descriptionBuilder;
    private final ReminderSettings reminderSettings;

    public void updateCodeFlow(UpdaterContext context, Subscription subscription, UpdateAssetsRequest request) {
        UpdaterState state = context.getState();
        CodeFlowState codeFlow = state.getCodeFlow();

        if (codeFlow != null && request.getBuildId() < codeFlow.getLastSynchronizedBuildId()) {
            log.info("Ignoring build {} for {}: build {} was already synchronized",
                    request.getBuildId(), context.getId(), codeFlow.getLastSynchronizedBuildId());
            context.removePendingUpdate(request.getSubscriptionId(), request.getBuildId());
            return;
        }

        SynchronizePullRequestResult result = state.getPullRequest() != null
                ? synchronizer.synchronize(context)
                : SynchronizePullRequestResult.NOT_FOUND;
        if (result == SynchronizePullRequestResult.IN_PROGRESS_CANNOT_UPDATE) {
            deferUpdate(context, request);
            return;
        }

        if (request.getAssets().isEmpty()) {
            skipEmptyBuild(context, request);
            return;
        }

        if (result == SynchronizePullRequestResult.IN_PROGRESS_CAN_UPDATE) {
            updateExistingPullRequest(context, subscription, request);
            return;
        }
        // no pull request, or the synchronizer ended the cycle: start over
        startOrContinueCycle(context, subscription, request);
    }

    /**
     * Handles a fired CODE_FLOW reminder: asks whether the requested head branch is ready.
     */
    public void processCodeFlowReminder(UpdaterContext context, Subscription subscription) {
        UpdaterState state = context.getState();
        CodeFlowState codeFlow = state.getCodeFlow();
        Optional<PendingUpdate> pending = state.codeFlowPendingUpdate();

        if (codeFlow == null || !codeFlow.isCycleActive() || pending.isEmpty()) {
            log.debug("Nothing awaits a code flow branch for {}", context.getId());
            context.cancelReminder(ReminderKind.CODE_FLOW);
            return;
        }
        if (state.getPullRequest() != null) {
            // deferred behind a pull request that cannot be updated; the update reminder replays it
            context.cancelReminder(ReminderKind.CODE_FLOW);
            if (!state.hasReminder(ReminderKind.PULL_REQUEST_UPDATE)) {
                context.scheduleReminder(ReminderKind.PULL_REQUEST_UPDATE, reminderSettings.getPullRequestUpdateRetry(), null);
            }
            return;
        }

        CodeFlowResponse response = pcsClient.pollSync(codeFlow.getRequestId());
        if (response.isReady()) {
            if (response.getHeadBranch() != null) {
                codeFlow.setHeadBranch(response.getHeadBranch());
            }
            createPullRequest(context, subscription, UpdateAssetsRequest.fromPendingUpdate(pending.get()));
        } else {
            log.info("Code flow branch {} for {} is not ready yet", codeFlow.getHeadBranch(), context.getId());
            context.scheduleReminder(ReminderKind.CODE_FLOW, reminderSettings.getCodeFlowPollInterval(), codeFlow.getRequestId());
        }
    }

    // ========================= CYCLE =========================

    private void startOrContinueCycle(UpdaterContext context, Subscription subscription, UpdateAssetsRequest request) {
        UpdaterState state = context.getState();
        CodeFlowState codeFlow = state.getCodeFlow();

        if (isSynchronizedCommit(codeFlow, request) && state.codeFlowPendingUpdate().isPresent()) {
            context.queuePendingUpdate(request, true);
            if (repositoryHost.branchExists(subscription.getTargetRepository(), codeFlow.getHeadBranch())) {
                log.info("Code flow branch {} for {} already exists, opening pull request",
                        codeFlow.getHeadBranch(), context.getId());
                createPullRequest(context, subscription, request);
            } else if (!state.hasReminder(ReminderKind.CODE_FLOW)) {
                context.scheduleReminder(ReminderKind.CODE_FLOW, reminderSettings.getCodeFlowPollInterval(), codeFlow.getRequestId());
            } else {
                log.debug("Commit {} for {} is still being synchronized", request.getSourceSha(), context.getId());
            }
            return;
        }

        String headBranch = codeFlow != null && codeFlow.isCycleActive()
                ? codeFlow.getHeadBranch()
                : newHeadBranch(subscription);

        CodeFlowResponse response = pcsClient.requestSync(toCodeFlowRequest(subscription, request, headBranch));
        advance(context, request, response, headBranch);

        if (response.isReady()) {
            createPullRequest(context, subscription, request);
        } else {
            log.info("Waiting for code flow branch {} for {} (request {})",
                    state.getCodeFlow().getHeadBranch(), context.getId(), response.getRequestId());
            context.queuePendingUpdate(request, true);
            context.scheduleReminder(ReminderKind.CODE_FLOW, reminderSettings.getCodeFlowPollInterval(), response.getRequestId());
        }
    }

    private void createPullRequest(UpdaterContext context, Subscription subscription, UpdateAssetsRequest request) {
        UpdaterState state = context.getState();
        CodeFlowState codeFlow = state.getCodeFlow();
        Instant now = context.now();

        PullRequestState pullRequest = PullRequestState.builder()
                .headBranch(codeFlow.getHeadBranch())
                .codeFlow(true)
                .requiredUpdates(assetSummaries(request))
                .createdAt(now)
                .lastUpdatedAt(now)
                .build();
        pullRequest.recordContribution(request.getSubscriptionId(), request.getBuildId());

        CreatedPullRequest created = repositoryHost.createPullRequest(subscription.getTargetRepository(),
                descriptionBuilder.build(pullRequest, subscription.getTargetBranch()));
        pullRequest.setUrl(created.getUrl());
        pullRequest.setHeadBranch(created.getHeadBranch());
        state.setPullRequest(pullRequest);

        context.scheduleReminder(ReminderKind.PULL_REQUEST_CHECK, reminderSettings.getPullRequestCheckInterval(), null);
        context.cancelReminder(ReminderKind.CODE_FLOW);
        context.removePendingUpdate(request.getSubscriptionId(), request.getBuildId());

        for (DependencyUpdateSummary update : pullRequest.getRequiredUpdates()) {
            context.emitFlowEvent(DependencyFlowEvent.EventType.CREATED, DependencyFlowEvent.FlowType.CODE_FLOW,
                    request.getBuildId(), created.getUrl(), update);
        }
        log.info("Opened code flow pull request {} for {} at {}", created.getUrl(), context.getId(), request.getSourceSha());
    }

    private void updateExistingPullRequest(UpdaterContext context, Subscription subscription, UpdateAssetsRequest request) {
        UpdaterState state = context.getState();
        PullRequestState pullRequest = state.getPullRequest();

        if (isSynchronizedCommit(state.getCodeFlow(), request)) {
            log.debug("Pull request {} already contains {}", pullRequest.getUrl(), request.getSourceSha());
            context.removePendingUpdate(request.getSubscriptionId(), request.getBuildId());
            return;
        }

        CodeFlowResponse response = pcsClient.requestSync(
                toCodeFlowRequest(subscription, request, pullRequest.getHeadBranch()));
        advance(context, request, response, pullRequest.getHeadBranch());

        List<DependencyUpdateSummary> incoming = assetSummaries(request);
        for (DependencyUpdateSummary update : incoming) {
            DependencyUpdateSummary event = update.toBuilder()
                    .fromVersion(previousVersion(pullRequest, update.getDependencyName()))
                    .build();
            context.emitFlowEvent(DependencyFlowEvent.EventType.UPDATED, DependencyFlowEvent.FlowType.CODE_FLOW,
                    request.getBuildId(), pullRequest.getUrl(), event);
        }

        pullRequest.setRequiredUpdates(DependencyUpdates.mergeSummaries(pullRequest.getRequiredUpdates(), incoming));
        pullRequest.recordContribution(request.getSubscriptionId(), request.getBuildId());
        pullRequest.setLastUpdatedAt(context.now());
        repositoryHost.updatePullRequest(pullRequest.getUrl(),
                descriptionBuilder.build(pullRequest, subscription.getTargetBranch()));

        context.removePendingUpdate(request.getSubscriptionId(), request.getBuildId());
        log.info("Flowed {} into pull request {} for {}", request.getSourceSha(), pullRequest.getUrl(), context.getId());
    }

    private void deferUpdate(UpdaterContext context, UpdateAssetsRequest request) {
        if (isSynchronizedCommit(context.getState().getCodeFlow(), request)) {
            log.debug("Pull request for {} already contains {}", context.getId(), request.getSourceSha());
            context.removePendingUpdate(request.getSubscriptionId(), request.getBuildId());
            return;
        }
        log.info("Pull request for {} cannot be updated, deferring build {}", context.getId(), request.getBuildId());
        context.queuePendingUpdate(request, true);
        context.scheduleReminder(ReminderKind.PULL_REQUEST_UPDATE, reminderSettings.getPullRequestUpdateRetry(), null);
    }

    /**
     * A build without assets has nothing to flow. It supersedes any queued build of the subscription.
     */
    private void skipEmptyBuild(UpdaterContext context, UpdateAssetsRequest request) {
        log.info("Build {} of subscription {} has no assets, nothing to flow",
                request.getBuildId(), request.getSubscriptionId());
        context.markApplied(request.getSubscriptionId(), request.getBuildId());
        context.removePendingUpdate(request.getSubscriptionId(), request.getBuildId());
        if (context.getState().codeFlowPendingUpdate().isEmpty()) {
            context.cancelReminder(ReminderKind.CODE_FLOW);
        }
    }

    // ========================= HELPERS =========================

    private void advance(UpdaterContext context, UpdateAssetsRequest request, CodeFlowResponse response, String headBranch) {
        CodeFlowState previous = context.getState().getCodeFlow();
        long lastBuild = previous == null
                ? request.getBuildId()
                : Math.max(previous.getLastSynchronizedBuildId(), request.getBuildId());
        context.getState().setCodeFlow(CodeFlowState.builder()
                .sourceCommit(request.getSourceSha())
                .headBranch(response.getHeadBranch() != null ? response.getHeadBranch() : headBranch)
                .lastSynchronizedBuildId(lastBuild)
                .requestId(response.getRequestId())
                .requestedAt(context.now())
                .build());
    }

    private boolean isSynchronizedCommit(CodeFlowState codeFlow, UpdateAssetsRequest request) {
        return codeFlow != null && request.getSourceSha().equals(codeFlow.getSourceCommit());
    }

    private CodeFlowRequest toCodeFlowRequest(Subscription subscription, UpdateAssetsRequest request, String headBranch) {
        return CodeFlowRequest.builder()
                .subscriptionId(subscription.getId())
                .buildId(request.getBuildId())
                .sourceRepository(request.getSourceRepository())
                .sourceSha(request.getSourceSha())
                .assets(new ArrayList<>(request.getAssets()))
                .targetRepository(subscription.getTargetRepository())
                .targetBranch(subscription.getTargetBranch())
                .headBranch(headBranch)
                .build();
    }

    private String newHeadBranch(Subscription subscription) {
        return "src/" + subscription.getTargetBranch() + "-" + UUID.randomUUID();
    }

    private List<DependencyUpdateSummary> assetSummaries(UpdateAssetsRequest request) {
        List<DependencyUpdateSummary> summaries = new ArrayList<>();
        for (Asset asset : request.getAssets()) {
            summaries.add(DependencyUpdateSummary.builder()
                    .dependencyName(asset.getName())
                    .toVersion(asset.getVersion())
                    .sourceRepository(request.getSourceRepository())
                    .sourceCommit(request.getSourceSha())
                    .subscriptionId(request.getSubscriptionId())
                    .build());
        }
        return summaries;
    }

    private String previousVersion(PullRequestState pullRequest, String dependencyName) {
        for (DependencyUpdateSummary existing : pullRequest.getRequiredUpdates()) {
            if (existing.getDependencyName().equalsIgnoreCase(dependencyName)) {
                return existing.getToVersion();
            }
        }
        return null;
    }
}
