package com.dependency.flow.maestro.service.updater;

import com.dependency.flow.maestro.model.PullRequestState;
import com.dependency.flow.maestro.model.ReminderKind;
import com.dependency.flow.maestro.model.SubscriptionBuild;
import com.dependency.flow.maestro.model.UpdaterState;
import com.dependency.flow.maestro.service.host.PullRequestStatus;
import com.dependency.flow.maestro.service.host.RepositoryHost;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reconciles the tracked pull request with what the repository host reports.
 * A merged, closed or vanished pull request is dropped from the bundle together with its
 * check reminder; for a merged one every contained build is marked applied.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PullRequestSynchronizer {

    private final RepositoryHost repositoryHost;

    public SynchronizePullRequestResult synchronize(UpdaterContext context) {
        PullRequestState pullRequest = context.getState().getPullRequest();
        if (pullRequest == null) {
            return SynchronizePullRequestResult.NOT_FOUND;
        }

        PullRequestStatus status = repositoryHost.getPullRequestStatus(pullRequest.getUrl());
        log.debug("Pull request {} of {} is {}", pullRequest.getUrl(), context.getId(), status);

        return switch (status) {
            case OPEN_CAN_UPDATE -> SynchronizePullRequestResult.IN_PROGRESS_CAN_UPDATE;
            case OPEN_CANNOT_UPDATE -> SynchronizePullRequestResult.IN_PROGRESS_CANNOT_UPDATE;
            case MERGED -> complete(context, pullRequest, true);
            case CLOSED -> complete(context, pullRequest, false);
            case NOT_FOUND -> forget(context, pullRequest);
        };
    }

    private SynchronizePullRequestResult complete(UpdaterContext context, PullRequestState pullRequest, boolean merged) {
        if (merged) {
            for (SubscriptionBuild contained : pullRequest.getContainedSubscriptions()) {
                context.markApplied(contained.getSubscriptionId(), contained.getBuildId());
            }
        }
        log.info("Pull request {} of {} was {}", pullRequest.getUrl(), context.getId(), merged ? "merged" : "closed");
        clear(context, pullRequest);
        return SynchronizePullRequestResult.COMPLETED;
    }

    private SynchronizePullRequestResult forget(UpdaterContext context, PullRequestState pullRequest) {
        log.info("Pull request {} of {} no longer exists", pullRequest.getUrl(), context.getId());
        clear(context, pullRequest);
        return SynchronizePullRequestResult.NOT_FOUND;
    }

    private void clear(UpdaterContext context, PullRequestState pullRequest) {
        UpdaterState state = context.getState();
        state.setPullRequest(null);
        context.cancelReminder(ReminderKind.PULL_REQUEST_CHECK);
        if (pullRequest.isCodeFlow() && state.getCodeFlow() != null) {
            // next build starts a fresh cycle with a new head branch
            state.getCodeFlow().endCycle();
        }
    }
}
