package com.dependency.flow.maestro.service.updater;

import com.dependency.flow.maestro.model.CodeFlowState;
import com.dependency.flow.maestro.model.PullRequestState;
import com.dependency.flow.maestro.model.Reminder;
import com.dependency.flow.maestro.model.ReminderKind;
import com.dependency.flow.maestro.model.SubscriptionBuild;
import com.dependency.flow.maestro.model.UpdaterState;
import com.dependency.flow.maestro.service.host.PullRequestStatus;
import com.dependency.flow.maestro.service.host.RepositoryHost;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PullRequestSynchronizerTest {

    private static final String PR_URL = "https://github.com/dotnet/runtime/pull/7";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private RepositoryHost repositoryHost;

    @InjectMocks
    private PullRequestSynchronizer synchronizer;

    @Test
    void noTrackedPullRequest_isNotFoundWithoutCallingHost() {
        UpdaterContext context = context(UpdaterState.empty("subscription:sub-1"));

        assertThat(synchronizer.synchronize(context)).isEqualTo(SynchronizePullRequestResult.NOT_FOUND);
        verifyNoInteractions(repositoryHost);
    }

    @Test
    void openPullRequest_isKept() {
        UpdaterContext context = context(stateWithPullRequest(false));
        when(repositoryHost.getPullRequestStatus(PR_URL)).thenReturn(PullRequestStatus.OPEN_CANNOT_UPDATE);

        assertThat(synchronizer.synchronize(context)).isEqualTo(SynchronizePullRequestResult.IN_PROGRESS_CANNOT_UPDATE);
        assertThat(context.getState().getPullRequest()).isNotNull();
        assertThat(context.getState().hasReminder(ReminderKind.PULL_REQUEST_CHECK)).isTrue();
    }

    @Test
    void mergedPullRequest_marksContainedBuildsApplied() {
        UpdaterContext context = context(stateWithPullRequest(false));
        when(repositoryHost.getPullRequestStatus(PR_URL)).thenReturn(PullRequestStatus.MERGED);

        assertThat(synchronizer.synchronize(context)).isEqualTo(SynchronizePullRequestResult.COMPLETED);
        assertThat(context.getState().getPullRequest()).isNull();
        assertThat(context.getState().hasReminder(ReminderKind.PULL_REQUEST_CHECK)).isFalse();
        assertThat(context.getAppliedBuilds()).containsExactly(
                new SubscriptionBuild("sub-1", 10), new SubscriptionBuild("sub-2", 20));
    }

    @Test
    void closedPullRequest_doesNotMarkBuildsApplied() {
        UpdaterContext context = context(stateWithPullRequest(false));
        when(repositoryHost.getPullRequestStatus(PR_URL)).thenReturn(PullRequestStatus.CLOSED);

        assertThat(synchronizer.synchronize(context)).isEqualTo(SynchronizePullRequestResult.COMPLETED);
        assertThat(context.getState().getPullRequest()).isNull();
        assertThat(context.getAppliedBuilds()).isEmpty();
    }

    @Test
    void deletedCodeFlowPullRequest_endsCycle() {
        UpdaterContext context = context(stateWithPullRequest(true));
        when(repositoryHost.getPullRequestStatus(PR_URL)).thenReturn(PullRequestStatus.NOT_FOUND);

        assertThat(synchronizer.synchronize(context)).isEqualTo(SynchronizePullRequestResult.NOT_FOUND);
        assertThat(context.getState().getPullRequest()).isNull();
        CodeFlowState codeFlow = context.getState().getCodeFlow();
        assertThat(codeFlow.isCycleActive()).isFalse();
        assertThat(codeFlow.getSourceCommit()).isNull();
        assertThat(codeFlow.getRequestId()).isNull();
        assertThat(codeFlow.getLastSynchronizedBuildId()).isEqualTo(20);
    }

    private static UpdaterContext context(UpdaterState state) {
        return new UpdaterContext(PullRequestUpdaterId.parse(state.getId()), state, CLOCK);
    }

    private static UpdaterState stateWithPullRequest(boolean codeFlow) {
        PullRequestState pullRequest = PullRequestState.builder()
                .url(PR_URL)
                .headBranch("deps/main-1")
                .codeFlow(codeFlow)
                .build();
        pullRequest.recordContribution("sub-1", 10);
        pullRequest.recordContribution("sub-2", 20);

        UpdaterState state = UpdaterState.empty("batch:https://github.com/dotnet/runtime:main");
        state.setPullRequest(pullRequest);
        if (codeFlow) {
            state.setCodeFlow(CodeFlowState.builder()
                    .sourceCommit("abc")
                    .headBranch("deps/main-1")
                    .lastSynchronizedBuildId(20)
                    .requestId("req-1")
                    .build());
        }
        state.putReminder(Reminder.builder()
                .kind(ReminderKind.PULL_REQUEST_CHECK)
                .dueAt(CLOCK.instant())
                .scheduledAt(CLOCK.instant())
                .build());
        return state;
    }
}
