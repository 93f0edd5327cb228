package com.dependency.flow.maestro.service.codeflow;

import com.dependency.flow.maestro.dto.UpdateAssetsRequest;
import com.dependency.flow.maestro.dto.UpdateAssetsResponse;
import com.dependency.flow.maestro.exception.CodeFlowServiceException;
import com.dependency.flow.maestro.model.Asset;
import com.dependency.flow.maestro.model.CodeFlowState;
import com.dependency.flow.maestro.model.DependencyFlowEvent;
import com.dependency.flow.maestro.model.DependencyUpdateSummary;
import com.dependency.flow.maestro.model.PendingUpdate;
import com.dependency.flow.maestro.model.PullRequestState;
import com.dependency.flow.maestro.model.Reminder;
import com.dependency.flow.maestro.model.ReminderKind;
import com.dependency.flow.maestro.model.Subscription;
import com.dependency.flow.maestro.model.SubscriptionBuild;
import com.dependency.flow.maestro.model.SubscriptionPolicy;
import com.dependency.flow.maestro.model.UpdaterPhase;
import com.dependency.flow.maestro.model.UpdaterState;
import com.dependency.flow.maestro.service.host.PullRequestStatus;
import com.dependency.flow.maestro.service.updater.UpdaterTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.dependency.flow.maestro.service.updater.UpdaterTestFixture.NOW;
import static com.dependency.flow.maestro.service.updater.UpdaterTestFixture.PR_URL;
import static com.dependency.flow.maestro.service.updater.UpdaterTestFixture.TARGET_BRANCH;
import static com.dependency.flow.maestro.service.updater.UpdaterTestFixture.TARGET_REPO;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CodeFlowCoordinatorTest {

    private static final String SOURCE_REPO = "https://github.com/dotnet/aspnetcore";
    private static final String KEY = "subscription:sub-cf";
    private static final String HEAD_BRANCH = "src/main-cycle";

    private UpdaterTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new UpdaterTestFixture();
        fixture.addSubscription(Subscription.builder()
                .id("sub-cf")
                .channelName(".NET 9")
                .sourceRepository(SOURCE_REPO)
                .targetRepository(TARGET_REPO)
                .targetBranch(TARGET_BRANCH)
                .sourceEnabled(true)
                .build());
    }

    @Test
    void noExistingState_requestsSyncAndWaitsForBranch() {
        when(fixture.pcsClient.requestSync(any())).thenReturn(pending("req-1"));

        UpdateAssetsResponse response = fixture.updater.updateAssets(build(100, "sha123"));

        ArgumentCaptor<CodeFlowRequest> request = ArgumentCaptor.forClass(CodeFlowRequest.class);
        verify(fixture.pcsClient).requestSync(request.capture());
        assertThat(request.getValue().getSourceSha()).isEqualTo("sha123");
        assertThat(request.getValue().getTargetRepository()).isEqualTo(TARGET_REPO);
        assertThat(request.getValue().getHeadBranch()).startsWith("src/main-");
        verify(fixture.host, never()).createPullRequest(anyString(), any());
        verify(fixture.host, never()).commitUpdates(anyString(), anyString(), any(), anyString());

        assertThat(response.getPhase()).isEqualTo(UpdaterPhase.AWAITING_BRANCH);
        UpdaterState state = fixture.stored(KEY);
        assertThat(state.getCodeFlow().getSourceCommit()).isEqualTo("sha123");
        assertThat(state.getCodeFlow().getHeadBranch()).isEqualTo(request.getValue().getHeadBranch());
        assertThat(state.getCodeFlow().getLastSynchronizedBuildId()).isEqualTo(100);
        assertThat(state.getCodeFlow().getRequestId()).isEqualTo("req-1");
        assertThat(state.codeFlowPendingUpdate()).get().extracting(PendingUpdate::getBuildId).isEqualTo(100L);
        assertThat(state.findReminder(ReminderKind.CODE_FLOW)).get()
                .extracting(Reminder::getDueAt)
                .isEqualTo(NOW.plus(Duration.ofMinutes(3)));
    }

    @Test
    void prBranchReady_opensPullRequestWithoutCommitting() {
        when(fixture.pcsClient.requestSync(any())).thenReturn(ready("req-1", null));

        UpdateAssetsResponse response = fixture.updater.updateAssets(build(100, "sha123"));

        verify(fixture.host).createPullRequest(eq(TARGET_REPO), any());
        verify(fixture.host, never()).createBranch(anyString(), anyString(), anyString());
        verify(fixture.host, never()).commitUpdates(anyString(), anyString(), any(), anyString());

        assertThat(response.getPhase()).isEqualTo(UpdaterPhase.IN_PROGRESS);
        UpdaterState state = fixture.stored(KEY);
        PullRequestState pullRequest = state.getPullRequest();
        assertThat(pullRequest.isCodeFlow()).isTrue();
        assertThat(pullRequest.getHeadBranch()).isEqualTo(state.getCodeFlow().getHeadBranch());
        assertThat(pullRequest.getContainedSubscriptions()).containsExactly(new SubscriptionBuild("sub-cf", 100));
        assertThat(state.hasReminder(ReminderKind.PULL_REQUEST_CHECK)).isTrue();
        assertThat(state.hasReminder(ReminderKind.CODE_FLOW)).isFalse();
        assertThat(state.getPendingUpdates()).isEmpty();

        assertThat(fixture.events).hasSize(2).allSatisfy(event -> {
            assertThat(event.getEventType()).isEqualTo(DependencyFlowEvent.EventType.CREATED);
            assertThat(event.getFlowType()).isEqualTo(DependencyFlowEvent.FlowType.CODE_FLOW);
        });
    }

    @Test
    void sameCommitWhileWaiting_doesNotCallCodeFlowServiceAgain() {
        fixture.store(awaitingBranch());
        when(fixture.host.branchExists(TARGET_REPO, HEAD_BRANCH)).thenReturn(false);

        UpdateAssetsResponse response = fixture.updater.updateAssets(build(100, "sha123"));

        verifyNoInteractions(fixture.pcsClient);
        verify(fixture.host, never()).createPullRequest(anyString(), any());
        assertThat(response.getPhase()).isEqualTo(UpdaterPhase.AWAITING_BRANCH);
        assertThat(fixture.stored(KEY).findReminder(ReminderKind.CODE_FLOW)).get()
                .extracting(Reminder::getDueAt)
                .isEqualTo(NOW.plus(Duration.ofMinutes(1)));
    }

    @Test
    void sameCommitWhileWaiting_branchAlreadyPushed_opensPullRequest() {
        fixture.store(awaitingBranch());
        when(fixture.host.branchExists(TARGET_REPO, HEAD_BRANCH)).thenReturn(true);

        fixture.updater.updateAssets(build(100, "sha123"));

        verifyNoInteractions(fixture.pcsClient);
        UpdaterState state = fixture.stored(KEY);
        assertThat(state.getPullRequest().getHeadBranch()).isEqualTo(HEAD_BRANCH);
        assertThat(state.getReminders()).extracting(Reminder::getKind)
                .containsExactly(ReminderKind.PULL_REQUEST_CHECK);
        assertThat(state.getPendingUpdates()).isEmpty();
    }

    @Test
    void codeFlowReminder_branchReady_opensPullRequest() {
        fixture.store(awaitingBranch());
        when(fixture.pcsClient.pollSync("req-1")).thenReturn(ready("req-1", HEAD_BRANCH));
        fixture.clock.advance(Duration.ofMinutes(1));

        fixture.updater.processCodeFlowReminder(KEY);

        verify(fixture.host).createPullRequest(eq(TARGET_REPO), any());
        UpdaterState state = fixture.stored(KEY);
        assertThat(state.phase()).isEqualTo(UpdaterPhase.IN_PROGRESS);
        assertThat(state.hasReminder(ReminderKind.CODE_FLOW)).isFalse();
        assertThat(state.getPendingUpdates()).isEmpty();
    }

    @Test
    void codeFlowReminder_branchPending_rearmsReminder() {
        fixture.store(awaitingBranch());
        when(fixture.pcsClient.pollSync("req-1")).thenReturn(pending("req-1"));
        fixture.clock.advance(Duration.ofMinutes(2));

        fixture.updater.processCodeFlowReminder(KEY);

        UpdaterState state = fixture.stored(KEY);
        assertThat(state.phase()).isEqualTo(UpdaterPhase.AWAITING_BRANCH);
        assertThat(state.findReminder(ReminderKind.CODE_FLOW)).get()
                .extracting(Reminder::getDueAt)
                .isEqualTo(NOW.plus(Duration.ofMinutes(5)));
    }

    @Test
    void codeFlowReminder_nothingAwaited_cancelsReminder() {
        UpdaterState state = UpdaterState.empty(KEY);
        state.putReminder(Reminder.builder().kind(ReminderKind.CODE_FLOW).dueAt(NOW).scheduledAt(NOW).build());
        fixture.store(state);

        fixture.updater.processCodeFlowReminder(KEY);

        assertThat(fixture.stored(KEY).getReminders()).isEmpty();
        verifyNoInteractions(fixture.pcsClient);
    }

    @Test
    void codeFlowReminder_serviceFailure_keepsStateForRetry() {
        fixture.store(awaitingBranch());
        when(fixture.pcsClient.pollSync("req-1")).thenThrow(new CodeFlowServiceException("unavailable"));
        fixture.clock.advance(Duration.ofMinutes(1));

        assertThatThrownBy(() -> fixture.updater.processCodeFlowReminder(KEY))
                .isInstanceOf(CodeFlowServiceException.class);

        UpdaterState state = fixture.stored(KEY);
        assertThat(state.hasReminder(ReminderKind.CODE_FLOW)).isTrue();
        assertThat(state.codeFlowPendingUpdate()).isPresent();
    }

    @Test
    void codeFlowReminderRearmedByNewerBuild_doesNotPollEarly() {
        // polled as due at 10:00, then a build for sha456 re-armed CODE_FLOW before the handler ran
        UpdaterState state = awaitingBranch();
        state.getCodeFlow().setSourceCommit("sha456");
        state.getCodeFlow().setRequestId("req-2");
        state.putReminder(Reminder.builder()
                .kind(ReminderKind.CODE_FLOW)
                .dueAt(NOW.plus(Duration.ofMinutes(3)))
                .scheduledAt(NOW)
                .payload("req-2")
                .build());
        fixture.store(state);

        fixture.updater.processReminder(KEY, ReminderKind.CODE_FLOW);

        verifyNoInteractions(fixture.pcsClient);
        UpdaterState stored = fixture.stored(KEY);
        assertThat(stored.phase()).isEqualTo(UpdaterPhase.AWAITING_BRANCH);
        assertThat(stored.findReminder(ReminderKind.CODE_FLOW)).get()
                .extracting(Reminder::getDueAt)
                .isEqualTo(NOW.plus(Duration.ofMinutes(3)));
    }

    @Test
    void emptyBuild_noExistingState_neverCallsCodeFlowService() {
        UpdateAssetsResponse response = fixture.updater.updateAssets(emptyBuild(100, "sha123"));

        verifyNoInteractions(fixture.pcsClient);
        verify(fixture.host, never()).createPullRequest(anyString(), any());
        assertThat(response.getPhase()).isEqualTo(UpdaterPhase.IDLE);
        UpdaterState state = fixture.stored(KEY);
        assertThat(state == null || state.getPullRequest() == null).isTrue();
        assertThat(fixture.subscription("sub-cf").getLastAppliedBuildId()).isEqualTo(100L);
    }

    @Test
    void emptyBuild_whileAwaitingBranch_dropsQueuedBuildAndReminder() {
        fixture.store(awaitingBranch());

        fixture.updater.updateAssets(emptyBuild(101, "sha456"));

        verifyNoInteractions(fixture.pcsClient);
        verify(fixture.host, never()).createPullRequest(anyString(), any());
        UpdaterState state = fixture.stored(KEY);
        assertThat(state.getPendingUpdates()).isEmpty();
        assertThat(state.getReminders()).isEmpty();
        assertThat(state.phase()).isEqualTo(UpdaterPhase.IDLE);
    }

    @Test
    void emptyBuild_prNotUpdatable_isStillDeferred() {
        fixture.store(withPullRequest());
        when(fixture.host.getPullRequestStatus(PR_URL)).thenReturn(PullRequestStatus.OPEN_CANNOT_UPDATE);

        fixture.updater.updateAssets(emptyBuild(101, "sha456"));

        verifyNoInteractions(fixture.pcsClient);
        UpdaterState state = fixture.stored(KEY);
        assertThat(state.codeFlowPendingUpdate()).get()
                .satisfies(pending -> assertThat(pending.getAssets()).isEmpty());
        assertThat(state.hasReminder(ReminderKind.PULL_REQUEST_UPDATE)).isTrue();
    }

    @Test
    void deferredBuild_isReplayedWhenPullRequestBecomesUpdatable() {
        fixture.store(withPullRequest());
        when(fixture.host.getPullRequestStatus(PR_URL))
                .thenReturn(PullRequestStatus.OPEN_CANNOT_UPDATE, PullRequestStatus.OPEN_CAN_UPDATE);
        fixture.updater.updateAssets(build(101, "sha456"));
        verifyNoInteractions(fixture.pcsClient);

        when(fixture.pcsClient.requestSync(any())).thenReturn(ready("req-2", HEAD_BRANCH));
        fixture.clock.advance(Duration.ofMinutes(5));
        fixture.updater.processReminder(KEY, ReminderKind.PULL_REQUEST_UPDATE);

        ArgumentCaptor<CodeFlowRequest> request = ArgumentCaptor.forClass(CodeFlowRequest.class);
        verify(fixture.pcsClient).requestSync(request.capture());
        assertThat(request.getValue().getSourceSha()).isEqualTo("sha456");
        assertThat(request.getValue().getBuildId()).isEqualTo(101);
        assertThat(request.getValue().getHeadBranch()).isEqualTo(HEAD_BRANCH);
        verify(fixture.host).updatePullRequest(eq(PR_URL), any());

        UpdaterState state = fixture.stored(KEY);
        assertThat(state.getPendingUpdates()).isEmpty();
        assertThat(state.hasReminder(ReminderKind.PULL_REQUEST_UPDATE)).isFalse();
        assertThat(state.getCodeFlow().getSourceCommit()).isEqualTo("sha456");
        assertThat(state.getCodeFlow().getLastSynchronizedBuildId()).isEqualTo(101);
    }

    @Test
    void lateOlderBuildAfterMergedPullRequest_isIgnored() {
        fixture.store(withPullRequest());
        when(fixture.host.getPullRequestStatus(PR_URL)).thenReturn(PullRequestStatus.MERGED);
        fixture.clock.advance(Duration.ofMinutes(2));
        fixture.updater.processReminder(KEY, ReminderKind.PULL_REQUEST_CHECK);

        fixture.updater.updateAssets(build(90, "sha-old"));

        verifyNoInteractions(fixture.pcsClient);
        UpdaterState state = fixture.stored(KEY);
        assertThat(state.getPullRequest()).isNull();
        assertThat(state.getCodeFlow().getLastSynchronizedBuildId()).isEqualTo(100);
        assertThat(state.getCodeFlow().isCycleActive()).isFalse();
        assertThat(state.getPendingUpdates()).isEmpty();
    }

    @Test
    void prNotUpdatable_newCommit_defersWithoutCallingCodeFlowService() {
        fixture.store(withPullRequest());
        when(fixture.host.getPullRequestStatus(PR_URL)).thenReturn(PullRequestStatus.OPEN_CANNOT_UPDATE);

        fixture.updater.updateAssets(build(101, "sha456"));

        verifyNoInteractions(fixture.pcsClient);
        UpdaterState state = fixture.stored(KEY);
        assertThat(state.getCodeFlow().getSourceCommit()).isEqualTo("sha123");
        assertThat(state.codeFlowPendingUpdate()).get().satisfies(pending -> {
            assertThat(pending.getBuildId()).isEqualTo(101);
            assertThat(pending.isCodeFlow()).isTrue();
        });
        assertThat(state.hasReminder(ReminderKind.PULL_REQUEST_UPDATE)).isTrue();
    }

    @Test
    void prUpdatableButNoUpdates_sameCommit_isNoOp() {
        fixture.store(withPullRequest());
        when(fixture.host.getPullRequestStatus(PR_URL)).thenReturn(PullRequestStatus.OPEN_CAN_UPDATE);

        fixture.updater.updateAssets(build(100, "sha123"));

        verifyNoInteractions(fixture.pcsClient);
        verify(fixture.host, never()).updatePullRequest(anyString(), any());
        assertThat(fixture.events).isEmpty();
    }

    @Test
    void updateCodeFlowPrWithNewBuild_flowsIntoExistingBranch() {
        fixture.store(withPullRequest());
        when(fixture.host.getPullRequestStatus(PR_URL)).thenReturn(PullRequestStatus.OPEN_CAN_UPDATE);
        when(fixture.pcsClient.requestSync(any())).thenReturn(ready("req-2", HEAD_BRANCH));

        fixture.updater.updateAssets(build(101, "sha456"));

        ArgumentCaptor<CodeFlowRequest> request = ArgumentCaptor.forClass(CodeFlowRequest.class);
        verify(fixture.pcsClient).requestSync(request.capture());
        assertThat(request.getValue().getHeadBranch()).isEqualTo(HEAD_BRANCH);
        assertThat(request.getValue().getSourceSha()).isEqualTo("sha456");
        verify(fixture.host).updatePullRequest(eq(PR_URL), any());
        verify(fixture.host, never()).createPullRequest(anyString(), any());

        UpdaterState state = fixture.stored(KEY);
        CodeFlowState codeFlow = state.getCodeFlow();
        assertThat(codeFlow.getSourceCommit()).isEqualTo("sha456");
        assertThat(codeFlow.getLastSynchronizedBuildId()).isEqualTo(101);
        assertThat(state.getPullRequest().getContainedSubscriptions())
                .containsExactly(new SubscriptionBuild("sub-cf", 101));
        assertThat(fixture.events).extracting(DependencyFlowEvent::getEventType)
                .containsOnly(DependencyFlowEvent.EventType.UPDATED);
        assertThat(fixture.events).filteredOn(e -> e.getAssetName().equals("Microsoft.AspNetCore.App.Ref"))
                .singleElement()
                .satisfies(event -> assertThat(event.getFromVersion()).isEqualTo("9.0.0-preview.1"));
    }

    @Test
    void olderBuild_isIgnored() {
        UpdaterState state = withPullRequest();
        state.getCodeFlow().setLastSynchronizedBuildId(105);
        fixture.store(state);

        fixture.updater.updateAssets(build(101, "sha456"));

        verifyNoInteractions(fixture.pcsClient);
        verify(fixture.host, never()).getPullRequestStatus(anyString());
        assertThat(fixture.stored(KEY).getCodeFlow().getLastSynchronizedBuildId()).isEqualTo(105);
    }

    @Test
    void completedPullRequest_startsNewCycle() {
        fixture.store(withPullRequest());
        when(fixture.host.getPullRequestStatus(PR_URL)).thenReturn(PullRequestStatus.MERGED);
        when(fixture.pcsClient.requestSync(any())).thenReturn(pending("req-2"));

        fixture.updater.updateAssets(build(101, "sha456"));

        ArgumentCaptor<CodeFlowRequest> request = ArgumentCaptor.forClass(CodeFlowRequest.class);
        verify(fixture.pcsClient).requestSync(request.capture());
        assertThat(request.getValue().getHeadBranch()).startsWith("src/main-").isNotEqualTo(HEAD_BRANCH);

        UpdaterState state = fixture.stored(KEY);
        assertThat(state.getPullRequest()).isNull();
        assertThat(state.phase()).isEqualTo(UpdaterPhase.AWAITING_BRANCH);
        assertThat(state.getCodeFlow().getRequestId()).isEqualTo("req-2");
        assertThat(fixture.subscription("sub-cf").getLastAppliedBuildId()).isEqualTo(100L);
    }

    @Test
    void codeFlowSubscriptions_areNeverBatched() {
        fixture.subscription("sub-cf").setPolicy(SubscriptionPolicy.builder().batchable(true).build());
        when(fixture.pcsClient.requestSync(any())).thenReturn(pending("req-1"));

        UpdateAssetsResponse response = fixture.updater.updateAssets(build(100, "sha123"));

        assertThat(response.getUpdaterId()).isEqualTo(KEY);
    }

    // ========================= HELPERS =========================

    private static UpdateAssetsRequest build(long buildId, String sha) {
        return UpdateAssetsRequest.builder()
                .subscriptionId("sub-cf")
                .buildId(buildId)
                .sourceRepository(SOURCE_REPO)
                .sourceSha(sha)
                .assets(new ArrayList<>(List.of(
                        Asset.builder().name("Microsoft.AspNetCore.App.Ref").version("9.0.0-" + sha).build(),
                        Asset.builder().name("Microsoft.AspNetCore.App.Runtime").version("9.0.0-" + sha).build())))
                .sourceEnabled(true)
                .build();
    }

    private static UpdateAssetsRequest emptyBuild(long buildId, String sha) {
        return build(buildId, sha).toBuilder().assets(new ArrayList<>()).build();
    }

    private static CodeFlowResponse pending(String requestId) {
        return CodeFlowResponse.builder().requestId(requestId).status(CodeFlowResponse.Status.PENDING).build();
    }

    private static CodeFlowResponse ready(String requestId, String headBranch) {
        return CodeFlowResponse.builder()
                .requestId(requestId)
                .status(CodeFlowResponse.Status.READY)
                .headBranch(headBranch)
                .build();
    }

    private static UpdaterState awaitingBranch() {
        UpdaterState state = UpdaterState.empty(KEY);
        state.setVersion(1L);
        state.setCodeFlow(CodeFlowState.builder()
                .sourceCommit("sha123")
                .headBranch(HEAD_BRANCH)
                .lastSynchronizedBuildId(100)
                .requestId("req-1")
                .requestedAt(NOW.minus(Duration.ofMinutes(2)))
                .build());
        state.putPendingUpdate(PendingUpdate.builder()
                .subscriptionId("sub-cf")
                .buildId(100)
                .sourceRepository(SOURCE_REPO)
                .sourceSha("sha123")
                .assets(new ArrayList<>(build(100, "sha123").getAssets()))
                .codeFlow(true)
                .queuedAt(NOW.minus(Duration.ofMinutes(2)))
                .build());
        state.putReminder(Reminder.builder()
                .kind(ReminderKind.CODE_FLOW)
                .dueAt(NOW.plus(Duration.ofMinutes(1)))
                .scheduledAt(NOW.minus(Duration.ofMinutes(2)))
                .payload("req-1")
                .build());
        return state;
    }

    private static UpdaterState withPullRequest() {
        UpdaterState state = UpdaterState.empty(KEY);
        state.setVersion(4L);
        state.setCodeFlow(CodeFlowState.builder()
                .sourceCommit("sha123")
                .headBranch(HEAD_BRANCH)
                .lastSynchronizedBuildId(100)
                .requestId("req-1")
                .requestedAt(NOW.minus(Duration.ofHours(1)))
                .build());
        PullRequestState pullRequest = PullRequestState.builder()
                .url(PR_URL)
                .headBranch(HEAD_BRANCH)
                .codeFlow(true)
                .requiredUpdates(new ArrayList<>(List.of(
                        DependencyUpdateSummary.builder()
                                .dependencyName("Microsoft.AspNetCore.App.Ref")
                                .toVersion("9.0.0-preview.1")
                                .sourceRepository(SOURCE_REPO)
                                .sourceCommit("sha123")
                                .subscriptionId("sub-cf")
                                .build())))
                .createdAt(NOW.minus(Duration.ofHours(1)))
                .build();
        pullRequest.recordContribution("sub-cf", 100);
        state.setPullRequest(pullRequest);
        state.putReminder(Reminder.builder()
                .kind(ReminderKind.PULL_REQUEST_CHECK)
                .dueAt(NOW.plus(Duration.ofMinutes(2)))
                .scheduledAt(NOW.minus(Duration.ofMinutes(3)))
                .build());
        return state;
    }
}
