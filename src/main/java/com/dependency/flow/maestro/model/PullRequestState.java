package com.dependency.flow.maestro.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The pull request tracked for an updater key. Created when the pull request is opened,
 * refreshed on every update pushed to it and removed once it is merged or closed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PullRequestState {

    private String url;
    private String headBranch;

    @Builder.Default
    private Status status = Status.IN_PROGRESS;

    private boolean codeFlow;

    @Builder.Default
    private boolean coherencySuccessful = true;

    @Builder.Default
    private List<CoherencyErrorDetails> coherencyErrors = new ArrayList<>();

    @Builder.Default
    private List<SubscriptionBuild> containedSubscriptions = new ArrayList<>();

    @Builder.Default
    private List<DependencyUpdateSummary> requiredUpdates = new ArrayList<>();

    private Instant createdAt;
    private Instant lastUpdatedAt;

    public void recordContribution(String subscriptionId, long buildId) {
        containedSubscriptions.removeIf(s -> s.getSubscriptionId().equals(subscriptionId));
        containedSubscriptions.add(new SubscriptionBuild(subscriptionId, buildId));
    }

    public enum Status {
        NONE,
        IN_PROGRESS,
        COMPLETED
    }
}
