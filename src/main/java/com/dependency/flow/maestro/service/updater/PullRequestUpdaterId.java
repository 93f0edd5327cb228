package com.dependency.flow.maestro.service.updater;

import com.dependency.flow.maestro.model.Subscription;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Owner key of an updater state bundle.
 * Batchable classic subscriptions share {@code batch:<targetRepository>:<targetBranch>};
 * every other subscription owns {@code subscription:<id>}.
 */
@Getter
@EqualsAndHashCode(of = "key")
public final class PullRequestUpdaterId {

    private static final String BATCH_PREFIX = "batch:";
    private static final String SUBSCRIPTION_PREFIX = "subscription:";

    private final String key;
    private final boolean batched;

    private PullRequestUpdaterId(String key, boolean batched) {
        this.key = key;
        this.batched = batched;
    }

    public static PullRequestUpdaterId forSubscription(Subscription subscription, boolean codeFlow) {
        if (subscription.isBatchable() && !codeFlow) {
            return batch(subscription.getTargetRepository(), subscription.getTargetBranch());
        }
        return nonBatched(subscription.getId());
    }

    public static PullRequestUpdaterId batch(String targetRepository, String targetBranch) {
        return new PullRequestUpdaterId(BATCH_PREFIX + targetRepository + ":" + targetBranch, true);
    }

    public static PullRequestUpdaterId nonBatched(String subscriptionId) {
        return new PullRequestUpdaterId(SUBSCRIPTION_PREFIX + subscriptionId, false);
    }

    public static PullRequestUpdaterId parse(String key) {
        if (key.startsWith(BATCH_PREFIX)) {
            return new PullRequestUpdaterId(key, true);
        }
        if (key.startsWith(SUBSCRIPTION_PREFIX)) {
            return new PullRequestUpdaterId(key, false);
        }
        throw new IllegalArgumentException("Not an updater key: " + key);
    }

    @Override
    public String toString() {
        return key;
    }
}
