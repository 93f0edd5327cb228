package com.dependency.flow.maestro.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * MongoDB document holding everything persisted for one updater key: the tracked pull request,
 * the code-flow bookkeeping, queued updates and active reminders.
 * The whole bundle is written in a single save, so one invocation either commits all of its
 * changes or none of them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "updater_states")
@CompoundIndex(name = "reminder_due_idx", def = "{'reminders.dueAt': 1}")
public class UpdaterState {

    @Id
    private String id;              // updater key, see PullRequestUpdaterId

    @Version
    private Long version;

    private PullRequestState pullRequest;
    private CodeFlowState codeFlow;

    @Builder.Default
    private List<PendingUpdate> pendingUpdates = new ArrayList<>();

    @Builder.Default
    private List<Reminder> reminders = new ArrayList<>();

    private Instant lastUpdatedAt;

    public static UpdaterState empty(String id) {
        return UpdaterState.builder().id(id).build();
    }

    // ========================= REMINDERS =========================

    public Optional<Reminder> findReminder(ReminderKind kind) {
        return reminders.stream().filter(r -> r.getKind() == kind).findFirst();
    }

    public boolean hasReminder(ReminderKind kind) {
        return findReminder(kind).isPresent();
    }

    /**
     * Stores the reminder, replacing any reminder of the same kind.
     */
    public void putReminder(Reminder reminder) {
        removeReminder(reminder.getKind());
        reminders.add(reminder);
    }

    public boolean removeReminder(ReminderKind kind) {
        return reminders.removeIf(r -> r.getKind() == kind);
    }

    public List<Reminder> dueReminders(Instant now) {
        return reminders.stream()
                .filter(r -> !r.getDueAt().isAfter(now))
                .collect(Collectors.toList());
    }

    // ========================= PENDING UPDATES =========================

    public Optional<PendingUpdate> findPendingUpdate(String subscriptionId) {
        return pendingUpdates.stream()
                .filter(p -> p.getSubscriptionId().equals(subscriptionId))
                .findFirst();
    }

    /**
     * Queues the update; a newer build for the same subscription supersedes the queued one.
     */
    public void putPendingUpdate(PendingUpdate update) {
        removePendingUpdate(update.getSubscriptionId());
        pendingUpdates.add(update);
    }

    public boolean removePendingUpdate(String subscriptionId) {
        return pendingUpdates.removeIf(p -> p.getSubscriptionId().equals(subscriptionId));
    }

    public Optional<PendingUpdate> codeFlowPendingUpdate() {
        return pendingUpdates.stream().filter(PendingUpdate::isCodeFlow).findFirst();
    }

    public List<PendingUpdate> classicPendingUpdates() {
        return pendingUpdates.stream().filter(p -> !p.isCodeFlow()).collect(Collectors.toList());
    }

    // ========================= PHASE & INVARIANTS =========================

    public UpdaterPhase phase() {
        if (pullRequest != null) {
            return UpdaterPhase.IN_PROGRESS;
        }
        if (codeFlowPendingUpdate().isPresent() && hasReminder(ReminderKind.CODE_FLOW)) {
            return UpdaterPhase.AWAITING_BRANCH;
        }
        if (!pendingUpdates.isEmpty()) {
            return UpdaterPhase.PENDING_UPDATE;
        }
        return UpdaterPhase.IDLE;
    }

    /**
     * Checks the bundle invariants. Called before every save.
     *
     * @throws IllegalStateException if the bundle is in a state no transition may produce
     */
    public void validate() {
        if (pullRequest != null) {
            if (pullRequest.getUrl() == null || pullRequest.getHeadBranch() == null) {
                throw new IllegalStateException("Tracked pull request without url or head branch for " + id);
            }
            if (pullRequest.getStatus() != PullRequestState.Status.IN_PROGRESS) {
                throw new IllegalStateException("Tracked pull request for " + id + " is " + pullRequest.getStatus());
            }
        }
        if (!pendingUpdates.isEmpty()
                && !hasReminder(ReminderKind.PULL_REQUEST_UPDATE)
                && !hasReminder(ReminderKind.CODE_FLOW)) {
            throw new IllegalStateException("Pending update without an active reminder for " + id);
        }
        long distinct = pendingUpdates.stream().map(PendingUpdate::getSubscriptionId).distinct().count();
        if (distinct != pendingUpdates.size()) {
            throw new IllegalStateException("More than one pending update per subscription for " + id);
        }
    }

    public boolean isEmpty() {
        return pullRequest == null && codeFlow == null && pendingUpdates.isEmpty() && reminders.isEmpty();
    }
}
