package com.dependency.flow.maestro.model;

/**
 * Phase of an updater key, derived from its state bundle.
 */
public enum UpdaterPhase {
    /** Nothing tracked and nothing queued. */
    IDLE,
    /** A build is queued behind a PULL_REQUEST_UPDATE reminder and no pull request is open. */
    PENDING_UPDATE,
    /** A code-flow build waits for its head branch behind a CODE_FLOW reminder. */
    AWAITING_BRANCH,
    /** A pull request is open and checked periodically. Deferred builds may be queued on top. */
    IN_PROGRESS
}
