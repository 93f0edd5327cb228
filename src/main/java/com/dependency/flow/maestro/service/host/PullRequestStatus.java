package com.dependency.flow.maestro.service.host;

/**
 * Live state of a pull request as reported by the repository host.
 */
public enum PullRequestStatus {
    NOT_FOUND,
    OPEN_CAN_UPDATE,
    /** Open, but carries commits not authored by the service account. */
    OPEN_CANNOT_UPDATE,
    MERGED,
    CLOSED
}
