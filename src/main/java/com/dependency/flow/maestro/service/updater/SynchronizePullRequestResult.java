package com.dependency.flow.maestro.service.updater;

public enum SynchronizePullRequestResult {
    NOT_FOUND,
    IN_PROGRESS_CAN_UPDATE,
    IN_PROGRESS_CANNOT_UPDATE,
    COMPLETED
}
