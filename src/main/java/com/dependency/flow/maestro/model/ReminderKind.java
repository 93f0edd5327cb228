package com.dependency.flow.maestro.model;

public enum ReminderKind {
    CODE_FLOW,
    PULL_REQUEST_UPDATE,
    PULL_REQUEST_CHECK
}
