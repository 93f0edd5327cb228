package com.dependency.flow.maestro.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable callback stored with the updater state it belongs to.
 * Fires no earlier than {@code dueAt}, possibly more than once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reminder {

    private ReminderKind kind;
    private Instant dueAt;
    private Instant scheduledAt;
    private String payload;
}
