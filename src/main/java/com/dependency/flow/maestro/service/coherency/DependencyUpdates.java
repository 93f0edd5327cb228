package com.dependency.flow.maestro.service.coherency;

import com.dependency.flow.maestro.model.DependencyUpdateSummary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Merging of update lists coming from several builds or subscriptions aimed at one pull request.
 * Entries are keyed by dependency name (case-insensitive); the later entry wins on the target
 * version while the earliest "from" version is kept.
 */
public final class DependencyUpdates {

    private DependencyUpdates() {
    }

    public static List<DependencyUpdate> merge(List<DependencyUpdate> first, List<DependencyUpdate> second) {
        Map<String, DependencyUpdate> merged = new LinkedHashMap<>();
        for (List<DependencyUpdate> list : List.of(first, second)) {
            for (DependencyUpdate update : list) {
                String key = key(update.getDependencyName());
                DependencyUpdate existing = merged.get(key);
                DependencyDetail from = existing != null ? existing.getFrom() : update.getFrom();
                merged.put(key, new DependencyUpdate(from, update.getTo()));
            }
        }
        return new ArrayList<>(merged.values());
    }

    public static List<DependencyUpdateSummary> mergeSummaries(List<DependencyUpdateSummary> existing,
                                                               List<DependencyUpdateSummary> incoming) {
        Map<String, DependencyUpdateSummary> merged = new LinkedHashMap<>();
        for (List<DependencyUpdateSummary> list : List.of(existing, incoming)) {
            for (DependencyUpdateSummary summary : list) {
                String key = key(summary.getDependencyName());
                DependencyUpdateSummary previous = merged.get(key);
                DependencyUpdateSummary next = summary.toBuilder().build();
                if (previous != null) {
                    next.setFromVersion(previous.getFromVersion());
                }
                merged.put(key, next);
            }
        }
        return new ArrayList<>(merged.values());
    }

    public static List<DependencyUpdateSummary> toSummaries(List<DependencyUpdate> updates, String subscriptionId) {
        List<DependencyUpdateSummary> summaries = new ArrayList<>();
        for (DependencyUpdate update : updates) {
            summaries.add(DependencyUpdateSummary.builder()
                    .dependencyName(update.getDependencyName())
                    .fromVersion(update.getFrom() != null ? update.getFrom().getVersion() : null)
                    .toVersion(update.getTo().getVersion())
                    .sourceRepository(update.getTo().getRepoUri())
                    .sourceCommit(update.getTo().getCommit())
                    .subscriptionId(subscriptionId)
                    .build());
        }
        return summaries;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
