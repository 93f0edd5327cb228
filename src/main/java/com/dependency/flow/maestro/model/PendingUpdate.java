package com.dependency.flow.maestro.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A build that could not be applied yet. Replayed when its reminder fires.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingUpdate {

    private String subscriptionId;
    private long buildId;
    private String sourceRepository;
    private String sourceSha;

    @Builder.Default
    private List<Asset> assets = new ArrayList<>();

    private boolean codeFlow;
    private Instant queuedAt;
}
