package com.dependency.flow.maestro.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * What was last requested from the branch synchronization service for a code-flow subscription.
 * {@code lastSynchronizedBuildId} outlives the cycle that set it, so a late older build is never
 * synchronized after its pull request completed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodeFlowState {

    private String sourceCommit;
    private String headBranch;
    private long lastSynchronizedBuildId;
    private String requestId;
    private Instant requestedAt;

    @JsonIgnore
    public boolean isCycleActive() {
        return headBranch != null;
    }

    /**
     * Forgets the head branch and the outstanding request once the cycle's pull request is gone.
     */
    public void endCycle() {
        sourceCommit = null;
        headBranch = null;
        requestId = null;
        requestedAt = null;
    }
}
