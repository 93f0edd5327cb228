package com.dependency.flow.maestro.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Standing rule that a target repository branch receives dependency updates
 * from the builds of a source channel. Owned by the subscription management API;
 * this service only reads it and advances {@code lastAppliedBuildId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "subscriptions")
@CompoundIndex(name = "target_idx", def = "{'targetRepository': 1, 'targetBranch': 1}")
public class Subscription {

    @Id
    private String id;

    private String channelName;
    private String sourceRepository;
    private String targetRepository;
    private String targetBranch;

    private SubscriptionPolicy policy;

    private boolean sourceEnabled;   // code flow instead of manifest commits

    @Builder.Default
    private boolean enabled = true;

    private Long lastAppliedBuildId;
    private Instant lastAppliedAt;

    public boolean isBatchable() {
        return policy != null && policy.isBatchable();
    }

    public CoherencyMode getCoherencyMode() {
        return policy != null && policy.getCoherencyMode() != null
                ? policy.getCoherencyMode()
                : CoherencyMode.STRICT;
    }
}
