package com.dependency.flow.maestro.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionPolicy {

    private boolean batchable;

    @Builder.Default
    private UpdateFrequency updateFrequency = UpdateFrequency.EVERY_BUILD;

    @Builder.Default
    private CoherencyMode coherencyMode = CoherencyMode.STRICT;
}
