package com.dependency.flow.maestro.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A subscription contributing to a pull request, with the build it last contributed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionBuild {

    private String subscriptionId;
    private long buildId;
}
