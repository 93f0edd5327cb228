package com.dependency.flow.maestro.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One applied version bump as recorded on a tracked pull request.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DependencyUpdateSummary {

    private String dependencyName;
    private String fromVersion;
    private String toVersion;
    private String sourceRepository;
    private String sourceCommit;
    private String subscriptionId;
}
