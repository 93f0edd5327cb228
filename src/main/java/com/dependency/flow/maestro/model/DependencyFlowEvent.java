package com.dependency.flow.maestro.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Append-only record of one asset version change applied to a pull request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "dependency_flow_events")
public class DependencyFlowEvent {

    @Id
    private String id;

    @Indexed
    private long sourceBuildId;

    private String subscriptionId;
    private String updaterId;
    private EventType eventType;
    private FlowType flowType;
    private String pullRequestUrl;

    private String assetName;
    private String fromVersion;
    private String toVersion;

    private Instant timestamp;

    public enum EventType {
        CREATED,
        UPDATED
    }

    public enum FlowType {
        CLASSIC,
        CODE_FLOW
    }
}
