package com.dependency.flow.maestro.service.telemetry;

import com.dependency.flow.maestro.model.DependencyFlowEvent;

import java.util.List;

/**
 * Receives flow events after the state they describe has been saved.
 * Implementations must not throw.
 */
public interface DependencyFlowEventSink {

    void record(List<DependencyFlowEvent> events);
}
