package com.dependency.flow.maestro.service.telemetry;

import com.dependency.flow.maestro.model.DependencyFlowEvent;
import com.dependency.flow.maestro.repository.DependencyFlowEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class MongoDependencyFlowEventSink implements DependencyFlowEventSink {

    private final DependencyFlowEventRepository eventRepository;

    @Override
    public void record(List<DependencyFlowEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        try {
            eventRepository.saveAll(events);
            log.debug("Recorded {} dependency flow events", events.size());
        } catch (RuntimeException e) {
            log.warn("Failed to record {} dependency flow events: {}", events.size(), e.getMessage());
        }
    }
}
