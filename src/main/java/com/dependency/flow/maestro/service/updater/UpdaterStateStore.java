package com.dependency.flow.maestro.service.updater;

import com.dependency.flow.maestro.model.Subscription;
import com.dependency.flow.maestro.model.SubscriptionBuild;
import com.dependency.flow.maestro.model.UpdaterState;
import com.dependency.flow.maestro.repository.SubscriptionRepository;
import com.dependency.flow.maestro.repository.UpdaterStateRepository;
import com.dependency.flow.maestro.service.telemetry.DependencyFlowEventSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Loads, mutates and saves updater state bundles.
 *
 * Work for one key runs under the key's lock against a freshly loaded bundle. The bundle is
 * validated and written in one save once the work returns; if the work throws, nothing is
 * written. The {@code @Version} field rejects a concurrent save from another instance.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UpdaterStateStore {

    private final UpdaterStateRepository stateRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final DependencyFlowEventSink eventSink;
    private final KeyedExecutor keyedExecutor;
    private final Clock clock;

    public <T> T withState(PullRequestUpdaterId id, Function<UpdaterContext, T> work) {
        return keyedExecutor.execute(id.getKey(), () -> {
            Optional<UpdaterState> stored = stateRepository.findById(id.getKey());
            UpdaterState state = stored.orElseGet(() -> UpdaterState.empty(id.getKey()));
            UpdaterContext context = new UpdaterContext(id, state, clock);

            T result = work.apply(context);

            state.validate();
            if (stored.isPresent() || !state.isEmpty()) {
                state.setLastUpdatedAt(clock.instant());
                stateRepository.save(state);
                log.debug("Saved updater state {} in phase {}", id, state.phase());
            }

            flushAppliedBuilds(context.getAppliedBuilds());
            eventSink.record(context.getEvents());
            return result;
        });
    }

    public Optional<UpdaterState> find(String key) {
        return stateRepository.findById(key);
    }

    /**
     * Advances {@code lastAppliedBuildId} of each subscription; it never moves backwards.
     */
    private void flushAppliedBuilds(List<SubscriptionBuild> appliedBuilds) {
        for (SubscriptionBuild applied : appliedBuilds) {
            try {
                Optional<Subscription> found = subscriptionRepository.findById(applied.getSubscriptionId());
                if (found.isEmpty()) {
                    log.warn("Subscription {} disappeared before build {} could be marked applied",
                            applied.getSubscriptionId(), applied.getBuildId());
                    continue;
                }
                Subscription subscription = found.get();
                Long current = subscription.getLastAppliedBuildId();
                if (current != null && current >= applied.getBuildId()) {
                    continue;
                }
                subscription.setLastAppliedBuildId(applied.getBuildId());
                subscription.setLastAppliedAt(Instant.now(clock));
                subscriptionRepository.save(subscription);
                log.info("Subscription {} applied build {}", subscription.getId(), applied.getBuildId());
            } catch (RuntimeException e) {
                log.warn("Failed to mark build {} applied for subscription {}: {}",
                        applied.getBuildId(), applied.getSubscriptionId(), e.getMessage());
            }
        }
    }
}
