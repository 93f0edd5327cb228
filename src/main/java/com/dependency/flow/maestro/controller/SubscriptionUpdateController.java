package com.dependency.flow.maestro.controller;

import com.dependency.flow.maestro.dto.UpdateAssetsRequest;
import com.dependency.flow.maestro.dto.UpdateAssetsResponse;
import com.dependency.flow.maestro.dto.UpdaterStateResponse;
import com.dependency.flow.maestro.model.Asset;
import com.dependency.flow.maestro.model.DependencyFlowEvent;
import com.dependency.flow.maestro.repository.DependencyFlowEventRepository;
import com.dependency.flow.maestro.service.updater.PullRequestUpdater;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Build ingestion and read access to updater state.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class SubscriptionUpdateController {

    private final PullRequestUpdater pullRequestUpdater;
    private final DependencyFlowEventRepository eventRepository;

    /**
     * Apply a new build of the subscription's source channel.
     * Returns the updater phase reached once the build has been processed.
     */
    @PostMapping("/subscriptions/{subscriptionId}/builds")
    public ResponseEntity<UpdateAssetsResponse> updateAssets(
            @PathVariable String subscriptionId,
            @Valid @RequestBody UpdateAssetsRequest request) {
        log.info("Received build {} for subscription {}", request.getBuildId(), subscriptionId);
        List<Asset> assets = request.getAssets() == null ? new ArrayList<>() : request.getAssets();
        rejectDuplicateAssets(assets);

        UpdateAssetsResponse response = pullRequestUpdater.updateAssets(
                request.toBuilder().subscriptionId(subscriptionId).assets(assets).build());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    /**
     * Batch keys embed the target repository URL, so the key travels as a query parameter.
     */
    @GetMapping("/updaters")
    public ResponseEntity<UpdaterStateResponse> getUpdaterState(@RequestParam String key) {
        return pullRequestUpdater.getState(key)
                .map(UpdaterStateResponse::from)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/builds/{buildId}/flow-events")
    public ResponseEntity<List<DependencyFlowEvent>> getFlowEvents(@PathVariable long buildId) {
        return ResponseEntity.ok(eventRepository.findBySourceBuildId(buildId));
    }

    private void rejectDuplicateAssets(List<Asset> assets) {
        Set<String> names = new HashSet<>();
        for (Asset asset : assets) {
            if (!names.add(asset.getName().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Duplicate asset in build: " + asset.getName());
            }
        }
    }
}
