package com.dependency.flow.maestro.dto;

import com.dependency.flow.maestro.model.Asset;
import com.dependency.flow.maestro.model.PendingUpdate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A build observed on a subscription's source channel.
 * The subscription id comes from the request path when received over HTTP.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UpdateAssetsRequest {

    private String subscriptionId;

    @NotNull
    private Long buildId;

    @NotBlank
    private String sourceRepository;

    @NotBlank
    private String sourceSha;

    @Valid
    @Builder.Default
    private List<Asset> assets = new ArrayList<>();

    private boolean sourceEnabled;

    public static UpdateAssetsRequest fromPendingUpdate(PendingUpdate pending) {
        return UpdateAssetsRequest.builder()
                .subscriptionId(pending.getSubscriptionId())
                .buildId(pending.getBuildId())
                .sourceRepository(pending.getSourceRepository())
                .sourceSha(pending.getSourceSha())
                .assets(new ArrayList<>(pending.getAssets()))
                .sourceEnabled(pending.isCodeFlow())
                .build();
    }
}
