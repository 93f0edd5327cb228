package com.dependency.flow.maestro.dto;

import com.dependency.flow.maestro.model.UpdaterPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateAssetsResponse {

    private String updaterId;
    private long buildId;
    private UpdaterPhase phase;
    private String pullRequestUrl;
}
