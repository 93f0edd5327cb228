package com.dependency.flow.maestro.service.codeflow;

import com.dependency.flow.maestro.model.Asset;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodeFlowRequest {

    private String subscriptionId;
    private long buildId;
    private String sourceRepository;
    private String sourceSha;

    @Builder.Default
    private List<Asset> assets = new ArrayList<>();

    private String targetRepository;
    private String targetBranch;
    private String headBranch;
}
