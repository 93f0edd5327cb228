package com.dependency.flow.maestro.service.host;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatedPullRequest {

    private String url;
    private String headBranch;
}
