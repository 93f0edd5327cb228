package com.dependency.flow.maestro.service.host;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PullRequestDescription {

    private String title;
    private String body;
    private String baseBranch;
    private String headBranch;
}
