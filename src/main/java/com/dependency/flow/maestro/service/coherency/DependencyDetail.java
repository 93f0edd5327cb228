package com.dependency.flow.maestro.service.coherency;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a repository's dependency manifest.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DependencyDetail {

    private String name;
    private String version;
    private String repoUri;
    private String commit;

    private boolean pinned;

    // Must stay at the version the parent's own manifest declares at the parent's commit
    private String coherentParentDependencyName;
}
