package com.dependency.flow.maestro.service.coherency;

import java.util.List;

/**
 * Reads the dependency manifest of a repository at a branch or commit.
 */
public interface DependencyGraphReader {

    /**
     * @return the declared dependencies, or an empty list when the ref has no manifest
     */
    List<DependencyDetail> getDependencies(String repoUri, String ref);
}
