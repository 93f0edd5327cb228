package com.dependency.flow.maestro.service.host;

import com.dependency.flow.maestro.service.coherency.DependencyGraphReader;
import com.dependency.flow.maestro.service.coherency.DependencyUpdate;

import java.util.List;

/**
 * Pull request and branch operations on the platform hosting the target repositories.
 * Every method may throw {@link com.dependency.flow.maestro.exception.RepositoryHostException}.
 */
public interface RepositoryHost extends DependencyGraphReader {

    /**
     * Creates {@code newBranch} pointing at the head of {@code fromBranch}.
     */
    void createBranch(String repoUri, String fromBranch, String newBranch);

    boolean branchExists(String repoUri, String branch);

    /**
     * Writes the updates into the dependency manifest on {@code branch}.
     *
     * @return the sha of the new commit
     */
    String commitUpdates(String repoUri, String branch, List<DependencyUpdate> updates, String message);

    CreatedPullRequest createPullRequest(String repoUri, PullRequestDescription description);

    void updatePullRequest(String pullRequestUrl, PullRequestDescription description);

    PullRequestStatus getPullRequestStatus(String pullRequestUrl);
}
