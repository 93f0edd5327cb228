package com.dependency.flow.maestro.service.updater;

import com.dependency.flow.maestro.model.CoherencyErrorDetails;
import com.dependency.flow.maestro.model.DependencyUpdateSummary;
import com.dependency.flow.maestro.model.PullRequestState;
import com.dependency.flow.maestro.model.SubscriptionBuild;
import com.dependency.flow.maestro.service.host.PullRequestDescription;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders title and markdown body of dependency update and code flow pull requests.
 */
@Component
public class PullRequestDescriptionBuilder {

    public PullRequestDescription build(PullRequestState pullRequest, String targetBranch) {
        return PullRequestDescription.builder()
                .title(title(pullRequest, targetBranch))
                .body(body(pullRequest))
                .baseBranch(targetBranch)
                .headBranch(pullRequest.getHeadBranch())
                .build();
    }

    public String commitMessage(List<DependencyUpdateSummary> updates) {
        StringBuilder message = new StringBuilder("Update dependencies from ")
                .append(String.join(", ", sources(updates)))
                .append("\n");
        for (DependencyUpdateSummary update : updates) {
            message.append("\n- ").append(update.getDependencyName()).append(": ")
                    .append(update.getFromVersion() == null ? "" : update.getFromVersion() + " -> ")
                    .append(update.getToVersion());
        }
        return message.toString();
    }

    private String title(PullRequestState pullRequest, String targetBranch) {
        Set<String> sources = sources(pullRequest.getRequiredUpdates());
        String from = sources.size() == 1 ? sources.iterator().next() : "multiple repositories";
        if (pullRequest.isCodeFlow()) {
            return "[" + targetBranch + "] Source code updates from " + from;
        }
        return "[" + targetBranch + "] Update dependencies from " + from;
    }

    private String body(PullRequestState pullRequest) {
        StringBuilder body = new StringBuilder();
        body.append(pullRequest.isCodeFlow()
                ? "This pull request brings source code changes and the following dependency versions.\n"
                : "This pull request updates the following dependencies.\n");

        Map<String, Long> builds = new LinkedHashMap<>();
        for (SubscriptionBuild contained : pullRequest.getContainedSubscriptions()) {
            builds.put(contained.getSubscriptionId(), contained.getBuildId());
        }

        Map<String, List<DependencyUpdateSummary>> bySubscription = new LinkedHashMap<>();
        for (DependencyUpdateSummary update : pullRequest.getRequiredUpdates()) {
            bySubscription.computeIfAbsent(update.getSubscriptionId(), k -> new ArrayList<>()).add(update);
        }

        for (Map.Entry<String, List<DependencyUpdateSummary>> entry : bySubscription.entrySet()) {
            List<DependencyUpdateSummary> updates = entry.getValue();
            body.append("\n## From ").append(updates.get(0).getSourceRepository()).append("\n");
            body.append("- **Subscription**: ").append(entry.getKey());
            Long buildId = builds.get(entry.getKey());
            if (buildId != null) {
                body.append(" (build ").append(buildId).append(")");
            }
            body.append("\n- **Updates**:\n");
            for (DependencyUpdateSummary update : updates) {
                body.append("  - **").append(update.getDependencyName()).append("**: ");
                if (update.getFromVersion() != null) {
                    body.append("from ").append(update.getFromVersion()).append(" ");
                }
                body.append("to ").append(update.getToVersion()).append("\n");
            }
        }

        if (!pullRequest.isCoherencySuccessful()) {
            body.append("\n## Coherency check failed\n");
            for (CoherencyErrorDetails error : pullRequest.getCoherencyErrors()) {
                body.append("- ").append(error.getError()).append("\n");
                for (String solution : error.getPotentialSolutions()) {
                    body.append("  - ").append(solution).append("\n");
                }
            }
        }
        return body.toString();
    }

    private Set<String> sources(List<DependencyUpdateSummary> updates) {
        Set<String> sources = new LinkedHashSet<>();
        for (DependencyUpdateSummary update : updates) {
            if (update.getSourceRepository() != null) {
                sources.add(update.getSourceRepository());
            }
        }
        return sources;
    }
}
