package com.dependency.flow.maestro.service.host;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.net.URI;

/**
 * Owner/name pair parsed from a GitHub repository or pull request URL.
 */
@Getter
@AllArgsConstructor
public class GitHubRepositoryRef {

    private final String owner;
    private final String repo;

    /**
     * Accepts https://github.com/{owner}/{repo}[.git] and API urls of the form
     * https://api.github.com/repos/{owner}/{repo}.
     */
    public static GitHubRepositoryRef parse(String repoUri) {
        String[] segments = segments(repoUri);
        int offset = segments.length > 0 && "repos".equals(segments[0]) ? 1 : 0;
        if (segments.length < offset + 2) {
            throw new IllegalArgumentException("Not a GitHub repository url: " + repoUri);
        }
        String repo = segments[offset + 1];
        if (repo.endsWith(".git")) {
            repo = repo.substring(0, repo.length() - 4);
        }
        return new GitHubRepositoryRef(segments[offset], repo);
    }

    /**
     * Parses https://github.com/{owner}/{repo}/pull/{number}.
     */
    public static int parsePullRequestNumber(String pullRequestUrl) {
        String[] segments = segments(pullRequestUrl);
        for (int i = 0; i < segments.length - 1; i++) {
            if ("pull".equals(segments[i]) || "pulls".equals(segments[i])) {
                return Integer.parseInt(segments[i + 1]);
            }
        }
        throw new IllegalArgumentException("Not a GitHub pull request url: " + pullRequestUrl);
    }

    private static String[] segments(String url) {
        String path = URI.create(url.trim()).getPath();
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Url has no path: " + url);
        }
        return path.replaceAll("^/+", "").split("/");
    }
}
