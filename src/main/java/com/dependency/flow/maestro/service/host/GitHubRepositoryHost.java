package com.dependency.flow.maestro.service.host;

import com.dependency.flow.maestro.exception.RepositoryHostException;
import com.dependency.flow.maestro.service.coherency.DependencyDetail;
import com.dependency.flow.maestro.service.coherency.DependencyUpdate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * GitHub REST implementation of the repository host.
 * Dependencies live in a JSON manifest ({@code maestro.github.manifest-path}) of each target repository;
 * commits are made through the contents API as the configured service account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GitHubRepositoryHost implements RepositoryHost {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<Map<String, Object>>> JSON_ARRAY =
            new ParameterizedTypeReference<>() {};

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;

    @Value("${maestro.github.api.base-url}")
    private String githubApiBaseUrl;

    @Value("${maestro.github.token:}")
    private String accessToken;

    @Value("${maestro.github.bot-login}")
    private String botLogin;

    @Value("${maestro.github.manifest-path:eng/dependencies.json}")
    private String manifestPath;

    // ========================= MANIFEST =========================

    @Override
    public List<DependencyDetail> getDependencies(String repoUri, String ref) {
        GitHubRepositoryRef repository = GitHubRepositoryRef.parse(repoUri);
        ManifestFile file = readManifest(repository, ref);
        return file == null ? List.of() : file.manifest.getDependencies();
    }

    @Override
    public String commitUpdates(String repoUri, String branch, List<DependencyUpdate> updates, String message) {
        GitHubRepositoryRef repository = GitHubRepositoryRef.parse(repoUri);
        log.info("Committing {} dependency updates to {}/{}@{}",
                updates.size(), repository.getOwner(), repository.getRepo(), branch);

        ManifestFile file = readManifest(repository, branch);
        if (file == null) {
            throw new RepositoryHostException("No dependency manifest " + manifestPath + " in " + repoUri + "@" + branch);
        }
        applyUpdates(file.manifest, updates);

        Map<String, Object> body = new HashMap<>();
        body.put("message", message);
        body.put("content", Base64.getEncoder().encodeToString(serialize(file.manifest)));
        body.put("branch", branch);
        body.put("sha", file.sha);

        Map<String, Object> response = call("commit to " + repoUri + "@" + branch, () -> buildClient().put()
                .uri(uriBuilder -> uriBuilder.path("/repos/{owner}/{repo}/contents/" + manifestPath)
                        .build(repository.getOwner(), repository.getRepo()))
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JSON_OBJECT)
                .block());

        String commitSha = nested(response, "commit", "sha");
        log.info("Created commit {} on {}/{}@{}", commitSha, repository.getOwner(), repository.getRepo(), branch);
        return commitSha;
    }

    // ========================= BRANCHES =========================

    @Override
    public void createBranch(String repoUri, String fromBranch, String newBranch) {
        GitHubRepositoryRef repository = GitHubRepositoryRef.parse(repoUri);
        String baseSha = getBranchHeadSha(repository, fromBranch);
        if (baseSha == null) {
            throw new RepositoryHostException("Branch " + fromBranch + " does not exist in " + repoUri);
        }

        call("create branch " + newBranch + " in " + repoUri, () -> buildClient().post()
                .uri("/repos/{owner}/{repo}/git/refs", repository.getOwner(), repository.getRepo())
                .bodyValue(Map.of("ref", "refs/heads/" + newBranch, "sha", baseSha))
                .retrieve()
                .bodyToMono(JSON_OBJECT)
                .block());

        log.info("Created branch {} from {}@{} in {}/{}",
                newBranch, fromBranch, baseSha, repository.getOwner(), repository.getRepo());
    }

    @Override
    public boolean branchExists(String repoUri, String branch) {
        return getBranchHeadSha(GitHubRepositoryRef.parse(repoUri), branch) != null;
    }

    // ========================= PULL REQUESTS =========================

    @Override
    public CreatedPullRequest createPullRequest(String repoUri, PullRequestDescription description) {
        GitHubRepositoryRef repository = GitHubRepositoryRef.parse(repoUri);

        Map<String, Object> response = call("create pull request in " + repoUri, () -> buildClient().post()
                .uri("/repos/{owner}/{repo}/pulls", repository.getOwner(), repository.getRepo())
                .bodyValue(Map.of(
                        "title", description.getTitle(),
                        "head", description.getHeadBranch(),
                        "base", description.getBaseBranch(),
                        "body", description.getBody() == null ? "" : description.getBody()))
                .retrieve()
                .bodyToMono(JSON_OBJECT)
                .block());

        String url = string(response, "html_url");
        String headRef = nested(response, "head", "ref");
        log.info("Opened pull request {} ({} -> {})", url, description.getHeadBranch(), description.getBaseBranch());
        return new CreatedPullRequest(url, headRef != null ? headRef : description.getHeadBranch());
    }

    @Override
    public void updatePullRequest(String pullRequestUrl, PullRequestDescription description) {
        GitHubRepositoryRef repository = GitHubRepositoryRef.parse(pullRequestUrl);
        int number = GitHubRepositoryRef.parsePullRequestNumber(pullRequestUrl);

        call("update pull request " + pullRequestUrl, () -> buildClient().patch()
                .uri("/repos/{owner}/{repo}/pulls/{number}", repository.getOwner(), repository.getRepo(), number)
                .bodyValue(Map.of(
                        "title", description.getTitle(),
                        "body", description.getBody() == null ? "" : description.getBody()))
                .retrieve()
                .bodyToMono(JSON_OBJECT)
                .block());

        log.info("Updated description of pull request {}", pullRequestUrl);
    }

    @Override
    public PullRequestStatus getPullRequestStatus(String pullRequestUrl) {
        GitHubRepositoryRef repository = GitHubRepositoryRef.parse(pullRequestUrl);
        int number = GitHubRepositoryRef.parsePullRequestNumber(pullRequestUrl);

        Map<String, Object> pullRequest = call("read pull request " + pullRequestUrl, () -> buildClient().get()
                .uri("/repos/{owner}/{repo}/pulls/{number}", repository.getOwner(), repository.getRepo(), number)
                .retrieve()
                .bodyToMono(JSON_OBJECT)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                .block());

        if (pullRequest == null) {
            log.info("Pull request {} no longer exists", pullRequestUrl);
            return PullRequestStatus.NOT_FOUND;
        }
        if ("closed".equals(string(pullRequest, "state"))) {
            return Boolean.TRUE.equals(pullRequest.get("merged")) ? PullRequestStatus.MERGED : PullRequestStatus.CLOSED;
        }

        List<Map<String, Object>> commits = call("list commits of " + pullRequestUrl, () -> buildClient().get()
                .uri("/repos/{owner}/{repo}/pulls/{number}/commits?per_page=100",
                        repository.getOwner(), repository.getRepo(), number)
                .retrieve()
                .bodyToMono(JSON_ARRAY)
                .block());

        if (commits != null) {
            for (Map<String, Object> commit : commits) {
                String author = nested(commit, "author", "login");
                if (author == null || !author.equalsIgnoreCase(botLogin)) {
                    log.info("Pull request {} has a commit by {}, it will not be updated automatically",
                            pullRequestUrl, author);
                    return PullRequestStatus.OPEN_CANNOT_UPDATE;
                }
            }
        }
        return PullRequestStatus.OPEN_CAN_UPDATE;
    }

    // ========================= HELPERS =========================

    private String getBranchHeadSha(GitHubRepositoryRef repository, String branch) {
        Map<String, Object> ref = call("read branch " + branch + " of " + repository.getOwner() + "/" + repository.getRepo(),
                () -> buildClient().get()
                        .uri(uriBuilder -> uriBuilder.path("/repos/{owner}/{repo}/git/ref/heads/" + branch)
                                .build(repository.getOwner(), repository.getRepo()))
                        .retrieve()
                        .bodyToMono(JSON_OBJECT)
                        .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                        .block());
        return nested(ref, "object", "sha");
    }

    private ManifestFile readManifest(GitHubRepositoryRef repository, String ref) {
        Map<String, Object> content = call("read dependency manifest of " + repository.getOwner() + "/"
                + repository.getRepo() + "@" + ref, () -> buildClient().get()
                // manifest path and branch names keep their slashes
                .uri(uriBuilder -> uriBuilder.path("/repos/{owner}/{repo}/contents/" + manifestPath)
                        .queryParam("ref", ref)
                        .build(repository.getOwner(), repository.getRepo()))
                .retrieve()
                .bodyToMono(JSON_OBJECT)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                .block());

        String encoded = string(content, "content");
        if (encoded == null) {
            log.debug("No dependency manifest in {}/{}@{}", repository.getOwner(), repository.getRepo(), ref);
            return null;
        }
        byte[] bytes = Base64.getMimeDecoder().decode(encoded);
        try {
            DependencyManifest manifest = objectMapper.readValue(bytes, DependencyManifest.class);
            return new ManifestFile(manifest, string(content, "sha"));
        } catch (java.io.IOException e) {
            throw new RepositoryHostException("Malformed dependency manifest in "
                    + repository.getOwner() + "/" + repository.getRepo() + "@" + ref, e);
        }
    }

    private void applyUpdates(DependencyManifest manifest, List<DependencyUpdate> updates) {
        Map<String, DependencyUpdate> byName = new HashMap<>();
        for (DependencyUpdate update : updates) {
            byName.put(update.getDependencyName().toLowerCase(Locale.ROOT), update);
        }
        List<DependencyDetail> result = new ArrayList<>();
        for (DependencyDetail dependency : manifest.getDependencies()) {
            DependencyUpdate update = byName.get(dependency.getName().toLowerCase(Locale.ROOT));
            result.add(update == null ? dependency : update.getTo());
        }
        manifest.setDependencies(result);
    }

    private byte[] serialize(DependencyManifest manifest) {
        try {
            return (objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(manifest) + "\n")
                    .getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new RepositoryHostException("Failed to serialize dependency manifest", e);
        }
    }

    private <T> T call(String operation, java.util.function.Supplier<T> request) {
        try {
            return request.get();
        } catch (WebClientResponseException e) {
            throw new RepositoryHostException("GitHub rejected " + operation + ": " + e.getStatusCode()
                    + " " + e.getResponseBodyAsString(), e);
        } catch (RuntimeException e) {
            throw new RepositoryHostException("GitHub call failed: " + operation + ": " + e.getMessage(), e);
        }
    }

    private WebClient buildClient() {
        return webClientBuilder.clone()
                .baseUrl(githubApiBaseUrl)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
                .build();
    }

    private static String string(Map<String, Object> map, String key) {
        if (map == null) return null;
        Object value = map.get(key);
        return value == null ? null : value.toString();
    }

    @SuppressWarnings("unchecked")
    private static String nested(Map<String, Object> map, String key, String child) {
        if (map == null) return null;
        Object value = map.get(key);
        if (!(value instanceof Map)) return null;
        return string((Map<String, Object>) value, child);
    }

    private static final class ManifestFile {
        private final DependencyManifest manifest;
        private final String sha;

        private ManifestFile(DependencyManifest manifest, String sha) {
            this.manifest = manifest;
            this.sha = sha;
        }
    }
}
