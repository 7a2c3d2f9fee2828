package com.squadron.workspace.multirepo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.squadron.core.config.SquadronProperties;
import com.squadron.core.credentials.CredentialStore;
import com.squadron.core.error.PullRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Opens pull requests through the GitHub REST API ({@code POST /repos/{owner}/{repo}/pulls}).
 *
 * <p>The token is resolved from the {@link CredentialStore} on every request under the
 * configured credential key.
 */
public class GitHubPullRequestClient implements PullRequestClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubPullRequestClient.class);

    /** owner and repository from https, ssh or scp-style remotes */
    static final Pattern REMOTE_PATTERN = Pattern.compile(
            "^(?:https?://(?:[^@/]+@)?[^/]+/|ssh://(?:[^@/]+@)?[^/]+/|[^@/\\s]+@[^:]+:)([^/]+)/([^/]+?)(?:\\.git)?/?$"
    );

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CredentialStore credentialStore;
    private final SquadronProperties.Pr config;

    public GitHubPullRequestClient(HttpClient httpClient, ObjectMapper objectMapper,
                                   CredentialStore credentialStore, SquadronProperties.Pr config) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.credentialStore = credentialStore;
        this.config = config;
    }

    /** Owner and name of a hosted repository. */
    public record RepositorySlug(String owner, String name) {
    }

    static RepositorySlug parseRemote(String remoteUrl) {
        Matcher matcher = REMOTE_PATTERN.matcher(remoteUrl.trim());
        if (!matcher.matches()) {
            throw new PullRequestException("Cannot determine owner/repository from remote: " + remoteUrl);
        }
        return new RepositorySlug(matcher.group(1), matcher.group(2));
    }

    @Override
    public PullRequest createPullRequest(String repoName, String remoteUrl, String title, String body,
                                         String head, String base) {
        RepositorySlug slug = parseRemote(remoteUrl);

        ObjectNode request = objectMapper.createObjectNode();
        request.put("title", title);
        request.put("head", head);
        request.put("base", base);
        request.put("body", body);

        JsonNode response = post("/repos/%s/%s/pulls".formatted(slug.owner(), slug.name()), request.toString());

        var pr = new PullRequest(
                repoName,
                response.path("number").asInt(),
                response.path("html_url").asText(""),
                response.path("title").asText(title),
                parseState(response),
                head,
                base);
        log.info("Opened pull request #{} for '{}': {}", pr.number(), repoName, pr.url());
        return pr;
    }

    static PullRequest.State parseState(JsonNode response) {
        if (response.path("merged").asBoolean(false)) {
            return PullRequest.State.MERGED;
        }
        return "closed".equals(response.path("state").asText("open").toLowerCase(Locale.ROOT))
                ? PullRequest.State.CLOSED : PullRequest.State.OPEN;
    }

    JsonNode post(String path, String body) {
        String token = credentialStore.getCredential(config.getCredentialKey())
                .orElseThrow(() -> new PullRequestException(
                        "No hosting API token configured under credential key '" + config.getCredentialKey() + "'"));
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(config.getApiUrl() + path))
                    .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                    .header("Authorization", "Bearer " + token)
                    .header("Accept", "application/vnd.github+json")
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new PullRequestException("GitHub API POST %s failed (HTTP %d): %s"
                        .formatted(path, response.statusCode(), response.body()));
            }
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new PullRequestException("GitHub API request failed: POST " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PullRequestException("GitHub API request interrupted: POST " + path, e);
        }
    }
}
