package com.squadron.workspace.multirepo;

/**
 * Per-repository result of opening pull requests for a feature.
 *
 * @param repoName    repository
 * @param pullRequest the opened pull request, or null on failure
 * @param error       failure message, or null on success
 */
public record PullRequestOutcome(String repoName, PullRequest pullRequest, String error) {

    public boolean succeeded() {
        return pullRequest != null;
    }
}
