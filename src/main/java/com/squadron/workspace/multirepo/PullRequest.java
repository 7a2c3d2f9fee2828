package com.squadron.workspace.multirepo;

/**
 * A pull request opened on the hosting service.
 */
public record PullRequest(String repoName, int number, String url, String title, State state,
                          String head, String base) {

    public enum State {
        OPEN,
        CLOSED,
        MERGED
    }
}
