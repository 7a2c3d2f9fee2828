package com.squadron.workspace.multirepo;

import com.squadron.core.error.PullRequestException;

/**
 * Opens pull requests on a hosting service.
 */
public interface PullRequestClient {

    /**
     * @param repoName  local repository name, carried into the result
     * @param remoteUrl remote the branch was pushed to; identifies the hosted repository
     * @throws PullRequestException if the hosting service rejects the request or is unreachable
     */
    PullRequest createPullRequest(String repoName, String remoteUrl, String title, String body,
                                  String head, String base);
}
