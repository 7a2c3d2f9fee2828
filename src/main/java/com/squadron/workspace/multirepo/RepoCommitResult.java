package com.squadron.workspace.multirepo;

import com.squadron.core.error.CommitException;

/**
 * Per-repository outcome of a commit across a feature's worktrees.
 *
 * @param repoName      repository
 * @param featureBranch branch committed on
 * @param commitHash    new commit, or null on failure
 * @param error         failure, or null on success
 */
public record RepoCommitResult(String repoName, String featureBranch, String commitHash, CommitException error) {

    public static RepoCommitResult committed(String repoName, String featureBranch, String commitHash) {
        return new RepoCommitResult(repoName, featureBranch, commitHash, null);
    }

    public static RepoCommitResult failed(String repoName, String featureBranch, CommitException error) {
        return new RepoCommitResult(repoName, featureBranch, null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
