package com.squadron.workspace.multirepo;

import java.util.List;

/**
 * Working-copy state of one repository's worktree for a feature.
 *
 * @param error non-null if git could not be queried; the other fields are then defaults
 */
public record RepoStatusSummary(String repoName, String branch, boolean clean, int ahead, int behind,
                                List<String> changedFiles, String error) {

    public RepoStatusSummary {
        changedFiles = changedFiles != null ? List.copyOf(changedFiles) : List.of();
    }

    public boolean hasChanges() {
        return !clean || ahead > 0;
    }
}
