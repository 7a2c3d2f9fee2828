package com.squadron.core.error;

import java.nio.file.Path;

/**
 * Thrown when releasing a worktree that has uncommitted changes without forcing.
 */
public class WorktreeDirtyException extends AllocationException {

    private final Path worktreePath;

    public WorktreeDirtyException(String repoName, Path worktreePath) {
        super(repoName, ("Worktree %s in repository '%s' has uncommitted changes; "
                + "commit them or release with force").formatted(worktreePath, repoName));
        this.worktreePath = worktreePath;
    }

    public Path getWorktreePath() {
        return worktreePath;
    }
}
