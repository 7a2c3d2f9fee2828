package com.squadron.workspace.git;

import java.nio.file.Path;

/**
 * One entry of {@code git worktree list --porcelain}.
 *
 * @param path     worktree directory
 * @param head     checked-out commit
 * @param branch   short branch name, or null when detached or bare
 * @param bare     whether this is the bare repository entry
 * @param detached whether HEAD is detached
 */
public record WorktreeInfo(Path path, String head, String branch, boolean bare, boolean detached) {
}
