package com.squadron.workspace;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of reconciling a pool's registry with the filesystem.
 *
 * @param removedAllocations ids dropped because their directory no longer exists
 * @param orphanedWorktrees  git worktrees under the pool root that no allocation owns
 */
public record SyncResult(List<String> removedAllocations, List<Path> orphanedWorktrees) {
}
