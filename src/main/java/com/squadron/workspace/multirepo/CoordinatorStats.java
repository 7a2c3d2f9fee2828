package com.squadron.workspace.multirepo;

import java.util.Map;

/**
 * @param totalRepos      configured repositories
 * @param activeWorktrees live allocations across all pools
 * @param features        multi-repository worktree sets
 * @param byRepo          live allocations per repository
 */
public record CoordinatorStats(int totalRepos, int activeWorktrees, int features, Map<String, Integer> byRepo) {
}
