package com.squadron.workspace.multirepo;

import com.squadron.workspace.WorktreeAllocation;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The worktrees of one feature branch across every configured repository.
 *
 * @param featureBranch shared branch name
 * @param allocations   repository name to allocation, primary first
 * @param allocationIds repository name to allocation id
 * @param createdAt     when the set was allocated
 */
public record MultiRepoWorktree(
    String featureBranch,
    Map<String, WorktreeAllocation> allocations,
    Map<String, String> allocationIds,
    Instant createdAt
) {

    public MultiRepoWorktree {
        allocations = Collections.unmodifiableMap(new LinkedHashMap<>(allocations));
        allocationIds = Collections.unmodifiableMap(new LinkedHashMap<>(allocationIds));
    }
}
