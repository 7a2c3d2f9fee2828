package com.squadron.workspace;

import java.nio.file.Path;
import java.time.Instant;

/**
 * One isolated working copy of a repository bound to a branch.
 *
 * <p>Identity fields are fixed at allocation; activity and dirty tracking are updated
 * by {@link WorktreePool} and are safe to read from any thread.
 */
public class WorktreeAllocation {

    private final String id;
    private final String repoName;
    private final Path repoPath;
    private final Path worktreePath;
    private final String branch;
    private final String featureId;
    private final String agentId;
    private final Instant createdAt;
    private final boolean branchCreated;

    private volatile Instant lastActiveAt;
    private volatile boolean allocated = true;
    private volatile boolean dirty;

    public WorktreeAllocation(String id, String repoName, Path repoPath, Path worktreePath, String branch,
                              String featureId, String agentId, Instant createdAt, boolean branchCreated) {
        this.id = id;
        this.repoName = repoName;
        this.repoPath = repoPath;
        this.worktreePath = worktreePath;
        this.branch = branch;
        this.featureId = featureId;
        this.agentId = agentId;
        this.createdAt = createdAt;
        this.branchCreated = branchCreated;
        this.lastActiveAt = createdAt;
    }

    public String getId() { return id; }
    public String getRepoName() { return repoName; }
    public Path getRepoPath() { return repoPath; }
    public Path getWorktreePath() { return worktreePath; }
    public String getBranch() { return branch; }
    public String getFeatureId() { return featureId; }
    /** Owning agent, or null when the worktree is not bound to an agent. */
    public String getAgentId() { return agentId; }
    public Instant getCreatedAt() { return createdAt; }
    /** True if the branch did not exist before this allocation created it. */
    public boolean isBranchCreated() { return branchCreated; }
    public Instant getLastActiveAt() { return lastActiveAt; }
    public boolean isAllocated() { return allocated; }
    public boolean isDirty() { return dirty; }

    void touch(Instant at) {
        this.lastActiveAt = at;
    }

    void setDirty(boolean dirty) {
        this.dirty = dirty;
    }

    void markReleased() {
        this.allocated = false;
    }

    @Override
    public String toString() {
        return "WorktreeAllocation{id=%s, repo=%s, branch=%s, path=%s, dirty=%s}"
                .formatted(id, repoName, branch, worktreePath, dirty);
    }
}
