package com.squadron.core.events;

/**
 * Lifecycle notifications emitted by the process orchestrator and the workspace allocator.
 */
public enum SquadronEventType {
    AGENT_STARTED,
    AGENT_OUTPUT,
    AGENT_WAITING,
    AGENT_PAUSED,
    AGENT_RESUMED,
    AGENT_COMPLETED,
    AGENT_ERROR,
    AGENT_KILLED,
    GIT_WORKTREE_CREATED,
    GIT_WORKTREE_REMOVED,
    GIT_COMMIT_CREATED,
    GIT_PR_CREATED
}
