package com.squadron.core.error;

/**
 * Thrown when a worktree cannot be allocated or released: the branch is already
 * allocated, the repository is invalid, or a path is missing.
 */
public class AllocationException extends RuntimeException {

    private final String repoName;

    public AllocationException(String repoName, String message) {
        super(message);
        this.repoName = repoName;
    }

    public AllocationException(String repoName, String message, Throwable cause) {
        super(message, cause);
        this.repoName = repoName;
    }

    /** Name of the repository the failure relates to, or null when not repository-specific. */
    public String getRepoName() {
        return repoName;
    }

    public static AllocationException alreadyAllocated(String repoName, String branch) {
        return new AllocationException(repoName,
                "Branch '%s' is already allocated in repository '%s'".formatted(branch, repoName));
    }
}
