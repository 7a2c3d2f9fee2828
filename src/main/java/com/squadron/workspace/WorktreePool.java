package com.squadron.workspace;

import com.squadron.core.config.SquadronProperties;
import com.squadron.core.error.AllocationException;
import com.squadron.core.error.GitException;
import com.squadron.core.error.NotInitializedException;
import com.squadron.core.error.WorktreeDirtyException;
import com.squadron.core.events.EventBus;
import com.squadron.core.events.SquadronEvent;
import com.squadron.core.events.SquadronEventType;
import com.squadron.core.metrics.SquadronMetrics;
import com.squadron.workspace.git.GitService;
import com.squadron.workspace.git.WorktreeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Allocates isolated git worktrees of a single repository.
 *
 * <p>Worktrees live at {@code <baseDir>/<repoName>/<sanitized-branch>}. A branch is held by at
 * most one allocation: the branch index is claimed with {@code putIfAbsent} before any git
 * work, so of two concurrent {@link #allocate} calls for the same branch exactly one succeeds.
 * A dirty allocation is only released with {@code force}.
 */
public class WorktreePool {

    private static final Logger log = LoggerFactory.getLogger(WorktreePool.class);

    private final String repoName;
    private final Path repoPath;
    private final String baseBranch;
    private final GitService git;
    private final SquadronProperties.Worktree config;
    private final EventBus eventBus;
    private final SquadronMetrics metrics;
    private final Clock clock;
    private final Path poolRoot;

    private final ConcurrentHashMap<String, WorktreeAllocation> allocations = new ConcurrentHashMap<>();
    /** branch name to allocation id, claimed before the worktree is created */
    private final ConcurrentHashMap<String, String> branchIndex = new ConcurrentHashMap<>();
    /** worktree path to allocation id; distinct branches can sanitize to the same directory */
    private final ConcurrentHashMap<Path, String> pathIndex = new ConcurrentHashMap<>();
    private final AtomicInteger reserved = new AtomicInteger();

    private volatile boolean initialized;

    public WorktreePool(String repoName, Path repoPath, String baseBranch, GitService git,
                        SquadronProperties.Worktree config, EventBus eventBus, SquadronMetrics metrics,
                        Clock clock) {
        this.repoName = repoName;
        this.repoPath = repoPath.toAbsolutePath().normalize();
        this.baseBranch = baseBranch;
        this.git = git;
        this.config = config;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.poolRoot = Path.of(config.getBaseDir()).toAbsolutePath().normalize().resolve(sanitize(repoName));
    }

    public String getRepoName() { return repoName; }
    public Path getRepoPath() { return repoPath; }
    public String getBaseBranch() { return baseBranch; }
    public Path getPoolRoot() { return poolRoot; }
    public boolean isInitialized() { return initialized; }

    /**
     * Checks that the repository path exists and is a git repository, without side effects.
     *
     * @throws AllocationException naming this repository
     */
    public void validate() {
        if (!Files.isDirectory(repoPath)) {
            throw new AllocationException(repoName,
                    "Repository '%s' path does not exist: %s".formatted(repoName, repoPath));
        }
        if (!git.isGitRepo(repoPath)) {
            throw new AllocationException(repoName,
                    "Repository '%s' is not a git repository: %s".formatted(repoName, repoPath));
        }
    }

    /**
     * Validates the repository, creates the pool root and, when auto-cleanup is on,
     * releases stale allocations.
     */
    public void initialize() {
        validate();
        try {
            Files.createDirectories(poolRoot);
        } catch (IOException e) {
            throw new AllocationException(repoName, "Cannot create worktree directory " + poolRoot, e);
        }
        initialized = true;
        log.info("Worktree pool for '{}' initialized at {}", repoName, poolRoot);

        if (config.isAutoCleanup()) {
            try {
                git.pruneWorktrees(repoPath);
            } catch (GitException e) {
                log.warn("Failed to prune worktrees of '{}': {}", repoName, e.getMessage());
            }
            cleanupStale(config.getStaleHours());
        }
    }

    /**
     * Allocates a worktree for {@code branch}, creating the branch from the base branch if needed.
     *
     * @param agentId owning agent, may be null
     * @throws AllocationException if the branch is already allocated, the pool is full or git fails
     */
    public WorktreeAllocation allocate(String branch, String featureId, String agentId) {
        requireInitialized();
        if (branch == null || branch.isBlank()) {
            throw new AllocationException(repoName, "Branch name is required");
        }

        String id = "wt_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        String holder = branchIndex.putIfAbsent(branch, id);
        if (holder != null) {
            metrics.recordAllocationConflict(repoName);
            throw AllocationException.alreadyAllocated(repoName, branch);
        }

        Path worktreePath = worktreePathFor(branch);
        boolean pathClaimed = false;
        boolean slotReserved = false;
        try {
            if (pathIndex.putIfAbsent(worktreePath, id) != null) {
                metrics.recordAllocationConflict(repoName);
                throw new AllocationException(repoName,
                        "Worktree path %s is already in use in repository '%s'".formatted(worktreePath, repoName));
            }
            pathClaimed = true;

            if (reserved.incrementAndGet() > config.getMaxPerRepo()) {
                reserved.decrementAndGet();
                throw new AllocationException(repoName,
                        "Repository '%s' reached its maximum of %d worktrees".formatted(repoName, config.getMaxPerRepo()));
            }
            slotReserved = true;

            boolean branchCreated = false;
            if (isRegisteredWorktree(worktreePath)) {
                log.info("Reusing existing worktree for '{}' at {}", branch, worktreePath);
            } else {
                branchCreated = git.addWorktree(repoPath, worktreePath, branch, baseBranch);
            }

            var allocation = new WorktreeAllocation(id, repoName, repoPath, worktreePath, branch,
                    featureId, agentId, clock.instant(), branchCreated);
            allocations.put(id, allocation);

            log.info("Allocated worktree {} for branch '{}' in '{}' at {}", id, branch, repoName, worktreePath);
            metrics.recordWorktreeAllocated(repoName);
            publish(SquadronEventType.GIT_WORKTREE_CREATED, allocation, Map.of("forced", false));
            return allocation;
        } catch (GitException e) {
            unclaim(branch, worktreePath, id, pathClaimed, slotReserved);
            throw new AllocationException(repoName,
                    "Failed to create worktree for branch '%s' in repository '%s': %s".formatted(branch, repoName, e.getMessage()), e);
        } catch (RuntimeException e) {
            unclaim(branch, worktreePath, id, pathClaimed, slotReserved);
            throw e;
        }
    }

    /**
     * Removes the worktree from disk and the registry.
     *
     * @throws WorktreeDirtyException if the worktree has uncommitted changes and {@code force} is false
     * @throws AllocationException    if the allocation is unknown
     */
    public void release(String allocationId, boolean force) {
        WorktreeAllocation allocation = allocations.get(allocationId);
        if (allocation == null) {
            throw new AllocationException(repoName,
                    "Unknown allocation '%s' in repository '%s'".formatted(allocationId, repoName));
        }

        if (!force && isDirty(allocation)) {
            allocation.setDirty(true);
            throw new WorktreeDirtyException(repoName, allocation.getWorktreePath());
        }

        if (!allocations.remove(allocationId, allocation)) {
            throw new AllocationException(repoName,
                    "Allocation '%s' in repository '%s' was already released".formatted(allocationId, repoName));
        }

        removeFromDisk(allocation.getWorktreePath());
        unclaim(allocation.getBranch(), allocation.getWorktreePath(), allocationId, true, true);
        allocation.markReleased();

        if (config.isDeleteBranchOnRelease()) {
            try {
                git.deleteBranch(repoPath, allocation.getBranch(), true);
            } catch (GitException e) {
                log.warn("Failed to delete branch '{}' in '{}': {}", allocation.getBranch(), repoName, e.getMessage());
            }
        }

        log.info("Released worktree {} for branch '{}' in '{}'{}", allocationId, allocation.getBranch(), repoName,
                force ? " (forced)" : "");
        metrics.recordWorktreeReleased(repoName, force);
        publish(SquadronEventType.GIT_WORKTREE_REMOVED, allocation, Map.of("forced", force));
    }

    /**
     * Deletes the branch of a released allocation if that allocation created it. Branches that
     * existed before the allocation, or that a newer allocation holds, are left alone.
     *
     * @return true if the branch was deleted
     * @throws AllocationException if the allocation is still live or git fails
     */
    public boolean discardCreatedBranch(WorktreeAllocation allocation) {
        if (allocations.containsKey(allocation.getId())) {
            throw new AllocationException(repoName,
                    "Allocation '%s' in repository '%s' is still live".formatted(allocation.getId(), repoName));
        }
        String branch = allocation.getBranch();
        if (!allocation.isBranchCreated() || branchIndex.containsKey(branch)) {
            return false;
        }
        try {
            if (!git.branchExists(repoPath, branch)) {
                return false;
            }
            git.deleteBranch(repoPath, branch, true);
        } catch (GitException e) {
            throw new AllocationException(repoName,
                    "Failed to delete branch '%s' in repository '%s': %s".formatted(branch, repoName, e.getMessage()), e);
        }
        log.info("Deleted branch '{}' created by {} in '{}'", branch, allocation.getId(), repoName);
        return true;
    }

    /** Refreshes last activity. Unknown ids are ignored. */
    public void touch(String allocationId) {
        WorktreeAllocation allocation = allocations.get(allocationId);
        if (allocation != null) {
            allocation.touch(clock.instant());
        }
    }

    /** Flags the worktree as holding uncommitted changes. Unknown ids are ignored. */
    public void markDirty(String allocationId) {
        WorktreeAllocation allocation = allocations.get(allocationId);
        if (allocation != null) {
            allocation.setDirty(true);
            allocation.touch(clock.instant());
        }
    }

    /** Clears the dirty flag, typically after a commit. Unknown ids are ignored. */
    public void markClean(String allocationId) {
        WorktreeAllocation allocation = allocations.get(allocationId);
        if (allocation != null) {
            allocation.setDirty(false);
        }
    }

    /**
     * True if the allocation is flagged dirty or, when release verification is on, git
     * reports uncommitted changes in its worktree. Unknown ids are clean.
     */
    public boolean hasUncommittedChanges(String allocationId) {
        WorktreeAllocation allocation = allocations.get(allocationId);
        return allocation != null && isDirty(allocation);
    }

    public Optional<WorktreeAllocation> getAllocation(String allocationId) {
        return Optional.ofNullable(allocationId).map(allocations::get);
    }

    public List<WorktreeAllocation> getAllAllocations() {
        return allocations.values().stream()
                .sorted(Comparator.comparing(WorktreeAllocation::getCreatedAt))
                .toList();
    }

    /** Allocations of a feature; a null feature matches allocations made without one. */
    public List<WorktreeAllocation> getAllocationsByFeature(String featureId) {
        return filter(a -> Objects.equals(featureId, a.getFeatureId()));
    }

    /** Allocations of an agent; a null agent matches allocations not bound to one. */
    public List<WorktreeAllocation> getAllocationsByAgent(String agentId) {
        return filter(a -> Objects.equals(agentId, a.getAgentId()));
    }

    public Optional<WorktreeAllocation> findByBranch(String branch) {
        String id = branchIndex.get(branch);
        return id == null ? Optional.empty() : Optional.ofNullable(allocations.get(id));
    }

    /**
     * Finds the allocation whose worktree contains {@code path}.
     */
    public Optional<WorktreeAllocation> findByPath(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        return allocations.values().stream()
                .filter(a -> normalized.startsWith(a.getWorktreePath()))
                .findFirst();
    }

    /**
     * Force-releases every allocation idle for longer than {@code maxIdleHours}.
     *
     * @return number of allocations released
     */
    public int cleanupStale(long maxIdleHours) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(maxIdleHours));
        int released = releaseAll(a -> a.getLastActiveAt().isBefore(cutoff));
        if (released > 0) {
            log.info("Released {} stale worktrees in '{}' (idle > {}h)", released, repoName, maxIdleHours);
        }
        return released;
    }

    public int cleanupAll() {
        return releaseAll(a -> true);
    }

    public int cleanupFeature(String featureId) {
        return featureId == null ? 0 : releaseAll(a -> featureId.equals(a.getFeatureId()));
    }

    public int cleanupAgent(String agentId) {
        return agentId == null ? 0 : releaseAll(a -> agentId.equals(a.getAgentId()));
    }

    /**
     * Drops registry entries whose directory vanished and reports git worktrees under
     * the pool root that no allocation owns.
     */
    public SyncResult syncWithDisk() {
        requireInitialized();
        var removed = new ArrayList<String>();
        for (WorktreeAllocation allocation : List.copyOf(allocations.values())) {
            if (!Files.exists(allocation.getWorktreePath()) && allocations.remove(allocation.getId(), allocation)) {
                unclaim(allocation.getBranch(), allocation.getWorktreePath(), allocation.getId(), true, true);
                allocation.markReleased();
                removed.add(allocation.getId());
                log.warn("Dropped allocation {} in '{}': {} no longer exists",
                        allocation.getId(), repoName, allocation.getWorktreePath());
            }
        }

        var orphaned = new ArrayList<Path>();
        try {
            if (!removed.isEmpty()) {
                git.pruneWorktrees(repoPath);
            }
            for (WorktreeInfo info : git.listWorktrees(repoPath)) {
                Path path = info.path().toAbsolutePath().normalize();
                if (path.startsWith(poolRoot) && !pathIndex.containsKey(path)) {
                    orphaned.add(path);
                }
            }
        } catch (GitException e) {
            log.warn("Failed to list worktrees of '{}': {}", repoName, e.getMessage());
        }
        return new SyncResult(List.copyOf(removed), List.copyOf(orphaned));
    }

    public PoolStats getStats() {
        var all = List.copyOf(allocations.values());
        Map<String, Integer> byFeature = new TreeMap<>();
        for (WorktreeAllocation allocation : all) {
            byFeature.merge(String.valueOf(allocation.getFeatureId()), 1, Integer::sum);
        }
        int active = (int) all.stream().filter(WorktreeAllocation::isAllocated).count();
        int dirty = (int) all.stream().filter(WorktreeAllocation::isDirty).count();
        return new PoolStats(repoName, all.size(), active, dirty, new LinkedHashMap<>(byFeature));
    }

    /** Deterministic worktree location for a branch in this pool. */
    public Path worktreePathFor(String branch) {
        return poolRoot.resolve(sanitize(branch));
    }

    static String sanitize(String name) {
        return name.replaceAll("[^A-Za-z0-9._-]", "-");
    }

    private int releaseAll(Predicate<WorktreeAllocation> selector) {
        int released = 0;
        for (WorktreeAllocation allocation : filter(selector)) {
            try {
                release(allocation.getId(), true);
                released++;
            } catch (AllocationException e) {
                log.warn("Failed to release {} in '{}': {}", allocation.getId(), repoName, e.getMessage());
            }
        }
        return released;
    }

    private List<WorktreeAllocation> filter(Predicate<WorktreeAllocation> selector) {
        return allocations.values().stream()
                .filter(selector)
                .sorted(Comparator.comparing(WorktreeAllocation::getCreatedAt))
                .toList();
    }

    private boolean isDirty(WorktreeAllocation allocation) {
        if (allocation.isDirty()) {
            return true;
        }
        if (!config.isVerifyCleanOnRelease() || !Files.isDirectory(allocation.getWorktreePath())) {
            return false;
        }
        try {
            return !git.isClean(allocation.getWorktreePath());
        } catch (GitException e) {
            log.warn("Could not check status of {}: {}", allocation.getWorktreePath(), e.getMessage());
            return false;
        }
    }

    private boolean isRegisteredWorktree(Path worktreePath) {
        if (!Files.isDirectory(worktreePath)) {
            return false;
        }
        try {
            return git.listWorktrees(repoPath).stream()
                    .anyMatch(info -> info.path().toAbsolutePath().normalize().equals(worktreePath));
        } catch (GitException e) {
            log.debug("Failed to list worktrees of '{}': {}", repoName, e.getMessage());
            return false;
        }
    }

    private void removeFromDisk(Path worktreePath) {
        if (!Files.exists(worktreePath)) {
            pruneQuietly();
            return;
        }
        try {
            git.removeWorktree(repoPath, worktreePath, true);
        } catch (GitException e) {
            log.warn("git worktree remove failed for {}, deleting directory: {}", worktreePath, e.getMessage());
            deleteDirectory(worktreePath);
            pruneQuietly();
        }
    }

    private void pruneQuietly() {
        try {
            git.pruneWorktrees(repoPath);
        } catch (GitException e) {
            log.warn("Failed to prune worktrees of '{}': {}", repoName, e.getMessage());
        }
    }

    private void deleteDirectory(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Failed to delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to delete directory {}: {}", dir, e.getMessage());
        }
    }

    private void unclaim(String branch, Path worktreePath, String id, boolean pathClaimed, boolean slotReserved) {
        branchIndex.remove(branch, id);
        if (pathClaimed) {
            pathIndex.remove(worktreePath, id);
        }
        if (slotReserved) {
            reserved.decrementAndGet();
        }
    }

    private void requireInitialized() {
        if (!initialized) {
            throw new NotInitializedException("Worktree pool for '%s' is not initialized".formatted(repoName));
        }
    }

    private void publish(SquadronEventType type, WorktreeAllocation allocation, Map<String, Object> extra) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("branch", allocation.getBranch());
        payload.put("worktreePath", allocation.getWorktreePath().toString());
        if (allocation.getFeatureId() != null) {
            payload.put("featureId", allocation.getFeatureId());
        }
        if (allocation.getAgentId() != null) {
            payload.put("agentId", allocation.getAgentId());
        }
        payload.putAll(extra);
        eventBus.publish(SquadronEvent.of(type, repoName, allocation.getId(), payload));
    }
}
